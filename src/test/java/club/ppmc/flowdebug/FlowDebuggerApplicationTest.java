package club.ppmc.flowdebug;

import club.ppmc.flowdebug.debug.ExecutionController;
import club.ppmc.flowdebug.flow.FlowStep;
import club.ppmc.flowdebug.flow.InMemoryVariableStore;
import club.ppmc.flowdebug.flow.SequentialFlowExecutor;
import club.ppmc.flowdebug.flow.StepResult;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import club.ppmc.flowdebug.model.debug.StepRecord;
import club.ppmc.flowdebug.service.DebugSessionService;
import com.google.gson.Gson;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "app.settings-dir=target/test-settings",
        "app.debug.log-export-dir=target/test-debug-logs",
        "app.debug.metrics-push-interval-ms=60000"
})
class FlowDebuggerApplicationTest {

    @Autowired
    private DebugSessionService debugSessionService;

    @Autowired
    private ExecutionController executionController;

    @Autowired
    private Gson gson;

    @Test
    void contextWiresSingleController() {
        assertSame(executionController, debugSessionService.getController());
    }

    @Test
    void gsonUsesSnakeCase() {
        String json = gson.toJson(new StepRecord("open_page", Map.of("url", "https://example.org")));
        assertTrue(json.contains("\"action_id\""), json);
    }

    @Test
    void runsFlowToCompletion() throws Exception {
        SequentialFlowExecutor executor = new SequentialFlowExecutor(List.of(
                new FlowStep(StepRecord.of("set_total"), (step, vars) -> {
                    vars.set("total", 3);
                    return StepResult.ok("ok");
                }),
                new FlowStep(StepRecord.of("noop"), (step, vars) -> StepResult.ok("ok"))),
                new InMemoryVariableStore());

        debugSessionService.start(executor, executor.getVariables(), ExecutionMode.NORMAL);

        assertTrue(debugSessionService.awaitTermination(Duration.ofSeconds(10)));
        assertEquals(3, executor.getVariables().getVariable("total"));
        assertFalse(debugSessionService.isDebugging());
    }
}
