package club.ppmc.flowdebug.service;

import club.ppmc.flowdebug.debug.BreakpointRegistry;
import club.ppmc.flowdebug.debug.DebugLogBuffer;
import club.ppmc.flowdebug.debug.ExecutionController;
import club.ppmc.flowdebug.debug.metrics.PerformanceMetricsCollector;
import club.ppmc.flowdebug.flow.FlowStep;
import club.ppmc.flowdebug.flow.InMemoryVariableStore;
import club.ppmc.flowdebug.flow.SequentialFlowExecutor;
import club.ppmc.flowdebug.flow.StepResult;
import club.ppmc.flowdebug.model.Settings;
import club.ppmc.flowdebug.model.debug.BreakpointRequest;
import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.OperationResult;
import club.ppmc.flowdebug.model.debug.StepRecord;
import club.ppmc.flowdebug.model.debug.WsDebugEvent;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DebugSessionServiceTest {

    private static final long TIMEOUT_MS = 5000;

    @TempDir
    Path tempDir;

    private ExecutionController controller;
    private WebSocketNotificationService notificationService;
    private Settings settings;
    private DebugSessionService service;
    private BlockingQueue<String> eventTypes;

    @BeforeEach
    void setUp() {
        controller = new ExecutionController(
                new BreakpointRegistry(),
                new DebugLogBuffer(),
                new PerformanceMetricsCollector(Optional::empty, Clock.systemUTC()));
        notificationService = mock(WebSocketNotificationService.class);
        eventTypes = new LinkedBlockingQueue<>();
        doAnswer(invocation -> {
            WsDebugEvent<?> event = invocation.getArgument(0);
            eventTypes.add(event.type());
            return null;
        }).when(notificationService).sendDebugEvent(any());

        settings = new Settings();
        settings.setMaxLogEntries(50);
        settings.setLogExportDirectory(tempDir.resolve("exports").toString());
        SettingsService settingsService = mock(SettingsService.class);
        when(settingsService.getSettings()).thenReturn(settings);

        service = new DebugSessionService(controller, notificationService, settingsService);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        service.stop();
        service.awaitTermination(Duration.ofSeconds(5));
    }

    private SequentialFlowExecutor flowOf(int steps, List<String> executed) {
        List<FlowStep> flowSteps = new ArrayList<>();
        for (int i = 0; i < steps; i++) {
            String actionId = "step" + i;
            flowSteps.add(new FlowStep(StepRecord.of(actionId), (step, vars) -> {
                executed.add(step.actionId());
                return StepResult.ok(step.actionId() + " done");
            }));
        }
        return new SequentialFlowExecutor(flowSteps, new InMemoryVariableStore());
    }

    private void awaitEvent(String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            String next = eventTypes.poll(100, TimeUnit.MILLISECONDS);
            if (type.equals(next)) {
                return;
            }
        }
        fail("未收到事件: " + type);
    }

    @Test
    void appliesSettingsOnConstruction() {
        assertEquals(50, controller.getLogBuffer().getMaxEntries());
        assertEquals(Duration.ZERO, controller.getPauseTimeout());
    }

    @Test
    void runsFlowOnWorkerThread_andEmitsLifecycleEvents() throws Exception {
        List<String> executed = new ArrayList<>();
        SequentialFlowExecutor executor = flowOf(3, executed);

        service.start(executor, executor.getVariables(), ExecutionMode.DEBUG);

        awaitEvent(WsDebugEvent.STARTED);
        awaitEvent(WsDebugEvent.TERMINATED);
        assertTrue(service.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(service.isDebugging());
        assertEquals(List.of("step0", "step1", "step2"), executed);
    }

    @Test
    void start_rejectsSecondConcurrentSession() throws Exception {
        List<String> executed = new ArrayList<>();
        service.start(flowOf(2, executed), new InMemoryVariableStore(), ExecutionMode.STEP);
        awaitEvent(WsDebugEvent.PAUSED);

        assertThrows(IllegalStateException.class,
                () -> service.start(flowOf(1, executed), new InMemoryVariableStore(), ExecutionMode.NORMAL));
    }

    @Test
    void stepOver_advancesOneStepAtATime() throws Exception {
        List<String> executed = new ArrayList<>();
        SequentialFlowExecutor executor = flowOf(3, executed);
        service.start(executor, executor.getVariables(), ExecutionMode.STEP);
        awaitEvent(WsDebugEvent.PAUSED);
        assertTrue(controller.isPaused());
        assertTrue(executed.isEmpty());

        service.stepOver();
        awaitEvent(WsDebugEvent.PAUSED);
        assertEquals(1, controller.getCurrentStepIndex());

        service.stepOut();
        assertTrue(service.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(3, executed.size());
    }

    @Test
    void stop_releasesPausedWorkerAndSkipsRemainingSteps() throws Exception {
        List<String> executed = new ArrayList<>();
        SequentialFlowExecutor executor = flowOf(3, executed);
        service.start(executor, executor.getVariables(), ExecutionMode.STEP);
        awaitEvent(WsDebugEvent.PAUSED);

        service.stop();

        assertTrue(service.awaitTermination(Duration.ofSeconds(5)));
        assertTrue(executed.isEmpty());
        assertEquals(ExecutionMode.NORMAL, controller.getExecutionMode());
        awaitEvent(WsDebugEvent.TERMINATED);
    }

    @Test
    void runToCursor_pausesAtTargetAndRemovesTemporaryBreakpoint() throws Exception {
        List<String> executed = new ArrayList<>();
        SequentialFlowExecutor executor = flowOf(4, executed);
        service.start(executor, executor.getVariables(), ExecutionMode.STEP);
        awaitEvent(WsDebugEvent.PAUSED);

        String temporaryId = service.runToCursor(2);

        awaitEvent(WsDebugEvent.BREAKPOINT_HIT);
        assertEquals(2, controller.getCurrentStepIndex());
        assertNull(controller.getBreakpoints().get(temporaryId));
        assertEquals(ExecutionMode.DEBUG, controller.getExecutionMode());

        service.resume();
        assertTrue(service.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(4, executed.size());
    }

    @Test
    void pauseAndResume_onlyActWhenStateAllows() {
        service.resume();
        assertFalse(controller.isPaused());

        service.pause();
        assertTrue(controller.isPaused());
        service.pause();
        assertTrue(controller.isPaused());

        service.resume();
        assertFalse(controller.isPaused());
    }

    @Test
    void addBreakpoint_validatesPerType() {
        OperationResult line = service.addBreakpoint(
                new BreakpointRequest(BreakpointType.LINE, 1, null, null, null, null, null));
        assertTrue(line.success());
        assertNotNull(controller.getBreakpoints().get(line.message()));

        assertFalse(service.addBreakpoint(
                new BreakpointRequest(BreakpointType.LINE, -1, null, null, null, null, null)).success());
        assertFalse(service.addBreakpoint(
                new BreakpointRequest(BreakpointType.CONDITION, 0, "x >", null, null, null, null)).success());
        assertFalse(service.addBreakpoint(
                new BreakpointRequest(BreakpointType.VARIABLE, 0, null, " ", 1, ">", null)).success());
        assertFalse(service.addBreakpoint(
                new BreakpointRequest(BreakpointType.VARIABLE, 0, null, "x", 1, "<>", null)).success());

        OperationResult variable = service.addBreakpoint(
                new BreakpointRequest(BreakpointType.VARIABLE, 5, null, "x", 10, ">=", false));
        assertTrue(variable.success());
        var created = controller.getBreakpoints().get(variable.message());
        assertEquals(-1, created.getStepIndex());
        assertEquals(ComparisonOperator.GREATER_OR_EQUAL, created.getComparisonOperator());
        assertFalse(created.isEnabled());
    }

    @Test
    void exportLogs_writesIntoConfiguredDirectory() {
        controller.getLogBuffer().add(LogLevel.INFO, "hello");

        OperationResult text = service.exportLogs("text", "debug.txt");
        OperationResult json = service.exportLogs("json", "debug.json");

        assertTrue(text.success(), text.message());
        assertTrue(json.success(), json.message());
        assertTrue(Files.exists(tempDir.resolve("exports/debug.txt")));
        assertTrue(Files.exists(tempDir.resolve("exports/debug.json")));
        assertFalse(service.exportLogs("text", "../escape.txt").success());
        assertFalse(service.exportLogs("xml", "debug.xml").success());
    }

    @Test
    void applySettings_updatesLiveController() {
        var updated = new Settings();
        updated.setMaxLogEntries(5);
        updated.setPauseTimeoutSeconds(30);
        updated.setMetricsSampleLimit(7);

        service.applySettings(updated);

        assertEquals(5, controller.getLogBuffer().getMaxEntries());
        assertEquals(Duration.ofSeconds(30), controller.getPauseTimeout());
    }

    @Test
    void logEntries_arePushedToWebSocket() {
        List<String> pushed = new ArrayList<>();
        doAnswer(invocation -> {
            pushed.add(invocation.<DebugLogEntry>getArgument(0).message());
            return null;
        }).when(notificationService).sendDebugLog(any());

        controller.getLogBuffer().add(LogLevel.WARNING, "pushed");

        assertEquals(List.of("pushed"), pushed);
    }

    @Test
    void watchVariables_listIncludesNamesWithoutStore() {
        assertTrue(service.addWatchVariable("total"));
        assertFalse(service.addWatchVariable("total"));

        assertTrue(service.getWatchVariables().containsKey("total"));
        assertTrue(service.removeWatchVariable("total"));
        assertTrue(service.getWatchVariables().isEmpty());
    }

    @Test
    void addBreakpoint_missingStepIndex_rejectedForLineAndWildcardOtherwise() {
        OperationResult line = service.addBreakpoint(
                new BreakpointRequest(BreakpointType.LINE, null, null, null, null, null, null));
        assertFalse(line.success());
        assertTrue(controller.getBreakpoints().list().isEmpty());

        OperationResult error = service.addBreakpoint(
                new BreakpointRequest(BreakpointType.ERROR, null, null, null, null, null, null));
        assertTrue(error.success());
        assertEquals(-1, controller.getBreakpoints().get(error.message()).getStepIndex());
    }
}
