/**
 * SequentialFlowExecutor.java
 *
 * 顺序流程执行器。按顺序执行每个步骤，并在步骤前后回调监听器。
 * 遇到第一个失败的步骤或收到停止请求时结束，最后总会回调 onFlowComplete。
 */
package club.ppmc.flowdebug.flow;

import club.ppmc.flowdebug.debug.FlowExecutionListener;
import club.ppmc.flowdebug.debug.FlowExecutor;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SequentialFlowExecutor implements FlowExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequentialFlowExecutor.class);

    private final List<FlowStep> steps;
    private final InMemoryVariableStore variables;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public SequentialFlowExecutor(List<FlowStep> steps, InMemoryVariableStore variables) {
        this.steps = List.copyOf(steps);
        this.variables = variables;
    }

    public List<FlowStep> getSteps() {
        return steps;
    }

    public InMemoryVariableStore getVariables() {
        return variables;
    }

    @Override
    public boolean execute(FlowExecutionListener listener) {
        boolean success = true;
        try {
            for (int i = 0; i < steps.size(); i++) {
                if (stopRequested.get()) {
                    LOGGER.info("流程在步骤 #{} 前被停止", i);
                    success = false;
                    break;
                }
                FlowStep step = steps.get(i);
                listener.onStepStart(i, step.record());
                if (stopRequested.get()) {
                    // 暂停期间收到停止请求，当前步骤不再执行
                    LOGGER.info("流程在步骤 #{} 暂停期间被停止", i);
                    success = false;
                    break;
                }
                StepResult result = runStep(i, step);
                listener.onStepComplete(i, result.success(), result.message());
                if (!result.success()) {
                    success = false;
                    break;
                }
            }
        } finally {
            listener.onFlowComplete(success);
        }
        return success;
    }

    private StepResult runStep(int index, FlowStep step) {
        try {
            StepResult result = step.action().execute(step.record(), variables);
            return result != null ? result : StepResult.ok("");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failed("步骤被中断");
        } catch (Exception e) {
            LOGGER.warn("步骤 #{} ({}) 执行异常", index, step.record().actionId(), e);
            return StepResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    @Override
    public void stop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
