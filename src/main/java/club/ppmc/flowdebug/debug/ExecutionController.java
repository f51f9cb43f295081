/**
 * ExecutionController.java
 *
 * 调试子系统的核心：执行控制器。
 * 它作为 FlowExecutionListener 挂接在流程执行器上，在每个步骤开始和结束时
 * 根据执行模式和断点决定是否让工作线程暂停，并把断点命中、单步、变量变化、
 * 暂停和继续等事件通知给控制端注册的回调。
 *
 * 线程模型：
 * - 工作线程调用 onStepStart / onStepComplete / onFlowComplete，只可能阻塞在 waitForContinue 中。
 * - 控制线程调用 pauseExecution / resumeExecution / stopDebugging 以及断点和监视变量的管理方法。
 * - 断点匹配和 hitCount 递增在 evaluationLock 内串行执行；回调在锁外调用。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.debug.condition.ConditionEvaluator;
import club.ppmc.flowdebug.debug.metrics.OshiProcessSampler;
import club.ppmc.flowdebug.debug.metrics.PerformanceMetricsCollector;
import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.StepRecord;
import club.ppmc.flowdebug.model.debug.VariableInfo;
import club.ppmc.flowdebug.model.metrics.MemoryUsage;
import club.ppmc.flowdebug.model.metrics.MetricsReport;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExecutionController implements FlowExecutionListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionController.class);

    private final BreakpointRegistry breakpoints;
    private final DebugLogBuffer logBuffer;
    private final PerformanceMetricsCollector metrics;
    private final ConditionEvaluator conditionEvaluator;

    private final PauseSignal pauseSignal = new PauseSignal();
    private final Object stateLock = new Object();
    private final Object evaluationLock = new Object();
    private final Set<String> watchVariables = new CopyOnWriteArraySet<>();

    private volatile ExecutionMode mode = ExecutionMode.NORMAL;
    private volatile boolean paused;
    // 每次停止调试或流程结束时递增，回调据此判断自己开始之后是否发生过停止
    private volatile long sessionEpoch;
    private volatile int currentStepIndex = -1;
    private volatile Duration pauseTimeout = Duration.ZERO;
    private volatile VariableStore variableStore;

    // 单槽回调：后注册的替换先注册的
    private volatile BreakpointHitHandler breakpointHitHandler;
    private volatile BiConsumer<Integer, StepRecord> stepExecutionHandler;
    private volatile BiConsumer<String, Object> variableChangedHandler;
    private volatile IntConsumer executionPausedHandler;
    private volatile IntConsumer executionResumedHandler;

    public ExecutionController() {
        this(new BreakpointRegistry(),
                new DebugLogBuffer(),
                new PerformanceMetricsCollector(new OshiProcessSampler(), Clock.systemDefaultZone()));
    }

    public ExecutionController(
            BreakpointRegistry breakpoints, DebugLogBuffer logBuffer, PerformanceMetricsCollector metrics) {
        this.breakpoints = breakpoints;
        this.logBuffer = logBuffer;
        this.metrics = metrics;
        this.conditionEvaluator = new ConditionEvaluator(logBuffer);
    }

    // ==================== 模式与会话 ====================

    public void setExecutionMode(ExecutionMode mode) {
        this.mode = mode;
        LOGGER.info("执行模式已设置为: {}", mode);
    }

    public ExecutionMode getExecutionMode() {
        return mode;
    }

    public boolean isPaused() {
        return paused;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public void setVariableStore(VariableStore variableStore) {
        this.variableStore = variableStore;
    }

    /**
     * 设置暂停的最长等待时间。Duration.ZERO（默认）表示一直等待到继续或停止。
     */
    public void setPauseTimeout(Duration pauseTimeout) {
        this.pauseTimeout = pauseTimeout == null || pauseTimeout.isNegative() ? Duration.ZERO : pauseTimeout;
    }

    public Duration getPauseTimeout() {
        return pauseTimeout;
    }

    public void startDebugging(ExecutionMode mode) {
        synchronized (stateLock) {
            this.mode = mode;
            this.paused = false;
            pauseSignal.set();
        }
        currentStepIndex = -1;
        metrics.startMonitoring();
        logBuffer.add(LogLevel.INFO, "开始调试，模式: " + mode);
        LOGGER.info("调试会话已开始，模式: {}", mode);
    }

    /**
     * 强制结束调试：模式重置为 NORMAL，释放任何正在等待的线程并停止性能监控。
     * 可在任何状态下、从任何线程重复调用。
     */
    public void stopDebugging() {
        synchronized (stateLock) {
            this.mode = ExecutionMode.NORMAL;
            this.paused = false;
            sessionEpoch++;
            pauseSignal.set();
        }
        metrics.stopMonitoring();
        logBuffer.add(LogLevel.INFO, "停止调试");
        LOGGER.info("调试会话已停止");
    }

    /**
     * 手动暂停。工作线程会在下一个挂起点阻塞。已暂停时无效果。
     */
    public void pauseExecution() {
        int stepIndex = currentStepIndex;
        if (enterPause(stepIndex, sessionEpoch)) {
            notifyPaused(stepIndex);
        }
    }

    /**
     * 继续执行。只有在确实处于暂停状态时才记录日志并通知回调。
     */
    public void resumeExecution() {
        boolean wasPaused;
        synchronized (stateLock) {
            wasPaused = paused;
            paused = false;
            pauseSignal.set();
        }
        if (!wasPaused) {
            return;
        }
        int stepIndex = currentStepIndex;
        logBuffer.add(LogLevel.INFO, "继续执行");
        LOGGER.info("继续执行，当前步骤 #{}", stepIndex);
        IntConsumer handler = executionResumedHandler;
        if (handler != null) {
            invokeSafely("execution-resumed", () -> handler.accept(stepIndex));
        }
    }

    /**
     * 唯一的挂起点：阻塞调用线程直到暂停信号被放行。
     * 设置了暂停超时且超时到达时，记录警告并自动继续。
     */
    public void waitForContinue() {
        Duration timeout = pauseTimeout;
        try {
            if (timeout.isZero()) {
                pauseSignal.await();
                return;
            }
            if (!pauseSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logBuffer.add(LogLevel.WARNING, String.format(
                        Locale.ROOT, "暂停超过 %d 秒，自动继续执行", timeout.toSeconds()));
                LOGGER.warn("暂停超时 ({}), 自动继续执行", timeout);
                resumeExecution();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (stateLock) {
                paused = false;
                pauseSignal.set();
            }
            logBuffer.add(LogLevel.WARNING, "等待继续执行时线程被中断，暂停已解除");
            LOGGER.warn("等待继续执行时线程被中断");
        }
    }

    // ==================== 执行器回调 ====================

    @Override
    public void onStepStart(int stepIndex, StepRecord step) {
        StepRecord stepData = step != null ? step : StepRecord.empty();
        long epoch = sessionEpoch;
        currentStepIndex = stepIndex;
        metrics.startStepTimer(stepIndex);

        ExecutionMode current = mode;
        if (current == ExecutionMode.STEP) {
            if (enterPause(stepIndex, epoch)) {
                notifyPaused(stepIndex);
            }
            BiConsumer<Integer, StepRecord> handler = stepExecutionHandler;
            if (handler != null) {
                invokeSafely("step-execution", () -> handler.accept(stepIndex, stepData));
            }
            if (!stoppedSince(epoch)) {
                waitForContinue();
            }
        } else {
            Breakpoint hit = current == ExecutionMode.DEBUG ? matchStartBreakpoints(stepIndex) : null;
            if (hit != null) {
                suspendOnBreakpoint(hit, stepIndex, stepData.toMap(), epoch);
            } else if (paused && !stoppedSince(epoch)) {
                // 控制线程请求的手动暂停在这里生效
                waitForContinue();
            }
        }

        logBuffer.add(LogLevel.INFO, String.format("步骤 #%d (%s) 开始执行", stepIndex, stepData.actionId()));
    }

    @Override
    public void onStepComplete(int stepIndex, boolean success, Object message) {
        long epoch = sessionEpoch;
        metrics.stopStepTimer(stepIndex);
        String messageText = normalizeMessage(message);
        ExecutionMode current = mode;

        Breakpoint hit = null;
        Map<String, Object> context = null;
        synchronized (evaluationLock) {
            if (!success && current == ExecutionMode.DEBUG) {
                for (Breakpoint bp : breakpoints.list()) {
                    if (bp.isEnabled() && bp.getType() == BreakpointType.ERROR && bp.targets(stepIndex)) {
                        bp.recordHit();
                        if (hit == null) {
                            hit = bp;
                            context = new LinkedHashMap<>();
                            context.put("error_message", messageText);
                        }
                    }
                }
            }
            if (current != ExecutionMode.NORMAL) {
                for (VariableHit variableHit : matchVariableBreakpoints()) {
                    if (hit == null) {
                        hit = variableHit.breakpoint();
                        context = new LinkedHashMap<>();
                        context.put("variable_name", variableHit.breakpoint().getVariableName());
                        context.put("variable_value", variableHit.value());
                    }
                }
            }
        }

        logBuffer.add(success ? LogLevel.SUCCESS : LogLevel.ERROR,
                String.format("步骤 #%d %s: %s", stepIndex, success ? "完成" : "失败", messageText));
        publishWatchValues();

        if (hit != null) {
            suspendOnBreakpoint(hit, stepIndex, context, epoch);
        }
    }

    @Override
    public void onFlowComplete(boolean success) {
        metrics.stopMonitoring();
        synchronized (stateLock) {
            mode = ExecutionMode.NORMAL;
            paused = false;
            sessionEpoch++;
            pauseSignal.set();
        }

        logBuffer.add(success ? LogLevel.SUCCESS : LogLevel.ERROR, "流程执行" + (success ? "成功" : "失败"));
        MemoryUsage memory = metrics.getAverageMemoryUsage();
        logBuffer.add(LogLevel.INFO, String.format(Locale.ROOT,
                "执行统计: 总时间=%.2f秒, 平均内存=%.2fMB, 平均CPU=%.2f%%",
                metrics.getTotalExecutionTime(), memory.rss(), metrics.getAverageCpuUsage()));
        LOGGER.info("流程执行结束, 成功: {}", success);
    }

    // ==================== 断点匹配 ====================

    /**
     * 在步骤开始时匹配行断点和条件断点。所有匹配的断点都计数，只返回第一个。
     */
    private Breakpoint matchStartBreakpoints(int stepIndex) {
        synchronized (evaluationLock) {
            Breakpoint first = null;
            Map<String, Object> environment = null;
            for (Breakpoint bp : breakpoints.list()) {
                if (!bp.isEnabled()) {
                    continue;
                }
                boolean matched = false;
                if (bp.getType() == BreakpointType.LINE) {
                    matched = bp.getStepIndex() == stepIndex;
                } else if (bp.getType() == BreakpointType.CONDITION
                        && bp.targets(stepIndex)
                        && !bp.getCondition().isBlank()) {
                    if (environment == null) {
                        environment = buildEnvironment();
                    }
                    matched = conditionEvaluator.isConditionMet(bp, environment);
                }
                if (matched) {
                    bp.recordHit();
                    if (first == null) {
                        first = bp;
                    }
                }
            }
            return first;
        }
    }

    private record VariableHit(Breakpoint breakpoint, Object value) {}

    /**
     * 匹配变量断点。只比较变量存储中当前存在的变量；条件成立的每一步都会触发（电平触发）。
     */
    private List<VariableHit> matchVariableBreakpoints() {
        List<VariableHit> hits = new ArrayList<>();
        VariableStore store = variableStore;
        if (store == null) {
            return hits;
        }
        for (Breakpoint bp : breakpoints.list()) {
            if (!bp.isEnabled() || bp.getType() != BreakpointType.VARIABLE) {
                continue;
            }
            String name = bp.getVariableName();
            if (name.isBlank() || !store.containsVariable(name)) {
                continue;
            }
            Object value = store.getVariable(name);
            if (conditionEvaluator.isVariableConditionMet(bp, value)) {
                bp.recordHit();
                hits.add(new VariableHit(bp, value));
            }
        }
        return hits;
    }

    /**
     * 在断点处挂起。如果回调开始之后调试已被停止（例如匹配断点期间），则不再暂停。
     */
    private void suspendOnBreakpoint(Breakpoint breakpoint, int stepIndex, Map<String, Object> context, long epoch) {
        if (stoppedSince(epoch)) {
            LOGGER.debug("调试已停止，忽略断点 {} 于步骤 #{}", breakpoint.getId(), stepIndex);
            return;
        }
        logBuffer.add(LogLevel.INFO, String.format(
                "命中断点 #%s (%s, 步骤 #%d, 第 %d 次)",
                breakpoint.getId(), breakpoint.getType(), stepIndex, breakpoint.getHitCount()));
        LOGGER.info("命中断点 {} 于步骤 #{}", breakpoint.getId(), stepIndex);

        boolean entered = enterPause(stepIndex, epoch);
        BreakpointHitHandler handler = breakpointHitHandler;
        if (handler != null) {
            invokeSafely("breakpoint-hit", () -> handler.onBreakpointHit(breakpoint.getId(), stepIndex, context));
        }
        if (entered) {
            notifyPaused(stepIndex);
        }
        if (!stoppedSince(epoch)) {
            waitForContinue();
        }
    }

    private Map<String, Object> buildEnvironment() {
        Map<String, Object> environment = new LinkedHashMap<>();
        VariableStore store = variableStore;
        if (store != null) {
            for (Map.Entry<String, VariableInfo> entry : store.getAllVariables().entrySet()) {
                environment.put(entry.getKey(), entry.getValue() != null ? entry.getValue().value() : null);
            }
        }
        return environment;
    }

    // ==================== 暂停状态 ====================

    /**
     * 进入暂停状态：先清除信号再通知观察者，这样观察者在回调中调用 resumeExecution 不会丢失。
     * epoch 与当前值不一致说明期间发生过停止，此时不清除信号，停止释放的线程不会被重新阻塞。
     *
     * @return 本次调用是否真正从运行进入了暂停。
     */
    private boolean enterPause(int stepIndex, long epoch) {
        synchronized (stateLock) {
            if (paused || sessionEpoch != epoch) {
                return false;
            }
            paused = true;
            pauseSignal.clear();
        }
        logBuffer.add(LogLevel.INFO, String.format("执行已暂停 (步骤 #%d)", stepIndex));
        LOGGER.info("执行已暂停于步骤 #{}", stepIndex);
        return true;
    }

    private boolean stoppedSince(long epoch) {
        return sessionEpoch != epoch;
    }

    private void notifyPaused(int stepIndex) {
        IntConsumer handler = executionPausedHandler;
        if (handler != null) {
            invokeSafely("execution-paused", () -> handler.accept(stepIndex));
        }
    }

    // ==================== 监视变量 ====================

    /**
     * @return 添加成功为 true；名称为空或已存在时为 false。
     */
    public boolean addWatchVariable(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        boolean added = watchVariables.add(name.trim());
        if (added) {
            logBuffer.add(LogLevel.DEBUG, "添加监视变量: " + name.trim());
        }
        return added;
    }

    public boolean removeWatchVariable(String name) {
        boolean removed = name != null && watchVariables.remove(name.trim());
        if (removed) {
            logBuffer.add(LogLevel.DEBUG, "移除监视变量: " + name.trim());
        }
        return removed;
    }

    public List<String> getWatchVariables() {
        return List.copyOf(watchVariables);
    }

    public void clearWatchVariables() {
        watchVariables.clear();
    }

    /**
     * @return 监视变量的当前值；未关联变量存储时为空。不存在的变量值为 null。
     */
    public Map<String, Object> getWatchVariableValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        VariableStore store = variableStore;
        if (store == null) {
            return values;
        }
        for (String name : watchVariables) {
            values.put(name, store.getVariable(name));
        }
        return values;
    }

    private void publishWatchValues() {
        BiConsumer<String, Object> handler = variableChangedHandler;
        if (handler == null) {
            return;
        }
        getWatchVariableValues().forEach((name, value) ->
                invokeSafely("variable-changed", () -> handler.accept(name, value)));
    }

    // ==================== 回调注册 ====================

    public void setBreakpointHitHandler(BreakpointHitHandler handler) {
        this.breakpointHitHandler = handler;
    }

    public void setStepExecutionHandler(BiConsumer<Integer, StepRecord> handler) {
        this.stepExecutionHandler = handler;
    }

    public void setVariableChangedHandler(BiConsumer<String, Object> handler) {
        this.variableChangedHandler = handler;
    }

    public void setExecutionPausedHandler(IntConsumer handler) {
        this.executionPausedHandler = handler;
    }

    public void setExecutionResumedHandler(IntConsumer handler) {
        this.executionResumedHandler = handler;
    }

    private void invokeSafely(String handlerName, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOGGER.error("调试回调 {} 执行失败", handlerName, e);
        }
    }

    // ==================== 组件访问 ====================

    public BreakpointRegistry getBreakpoints() {
        return breakpoints;
    }

    public DebugLogBuffer getLogBuffer() {
        return logBuffer;
    }

    public PerformanceMetricsCollector getMetrics() {
        return metrics;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public MetricsReport getPerformanceReport() {
        return metrics.toReport();
    }

    private static String normalizeMessage(Object message) {
        if (message instanceof Map<?, ?> map && map.containsKey("message")) {
            return String.valueOf(map.get("message"));
        }
        return String.valueOf(message);
    }
}
