/**
 * DebugSessionService.java
 *
 * 调试会话服务，是所有调试功能的入口。
 * 它在一个专用的工作线程上运行流程执行器，把 ExecutionController 挂接为执行器的监听器，
 * 并将控制器的各类回调转换为 WebSocket 事件推送给前端。
 * 同时提供暂停、继续、单步、运行到光标、断点和监视变量管理等控制操作。
 */
package club.ppmc.flowdebug.service;

import club.ppmc.flowdebug.debug.Breakpoint;
import club.ppmc.flowdebug.debug.BreakpointRegistry;
import club.ppmc.flowdebug.debug.ExecutionController;
import club.ppmc.flowdebug.debug.FlowExecutor;
import club.ppmc.flowdebug.debug.VariableStore;
import club.ppmc.flowdebug.model.Settings;
import club.ppmc.flowdebug.model.debug.BreakpointHitEventData;
import club.ppmc.flowdebug.model.debug.BreakpointRequest;
import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.DebugStateResponse;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.OperationResult;
import club.ppmc.flowdebug.model.debug.PausedEventData;
import club.ppmc.flowdebug.model.debug.StepEventData;
import club.ppmc.flowdebug.model.debug.VariableChangedEventData;
import club.ppmc.flowdebug.model.debug.WsDebugEvent;
import club.ppmc.flowdebug.model.metrics.MetricsReport;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DebugSessionService {

    private final ExecutionController controller;
    private final WebSocketNotificationService notificationService;
    private final SettingsService settingsService;
    private final Object sessionLock = new Object();

    private volatile Thread workerThread;
    private volatile FlowExecutor currentExecutor;
    private volatile String runToCursorBreakpointId;

    public DebugSessionService(
            ExecutionController controller,
            WebSocketNotificationService notificationService,
            SettingsService settingsService) {
        this.controller = controller;
        this.notificationService = notificationService;
        this.settingsService = settingsService;
        registerHandlers();
        applySettings(settingsService.getSettings());
    }

    private void registerHandlers() {
        controller.setBreakpointHitHandler((breakpointId, stepIndex, context) -> {
            if (breakpointId.equals(runToCursorBreakpointId)) {
                removeRunToCursorBreakpoint();
            }
            notificationService.sendDebugEvent(new WsDebugEvent<>(
                    WsDebugEvent.BREAKPOINT_HIT, new BreakpointHitEventData(breakpointId, stepIndex, context)));
        });
        controller.setStepExecutionHandler((stepIndex, step) -> notificationService.sendDebugEvent(
                new WsDebugEvent<>(WsDebugEvent.STEP, new StepEventData(stepIndex, step))));
        controller.setVariableChangedHandler((name, value) -> notificationService.sendDebugEvent(
                new WsDebugEvent<>(WsDebugEvent.VARIABLE_CHANGED, new VariableChangedEventData(name, value))));
        controller.setExecutionPausedHandler(stepIndex -> notificationService.sendDebugEvent(new WsDebugEvent<>(
                WsDebugEvent.PAUSED,
                new PausedEventData(stepIndex, controller.getWatchVariableValues(), controller.getPerformanceReport()))));
        controller.setExecutionResumedHandler(stepIndex -> notificationService.sendDebugEvent(
                new WsDebugEvent<>(WsDebugEvent.RESUMED, Map.of("step_index", stepIndex))));
        controller.getLogBuffer().setListener(notificationService::sendDebugLog);
    }

    // ==================== 会话生命周期 ====================

    /**
     * 在新的工作线程上以给定模式启动流程。
     *
     * @throws IllegalStateException 已有会话正在运行。
     */
    public void start(FlowExecutor executor, VariableStore variableStore, ExecutionMode mode) {
        ExecutionMode effectiveMode = mode != null ? mode : settingsService.getSettings().getDefaultExecutionMode();
        synchronized (sessionLock) {
            if (isDebugging()) {
                throw new IllegalStateException("已有调试会话正在运行");
            }
            controller.setVariableStore(variableStore);
            controller.startDebugging(effectiveMode);
            currentExecutor = executor;
            var thread = new Thread(() -> runFlow(executor), "Flow-Debug-Worker");
            thread.setDaemon(true);
            workerThread = thread;
            notificationService.sendDebugEvent(
                    new WsDebugEvent<>(WsDebugEvent.STARTED, Map.of("mode", effectiveMode.name())));
            thread.start();
        }
        log.info("调试会话已启动，模式: {}", effectiveMode);
    }

    private void runFlow(FlowExecutor executor) {
        boolean success = false;
        try {
            success = executor.execute(controller);
        } catch (RuntimeException e) {
            log.error("流程执行线程发生未处理的异常", e);
            controller.getLogBuffer().add(LogLevel.ERROR, "流程执行异常: " + e.getMessage());
            controller.stopDebugging();
        } finally {
            removeRunToCursorBreakpoint();
            synchronized (sessionLock) {
                if (workerThread == Thread.currentThread()) {
                    workerThread = null;
                    currentExecutor = null;
                }
            }
            log.info("调试会话已结束，成功: {}", success);
            notificationService.sendDebugEvent(new WsDebugEvent<>(WsDebugEvent.TERMINATED, Map.of("success", success)));
        }
    }

    /**
     * 停止当前会话：请求执行器停止，并释放可能处于暂停中的工作线程。
     * 没有会话时也可以安全调用。
     */
    public void stop() {
        FlowExecutor executor = currentExecutor;
        if (executor != null) {
            executor.stop();
        }
        controller.stopDebugging();
        removeRunToCursorBreakpoint();
    }

    /**
     * 等待工作线程结束。
     *
     * @return 在超时前结束（或本来就没有运行）时为 true。
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread thread = workerThread;
        if (thread == null) {
            return true;
        }
        thread.join(Math.max(1L, timeout.toMillis()));
        return !thread.isAlive();
    }

    public boolean isDebugging() {
        Thread thread = workerThread;
        return thread != null && thread.isAlive();
    }

    @PreDestroy
    public void shutdown() {
        if (isDebugging()) {
            log.info("应用关闭，停止正在运行的调试会话");
            stop();
        }
    }

    // ==================== 执行控制 ====================

    public void pause() {
        if (!controller.isPaused()) {
            controller.pauseExecution();
        }
    }

    public void resume() {
        if (controller.isPaused()) {
            controller.resumeExecution();
        }
    }

    /**
     * 单步执行：切换到单步模式后继续，工作线程会在下一个步骤前再次暂停。
     */
    public void stepOver() {
        controller.setExecutionMode(ExecutionMode.STEP);
        controller.resumeExecution();
    }

    /**
     * 流程步骤没有嵌套结构，步入与单步执行的效果相同。
     */
    public void stepInto() {
        stepOver();
    }

    /**
     * 步出：切换回调试模式后继续，直到下一个断点。
     */
    public void stepOut() {
        controller.setExecutionMode(ExecutionMode.DEBUG);
        controller.resumeExecution();
    }

    /**
     * 运行到指定步骤：添加一个临时行断点，切换到调试模式后继续。
     * 临时断点在命中或会话结束时移除，同一时间只保留一个。
     *
     * @return 临时断点的ID。
     */
    public String runToCursor(int stepIndex) {
        removeRunToCursorBreakpoint();
        String id = controller.getBreakpoints().add(Breakpoint.line(stepIndex));
        runToCursorBreakpointId = id;
        controller.getLogBuffer().add(LogLevel.DEBUG, "运行到步骤 #" + stepIndex);
        controller.setExecutionMode(ExecutionMode.DEBUG);
        controller.resumeExecution();
        return id;
    }

    private void removeRunToCursorBreakpoint() {
        String id = runToCursorBreakpointId;
        if (id != null) {
            runToCursorBreakpointId = null;
            controller.getBreakpoints().remove(id);
        }
    }

    public void setMode(ExecutionMode mode) {
        controller.setExecutionMode(mode);
    }

    public DebugStateResponse getState() {
        return new DebugStateResponse(
                controller.getExecutionMode(), controller.isPaused(), controller.getCurrentStepIndex(), isDebugging());
    }

    // ==================== 断点 ====================

    /**
     * 根据请求创建断点。条件表达式会先做语法检查。
     *
     * @return 成功时消息为新断点的ID。
     */
    public OperationResult addBreakpoint(BreakpointRequest request) {
        BreakpointType type = request.type();
        if (type == null) {
            return OperationResult.failure("必须指定断点类型");
        }
        String condition = request.condition();
        String variableName = request.variableName();
        ComparisonOperator operator = null;
        int stepIndex = request.stepIndex() != null ? request.stepIndex() : Breakpoint.ANY_STEP;

        switch (type) {
            case LINE -> {
                if (request.stepIndex() == null || stepIndex < 0) {
                    return OperationResult.failure("行断点必须指定步骤索引");
                }
            }
            case CONDITION -> {
                if (condition == null || condition.isBlank()) {
                    return OperationResult.failure("条件断点必须指定条件表达式");
                }
                try {
                    controller.getConditionEvaluator().validate(condition);
                } catch (RuntimeException e) {
                    return OperationResult.failure("条件表达式无效: " + e.getMessage());
                }
            }
            case VARIABLE -> {
                if (variableName == null || variableName.isBlank()) {
                    return OperationResult.failure("变量断点必须指定变量名");
                }
                try {
                    operator = request.comparisonOperator() != null
                            ? ComparisonOperator.fromSymbol(request.comparisonOperator())
                            : ComparisonOperator.EQUALS;
                } catch (IllegalArgumentException e) {
                    return OperationResult.failure(e.getMessage());
                }
                stepIndex = Breakpoint.ANY_STEP;
            }
            case ERROR -> {
                // 未指定步骤的错误断点匹配所有步骤
            }
        }

        var breakpoint = new Breakpoint(
                null,
                stepIndex,
                type,
                condition,
                variableName,
                request.variableValue(),
                operator,
                request.enabled() == null || request.enabled());
        String id = controller.getBreakpoints().add(breakpoint);
        controller.getLogBuffer().add(LogLevel.DEBUG, "添加断点 #" + id + " (" + type + ")");
        return OperationResult.ok(id);
    }

    public boolean removeBreakpoint(String breakpointId) {
        boolean removed = controller.getBreakpoints().remove(breakpointId);
        if (removed) {
            controller.getLogBuffer().add(LogLevel.DEBUG, "移除断点 #" + breakpointId);
        }
        return removed;
    }

    public OperationResult toggleBreakpoint(int stepIndex) {
        return controller.getBreakpoints().toggle(stepIndex);
    }

    public boolean setBreakpointEnabled(String breakpointId, boolean enabled) {
        return controller.getBreakpoints().setEnabled(breakpointId, enabled);
    }

    public void clearBreakpoints() {
        controller.getBreakpoints().clear();
        runToCursorBreakpointId = null;
        controller.getLogBuffer().add(LogLevel.DEBUG, "已清除所有断点");
    }

    public BreakpointRegistry getBreakpoints() {
        return controller.getBreakpoints();
    }

    // ==================== 监视变量 ====================

    public boolean addWatchVariable(String name) {
        return controller.addWatchVariable(name);
    }

    public boolean removeWatchVariable(String name) {
        return controller.removeWatchVariable(name);
    }

    public void clearWatchVariables() {
        controller.clearWatchVariables();
    }

    /**
     * @return 所有监视变量及其当前值，未关联变量存储时值均为 null。
     */
    public Map<String, Object> getWatchVariables() {
        Map<String, Object> values = new LinkedHashMap<>();
        controller.getWatchVariables().forEach(name -> values.put(name, null));
        values.putAll(controller.getWatchVariableValues());
        return values;
    }

    // ==================== 日志 ====================

    public List<DebugLogEntry> getLogs(LogLevel level) {
        return controller.getLogBuffer().getLogs(level);
    }

    public void clearLogs() {
        controller.getLogBuffer().clear();
    }

    public MetricsReport getMetrics() {
        return controller.getPerformanceReport();
    }

    /**
     * 将调试日志导出到配置的导出目录。
     *
     * @param format "text" 或 "json"。
     * @param fileName 不含路径的文件名。
     */
    public OperationResult exportLogs(String format, String fileName) {
        Path directory = Paths.get(settingsService.getSettings().getLogExportDirectory()).toAbsolutePath().normalize();
        Path target = directory.resolve(fileName).normalize();
        if (!target.startsWith(directory) || target.equals(directory)) {
            return OperationResult.failure("非法的文件名: " + fileName);
        }
        if ("json".equalsIgnoreCase(format)) {
            return controller.getLogBuffer().exportJson(target);
        }
        if ("text".equalsIgnoreCase(format)) {
            return controller.getLogBuffer().exportText(target);
        }
        return OperationResult.failure("不支持的导出格式: " + format);
    }

    // ==================== 设置 ====================

    /**
     * 将设置应用到执行控制器。无效的值会被忽略。
     */
    public void applySettings(Settings settings) {
        if (settings == null) {
            return;
        }
        if (settings.getMaxLogEntries() > 0) {
            controller.getLogBuffer().setMaxEntries(settings.getMaxLogEntries());
        } else {
            log.warn("忽略无效的日志条目上限: {}", settings.getMaxLogEntries());
        }
        if (settings.getMetricsSampleLimit() > 0) {
            controller.getMetrics().setExportSampleLimit(settings.getMetricsSampleLimit());
        } else {
            log.warn("忽略无效的指标采样上限: {}", settings.getMetricsSampleLimit());
        }
        controller.setPauseTimeout(Duration.ofSeconds(Math.max(0L, settings.getPauseTimeoutSeconds())));
        log.debug("已应用调试设置: {}", settings);
    }

    public ExecutionController getController() {
        return controller;
    }
}
