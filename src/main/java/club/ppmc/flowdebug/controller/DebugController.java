/**
 * DebugController.java
 *
 * 该控制器负责处理所有与调试功能相关的HTTP请求。
 * 它作为前端UI和后端 DebugSessionService 之间的桥梁，将用户的操作
 * （暂停、继续、单步、设置断点、监视变量、导出日志等）转换为对服务的调用。
 * 流程的启动由嵌入方通过 DebugSessionService 完成，这里只提供控制接口。
 */
package club.ppmc.flowdebug.controller;

import club.ppmc.flowdebug.debug.Breakpoint;
import club.ppmc.flowdebug.model.debug.BreakpointRequest;
import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.DebugStateResponse;
import club.ppmc.flowdebug.model.debug.EnableBreakpointRequest;
import club.ppmc.flowdebug.model.debug.LogExportRequest;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.ModeRequest;
import club.ppmc.flowdebug.model.debug.OperationResult;
import club.ppmc.flowdebug.model.debug.RunToCursorRequest;
import club.ppmc.flowdebug.model.debug.ToggleBreakpointRequest;
import club.ppmc.flowdebug.model.debug.WatchVariableRequest;
import club.ppmc.flowdebug.model.metrics.MetricsReport;
import club.ppmc.flowdebug.service.DebugSessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestController
@RequestMapping("/api/debug")
@Slf4j
public class DebugController {

    private final DebugSessionService debugSessionService;

    public DebugController(DebugSessionService debugSessionService) {
        this.debugSessionService = debugSessionService;
    }

    // ==================== 执行控制 ====================

    @GetMapping("/state")
    public ResponseEntity<DebugStateResponse> getState() {
        return ResponseEntity.ok(debugSessionService.getState());
    }

    /**
     * 手动暂停。工作线程会在下一个步骤开始前阻塞。
     */
    @PostMapping("/pause")
    public ResponseEntity<Map<String, String>> pause() {
        debugSessionService.pause();
        return ResponseEntity.ok(Map.of("message", "已请求暂停。"));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, String>> resume() {
        debugSessionService.resume();
        return ResponseEntity.ok(Map.of("message", "继续执行。"));
    }

    /**
     * 停止当前的调试会话。
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        debugSessionService.stop();
        return ResponseEntity.ok(Map.of("message", "调试会话已停止。"));
    }

    @PostMapping("/stepOver")
    public ResponseEntity<Void> stepOver() {
        debugSessionService.stepOver();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/stepInto")
    public ResponseEntity<Void> stepInto() {
        debugSessionService.stepInto();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/stepOut")
    public ResponseEntity<Void> stepOut() {
        debugSessionService.stepOut();
        return ResponseEntity.ok().build();
    }

    /**
     * 运行到指定步骤。
     */
    @PostMapping("/runToCursor")
    public ResponseEntity<Map<String, String>> runToCursor(@Valid @RequestBody RunToCursorRequest request) {
        String breakpointId = debugSessionService.runToCursor(request.stepIndex());
        return ResponseEntity.ok(Map.of(
                "message", "运行到步骤 #" + request.stepIndex(),
                "breakpoint_id", breakpointId));
    }

    @PostMapping("/mode")
    public ResponseEntity<Map<String, String>> setMode(@Valid @RequestBody ModeRequest request) {
        debugSessionService.setMode(request.mode());
        return ResponseEntity.ok(Map.of("message", "执行模式已设置为 " + request.mode()));
    }

    // ==================== 断点 ====================

    @GetMapping("/breakpoints")
    public ResponseEntity<List<Map<String, Object>>> listBreakpoints() {
        return ResponseEntity.ok(debugSessionService.getBreakpoints().list().stream()
                .map(Breakpoint::toMap)
                .collect(Collectors.toList()));
    }

    /**
     * 添加断点。
     *
     * @return 成功时返回新断点的ID，参数不合法时返回400。
     */
    @PostMapping("/breakpoints")
    public ResponseEntity<Map<String, String>> addBreakpoint(@Valid @RequestBody BreakpointRequest request) {
        OperationResult result = debugSessionService.addBreakpoint(request);
        if (!result.success()) {
            return ResponseEntity.badRequest().body(Map.of("message", result.message()));
        }
        return ResponseEntity.ok(Map.of("id", result.message()));
    }

    @DeleteMapping("/breakpoints/{id}")
    public ResponseEntity<Map<String, String>> removeBreakpoint(@PathVariable String id) {
        if (!debugSessionService.removeBreakpoint(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "断点不存在: " + id));
        }
        return ResponseEntity.ok(Map.of("message", "已移除断点 #" + id));
    }

    @DeleteMapping("/breakpoints")
    public ResponseEntity<Map<String, String>> clearBreakpoints() {
        debugSessionService.clearBreakpoints();
        return ResponseEntity.ok(Map.of("message", "已清除所有断点。"));
    }

    @PostMapping("/breakpoints/{id}/enabled")
    public ResponseEntity<Map<String, String>> setBreakpointEnabled(
            @PathVariable String id, @RequestBody EnableBreakpointRequest request) {
        if (!debugSessionService.setBreakpointEnabled(id, request.enabled())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "断点不存在: " + id));
        }
        return ResponseEntity.ok(Map.of("message", (request.enabled() ? "已启用" : "已禁用") + "断点 #" + id));
    }

    /**
     * 切换（设置或移除）指定步骤上的行断点。
     */
    @PostMapping("/breakpoints/toggle")
    public ResponseEntity<OperationResult> toggleBreakpoint(@Valid @RequestBody ToggleBreakpointRequest request) {
        return ResponseEntity.ok(debugSessionService.toggleBreakpoint(request.stepIndex()));
    }

    @GetMapping(value = "/breakpoints/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportBreakpoints() {
        return ResponseEntity.ok(debugSessionService.getBreakpoints().exportJson());
    }

    @PostMapping(value = "/breakpoints/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OperationResult> importBreakpoints(@RequestBody String json) {
        OperationResult result = debugSessionService.getBreakpoints().importJson(json);
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    // ==================== 监视变量 ====================

    @GetMapping("/watches")
    public ResponseEntity<Map<String, Object>> getWatches() {
        return ResponseEntity.ok(debugSessionService.getWatchVariables());
    }

    @PostMapping("/watches")
    public ResponseEntity<Map<String, String>> addWatch(@Valid @RequestBody WatchVariableRequest request) {
        if (!debugSessionService.addWatchVariable(request.name())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("message", "监视变量已存在: " + request.name()));
        }
        return ResponseEntity.ok(Map.of("message", "已添加监视变量: " + request.name()));
    }

    @DeleteMapping("/watches/{name}")
    public ResponseEntity<Map<String, String>> removeWatch(@PathVariable String name) {
        if (!debugSessionService.removeWatchVariable(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "监视变量不存在: " + name));
        }
        return ResponseEntity.ok(Map.of("message", "已移除监视变量: " + name));
    }

    @DeleteMapping("/watches")
    public ResponseEntity<Map<String, String>> clearWatches() {
        debugSessionService.clearWatchVariables();
        return ResponseEntity.ok(Map.of("message", "已清除所有监视变量。"));
    }

    // ==================== 日志与指标 ====================

    /**
     * 获取调试日志。
     *
     * @param level 可选的级别过滤条件。
     */
    @GetMapping("/logs")
    public ResponseEntity<List<DebugLogEntry>> getLogs(@RequestParam(required = false) LogLevel level) {
        return ResponseEntity.ok(debugSessionService.getLogs(level));
    }

    @DeleteMapping("/logs")
    public ResponseEntity<Map<String, String>> clearLogs() {
        debugSessionService.clearLogs();
        return ResponseEntity.ok(Map.of("message", "调试日志已清空。"));
    }

    @PostMapping("/logs/export")
    public ResponseEntity<OperationResult> exportLogs(@Valid @RequestBody LogExportRequest request) {
        OperationResult result = debugSessionService.exportLogs(request.format(), request.fileName());
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.internalServerError().body(result);
    }

    @GetMapping("/metrics")
    public ResponseEntity<MetricsReport> getMetrics() {
        return ResponseEntity.ok(debugSessionService.getMetrics());
    }

    // ==================== 错误处理 ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of("message", "请求参数无效: " + message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleUnreadable(Exception e) {
        log.debug("无法解析调试请求", e);
        return ResponseEntity.badRequest().body(Map.of("message", "请求格式错误: " + e.getMessage()));
    }
}
