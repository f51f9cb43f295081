/**
 * SettingsController.java
 *
 * 该控制器负责处理调试器设置的读取和更新请求。
 * 设置通过 SettingsService 持久化，并立即应用到正在运行的执行控制器。
 */
package club.ppmc.flowdebug.controller;

import club.ppmc.flowdebug.model.Settings;
import club.ppmc.flowdebug.service.DebugSessionService;
import club.ppmc.flowdebug.service.SettingsService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;
    private final DebugSessionService debugSessionService;

    public SettingsController(SettingsService settingsService, DebugSessionService debugSessionService) {
        this.settingsService = settingsService;
        this.debugSessionService = debugSessionService;
    }

    /**
     * 获取当前的调试器设置。
     */
    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    /**
     * 更新并保存设置，然后应用到执行控制器。
     */
    @PostMapping
    public ResponseEntity<?> updateSettings(@Valid @RequestBody Settings newSettings) {
        try {
            settingsService.updateSettings(newSettings);
            debugSessionService.applySettings(newSettings);
            return ResponseEntity.ok(Map.of("message", "设置更新成功。"));
        } catch (IOException e) {
            log.error("保存设置失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
    }
}
