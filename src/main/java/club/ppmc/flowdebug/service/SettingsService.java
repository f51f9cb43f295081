/**
 * SettingsService.java
 *
 * 调试器的配置中心，负责设置的加载、更新和持久化。
 * 设置以JSON格式保存在 app.settings-dir 目录下的 settings.json 中。
 * 首次启动时使用 application.properties 中 app.debug.* 的值作为默认设置创建该文件。
 */
package club.ppmc.flowdebug.service;

import club.ppmc.flowdebug.model.Settings;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final int initialMaxLogEntries;
    private final String initialLogExportDirectory;
    private final int initialMetricsSampleLimit;
    private final long initialPauseTimeoutSeconds;
    private final ExecutionMode initialExecutionMode;

    public SettingsService(
            @Value("${app.settings-dir:./.flow-debugger}") String settingsDir,
            @Value("${app.debug.max-log-entries:1000}") int initialMaxLogEntries,
            @Value("${app.debug.log-export-dir:./debug-logs}") String initialLogExportDirectory,
            @Value("${app.debug.metrics-sample-limit:100}") int initialMetricsSampleLimit,
            @Value("${app.debug.pause-timeout-seconds:0}") long initialPauseTimeoutSeconds,
            @Value("${app.debug.default-mode:DEBUG}") ExecutionMode initialExecutionMode) {

        this.settingsFilePath = Paths.get(settingsDir, SETTINGS_FILE_NAME).toAbsolutePath().normalize();
        this.initialMaxLogEntries = initialMaxLogEntries;
        this.initialLogExportDirectory = initialLogExportDirectory;
        this.initialMetricsSampleLimit = initialMetricsSampleLimit;
        this.initialPauseTimeoutSeconds = initialPauseTimeoutSeconds;
        this.initialExecutionMode = initialExecutionMode;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    public synchronized void updateSettings(Settings newSettings) throws IOException {
        this.currentSettings = newSettings;
        saveSettings();
    }

    public Path getSettingsFilePath() {
        return settingsFilePath;
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        if (Files.notExists(settingsFilePath.getParent())) {
            Files.createDirectories(settingsFilePath.getParent());
        }
        try {
            Files.write(settingsFilePath, objectMapper.writeValueAsBytes(currentSettings));
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        settings.setMaxLogEntries(initialMaxLogEntries);
        settings.setLogExportDirectory(initialLogExportDirectory);
        settings.setMetricsSampleLimit(initialMetricsSampleLimit);
        settings.setPauseTimeoutSeconds(initialPauseTimeoutSeconds);
        settings.setDefaultExecutionMode(initialExecutionMode);
        return settings;
    }
}
