/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化调试器的各项配置。
 * 这些设置可以由用户通过UI修改，由 SettingsService 负责加载和保存到 settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.flowdebug.model;

import club.ppmc.flowdebug.model.debug.ExecutionMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class Settings {

    // --- 调试日志 ---
    /**
     * 调试日志缓冲区最多保留的条目数，超出后丢弃最旧的条目。
     */
    @Min(1)
    private int maxLogEntries = 1000;

    /**
     * 导出调试日志时使用的目录。
     */
    @NotBlank
    private String logExportDirectory = "./debug-logs";

    // --- 性能指标 ---
    /**
     * 导出性能指标时保留的最近原始采样条数。
     */
    @Min(1)
    private int metricsSampleLimit = 100;

    // --- 执行控制 ---
    /**
     * 暂停的最长等待时间（秒）。0 表示无限等待，直到用户继续或停止。
     */
    @Min(0)
    private long pauseTimeoutSeconds = 0;

    /**
     * 启动新会话时未指定模式时使用的执行模式。
     */
    @NotNull
    private ExecutionMode defaultExecutionMode = ExecutionMode.DEBUG;
}
