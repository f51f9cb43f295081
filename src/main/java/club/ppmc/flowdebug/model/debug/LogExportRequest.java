/**
 * LogExportRequest.java
 *
 * 导出调试日志的请求。文件会写入配置的导出目录中。
 */
package club.ppmc.flowdebug.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param format 导出格式，"text" 或 "json"。
 * @param fileName 导出文件名，不能包含路径分隔符。
 */
public record LogExportRequest(
        @NotBlank @Pattern(regexp = "text|json", message = "格式必须是 'text' 或 'json'") String format,
        @JsonProperty("file_name") @NotBlank @Pattern(regexp = "[^/\\\\]+", message = "文件名不能包含路径分隔符")
        String fileName) {}
