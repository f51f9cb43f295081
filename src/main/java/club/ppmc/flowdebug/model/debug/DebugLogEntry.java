/**
 * DebugLogEntry.java
 *
 * 调试日志缓冲区中的一条记录。它是不可变的，由 DebugLogBuffer 创建，
 * 并通过 REST 接口或 WebSocket 推送给前端。
 */
package club.ppmc.flowdebug.model.debug;

/**
 * @param timestamp 记录时间 (毫秒时间戳)。
 * @param level 日志级别。
 * @param message 日志内容。
 */
public record DebugLogEntry(long timestamp, LogLevel level, String message) {}
