/**
 * LogLevel.java
 *
 * 调试日志条目的级别。
 */
package club.ppmc.flowdebug.model.debug;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
