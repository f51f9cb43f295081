/**
 * CpuSample.java
 *
 * 一次进程CPU采样。
 */
package club.ppmc.flowdebug.model.metrics;

/**
 * @param timestamp 采样时间 (毫秒时间戳)。
 * @param percent 两次采样之间的进程CPU使用率 (百分比)。
 */
public record CpuSample(long timestamp, double percent) {}
