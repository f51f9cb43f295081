/**
 * MemorySample.java
 *
 * 一次进程内存采样。
 */
package club.ppmc.flowdebug.model.metrics;

/**
 * @param timestamp 采样时间 (毫秒时间戳)。
 * @param rss 常驻内存 (字节)。
 * @param vms 虚拟内存 (字节)。
 */
public record MemorySample(long timestamp, long rss, long vms) {}
