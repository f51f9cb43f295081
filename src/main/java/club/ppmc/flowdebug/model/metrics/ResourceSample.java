/**
 * ResourceSample.java
 *
 * ProcessSampler 返回的一次原始采样结果，由 PerformanceMetricsCollector 拆分为内存和CPU两条记录。
 */
package club.ppmc.flowdebug.model.metrics;

/**
 * @param rss 常驻内存 (字节)。
 * @param vms 虚拟内存 (字节)。
 * @param cpuPercent 自上次采样以来的CPU使用率 (百分比)。
 */
public record ResourceSample(long rss, long vms, double cpuPercent) {}
