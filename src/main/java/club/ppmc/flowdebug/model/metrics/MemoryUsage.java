/**
 * MemoryUsage.java
 *
 * 平均内存占用，单位 MB。
 */
package club.ppmc.flowdebug.model.metrics;

public record MemoryUsage(double rss, double vms) {

    public static final MemoryUsage ZERO = new MemoryUsage(0.0, 0.0);
}
