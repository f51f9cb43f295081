/**
 * ProcessSampler.java
 *
 * 当前进程资源占用的采样接口。PerformanceMetricsCollector 通过它获取内存和CPU数据，
 * 测试中可替换为返回固定数值的实现。
 */
package club.ppmc.flowdebug.debug.metrics;

import club.ppmc.flowdebug.model.metrics.ResourceSample;
import java.util.Optional;

@FunctionalInterface
public interface ProcessSampler {

    /**
     * 采集一次当前进程的资源占用。
     *
     * @return 采样结果；当前平台无法获取进程信息时为空。
     */
    Optional<ResourceSample> sample();
}
