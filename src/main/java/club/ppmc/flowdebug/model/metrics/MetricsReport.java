/**
 * MetricsReport.java
 *
 * 该文件定义了性能指标的导出视图，对应 PerformanceMetricsCollector 的完整统计结果。
 * 它通过 REST 接口返回，也会在流程暂停时随 PAUSED 事件通过 WebSocket 推送给前端。
 * 为了控制导出体积，原始采样只保留最近的若干条。
 */
package club.ppmc.flowdebug.model.metrics;

import java.util.List;
import java.util.Map;

/**
 * 封装性能统计数据的记录。
 *
 * @param totalTime 总执行时间 (秒)。
 * @param stepTimes 每个步骤的计时，键为步骤索引。
 * @param avgMemoryUsage 平均内存占用 (MB)。
 * @param avgCpuUsage 平均CPU使用率 (百分比)。
 * @param memoryUsage 最近的内存采样。
 * @param cpuUsage 最近的CPU采样。
 */
public record MetricsReport(
        double totalTime,
        Map<Integer, StepTiming> stepTimes,
        MemoryUsage avgMemoryUsage,
        double avgCpuUsage,
        List<MemorySample> memoryUsage,
        List<CpuSample> cpuUsage) {}
