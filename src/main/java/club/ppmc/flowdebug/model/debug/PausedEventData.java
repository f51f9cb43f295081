/**
 * PausedEventData.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于聚合流程暂停时需要发送给前端的所有上下文信息。
 * 它是 WsDebugEvent 中 PAUSED 事件的数据负载。
 */
package club.ppmc.flowdebug.model.debug;

import club.ppmc.flowdebug.model.metrics.MetricsReport;
import java.util.Map;

/**
 * 聚合了流程暂停时所有相关信息的记录。
 *
 * @param stepIndex 当前暂停所在的步骤索引。
 * @param watchValues 所有监视变量的当前值。
 * @param metrics 暂停时刻的性能指标。
 */
public record PausedEventData(int stepIndex, Map<String, Object> watchValues, MetricsReport metrics) {}
