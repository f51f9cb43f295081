/**
 * BreakpointHitEventData.java
 *
 * BREAKPOINT_HIT 事件的数据负载。
 */
package club.ppmc.flowdebug.model.debug;

import java.util.Map;

/**
 * @param breakpointId 命中的断点ID。
 * @param stepIndex 命中时所在的步骤索引。
 * @param context 命中上下文：行/条件断点为步骤数据，错误断点为错误信息，变量断点为变量名和值。
 */
public record BreakpointHitEventData(String breakpointId, int stepIndex, Map<String, Object> context) {}
