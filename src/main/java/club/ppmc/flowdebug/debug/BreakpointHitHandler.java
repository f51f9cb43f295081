/**
 * BreakpointHitHandler.java
 *
 * 断点命中回调。
 */
package club.ppmc.flowdebug.debug;

import java.util.Map;

@FunctionalInterface
public interface BreakpointHitHandler {

    /**
     * @param breakpointId 命中的断点ID。
     * @param stepIndex 命中时的步骤索引。
     * @param context 命中上下文（步骤数据、错误信息或变量值）。
     */
    void onBreakpointHit(String breakpointId, int stepIndex, Map<String, Object> context);
}
