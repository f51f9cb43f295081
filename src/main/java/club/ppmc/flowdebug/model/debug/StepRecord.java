/**
 * StepRecord.java
 *
 * 流程中一个步骤的描述：动作标识与参数。
 * 由流程执行器在步骤开始时传给 ExecutionController，调试子系统只读取它，从不修改。
 */
package club.ppmc.flowdebug.model.debug;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param actionId 动作标识，例如 "open_page"。
 * @param parameters 动作参数。
 */
public record StepRecord(String actionId, Map<String, Object> parameters) {

    public StepRecord {
        actionId = actionId == null ? "" : actionId;
        parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static StepRecord of(String actionId) {
        return new StepRecord(actionId, Map.of());
    }

    public static StepRecord empty() {
        return new StepRecord("", Map.of());
    }

    /**
     * 转换为断点命中事件中使用的上下文 Map。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_id", actionId);
        map.put("parameters", parameters);
        return map;
    }
}
