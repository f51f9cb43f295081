/**
 * Breakpoint.java
 *
 * 断点定义。除 enabled 和 hitCount 外的字段在创建后不可变。
 * hitCount 只由 ExecutionController 在其串行化的求值路径中递增，
 * 因此递增方法是包级私有的。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;

@Getter
public class Breakpoint {

    /** 错误断点和变量断点使用的通配步骤索引。 */
    public static final int ANY_STEP = -1;

    private final String id;
    private final int stepIndex;
    private final BreakpointType type;
    private final String condition;
    private final String variableName;
    private final Object variableValue;
    private final ComparisonOperator comparisonOperator;
    private volatile boolean enabled;
    private volatile int hitCount;

    public Breakpoint(
            String id,
            int stepIndex,
            BreakpointType type,
            String condition,
            String variableName,
            Object variableValue,
            ComparisonOperator comparisonOperator,
            boolean enabled) {
        this.id = id != null && !id.isBlank() ? id : generateId();
        this.stepIndex = stepIndex;
        this.type = type != null ? type : BreakpointType.LINE;
        this.condition = condition != null ? condition : "";
        this.variableName = variableName != null ? variableName : "";
        this.variableValue = variableValue;
        this.comparisonOperator = comparisonOperator != null ? comparisonOperator : ComparisonOperator.EQUALS;
        this.enabled = enabled;
    }

    public static Breakpoint line(int stepIndex) {
        return new Breakpoint(null, stepIndex, BreakpointType.LINE, null, null, null, null, true);
    }

    public static Breakpoint condition(int stepIndex, String expression) {
        return new Breakpoint(null, stepIndex, BreakpointType.CONDITION, expression, null, null, null, true);
    }

    public static Breakpoint error(int stepIndex) {
        return new Breakpoint(null, stepIndex, BreakpointType.ERROR, null, null, null, null, true);
    }

    public static Breakpoint variable(String variableName, ComparisonOperator operator, Object value) {
        return new Breakpoint(null, ANY_STEP, BreakpointType.VARIABLE, null, variableName, value, operator, true);
    }

    /**
     * 判断该断点是否作用于给定步骤。通配索引匹配所有步骤。
     */
    public boolean targets(int index) {
        return stepIndex == ANY_STEP || stepIndex == index;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void recordHit() {
        hitCount++;
    }

    /**
     * 转换为字典形式。variable_value 以字符串形式保存。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("step_index", stepIndex);
        map.put("type", type.name());
        map.put("condition", condition);
        map.put("variable_name", variableName);
        map.put("variable_value", variableValue != null ? String.valueOf(variableValue) : null);
        map.put("comparison_operator", comparisonOperator.symbol());
        map.put("enabled", enabled);
        map.put("hit_count", hitCount);
        return map;
    }

    /**
     * 从字典创建断点。缺失的字段使用默认值，hit_count 缺省为 0。
     *
     * @throws IllegalArgumentException 如果类型或比较运算符无法识别。
     */
    public static Breakpoint fromMap(Map<String, ?> data) {
        Object type = data.get("type");
        Object operator = data.get("comparison_operator");
        Object enabled = data.get("enabled");
        var breakpoint = new Breakpoint(
                data.get("id") != null ? String.valueOf(data.get("id")) : null,
                toInt(data.get("step_index"), 0),
                type != null ? BreakpointType.valueOf(String.valueOf(type).trim().toUpperCase(Locale.ROOT)) : null,
                data.get("condition") != null ? String.valueOf(data.get("condition")) : null,
                data.get("variable_name") != null ? String.valueOf(data.get("variable_name")) : null,
                data.get("variable_value"),
                operator != null ? ComparisonOperator.fromSymbol(String.valueOf(operator)) : null,
                enabled == null || Boolean.parseBoolean(String.valueOf(enabled)));
        breakpoint.hitCount = toInt(data.get("hit_count"), 0);
        return breakpoint;
    }

    private static int toInt(Object value, int defaultValue) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return (int) Double.parseDouble(text.trim());
        }
        return defaultValue;
    }

    private static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return String.format("Breakpoint[%s, %s, step=%d, enabled=%s, hits=%d]", id, type, stepIndex, enabled, hitCount);
    }
}
