/**
 * ValueComparator.java
 *
 * 变量断点和条件表达式共用的宽松比较规则：
 * 两侧都能解释为数字时按数值比较（"10" 与 10 相等）；
 * 否则相等性按字符串形式比较，大小比较仅支持两个字符串；
 * in / not in 对集合检查元素，对 Map 检查键，对其他值检查字符串包含关系。
 */
package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.exception.ConditionEvaluationException;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

public final class ValueComparator {

    private ValueComparator() {}

    public static boolean compare(Object actual, ComparisonOperator operator, Object expected) {
        return switch (operator) {
            case EQUALS -> looselyEquals(actual, expected);
            case NOT_EQUALS -> !looselyEquals(actual, expected);
            case GREATER_THAN -> order(actual, expected, operator) > 0;
            case LESS_THAN -> order(actual, expected, operator) < 0;
            case GREATER_OR_EQUAL -> order(actual, expected, operator) >= 0;
            case LESS_OR_EQUAL -> order(actual, expected, operator) <= 0;
            case IN -> contains(expected, actual);
            case NOT_IN -> !contains(expected, actual);
        };
    }

    public static boolean looselyEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        Long leftIntegral = toIntegral(left);
        Long rightIntegral = toIntegral(right);
        if (leftIntegral != null && rightIntegral != null) {
            return leftIntegral.longValue() == rightIntegral.longValue();
        }
        Double leftNumber = toNumber(left);
        Double rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return Double.compare(leftNumber, rightNumber) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return String.valueOf(left).equalsIgnoreCase(String.valueOf(right));
        }
        return Objects.equals(String.valueOf(left), String.valueOf(right));
    }

    private static int order(Object left, Object right, ComparisonOperator operator) {
        Long leftIntegral = toIntegral(left);
        Long rightIntegral = toIntegral(right);
        if (leftIntegral != null && rightIntegral != null) {
            return Long.compare(leftIntegral, rightIntegral);
        }
        Double leftNumber = toNumber(left);
        Double rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return Double.compare(leftNumber, rightNumber);
        }
        if (left instanceof String leftText && right instanceof String rightText) {
            return leftText.compareTo(rightText);
        }
        throw new ConditionEvaluationException(
                String.format("无法使用 '%s' 比较 %s 和 %s", operator.symbol(), describe(left), describe(right)),
                null);
    }

    private static boolean contains(Object container, Object element) {
        if (container == null) {
            throw new ConditionEvaluationException("'in' 运算的右侧不能为空", null);
        }
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> looselyEquals(item, element));
        }
        if (container instanceof Map<?, ?> map) {
            return map.keySet().stream().anyMatch(key -> looselyEquals(key, element));
        }
        if (element == null) {
            return false;
        }
        return String.valueOf(container).contains(String.valueOf(element));
    }

    /**
     * 尝试把值解释为数字。布尔值不视为数字。
     *
     * @return 数值，无法解释时返回 null。
     */
    static Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty() || !trimmed.matches("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?")) {
                return null;
            }
            return Double.parseDouble(trimmed);
        }
        return null;
    }

    /**
     * 尝试把值解释为整数，用于避免大整数经 double 比较时丢失精度。
     *
     * @return 整数值；不是整数类型、不是整数字面量或超出 long 范围时返回 null。
     */
    static Long toIntegral(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (!trimmed.matches("[-+]?\\d+")) {
                return null;
            }
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }
}
