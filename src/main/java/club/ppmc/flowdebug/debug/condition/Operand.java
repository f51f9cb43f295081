/**
 * Operand.java
 *
 * 比较两侧的值表达式：字面量、变量引用、列表字面量、取负和四则/取模运算。
 */
package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.exception.ConditionEvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public sealed interface Operand {

    Object evaluate(Map<String, Object> environment);

    record Literal(Object value) implements Operand {
        @Override
        public Object evaluate(Map<String, Object> environment) {
            return value;
        }
    }

    record Variable(String name) implements Operand {
        @Override
        public Object evaluate(Map<String, Object> environment) {
            if (!environment.containsKey(name)) {
                throw new ConditionEvaluationException("未定义的变量: " + name, name);
            }
            return environment.get(name);
        }
    }

    record ListLiteral(List<Operand> elements) implements Operand {
        @Override
        public Object evaluate(Map<String, Object> environment) {
            List<Object> values = new ArrayList<>(elements.size());
            for (Operand element : elements) {
                values.add(element.evaluate(environment));
            }
            return values;
        }
    }

    record Negation(Operand operand) implements Operand {
        @Override
        public Object evaluate(Map<String, Object> environment) {
            Object value = operand.evaluate(environment);
            if (isIntegral(value)) {
                try {
                    return Math.negateExact(((Number) value).longValue());
                } catch (ArithmeticException e) {
                    throw new ConditionEvaluationException("整数取负溢出: " + value, null, e);
                }
            }
            Double number = ValueComparator.toNumber(value);
            if (number == null) {
                throw new ConditionEvaluationException("无法对非数字取负: " + value, null);
            }
            return -number;
        }
    }

    record Arithmetic(Operand left, char operator, Operand right) implements Operand {

        @Override
        public Object evaluate(Map<String, Object> environment) {
            Object leftValue = left.evaluate(environment);
            Object rightValue = right.evaluate(environment);
            if (operator == '+' && (leftValue instanceof String || rightValue instanceof String)
                    && (ValueComparator.toNumber(leftValue) == null || ValueComparator.toNumber(rightValue) == null)) {
                return String.valueOf(leftValue) + rightValue;
            }
            Double a = ValueComparator.toNumber(leftValue);
            Double b = ValueComparator.toNumber(rightValue);
            if (a == null || b == null) {
                throw new ConditionEvaluationException(
                        String.format("运算 '%s' 需要数字操作数: %s, %s", operator, leftValue, rightValue), null);
            }
            if (operator != '/' && isIntegral(leftValue) && isIntegral(rightValue)) {
                return integralResult(((Number) leftValue).longValue(), ((Number) rightValue).longValue());
            }
            return switch (operator) {
                case '+' -> a + b;
                case '-' -> a - b;
                case '*' -> a * b;
                case '/' -> {
                    if (b == 0) {
                        throw new ConditionEvaluationException("除数不能为零", null);
                    }
                    yield a / b;
                }
                case '%' -> {
                    if (b == 0) {
                        throw new ConditionEvaluationException("取模的除数不能为零", null);
                    }
                    yield a % b;
                }
                default -> throw new ConditionEvaluationException("不支持的运算符: " + operator, null);
            };
        }

        /**
         * 两个整数操作数使用 long 精确运算，溢出时抛出异常而不是静默截断。
         */
        private Object integralResult(long a, long b) {
            try {
                return switch (operator) {
                    case '+' -> Math.addExact(a, b);
                    case '-' -> Math.subtractExact(a, b);
                    case '*' -> Math.multiplyExact(a, b);
                    case '%' -> {
                        if (b == 0) {
                            throw new ConditionEvaluationException("取模的除数不能为零", null);
                        }
                        yield a % b;
                    }
                    default -> throw new ConditionEvaluationException("不支持的运算符: " + operator, null);
                };
            } catch (ArithmeticException e) {
                throw new ConditionEvaluationException(
                        String.format("整数运算溢出: %d %s %d", a, operator, b), null, e);
            }
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
