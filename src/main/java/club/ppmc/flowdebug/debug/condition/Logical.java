/**
 * Logical.java
 *
 * 逻辑节点：and / or 组合任意多个子条件，not 只有一个子条件。
 * and / or 按从左到右短路求值。
 */
package club.ppmc.flowdebug.debug.condition;

import java.util.List;
import java.util.Map;

public record Logical(Operator operator, List<Condition> operands) implements Condition {

    public enum Operator {
        AND,
        OR,
        NOT
    }

    public Logical {
        operands = List.copyOf(operands);
        if (operator == Operator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("not 只能有一个操作数");
        }
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("逻辑表达式至少需要一个操作数");
        }
    }

    @Override
    public boolean evaluate(Map<String, Object> environment) {
        return switch (operator) {
            case AND -> operands.stream().allMatch(condition -> condition.evaluate(environment));
            case OR -> operands.stream().anyMatch(condition -> condition.evaluate(environment));
            case NOT -> !operands.get(0).evaluate(environment);
        };
    }
}
