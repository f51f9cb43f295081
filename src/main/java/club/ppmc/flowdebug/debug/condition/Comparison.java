/**
 * Comparison.java
 *
 * 比较节点：lhs op rhs。
 */
package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.Map;

public record Comparison(Operand left, ComparisonOperator operator, Operand right) implements Condition {

    @Override
    public boolean evaluate(Map<String, Object> environment) {
        return ValueComparator.compare(left.evaluate(environment), operator, right.evaluate(environment));
    }
}
