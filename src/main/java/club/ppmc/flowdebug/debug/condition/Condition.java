/**
 * Condition.java
 *
 * 受限的条件表达式语法树。只允许比较和逻辑组合两类节点，
 * 求值时只能读取传入的变量环境，无法访问文件系统、进程或任何其他外部能力。
 */
package club.ppmc.flowdebug.debug.condition;

import java.util.Map;

public sealed interface Condition permits Comparison, Logical {

    /**
     * 在给定的变量环境中求值。
     *
     * @param environment 变量名到变量值的映射。
     * @throws club.ppmc.flowdebug.exception.ConditionEvaluationException 如果无法求值。
     */
    boolean evaluate(Map<String, Object> environment);
}
