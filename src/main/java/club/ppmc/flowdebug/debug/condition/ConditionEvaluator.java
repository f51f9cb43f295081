/**
 * ConditionEvaluator.java
 *
 * 条件断点和变量断点的求值器。
 * 表达式只能使用受限的比较、逻辑和算术语法，无法访问文件系统、进程或任何其他外部能力。
 * 面向断点的两个方法是"失败即未命中"的：任何求值错误都会被写入调试日志并返回 false，
 * 绝不会传播到工作线程。
 */
package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.debug.Breakpoint;
import club.ppmc.flowdebug.debug.DebugLogBuffer;
import club.ppmc.flowdebug.exception.ConditionEvaluationException;
import club.ppmc.flowdebug.model.debug.LogLevel;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConditionEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ConditionParser parser = new ConditionParser();
    private final Map<String, Condition> parsedConditions = new ConcurrentHashMap<>();
    private final DebugLogBuffer logBuffer;

    public ConditionEvaluator(DebugLogBuffer logBuffer) {
        this.logBuffer = logBuffer;
    }

    /**
     * 检查表达式语法，不求值。
     *
     * @throws ConditionEvaluationException 表达式无法解析。
     */
    public void validate(String expression) {
        compile(expression);
    }

    /**
     * 严格求值，错误以异常形式抛出。
     */
    public boolean evaluate(String expression, Map<String, Object> environment) {
        Condition condition = compile(expression);
        try {
            return condition.evaluate(environment);
        } catch (ConditionEvaluationException e) {
            throw e.getExpression() == null || !e.getExpression().equals(expression)
                    ? new ConditionEvaluationException(e.getMessage(), expression, e)
                    : e;
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException("条件求值失败: " + e.getMessage(), expression, e);
        }
    }

    /**
     * 对条件断点求值。出错时记录 ERROR 日志并视为未命中。
     */
    public boolean isConditionMet(Breakpoint breakpoint, Map<String, Object> environment) {
        try {
            return evaluate(breakpoint.getCondition(), environment);
        } catch (RuntimeException e) {
            reportFailure(breakpoint, "条件表达式求值失败: " + breakpoint.getCondition() + ", 错误: " + e.getMessage(), e);
            return false;
        }
    }

    /**
     * 用断点的比较运算符比较变量当前值与断点的期望值。出错时记录 ERROR 日志并视为未命中。
     */
    public boolean isVariableConditionMet(Breakpoint breakpoint, Object currentValue) {
        try {
            return ValueComparator.compare(
                    currentValue, breakpoint.getComparisonOperator(), breakpoint.getVariableValue());
        } catch (RuntimeException e) {
            reportFailure(breakpoint, "变量断点比较失败: " + breakpoint.getVariableName() + ", 错误: " + e.getMessage(), e);
            return false;
        }
    }

    private Condition compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConditionEvaluationException("条件表达式为空", expression);
        }
        Condition cached = parsedConditions.get(expression);
        if (cached != null) {
            return cached;
        }
        Condition condition = parser.parse(expression);
        parsedConditions.put(expression, condition);
        return condition;
    }

    private void reportFailure(Breakpoint breakpoint, String message, RuntimeException e) {
        LOGGER.warn("断点 {} 求值失败: {}", breakpoint.getId(), e.getMessage());
        logBuffer.add(LogLevel.ERROR, message);
    }
}
