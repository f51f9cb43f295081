/**
 * BreakpointType.java
 *
 * 断点的四种类型。
 */
package club.ppmc.flowdebug.model.debug;

public enum BreakpointType {
    /** 行断点：在指定步骤开始前暂停。 */
    LINE,
    /** 条件断点：在指定步骤开始前，当表达式成立时暂停。 */
    CONDITION,
    /** 错误断点：步骤执行失败时暂停。 */
    ERROR,
    /** 变量断点：步骤完成后，当变量满足比较条件时暂停。 */
    VARIABLE
}
