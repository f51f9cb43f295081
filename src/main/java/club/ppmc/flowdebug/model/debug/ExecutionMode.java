/**
 * ExecutionMode.java
 *
 * 流程的执行模式。同一时刻只有一个模式处于激活状态，
 * 模式的切换只能通过 ExecutionController 的公开方法完成。
 */
package club.ppmc.flowdebug.model.debug;

public enum ExecutionMode {
    /** 正常执行，从不暂停。 */
    NORMAL,
    /** 调试执行，仅在断点命中时暂停。 */
    DEBUG,
    /** 单步执行，每个步骤开始前都暂停。 */
    STEP
}
