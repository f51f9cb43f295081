/**
 * StepAction.java
 *
 * 步骤的具体动作。动作可以通过变量存储读写流程变量。
 */
package club.ppmc.flowdebug.flow;

import club.ppmc.flowdebug.model.debug.StepRecord;

@FunctionalInterface
public interface StepAction {

    /**
     * 执行动作。抛出的异常会被执行器转换为失败结果。
     */
    StepResult execute(StepRecord step, InMemoryVariableStore variables) throws Exception;
}
