/**
 * FlowExecutionListener.java
 *
 * 流程执行器在每个步骤前后以及流程结束时的回调。
 * 所有回调都在执行流程的工作线程上同步调用，onStepStart 可能在此阻塞（暂停）。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.StepRecord;

public interface FlowExecutionListener {

    void onStepStart(int stepIndex, StepRecord step);

    /**
     * @param message 步骤结果消息，可以是字符串，也可以是包含 "message" 键的 Map。
     */
    void onStepComplete(int stepIndex, boolean success, Object message);

    void onFlowComplete(boolean success);
}
