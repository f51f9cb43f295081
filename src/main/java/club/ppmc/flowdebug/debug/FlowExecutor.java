/**
 * FlowExecutor.java
 *
 * 顺序执行流程步骤的执行器。调试子系统只观察并控制它的节奏，不参与步骤本身的执行。
 */
package club.ppmc.flowdebug.debug;

public interface FlowExecutor {

    /**
     * 在当前线程上顺序执行整个流程，并在各个挂起点回调监听器。
     *
     * @return 流程是否成功完成。
     */
    boolean execute(FlowExecutionListener listener);

    /**
     * 请求执行器在当前步骤结束后停止。可从任意线程调用。
     */
    void stop();
}
