/**
 * DebugStateResponse.java
 *
 * GET /api/debug/state 的响应体，描述调试器当前状态。
 */
package club.ppmc.flowdebug.model.debug;

/**
 * @param mode 当前执行模式。
 * @param paused 是否处于暂停状态。
 * @param currentStepIndex 最近一次开始执行的步骤索引，未开始时为 -1。
 * @param debugging 是否有流程正在工作线程上运行。
 */
public record DebugStateResponse(ExecutionMode mode, boolean paused, int currentStepIndex, boolean debugging) {}
