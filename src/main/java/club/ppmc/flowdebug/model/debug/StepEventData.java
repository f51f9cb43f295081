/**
 * StepEventData.java
 *
 * STEP 事件的数据负载，在单步模式下每个步骤开始前发送。
 */
package club.ppmc.flowdebug.model.debug;

public record StepEventData(int stepIndex, StepRecord step) {}
