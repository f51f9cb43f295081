/**
 * StepTiming.java
 *
 * 单个步骤的计时记录。
 */
package club.ppmc.flowdebug.model.metrics;

/**
 * @param start 开始时间 (毫秒时间戳)。
 * @param end 结束时间 (毫秒时间戳)，步骤未结束时为 0。
 * @param duration 执行耗时 (秒)，步骤未结束时为 0。
 */
public record StepTiming(long start, long end, double duration) {

    public static StepTiming started(long start) {
        return new StepTiming(start, 0L, 0.0);
    }

    public StepTiming finish(long endTime) {
        return new StepTiming(start, endTime, (endTime - start) / 1000.0);
    }
}
