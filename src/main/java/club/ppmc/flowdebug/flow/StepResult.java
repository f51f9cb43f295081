/**
 * StepResult.java
 *
 * 单个步骤动作的执行结果。
 */
package club.ppmc.flowdebug.flow;

/**
 * @param success 步骤是否成功。
 * @param message 结果消息，失败时为错误描述。
 */
public record StepResult(boolean success, String message) {

    public static StepResult ok(String message) {
        return new StepResult(true, message);
    }

    public static StepResult failed(String message) {
        return new StepResult(false, message);
    }
}
