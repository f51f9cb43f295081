/**
 * OperationResult.java
 *
 * 一个简单的 (是否成功, 消息) 结果对象。
 * 用于不应抛出异常的操作，例如日志导出和断点切换。
 */
package club.ppmc.flowdebug.model.debug;

public record OperationResult(boolean success, String message) {

    public static OperationResult ok(String message) {
        return new OperationResult(true, message);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message);
    }
}
