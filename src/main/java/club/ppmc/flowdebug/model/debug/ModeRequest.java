/**
 * ModeRequest.java
 *
 * 切换执行模式的请求。
 */
package club.ppmc.flowdebug.model.debug;

import jakarta.validation.constraints.NotNull;

public record ModeRequest(@NotNull ExecutionMode mode) {}
