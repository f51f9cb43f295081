/**
 * WatchVariableRequest.java
 *
 * 添加或移除监视变量的请求。
 */
package club.ppmc.flowdebug.model.debug;

import jakarta.validation.constraints.NotBlank;

public record WatchVariableRequest(@NotBlank String name) {}
