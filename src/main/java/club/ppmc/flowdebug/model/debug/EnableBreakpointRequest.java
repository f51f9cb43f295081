/**
 * EnableBreakpointRequest.java
 *
 * 启用或禁用断点的请求。
 */
package club.ppmc.flowdebug.model.debug;

public record EnableBreakpointRequest(boolean enabled) {}
