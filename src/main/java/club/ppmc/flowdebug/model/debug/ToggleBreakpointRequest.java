/**
 * ToggleBreakpointRequest.java
 *
 * 切换某个步骤上的行断点的请求。
 */
package club.ppmc.flowdebug.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ToggleBreakpointRequest(@JsonProperty("step_index") @NotNull @Min(0) Integer stepIndex) {}
