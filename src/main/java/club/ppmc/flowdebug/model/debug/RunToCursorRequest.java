/**
 * RunToCursorRequest.java
 *
 * “运行到光标处”请求：继续执行直到指定步骤。
 */
package club.ppmc.flowdebug.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record RunToCursorRequest(@JsonProperty("step_index") @NotNull @Min(0) Integer stepIndex) {}
