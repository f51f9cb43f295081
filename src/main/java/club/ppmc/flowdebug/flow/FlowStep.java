/**
 * FlowStep.java
 *
 * 流程中的一个步骤：步骤数据（动作ID和参数）加上要执行的动作。
 */
package club.ppmc.flowdebug.flow;

import club.ppmc.flowdebug.model.debug.StepRecord;
import java.util.Objects;

public record FlowStep(StepRecord record, StepAction action) {

    public FlowStep {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(action, "action");
    }
}
