package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BreakpointTest {

    @Test
    void toMap_thenFromMap_reproducesEveryField() {
        var original = new Breakpoint("bp-1", Breakpoint.ANY_STEP, BreakpointType.VARIABLE,
                "", "count", 10, ComparisonOperator.GREATER_THAN, false);
        original.recordHit();
        original.recordHit();

        Breakpoint restored = Breakpoint.fromMap(original.toMap());

        assertEquals("bp-1", restored.getId());
        assertEquals(Breakpoint.ANY_STEP, restored.getStepIndex());
        assertEquals(BreakpointType.VARIABLE, restored.getType());
        assertEquals("count", restored.getVariableName());
        assertEquals("10", restored.getVariableValue());
        assertEquals(ComparisonOperator.GREATER_THAN, restored.getComparisonOperator());
        assertFalse(restored.isEnabled());
        assertEquals(2, restored.getHitCount());
        assertEquals(original.toMap(), restored.toMap());
    }

    @Test
    void toMap_usesSnakeCaseKeysAndOperatorSymbol() {
        Breakpoint bp = Breakpoint.variable("items", ComparisonOperator.NOT_IN, "abc");

        Map<String, Object> map = bp.toMap();

        assertEquals("VARIABLE", map.get("type"));
        assertEquals("not in", map.get("comparison_operator"));
        assertEquals("items", map.get("variable_name"));
        assertEquals(-1, map.get("step_index"));
        assertEquals(0, map.get("hit_count"));
        assertEquals(true, map.get("enabled"));
    }

    @Test
    void fromMap_defaultsHitCountToZeroWhenAbsent() {
        Map<String, Object> data = new HashMap<>();
        data.put("id", "x");
        data.put("step_index", 3.0);
        data.put("type", "line");

        Breakpoint bp = Breakpoint.fromMap(data);

        assertEquals(0, bp.getHitCount());
        assertEquals(3, bp.getStepIndex());
        assertEquals(BreakpointType.LINE, bp.getType());
        assertTrue(bp.isEnabled());
        assertEquals(ComparisonOperator.EQUALS, bp.getComparisonOperator());
    }

    @Test
    void fromMap_rejectsUnknownType() {
        Map<String, Object> data = Map.of("type", "WATCHPOINT");

        assertThrows(IllegalArgumentException.class, () -> Breakpoint.fromMap(data));
    }

    @Test
    void generatedIdsAreUnique() {
        assertNotEquals(Breakpoint.line(1).getId(), Breakpoint.line(1).getId());
    }

    @Test
    void wildcardIndexTargetsEveryStep() {
        Breakpoint anyStep = Breakpoint.error(Breakpoint.ANY_STEP);
        Breakpoint stepTwo = Breakpoint.error(2);

        assertTrue(anyStep.targets(0));
        assertTrue(anyStep.targets(7));
        assertTrue(stepTwo.targets(2));
        assertFalse(stepTwo.targets(3));
    }
}
