package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import club.ppmc.flowdebug.model.debug.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BreakpointRegistryTest {

    private BreakpointRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new BreakpointRegistry();
    }

    @Test
    void add_returnsIdAndKeepsInsertionOrder() {
        String first = registry.add(Breakpoint.line(3));
        String second = registry.add(Breakpoint.line(1));

        assertEquals(2, registry.size());
        assertEquals(first, registry.list().get(0).getId());
        assertEquals(second, registry.list().get(1).getId());
        assertSame(registry.get(first), registry.list().get(0));
    }

    @Test
    void unknownIds_produceFailureResultsInsteadOfExceptions() {
        assertFalse(registry.remove("missing"));
        assertFalse(registry.remove(null));
        assertNull(registry.get("missing"));
        assertFalse(registry.setEnabled("missing", true));
    }

    @Test
    void setEnabled_flipsState() {
        String id = registry.add(Breakpoint.line(0));

        assertTrue(registry.setEnabled(id, false));
        assertFalse(registry.get(id).isEnabled());
        assertTrue(registry.setEnabled(id, true));
        assertTrue(registry.get(id).isEnabled());
    }

    @Test
    void toggle_addsThenRemovesLineBreakpoint() {
        OperationResult added = registry.toggle(4);
        assertTrue(added.success());
        Breakpoint created = registry.get(added.message());
        assertNotNull(created);
        assertEquals(BreakpointType.LINE, created.getType());
        assertEquals(4, created.getStepIndex());

        OperationResult removed = registry.toggle(4);
        assertTrue(removed.success());
        assertTrue(removed.message().contains(created.getId()));
        assertTrue(registry.findLineBreakpoint(4).isEmpty());
    }

    @Test
    void doubleToggle_ignoresPriorHitCount() {
        String id = registry.add(Breakpoint.line(2));
        registry.get(id).recordHit();

        registry.toggle(2);
        assertTrue(registry.findLineBreakpoint(2).isEmpty());
        registry.toggle(2);
        registry.toggle(2);

        assertEquals(0, registry.size());
    }

    @Test
    void toggle_ignoresNonLineBreakpointsAtSameIndex() {
        registry.add(Breakpoint.condition(5, "x > 1"));

        OperationResult result = registry.toggle(5);

        assertEquals(2, registry.size());
        assertEquals(BreakpointType.LINE, registry.get(result.message()).getType());
    }

    @Test
    void exportJson_thenImportJson_restoresBreakpointsWithHitCounts() {
        String id = registry.add(Breakpoint.line(1));
        registry.get(id).recordHit();
        registry.add(Breakpoint.variable("total", ComparisonOperator.GREATER_OR_EQUAL, 3));
        String json = registry.exportJson();

        var other = new BreakpointRegistry();
        OperationResult result = other.importJson(json);

        assertTrue(result.success());
        assertEquals(2, other.size());
        assertEquals(1, other.get(id).getHitCount());
        Breakpoint variable = other.list().get(1);
        assertEquals(ComparisonOperator.GREATER_OR_EQUAL, variable.getComparisonOperator());
        assertEquals("3", variable.getVariableValue());
    }

    @Test
    void importJson_withMalformedContent_leavesRegistryUntouched() {
        registry.add(Breakpoint.line(0));

        OperationResult result = registry.importJson("[{\"type\": \"NOPE\"}]");

        assertFalse(result.success());
        assertEquals(1, registry.size());
        assertFalse(registry.importJson("not json").success());
    }

    @Test
    void clear_removesEverything() {
        registry.add(Breakpoint.line(0));
        registry.add(Breakpoint.error(Breakpoint.ANY_STEP));

        registry.clear();

        assertEquals(0, registry.size());
        assertTrue(registry.list().isEmpty());
    }
}
