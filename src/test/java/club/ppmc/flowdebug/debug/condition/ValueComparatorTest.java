package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.exception.ConditionEvaluationException;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueComparatorTest {

    @Test
    void numbersCompareNumericallyAcrossTypesAndStrings() {
        assertTrue(ValueComparator.compare(15, ComparisonOperator.GREATER_THAN, "10"));
        assertFalse(ValueComparator.compare(5, ComparisonOperator.GREATER_THAN, "10"));
        assertTrue(ValueComparator.compare("10", ComparisonOperator.EQUALS, 10));
        assertTrue(ValueComparator.compare(10L, ComparisonOperator.EQUALS, 10.0));
        assertTrue(ValueComparator.compare(3, ComparisonOperator.LESS_OR_EQUAL, 3));
    }

    @Test
    void stringsCompareLexicographically() {
        assertTrue(ValueComparator.compare("beta", ComparisonOperator.GREATER_THAN, "alpha"));
        assertTrue(ValueComparator.compare("abc", ComparisonOperator.NOT_EQUALS, "abd"));
    }

    @Test
    void nullEqualsOnlyNull() {
        assertTrue(ValueComparator.looselyEquals(null, null));
        assertFalse(ValueComparator.looselyEquals(null, "null"));
        assertTrue(ValueComparator.compare(null, ComparisonOperator.NOT_EQUALS, 0));
    }

    @Test
    void booleansAreNotNumbers() {
        assertTrue(ValueComparator.looselyEquals(true, "True"));
        assertFalse(ValueComparator.looselyEquals(true, 1));
        assertNull(ValueComparator.toNumber(true));
    }

    @Test
    void membership() {
        assertTrue(ValueComparator.compare(2, ComparisonOperator.IN, List.of(1, 2, 3)));
        assertTrue(ValueComparator.compare("2", ComparisonOperator.IN, List.of(1, 2, 3)));
        assertTrue(ValueComparator.compare("k", ComparisonOperator.IN, Map.of("k", 1)));
        assertTrue(ValueComparator.compare("ell", ComparisonOperator.IN, "hello"));
        assertTrue(ValueComparator.compare("x", ComparisonOperator.NOT_IN, "hello"));
    }

    @Test
    void incomparableValuesThrow() {
        assertThrows(ConditionEvaluationException.class,
                () -> ValueComparator.compare("abc", ComparisonOperator.GREATER_THAN, 3));
        assertThrows(ConditionEvaluationException.class,
                () -> ValueComparator.compare(null, ComparisonOperator.LESS_THAN, 3));
        assertThrows(ConditionEvaluationException.class,
                () -> ValueComparator.compare(1, ComparisonOperator.IN, null));
    }

    @Test
    void integralValuesCompareWithoutDoubleRounding() {
        long above = 9007199254740993L;

        assertFalse(ValueComparator.looselyEquals(above, 9007199254740992L));
        assertTrue(ValueComparator.compare(above, ComparisonOperator.GREATER_THAN, 9007199254740992L));
        assertTrue(ValueComparator.compare("9007199254740993", ComparisonOperator.EQUALS, above));
        assertEquals(above, ValueComparator.toIntegral(" 9007199254740993 "));
        assertNull(ValueComparator.toIntegral("99999999999999999999"));
        assertNull(ValueComparator.toIntegral(1.0));
    }
}
