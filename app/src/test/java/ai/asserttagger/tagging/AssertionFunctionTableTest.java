package ai.asserttagger.tagging;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class AssertionFunctionTableTest {

    @Test
    void defaultTableRecognizesAssertAtIndexOne() {
        assertEquals(OptionalInt.of(1), AssertionFunctionTable.DEFAULT.messageIndex("assert"));
        assertTrue(AssertionFunctionTable.DEFAULT.messageIndex("fail").isEmpty());
    }

    @Test
    void matchingIsOnExactCalleeText() {
        var table = AssertionFunctionTable.of(Map.of("assert", 1));
        assertTrue(table.messageIndex("console.assert").isEmpty());
        assertTrue(table.messageIndex("Assert").isEmpty());
    }

    @Test
    void packageEntriesExtendAndOverrideDefaults() {
        var table = AssertionFunctionTable.DEFAULT.extendedWith(Map.of("fail", 0, "assert", 2));
        assertEquals(OptionalInt.of(0), table.messageIndex("fail"));
        assertEquals(OptionalInt.of(2), table.messageIndex("assert"));
    }

    @Test
    void extendingWithNothingReturnsSameTable() {
        assertSame(AssertionFunctionTable.DEFAULT, AssertionFunctionTable.DEFAULT.extendedWith(Map.of()));
    }

    @Test
    void rejectsNegativeIndexesAndBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> AssertionFunctionTable.of(Map.of("assert", -1)));
        assertThrows(IllegalArgumentException.class, () -> AssertionFunctionTable.of(Map.of(" ", 0)));
    }
}
