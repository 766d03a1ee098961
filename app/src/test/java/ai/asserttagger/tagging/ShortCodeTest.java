package ai.asserttagger.tagging;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ShortCodeTest {

    @Test
    void formatsLowercaseHexPaddedToThreeDigits() {
        assertEquals("0x000", ShortCode.format(0));
        assertEquals("0x00a", ShortCode.format(10));
        assertEquals("0x1ff", ShortCode.format(511));
    }

    @Test
    void formatDoesNotTruncateWideCodes() {
        assertEquals("0x1000", ShortCode.format(4096));
        assertEquals("0xabcde", ShortCode.format(0xabcde));
    }

    @Test
    void formatRejectsNegativeCodes() {
        assertThrows(IllegalArgumentException.class, () -> ShortCode.format(-1));
    }

    @Test
    void parseAcceptsOnlyLowercasePrefixedHex() {
        assertEquals(5, ShortCode.parse("0x005"));
        assertEquals(0xABC, ShortCode.parse("0xABC"));
        assertEquals(0x1_000, ShortCode.parse("0x1_000"));
        assertThrows(NumberFormatException.class, () -> ShortCode.parse("5"));
        assertThrows(NumberFormatException.class, () -> ShortCode.parse("0X5"));
        assertThrows(NumberFormatException.class, () -> ShortCode.parse("0x"));
        assertThrows(NumberFormatException.class, () -> ShortCode.parse("0xffffffffff"));
    }
}
