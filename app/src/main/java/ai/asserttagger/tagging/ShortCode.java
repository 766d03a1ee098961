package ai.asserttagger.tagging;

import java.util.Locale;

/** Formatting and parsing of short codes as they appear in sources and in the mapping file. */
public final class ShortCode {
    public static final String PREFIX = "0x";
    private static final int MIN_DIGITS = 3;

    private ShortCode() {}

    /** Lowercase hex with a {@code 0x} prefix, zero-padded to at least three digits: 10 is {@code 0x00a}. */
    public static String format(int code) {
        if (code < 0) {
            throw new IllegalArgumentException("Short codes are non-negative, got " + code);
        }
        var hex = Integer.toHexString(code);
        return PREFIX + "0".repeat(Math.max(0, MIN_DIGITS - hex.length())) + hex;
    }

    /** True if {@code literalText} is written the way the tagger writes codes, i.e. with a lowercase {@code 0x}. */
    public static boolean isHexLiteral(String literalText) {
        return literalText.startsWith(PREFIX) && literalText.length() > PREFIX.length();
    }

    /**
     * Parses a hex literal such as {@code 0x01f} (numeric separators allowed).
     *
     * @throws NumberFormatException if the text is not a {@code 0x} literal that fits in an int
     */
    public static int parse(String literalText) {
        if (!isHexLiteral(literalText)) {
            throw new NumberFormatException("Not a hex short code: " + literalText);
        }
        var digits = literalText.substring(PREFIX.length()).replace("_", "").toLowerCase(Locale.ROOT);
        return Integer.parseInt(digits, 16);
    }
}
