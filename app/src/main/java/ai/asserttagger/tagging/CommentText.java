package ai.asserttagger.tagging;

/** Recovers an assertion message from the comment that follows a short code. */
final class CommentText {
    private CommentText() {}

    /**
     * Strips the opening and closing comment delimiters and surrounding whitespace, then one layer of {@code "} or {@code `} quoting when the
     * same quote character is both the first and the last character. Quotes elsewhere in the comment are kept.
     */
    static String extractMessage(String comment) {
        String text;
        if (comment.startsWith("//")) {
            text = comment.substring(2);
        } else {
            text = comment;
            if (text.startsWith("/*")) {
                text = text.substring(2);
            }
            if (text.endsWith("*/")) {
                text = text.substring(0, text.length() - 2);
            }
        }
        text = text.strip();
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if (first == last && (first == '"' || first == '`')) {
                text = text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    /** The block comment written after a newly assigned code. */
    static String blockComment(String message) {
        return "/* " + message + " */";
    }
}
