package ai.asserttagger.tagging;

/** How the message argument of an assertion call was classified. */
public enum SiteKind {
    /** A hex numeric literal, optionally followed by a comment holding the original message. */
    TAGGED_CODE,
    /** A plain string or a template string without substitutions; gets a code during mutation. */
    UNTAGGED_LITERAL,
    /** A template string with substitutions. Always an error. */
    INTERPOLATED_LITERAL,
    /**
     * A binary expression or a nested call. These are left alone without error; whether they should be rejected
     * instead is an open product decision, so they are kept as their own classification rather than a default.
     */
    PASS_THROUGH,
    /** Anything else, including non-hex numeric literals. Always an error. */
    UNSUPPORTED
}
