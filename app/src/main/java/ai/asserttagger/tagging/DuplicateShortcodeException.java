package ai.asserttagger.tagging;

/** Thrown by {@link ShortCodeRegistry#register} when a code is already owned by another site. */
public class DuplicateShortcodeException extends Exception {
    private final int code;
    private final AssertionSite original;
    private final AssertionSite duplicate;

    public DuplicateShortcodeException(int code, AssertionSite original, AssertionSite duplicate) {
        super("Duplicate shortcode " + ShortCode.format(code) + " at " + duplicate.location() + ", first used at "
                + original.location());
        this.code = code;
        this.original = original;
        this.duplicate = duplicate;
    }

    public int getCode() {
        return code;
    }

    public AssertionSite getOriginal() {
        return original;
    }

    public AssertionSite getDuplicate() {
        return duplicate;
    }

    public TaggingProblem toProblem() {
        return TaggingProblem.duplicateShortcode(getCode(), getOriginal(), getDuplicate());
    }
}
