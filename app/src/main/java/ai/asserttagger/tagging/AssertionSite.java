package ai.asserttagger.tagging;

import ai.asserttagger.analyzer.ProjectFile;
import org.jetbrains.annotations.Nullable;

/**
 * One matched assertion call, reduced to what validation and rewriting need from its message argument. Sites are
 * produced by {@link AssertionSiteScanner} and never outlive a run.
 *
 * @param file the file containing the call
 * @param line 1-based line of the message argument
 * @param nodeType tree-sitter type of the message argument
 * @param startByte UTF-8 offset where the message argument starts
 * @param endByte UTF-8 offset where the message argument ends
 * @param text source text of the message argument
 * @param kind classification of the argument
 * @param message the human-readable message: the literal's content for untagged literals, the trailing comment for
 *     tagged codes; null when there is none
 * @param problem the error this classification represents, for {@link SiteKind#INTERPOLATED_LITERAL} and
 *     {@link SiteKind#UNSUPPORTED}
 */
public record AssertionSite(
        ProjectFile file,
        int line,
        String nodeType,
        int startByte,
        int endByte,
        String text,
        SiteKind kind,
        @Nullable String message,
        @Nullable TaggingProblem problem) {

    public String location() {
        return file.absPath() + ":" + line;
    }

    /** The numeric value of a {@link SiteKind#TAGGED_CODE} site. */
    public int code() {
        if (kind != SiteKind.TAGGED_CODE) {
            throw new IllegalStateException("Site at " + location() + " is " + kind + ", not a tagged code");
        }
        return ShortCode.parse(text);
    }
}
