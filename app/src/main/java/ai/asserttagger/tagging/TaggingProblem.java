package ai.asserttagger.tagging;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A fatal problem found while collecting assertion sites. Problems are accumulated over the whole run and reported
 * together; any problem prevents every file from being modified.
 *
 * @param kind what went wrong
 * @param message human-readable description
 * @param locations {@code file:line} of every site involved, in discovery order
 */
public record TaggingProblem(Kind kind, String message, List<String> locations) {

    public enum Kind {
        MALFORMED_SHORTCODE,
        DUPLICATE_SHORTCODE,
        UNSUPPORTED_INTERPOLATION,
        UNSUPPORTED_ARGUMENT_KIND,
        INVALID_BUILD_CONFIGURATION
    }

    public TaggingProblem {
        locations = List.copyOf(locations);
    }

    public static TaggingProblem malformedShortcode(AssertionSite site) {
        return new TaggingProblem(
                Kind.MALFORMED_SHORTCODE,
                "Shortcodes must be provided by automation and be in hex format: " + site.text(),
                List.of(site.location()));
    }

    public static TaggingProblem duplicateShortcode(int code, AssertionSite original, AssertionSite duplicate) {
        return new TaggingProblem(
                Kind.DUPLICATE_SHORTCODE,
                "Duplicate shortcode " + ShortCode.format(code) + " detected",
                List.of(original.location(), duplicate.location()));
    }

    public static TaggingProblem unsupportedInterpolation(AssertionSite site) {
        return new TaggingProblem(
                Kind.UNSUPPORTED_INTERPOLATION,
                "Template expressions are not supported in assertions (they'll be replaced by a short code anyway). "
                        + "Use a string literal instead.",
                List.of(site.location()));
    }

    public static TaggingProblem unsupportedArgument(AssertionSite site, String reason) {
        return new TaggingProblem(Kind.UNSUPPORTED_ARGUMENT_KIND, reason, List.of(site.location()));
    }

    /** Renders the message followed by one tab-indented location per line. */
    public String render() {
        return locations.stream().map(l -> "\n\t" + l).collect(Collectors.joining("", message, ""));
    }

    @Override
    public String toString() {
        return render();
    }
}
