package ai.asserttagger.analyzer;

import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * A tsconfig {@code include}/{@code exclude} pattern resolved against the directory of the tsconfig that declares it.
 *
 * <p>{@code *} matches within one path segment, {@code ?} matches one character and {@code **}{@code /} matches zero or
 * more directories. Paths are compared with {@code /} separators.
 */
public final class TsGlob {
    private final String glob;
    private final Pattern pattern;
    private final Pattern underPattern;

    private TsGlob(String glob) {
        this.glob = glob;
        this.pattern = Pattern.compile(toRegex(glob));
        this.underPattern = Pattern.compile(toRegex(glob) + "/.*");
    }

    /**
     * Resolves {@code entry} against {@code baseDir}. When {@code directoryShorthand} is set, an entry whose last
     * segment has neither a wildcard nor an extension names a directory and is widened to everything below it, the way
     * tsc treats {@code "include": ["src"]}.
     */
    public static TsGlob resolve(Path baseDir, String entry, boolean directoryShorthand) {
        var base = portable(baseDir.toAbsolutePath().normalize());
        var normalizedEntry = entry.replace('\\', '/');
        while (normalizedEntry.startsWith("./")) {
            normalizedEntry = normalizedEntry.substring(2);
        }
        var joined = normalizedEntry.startsWith("/") ? normalizedEntry : base + "/" + normalizedEntry;
        var glob = collapse(joined);
        if (directoryShorthand) {
            var last = Iterables.getLast(Splitter.on('/').omitEmptyStrings().split(glob), "");
            if (!hasWildcard(last) && !last.contains(".")) {
                glob = glob + "/**/*";
            }
        }
        return new TsGlob(glob);
    }

    /** A glob matching exactly {@code path} (and, through {@link #matchesOrContains}, everything below it). */
    public static TsGlob literal(Path path) {
        return new TsGlob(portable(path.toAbsolutePath().normalize()));
    }

    public static String portable(Path path) {
        return path.toString().replace('\\', '/');
    }

    /** True if {@code path} itself matches. */
    public boolean matches(Path path) {
        return pattern.matcher(portable(path.toAbsolutePath().normalize())).matches();
    }

    /** True if {@code path} matches or lies below a directory that matches. Used for exclude patterns. */
    public boolean matchesOrContains(Path path) {
        var p = portable(path.toAbsolutePath().normalize());
        return pattern.matcher(p).matches() || underPattern.matcher(p).matches();
    }

    /** The longest leading directory of the glob without wildcards; walking starts here. */
    public Path walkRoot() {
        var literal = new StringBuilder();
        var segments = Splitter.on('/').split(glob);
        var first = true;
        for (var segment : segments) {
            if (hasWildcard(segment)) {
                break;
            }
            if (!first) {
                literal.append('/');
            }
            literal.append(segment);
            first = false;
        }
        var prefix = literal.toString();
        if (prefix.equals(glob)) {
            // no wildcard at all: the pattern names a single file or directory
            var parent = Path.of(prefix).getParent();
            return parent == null ? Path.of(prefix) : parent;
        }
        return Path.of(prefix.isEmpty() ? "/" : prefix);
    }

    @Override
    public String toString() {
        return glob;
    }

    private static boolean hasWildcard(String segment) {
        return segment.indexOf('*') >= 0 || segment.indexOf('?') >= 0;
    }

    /** Removes {@code .} and {@code ..} segments that precede any wildcard. */
    private static String collapse(String glob) {
        var wildcardAt = glob.length();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                wildcardAt = i;
                break;
            }
        }
        if (wildcardAt == glob.length()) {
            return portable(Path.of(glob).normalize());
        }
        var cut = glob.lastIndexOf('/', wildcardAt);
        if (cut <= 0) {
            return glob;
        }
        var head = portable(Path.of(glob.substring(0, cut)).normalize());
        return head + glob.substring(cut);
    }

    static String toRegex(String glob) {
        var regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (glob.startsWith("**/", i)) {
                    regex.append("(?:[^/]*/)*");
                    i += 3;
                    continue;
                }
                if (glob.startsWith("**", i) && i + 2 == glob.length()) {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
            i++;
        }
        return regex.toString();
    }
}
