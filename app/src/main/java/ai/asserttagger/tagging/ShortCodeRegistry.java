package ai.asserttagger.tagging;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Every short code seen during a run and the site that owns it. One instance spans all packages of a run; it is not
 * thread-safe and is only written by the thread driving the run.
 */
public class ShortCodeRegistry {
    private final Map<Integer, AssertionSite> owners = new HashMap<>();
    private int maxCode = -1;

    /**
     * Records {@code site} as the owner of {@code code}.
     *
     * @throws DuplicateShortcodeException if another site already owns the code; the registry is unchanged
     */
    public void register(int code, AssertionSite site) throws DuplicateShortcodeException {
        if (code < 0) {
            throw new IllegalArgumentException("Short codes are non-negative, got " + code);
        }
        var existing = owners.get(code);
        if (existing != null) {
            throw new DuplicateShortcodeException(code, existing, site);
        }
        owners.put(code, site);
        maxCode = Math.max(maxCode, code);
    }

    /**
     * The smallest code greater than every code registered so far. Only meaningful once every tagged site of every
     * package has been registered.
     *
     * @throws IllegalStateException if {@link Integer#MAX_VALUE} is already taken
     */
    public int nextCode() {
        if (maxCode == Integer.MAX_VALUE) {
            throw new IllegalStateException("No short code left after " + ShortCode.format(maxCode));
        }
        return maxCode + 1;
    }

    /** The highest registered code, or -1 if none. */
    public int maxCode() {
        return maxCode;
    }

    public @Nullable AssertionSite owner(int code) {
        return owners.get(code);
    }

    public int size() {
        return owners.size();
    }
}
