package ai.asserttagger.tagging;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Function name to zero-based index of its message argument. Names are matched against the exact callee text of a
 * call, without regard to scope or imports.
 */
public final class AssertionFunctionTable {
    public static final AssertionFunctionTable DEFAULT = of(Map.of("assert", 1));

    private final Map<String, Integer> messageIndexes;

    private AssertionFunctionTable(Map<String, Integer> messageIndexes) {
        this.messageIndexes = messageIndexes;
    }

    /**
     * @throws IllegalArgumentException if a name is blank or an index is negative
     */
    public static AssertionFunctionTable of(Map<String, Integer> messageIndexes) {
        var copy = new LinkedHashMap<String, Integer>();
        messageIndexes.forEach((name, index) -> {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Assertion function names must not be blank");
            }
            if (index == null || index < 0) {
                throw new IllegalArgumentException(
                        "Message index for assertion function '" + name + "' must be >= 0, got " + index);
            }
            copy.put(name, index);
        });
        return new AssertionFunctionTable(Map.copyOf(copy));
    }

    /** A table with every entry of this one plus {@code overrides}; entries in {@code overrides} win. */
    public AssertionFunctionTable extendedWith(Map<String, Integer> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(messageIndexes);
        merged.putAll(overrides);
        return of(merged);
    }

    public OptionalInt messageIndex(String calleeText) {
        var index = messageIndexes.get(calleeText);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public Map<String, Integer> asMap() {
        return messageIndexes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssertionFunctionTable other && messageIndexes.equals(other.messageIndexes);
    }

    @Override
    public int hashCode() {
        return messageIndexes.hashCode();
    }

    @Override
    public String toString() {
        return messageIndexes.toString();
    }
}
