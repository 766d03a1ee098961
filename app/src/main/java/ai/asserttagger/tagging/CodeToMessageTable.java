package ai.asserttagger.tagging;

import java.util.Collections;
import java.util.Comparator;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Formatted short code to original message, ordered by numeric code value. This is the content of the mapping file.
 */
public class CodeToMessageTable {
    private final SortedMap<String, String> messages = new TreeMap<>(Comparator.comparingInt(ShortCode::parse));

    /**
     * @throws IllegalStateException if the code already has a message; the registry rejects duplicates before they get
     *     here
     */
    public void put(String formattedCode, String message) {
        var previous = messages.putIfAbsent(formattedCode, message);
        if (previous != null) {
            throw new IllegalStateException("Message for " + formattedCode + " recorded twice");
        }
    }

    public SortedMap<String, String> entries() {
        return Collections.unmodifiableSortedMap(messages);
    }

    public int size() {
        return messages.size();
    }
}
