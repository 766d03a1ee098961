package ai.asserttagger.util;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON utility for reading the configuration files the tagger consumes (engine config, {@code package.json},
 * {@code tsconfig.json}) and for escaping strings in generated sources.
 */
public class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    /**
     * tsconfig files are JSONC: comments and trailing commas are allowed, so the mapper accepts both for every file it
     * reads.
     */
    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /** Reads a JSON file into a tree. */
    public static JsonNode readTree(Path file) throws IOException {
        return MAPPER.readTree(Files.readString(file));
    }

    /** Reads a JSON file into the given type. */
    public static <T> T read(Path file, Class<T> type) throws IOException {
        return MAPPER.readValue(Files.readString(file), type);
    }

    /** Returns {@code value} as a double-quoted JSON (and therefore TypeScript) string literal. */
    public static String quote(String value) {
        return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + '"';
    }
}
