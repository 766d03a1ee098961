package ai.asserttagger.config;

import ai.asserttagger.tagging.AssertionFunctionTable;
import ai.asserttagger.util.Json;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Engine-wide settings, read from {@code assertTagging.config.json} at the repository root.
 *
 * @param assertionFunctions default assertion function table for every package
 * @param enabledPaths regular expressions; a package is enabled if one is found in its repo-relative path. Empty
 *     enables every package.
 * @param mappingFile where the mapping module is written, relative to the repository root
 */
public record TaggingConfig(Map<String, Integer> assertionFunctions, List<String> enabledPaths, String mappingFile) {
    private static final Logger logger = LogManager.getLogger(TaggingConfig.class);

    public static final String CONFIG_FILE = "assertTagging.config.json";
    public static final String DEFAULT_MAPPING_FILE = "assertionShortCodesMap.ts";

    public static final TaggingConfig DEFAULT =
            new TaggingConfig(AssertionFunctionTable.DEFAULT.asMap(), List.of(), DEFAULT_MAPPING_FILE);

    @JsonCreator
    public TaggingConfig(
            @JsonProperty("assertionFunctions") @Nullable Map<String, Integer> assertionFunctions,
            @JsonProperty("enabledPaths") @Nullable List<String> enabledPaths,
            @JsonProperty("mappingFile") @Nullable String mappingFile) {
        this.assertionFunctions = assertionFunctions == null
                ? AssertionFunctionTable.DEFAULT.asMap()
                : Map.copyOf(assertionFunctions);
        this.enabledPaths = enabledPaths == null ? List.of() : List.copyOf(enabledPaths);
        this.mappingFile = mappingFile == null || mappingFile.isBlank() ? DEFAULT_MAPPING_FILE : mappingFile;
    }

    /**
     * Loads the config at {@code file}, or the defaults if it does not exist.
     *
     * @throws IOException if the file exists but cannot be read, is not valid JSON, or holds an invalid value
     */
    public static TaggingConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            logger.debug("No tagging config at {}; using defaults", file);
            return DEFAULT;
        }
        var config = Json.read(file, TaggingConfig.class);
        try {
            config.assertionFunctionTable();
            config.enabledPatterns();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid tagging config " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Loaded tagging config from {}: {}", file, config);
        return config;
    }

    public AssertionFunctionTable assertionFunctionTable() {
        return AssertionFunctionTable.of(assertionFunctions);
    }

    /**
     * @throws IllegalArgumentException if a pattern is not a valid regular expression
     */
    public List<Pattern> enabledPatterns() {
        try {
            return enabledPaths.stream().map(Pattern::compile).toList();
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid enabledPaths pattern: " + e.getPattern(), e);
        }
    }
}
