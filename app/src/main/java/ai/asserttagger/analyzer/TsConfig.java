package ai.asserttagger.analyzer;

import ai.asserttagger.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The parts of a tsconfig that decide which files are compiled, with {@code extends} chains already applied. Each list
 * is null when no config in the chain sets it, so callers can apply tsc's defaults.
 */
public record TsConfig(
        Path configFile,
        @Nullable List<Path> files,
        @Nullable List<TsGlob> include,
        @Nullable List<TsGlob> exclude,
        @Nullable Path outDir) {
    private static final Logger logger = LogManager.getLogger(TsConfig.class);

    public Path directory() {
        return configFile.toAbsolutePath().normalize().getParent();
    }

    public static TsConfig load(Path configFile) throws BuildConfigurationException {
        return load(configFile.toAbsolutePath().normalize(), new LinkedHashSet<>());
    }

    private static TsConfig load(Path configFile, Set<Path> visiting) throws BuildConfigurationException {
        if (!visiting.add(configFile)) {
            throw new BuildConfigurationException("cyclic extends chain " + visiting, configFile);
        }

        JsonNode root;
        try {
            root = Json.readTree(configFile);
        } catch (IOException e) {
            throw new BuildConfigurationException(e.getMessage(), e, configFile);
        }
        if (root == null || !root.isObject()) {
            throw new BuildConfigurationException("expected a JSON object", configFile);
        }

        var dir = configFile.getParent();
        @Nullable TsConfig base = null;
        for (var parent : extendsTargets(root.get("extends"), dir, configFile)) {
            var loaded = load(parent, visiting);
            base = base == null ? loaded : loaded.inheritFrom(base);
        }
        visiting.remove(configFile);

        var files = pathList(root.get("files"), dir, configFile);
        var include = globList(root.get("include"), dir, configFile, true);
        var exclude = globList(root.get("exclude"), dir, configFile, false);
        @Nullable Path outDir = null;
        var compilerOptions = root.get("compilerOptions");
        if (compilerOptions != null && compilerOptions.hasNonNull("outDir")) {
            outDir = dir.resolve(compilerOptions.get("outDir").asText()).normalize();
        }

        var own = new TsConfig(configFile, files, include, exclude, outDir);
        return base == null ? own : own.inheritFrom(base);
    }

    /** Fills every setting this config leaves unset from {@code base}. */
    private TsConfig inheritFrom(TsConfig base) {
        return new TsConfig(
                configFile,
                files != null ? files : base.files,
                include != null ? include : base.include,
                exclude != null ? exclude : base.exclude,
                outDir != null ? outDir : base.outDir);
    }

    private static List<Path> extendsTargets(@Nullable JsonNode node, Path dir, Path configFile)
            throws BuildConfigurationException {
        var targets = new ArrayList<Path>();
        if (node == null || node.isNull()) {
            return targets;
        }
        var entries = new ArrayList<String>();
        if (node.isArray()) {
            node.forEach(n -> entries.add(n.asText()));
        } else if (node.isTextual()) {
            entries.add(node.asText());
        } else {
            throw new BuildConfigurationException("extends must be a string or an array of strings", configFile);
        }
        for (var entry : entries) {
            if (!entry.startsWith(".") && !Path.of(entry).isAbsolute()) {
                // a package reference such as "@tsconfig/node18"; those never narrow the file set
                logger.debug("Ignoring non-relative extends '{}' in {}", entry, configFile);
                continue;
            }
            var target = dir.resolve(entry).normalize();
            if (!Files.isRegularFile(target) && !entry.endsWith(".json")) {
                target = dir.resolve(entry + ".json").normalize();
            }
            if (!Files.isRegularFile(target)) {
                throw new BuildConfigurationException("extended config " + entry + " does not exist", configFile);
            }
            targets.add(target);
        }
        return targets;
    }

    private static @Nullable List<Path> pathList(@Nullable JsonNode node, Path dir, Path configFile)
            throws BuildConfigurationException {
        var entries = stringList(node, configFile);
        if (entries == null) {
            return null;
        }
        return entries.stream().map(e -> dir.resolve(e).normalize()).toList();
    }

    private static @Nullable List<TsGlob> globList(
            @Nullable JsonNode node, Path dir, Path configFile, boolean directoryShorthand)
            throws BuildConfigurationException {
        var entries = stringList(node, configFile);
        if (entries == null) {
            return null;
        }
        return entries.stream()
                .map(e -> TsGlob.resolve(dir, e, directoryShorthand))
                .toList();
    }

    private static @Nullable List<String> stringList(@Nullable JsonNode node, Path configFile)
            throws BuildConfigurationException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new BuildConfigurationException("expected an array of strings but found " + node, configFile);
        }
        var values = new ArrayList<String>();
        for (var element : node) {
            if (!element.isTextual()) {
                throw new BuildConfigurationException("expected a string but found " + element, configFile);
            }
            values.add(element.asText());
        }
        return values;
    }
}
