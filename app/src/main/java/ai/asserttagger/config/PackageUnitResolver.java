package ai.asserttagger.config;

import ai.asserttagger.analyzer.SourceProjectLoader;
import ai.asserttagger.tagging.AssertionFunctionTable;
import ai.asserttagger.tagging.PackageUnit;
import ai.asserttagger.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns package directories into {@link PackageUnit}s: resolves each package's assertion function table and decides
 * whether it is skipped, either for lack of a tsconfig or because the enablement filter excludes it.
 */
public class PackageUnitResolver {
    private static final Logger logger = LogManager.getLogger(PackageUnitResolver.class);

    static final String PACKAGE_JSON = "package.json";
    static final String CONFIG_KEY = "assertTagging";

    private final Path repoRoot;
    private final TaggingConfig config;
    private final SourceProjectLoader loader;

    public PackageUnitResolver(Path repoRoot, TaggingConfig config, SourceProjectLoader loader) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.config = config;
        this.loader = loader;
    }

    /**
     * Resolves {@code packageDirs} (relative ones against the repo root), keeping their order. A directory given more
     * than once is resolved once.
     *
     * @param applyEnablementFilter false to ignore {@link TaggingConfig#enabledPaths()}
     * @throws IOException if a package.json cannot be read or declares an invalid table
     */
    public List<PackageUnit> resolve(List<Path> packageDirs, boolean applyEnablementFilter) throws IOException {
        var patterns = applyEnablementFilter ? config.enabledPatterns() : List.<Pattern>of();
        var defaults = config.assertionFunctionTable();
        var units = new ArrayList<PackageUnit>();
        var seen = new HashSet<Path>();
        for (var dir : packageDirs) {
            var root = repoRoot.resolve(dir).normalize();
            if (!seen.add(root)) {
                logger.debug("Ignoring repeated package {}", root);
                continue;
            }
            units.add(resolve(root, patterns, defaults));
        }
        return units;
    }

    private PackageUnit resolve(Path root, List<Pattern> patterns, AssertionFunctionTable defaults)
            throws IOException {
        if (!Files.isDirectory(root)) {
            return skip(root, "not a directory");
        }
        if (!patterns.isEmpty()) {
            var relative = repoRoot.relativize(root).toString().replace('\\', '/');
            if (patterns.stream().noneMatch(p -> p.matcher(relative).find())) {
                return skip(root, "not matched by enabledPaths");
            }
        }
        if (loader.findBuildConfiguration(root).isEmpty()) {
            return skip(root, "no " + SourceProjectLoader.TSCONFIG);
        }
        var table = defaults.extendedWith(packageOverrides(root));
        logger.debug("Package {} uses assertion functions {}", root, table);
        return PackageUnit.of(root, table);
    }

    private static PackageUnit skip(Path root, String reason) {
        logger.info("Skipping {}: {}", root, reason);
        return PackageUnit.skipped(root, reason);
    }

    /** The {@code assertTagging.assertionFunctions} object of the package's package.json, if any. */
    Map<String, Integer> packageOverrides(Path root) throws IOException {
        var packageJson = root.resolve(PACKAGE_JSON);
        if (!Files.isRegularFile(packageJson)) {
            return Map.of();
        }
        JsonNode functions = Json.readTree(packageJson).path(CONFIG_KEY).path("assertionFunctions");
        if (functions.isMissingNode() || functions.isNull()) {
            return Map.of();
        }
        if (!functions.isObject()) {
            throw new IOException(packageJson + ": " + CONFIG_KEY + ".assertionFunctions must be an object");
        }
        var overrides = new LinkedHashMap<String, Integer>();
        var fields = functions.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (!field.getValue().isIntegralNumber()
                    || !field.getValue().canConvertToInt()
                    || field.getValue().asInt() < 0) {
                throw new IOException(packageJson + ": message index of '" + field.getKey()
                        + "' must be a non-negative integer, got " + field.getValue());
            }
            overrides.put(field.getKey(), field.getValue().asInt());
        }
        return overrides;
    }
}
