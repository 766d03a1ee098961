package ai.asserttagger.analyzer;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves the set of TypeScript files a package compiles, as designated by its tsconfig.
 *
 * <p>Only {@code files}, {@code include}, {@code exclude}, {@code extends} and {@code compilerOptions.outDir} are
 * interpreted; project references and path mappings do not change which files belong to a package and are ignored.
 */
public class SourceProjectLoader {
    private static final Logger logger = LogManager.getLogger(SourceProjectLoader.class);

    public static final String TSCONFIG = "tsconfig.json";

    private static final List<String> DEFAULT_EXCLUDES = List.of("node_modules", "bower_components", "jspm_packages");
    private static final List<String> SOURCE_EXTENSIONS = List.of(".ts", ".mts", ".cts");
    private static final List<String> DECLARATION_EXTENSIONS = List.of(".d.ts", ".d.mts", ".d.cts");

    /** Locates the package's tsconfig: {@code <root>/tsconfig.json}, else {@code <root>/src/tsconfig.json}. */
    public Optional<Path> findBuildConfiguration(Path packageRoot) {
        var direct = packageRoot.resolve(TSCONFIG);
        if (Files.isRegularFile(direct)) {
            return Optional.of(direct);
        }
        var nested = packageRoot.resolve("src").resolve(TSCONFIG);
        if (Files.isRegularFile(nested)) {
            return Optional.of(nested);
        }
        return Optional.empty();
    }

    /**
     * Loads the compiled inputs of the package rooted at {@code packageRoot}, sorted by path.
     *
     * @throws BuildConfigurationException if the package has no tsconfig or it cannot be resolved
     */
    public List<ProjectFile> load(Path packageRoot) throws BuildConfigurationException, IOException {
        var root = packageRoot.toAbsolutePath().normalize();
        var configFile = findBuildConfiguration(root)
                .orElseThrow(() -> new BuildConfigurationException("no tsconfig found", root.resolve(TSCONFIG)));
        var config = TsConfig.load(configFile);
        var files = resolveFiles(config);
        logger.debug("Loaded {} source files for {} from {}", files.size(), root, configFile);
        return files.stream()
                .map(p -> new ProjectFile(root, root.relativize(p)))
                .sorted()
                .toList();
    }

    List<Path> resolveFiles(TsConfig config) throws IOException {
        var dir = config.directory();
        var include = config.include();
        if (include == null) {
            include = config.files() == null ? List.of(TsGlob.resolve(dir, "**/*", false)) : List.of();
        }
        var exclude = new ArrayList<TsGlob>();
        if (config.exclude() != null) {
            exclude.addAll(config.exclude());
        } else {
            DEFAULT_EXCLUDES.forEach(e -> exclude.add(TsGlob.resolve(dir, e, false)));
            if (config.outDir() != null) {
                exclude.add(TsGlob.literal(config.outDir()));
            }
        }

        var results = new TreeSet<Path>();
        if (config.files() != null) {
            for (var file : config.files()) {
                if (!Files.isRegularFile(file)) {
                    logger.warn("File {} listed in {} does not exist", file, config.configFile());
                } else if (isScannable(file)) {
                    results.add(file);
                }
            }
        }
        for (var glob : include) {
            var walkRoot = glob.walkRoot();
            if (!Files.isDirectory(walkRoot)) {
                continue;
            }
            Files.walkFileTree(walkRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    if (!d.equals(walkRoot) && isExcluded(d, exclude)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path f, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && glob.matches(f) && !isExcluded(f, exclude) && isScannable(f)) {
                        results.add(f.normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        return List.copyOf(results);
    }

    private static boolean isExcluded(Path path, List<TsGlob> exclude) {
        return exclude.stream().anyMatch(g -> g.matchesOrContains(path));
    }

    static boolean isScannable(Path file) {
        var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tsx")) {
            logger.warn("Skipping {}: TSX sources are not supported", file);
            return false;
        }
        if (DECLARATION_EXTENSIONS.stream().anyMatch(name::endsWith)) {
            return false;
        }
        return SOURCE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
