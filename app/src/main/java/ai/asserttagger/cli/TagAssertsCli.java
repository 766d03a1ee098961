package ai.asserttagger.cli;

import ai.asserttagger.analyzer.SourceProjectLoader;
import ai.asserttagger.analyzer.TypescriptParser;
import ai.asserttagger.config.PackageUnitResolver;
import ai.asserttagger.config.TaggingConfig;
import ai.asserttagger.tagging.TaggingAbortedException;
import ai.asserttagger.tagging.TaggingEngine;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "tag-asserts",
        mixinStandardHelpOptions = true,
        description = "Replaces assertion messages with unique short codes and regenerates the short code map.")
public final class TagAssertsCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TagAssertsCli.class);

    static final int EXIT_PROBLEMS = 1;
    static final int EXIT_FAILURE = 2;

    // injected by picocli before call()
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "--repo-root",
            description = "Repository root; package directories and the mapping file resolve against it.")
    private Path repoRoot = Path.of(".");

    @CommandLine.Option(
            names = "--config",
            description = "Tagging config file. Defaults to " + TaggingConfig.CONFIG_FILE + " in the repository root.")
    @Nullable
    private Path configFile;

    @CommandLine.Option(names = "--mapping-file", description = "Overrides the mapping file location from the config.")
    @Nullable
    private Path mappingFile;

    @CommandLine.Option(
            names = "--disable-config",
            description = "Ignore the enabledPaths filter of the config. Useful for testing.")
    private boolean disableConfig = false;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "PACKAGE_DIR", description = "Package directories, in order.")
    private List<Path> packageDirs = new ArrayList<>();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TagAssertsCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var root = repoRoot.toAbsolutePath().normalize();
        try {
            var config = TaggingConfig.load(configFile != null ? configFile : root.resolve(TaggingConfig.CONFIG_FILE));
            var loader = new SourceProjectLoader();
            var units = new PackageUnitResolver(root, config, loader).resolve(packageDirs, !disableConfig);
            var target = mappingFile != null ? root.resolve(mappingFile) : root.resolve(config.mappingFile());

            var report = new TaggingEngine(loader, new TypescriptParser()).run(units, target);
            out.println(report.summary());
            out.flush();
            return 0;
        } catch (TaggingAbortedException e) {
            e.getProblems().forEach(p -> err.println(p.render()));
            err.println(e.getProblems().size() + " problem(s) found; no files were modified.");
            err.flush();
            return EXIT_PROBLEMS;
        } catch (IOException e) {
            logger.error("Tagging failed", e);
            err.println("Tagging failed: " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            // may have happened after some sources were rewritten
            logger.error("Tagging failed unexpectedly", e);
            err.println("Tagging failed unexpectedly: " + e + "; sources may have been partially modified.");
            err.flush();
            return EXIT_FAILURE;
        }
    }
}
