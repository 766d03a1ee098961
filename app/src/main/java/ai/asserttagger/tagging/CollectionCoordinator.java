package ai.asserttagger.tagging;

import static java.util.Objects.requireNonNull;

import ai.asserttagger.analyzer.BuildConfigurationException;
import ai.asserttagger.analyzer.ProjectFile;
import ai.asserttagger.analyzer.SourceProjectLoader;
import java.io.IOException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scans every selected package, in selection order, into one {@link TaggingRun}: existing codes go into the registry,
 * files with untagged messages are marked pending on their package, and every problem is accumulated on the run.
 */
public class CollectionCoordinator {
    private static final Logger logger = LogManager.getLogger(CollectionCoordinator.class);

    private final SourceProjectLoader loader;
    private final AssertionSiteScanner scanner;

    public CollectionCoordinator(SourceProjectLoader loader, AssertionSiteScanner scanner) {
        this.loader = loader;
        this.scanner = scanner;
    }

    /**
     * Collects all packages. Problems found in the sources never stop collection; only I/O failures do.
     *
     * @throws IOException if a source file cannot be read
     */
    public void collect(List<PackageUnit> units, TaggingRun run) throws IOException {
        run.requirePhase(TaggingRun.Phase.VALIDATING);
        for (var unit : units) {
            if (unit.isSkipped()) {
                logger.info("Skipping {}: {}", unit.root(), unit.skipReason());
                continue;
            }
            collect(unit, run);
        }
        logger.info(
                "Collected {} existing short code(s) across {} package(s); {} problem(s)",
                run.registry().size(),
                units.stream().filter(u -> !u.isSkipped()).count(),
                run.problems().size());
    }

    private void collect(PackageUnit unit, TaggingRun run) throws IOException {
        List<ProjectFile> files;
        try {
            files = loader.load(unit.root());
        } catch (BuildConfigurationException e) {
            logger.warn("Cannot load sources of {}", unit.root(), e);
            run.addProblem(new TaggingProblem(
                    TaggingProblem.Kind.INVALID_BUILD_CONFIGURATION,
                    e.getMessage(),
                    List.of(e.getConfigFile().toString())));
            return;
        }

        int sites = 0;
        for (var file : files) {
            for (var site : scanner.scan(file, unit.assertionFunctions())) {
                record(unit, site, run);
                sites++;
            }
        }
        logger.debug(
                "Scanned {} file(s) in {}: {} assertion site(s), {} file(s) pending tags",
                files.size(),
                unit.root(),
                sites,
                unit.pendingFiles().size());
    }

    private static void record(PackageUnit unit, AssertionSite site, TaggingRun run) {
        switch (site.kind()) {
            case TAGGED_CODE -> {
                int code = site.code();
                try {
                    run.registry().register(code, site);
                    if (site.message() != null) {
                        run.messages().put(ShortCode.format(code), site.message());
                    }
                } catch (DuplicateShortcodeException e) {
                    run.addProblem(e.toProblem());
                }
            }
            case UNTAGGED_LITERAL -> unit.markPending(site.file());
            case INTERPOLATED_LITERAL, UNSUPPORTED -> run.addProblem(requireNonNull(site.problem()));
            case PASS_THROUGH -> logger.trace("Leaving {} message at {} as is", site.nodeType(), site.location());
        }
    }
}
