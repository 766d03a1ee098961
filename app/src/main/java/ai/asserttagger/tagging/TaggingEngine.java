package ai.asserttagger.tagging;

import ai.asserttagger.analyzer.SourceProjectLoader;
import ai.asserttagger.analyzer.TypescriptParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tags assertion messages across a set of packages: collect everything, and only if nothing is wrong anywhere, rewrite
 * the sources and regenerate the mapping file.
 */
public class TaggingEngine {
    private static final Logger logger = LogManager.getLogger(TaggingEngine.class);

    private final CollectionCoordinator coordinator;
    private final TaggingMutator mutator;
    private final MappingFileWriter mappingWriter;

    public TaggingEngine() {
        this(new SourceProjectLoader(), new TypescriptParser());
    }

    public TaggingEngine(SourceProjectLoader loader, TypescriptParser parser) {
        var scanner = new AssertionSiteScanner(parser);
        this.coordinator = new CollectionCoordinator(loader, scanner);
        this.mutator = new TaggingMutator(parser, scanner);
        this.mappingWriter = new MappingFileWriter();
    }

    /**
     * Runs collection and, if it found no problems, mutation.
     *
     * @param units the packages, in the order they are processed
     * @param mappingFile where to write the code-to-message module
     * @throws TaggingAbortedException if any problem was found; nothing was written
     * @throws IOException if reading or writing a file fails
     */
    public TaggingReport run(List<PackageUnit> units, Path mappingFile) throws TaggingAbortedException, IOException {
        var run = new TaggingRun();
        coordinator.collect(units, run);
        try {
            run.beginMutation();
        } catch (TaggingAbortedException e) {
            logger.error("Tagging aborted with {} problem(s); no files were modified", e.getProblems().size());
            throw e;
        }

        var tagged = mutator.tag(units, run);
        mappingWriter.write(mappingFile, run.messages());

        var skipped = new LinkedHashMap<Path, String>();
        units.stream().filter(PackageUnit::isSkipped).forEach(u -> skipped.put(u.root(), u.skipReason()));
        var scanned = units.stream()
                .filter(u -> !u.isSkipped())
                .map(PackageUnit::root)
                .toList();
        return new TaggingReport(scanned, skipped, tagged, mappingFile, run.messages().size());
    }
}
