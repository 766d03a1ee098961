package ai.asserttagger.tagging;

import ai.asserttagger.analyzer.ProjectFile;
import ai.asserttagger.analyzer.TypescriptParser;
import ai.asserttagger.util.AtomicWrites;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Replaces untagged assertion messages with newly assigned short codes. Only runs once collection found no problems, so
 * every code it takes from the registry is free.
 */
public class TaggingMutator {
    private static final Logger logger = LogManager.getLogger(TaggingMutator.class);

    private final TypescriptParser parser;
    private final AssertionSiteScanner scanner;

    public TaggingMutator(TypescriptParser parser, AssertionSiteScanner scanner) {
        this.parser = parser;
        this.scanner = scanner;
    }

    private record Replacement(int startByte, int endByte, String text) {}

    /** Tags every pending file of every package, in package then scan order. */
    public List<TaggedFile> tag(List<PackageUnit> units, TaggingRun run) throws IOException {
        run.requirePhase(TaggingRun.Phase.MUTATING);
        var tagged = new ArrayList<TaggedFile>();
        for (var unit : units) {
            if (unit.isSkipped()) {
                continue;
            }
            for (var file : unit.pendingFiles()) {
                var result = tag(file, unit.assertionFunctions(), run);
                if (result != null) {
                    tagged.add(result);
                }
            }
        }
        return tagged;
    }

    /**
     * Re-reads {@code file}, since it may have changed on disk since it was collected, assigns codes to the messages
     * that are still untagged and saves it.
     *
     * @return the tagging result, or null if nothing in the file needed a code any more
     */
    @Nullable
    TaggedFile tag(ProjectFile file, AssertionFunctionTable table, TaggingRun run) throws IOException {
        var source = parser.parse(file);
        // scan order follows call nodes, so a call nested in another call's arguments comes before the outer message
        var untagged = scanner.scan(source, table).stream()
                .filter(s -> s.kind() == SiteKind.UNTAGGED_LITERAL)
                .sorted(Comparator.comparingInt(AssertionSite::startByte))
                .toList();
        if (untagged.isEmpty()) {
            logger.debug("{} no longer has untagged messages", file);
            return null;
        }

        var replacements = new ArrayList<Replacement>();
        var codes = new ArrayList<String>();
        for (var site : untagged) {
            int code = run.registry().nextCode();
            try {
                run.registry().register(code, site);
            } catch (DuplicateShortcodeException e) {
                throw new IllegalStateException("Newly assigned short code collided with an existing one", e);
            }
            var formatted = ShortCode.format(code);
            var comment = CommentText.blockComment(site.message() == null ? "" : site.message());
            // record what a later scan of the comment will read back, so reruns regenerate the same mapping
            run.messages().put(formatted, CommentText.extractMessage(comment));
            replacements.add(new Replacement(site.startByte(), site.endByte(), formatted + " " + comment));
            codes.add(formatted);
        }

        AtomicWrites.atomicOverwrite(file.absPath(), splice(source.bytes(), replacements));
        logger.debug("Tagged {} message(s) in {}: {}", codes.size(), file, codes);
        return new TaggedFile(file, codes);
    }

    /**
     * Applies non-overlapping replacements, which must be sorted by start offset. Message literals never contain
     * another assertion call, so the ranges of one file cannot overlap.
     */
    private static byte[] splice(byte[] original, List<Replacement> replacements) {
        var out = new ByteArrayOutputStream(original.length + replacements.size() * 16);
        int position = 0;
        for (var r : replacements) {
            if (r.startByte() < position) {
                throw new IllegalStateException("Overlapping or unsorted replacement at byte " + r.startByte());
            }
            out.write(original, position, r.startByte() - position);
            out.writeBytes(r.text().getBytes(StandardCharsets.UTF_8));
            position = r.endByte();
        }
        out.write(original, position, original.length - position);
        return out.toByteArray();
    }
}
