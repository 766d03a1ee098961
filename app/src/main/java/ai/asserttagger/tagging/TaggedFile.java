package ai.asserttagger.tagging;

import ai.asserttagger.analyzer.ProjectFile;
import java.util.List;

/**
 * A file rewritten by {@link TaggingMutator}.
 *
 * @param file the rewritten file
 * @param codes the formatted codes assigned in it, in the order they were assigned
 */
public record TaggedFile(ProjectFile file, List<String> codes) {
    public TaggedFile {
        codes = List.copyOf(codes);
    }
}
