package ai.asserttagger.tagging;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful run.
 *
 * @param scannedPackages roots of the packages that were collected, in order
 * @param skippedPackages roots of skipped packages with the reason, in order
 * @param taggedFiles files that were rewritten
 * @param mappingFile where the mapping file was written
 * @param mappingSize number of entries in the mapping file
 */
public record TaggingReport(
        List<Path> scannedPackages,
        Map<Path, String> skippedPackages,
        List<TaggedFile> taggedFiles,
        Path mappingFile,
        int mappingSize) {

    /** Every newly assigned code, in assignment order. */
    public List<String> assignedCodes() {
        return taggedFiles.stream().flatMap(f -> f.codes().stream()).toList();
    }

    public String summary() {
        return String.format(
                "Scanned %d package(s), skipped %d; tagged %d message(s) in %d file(s); wrote %d code(s) to %s",
                scannedPackages.size(),
                skippedPackages.size(),
                assignedCodes().size(),
                taggedFiles.size(),
                mappingSize,
                mappingFile);
    }
}
