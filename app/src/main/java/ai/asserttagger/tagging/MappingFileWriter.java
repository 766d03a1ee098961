package ai.asserttagger.tagging;

import ai.asserttagger.util.AtomicWrites;
import ai.asserttagger.util.Json;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes the code-to-message table as a generated TypeScript module. The file is always regenerated in full. */
public class MappingFileWriter {
    private static final Logger logger = LogManager.getLogger(MappingFileWriter.class);

    static final String HEADER =
            """
            /*!
             * Generated by assert-tagger from the short codes in the tagged sources.
             * Do not edit this file by hand; rerun the tagger to regenerate it.
             */

            """;

    public void write(Path target, CodeToMessageTable table) throws IOException {
        AtomicWrites.atomicOverwrite(target, render(table));
        logger.info("Wrote {} short code(s) to {}", table.size(), target);
    }

    public String render(CodeToMessageTable table) {
        var sb = new StringBuilder(HEADER);
        if (table.size() == 0) {
            return sb.append("export const shortCodeMap = {};\n").toString();
        }
        sb.append("export const shortCodeMap = {\n");
        table.entries().forEach((code, message) -> sb.append('\t')
                .append(Json.quote(code))
                .append(": ")
                .append(Json.quote(message))
                .append(",\n"));
        return sb.append("};\n").toString();
    }
}
