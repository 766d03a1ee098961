package ai.asserttagger.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterTypescript;

/** Parses TypeScript sources with the tree-sitter TypeScript grammar. Safe to share between threads. */
public final class TypescriptParser {
    private static final Logger logger = LogManager.getLogger(TypescriptParser.class);

    private static final TSLanguage TS_LANGUAGE = new TreeSitterTypescript();

    // TSParser is not threadsafe, so we create a parser per thread
    private final ThreadLocal<TSParser> parser = ThreadLocal.withInitial(() -> {
        var localParser = new TSParser();
        if (!localParser.setLanguage(TS_LANGUAGE)) {
            throw new IllegalStateException("Failed to set TypeScript language on TSParser");
        }
        return localParser;
    });

    /** Reads {@code file} from storage and parses it. Every call re-reads the file. */
    public ParsedSource parse(ProjectFile file) throws IOException {
        return parse(file, file.read());
    }

    /** Parses {@code source} as the content of {@code file}. */
    public ParsedSource parse(ProjectFile file, String source) {
        var tree = parser.get().parseString(null, source);
        if (tree.getRootNode().hasError()) {
            logger.debug("Syntax errors in {}; scanning the recoverable parts of the tree", file);
        }
        return new ParsedSource(file, source.getBytes(StandardCharsets.UTF_8), tree);
    }
}
