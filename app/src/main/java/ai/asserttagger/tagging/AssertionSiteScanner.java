package ai.asserttagger.tagging;

import static ai.asserttagger.analyzer.TreeSitterNodes.isAbsent;

import ai.asserttagger.analyzer.ParsedSource;
import ai.asserttagger.analyzer.ProjectFile;
import ai.asserttagger.analyzer.TreeSitterNodes;
import ai.asserttagger.analyzer.TypescriptParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Finds assertion calls in TypeScript sources and classifies their message argument. Scanning has no side effects and
 * never fails on what it finds: errors are reported as classifications for the caller to aggregate.
 */
public class AssertionSiteScanner {
    private static final Logger logger = LogManager.getLogger(AssertionSiteScanner.class);

    static final String CALL_EXPRESSION = "call_expression";
    static final String ARGUMENTS = "arguments";
    static final String COMMENT = "comment";
    static final String NUMBER = "number";
    static final String STRING = "string";
    static final String TEMPLATE_STRING = "template_string";
    static final String TEMPLATE_SUBSTITUTION = "template_substitution";
    static final String BINARY_EXPRESSION = "binary_expression";

    private final TypescriptParser parser;

    public AssertionSiteScanner(TypescriptParser parser) {
        this.parser = parser;
    }

    /** Reads, parses and scans each file in order. */
    public List<AssertionSite> scan(List<ProjectFile> files, AssertionFunctionTable table) throws IOException {
        var sites = new ArrayList<AssertionSite>();
        for (var file : files) {
            sites.addAll(scan(file, table));
        }
        return sites;
    }

    /** Reads {@code file} fresh from storage and scans it. */
    public List<AssertionSite> scan(ProjectFile file, AssertionFunctionTable table) throws IOException {
        return scan(parser.parse(file), table);
    }

    /** Scans a parsed source; sites are returned in document order. */
    public List<AssertionSite> scan(ParsedSource source, AssertionFunctionTable table) {
        var sites = new ArrayList<AssertionSite>();
        for (var call : TreeSitterNodes.findAllNodesByType(source.rootNode(), CALL_EXPRESSION)) {
            var callee = call.getChildByFieldName("function");
            if (isAbsent(callee)) {
                continue;
            }
            var messageIndex = table.messageIndex(source.text(callee));
            if (messageIndex.isEmpty()) {
                continue;
            }
            var argument = argumentAt(call, messageIndex.getAsInt());
            if (argument == null) {
                // a call without a message has nothing to tag
                continue;
            }
            sites.add(classify(source, argument));
        }
        if (!sites.isEmpty()) {
            logger.trace("Found {} assertion sites in {}", sites.size(), source.file());
        }
        return sites;
    }

    /** The argument at {@code index}, skipping comments; null if the call has fewer arguments. */
    private static @Nullable TSNode argumentAt(TSNode call, int index) {
        var arguments = call.getChildByFieldName(ARGUMENTS);
        if (isAbsent(arguments) || !ARGUMENTS.equals(arguments.getType())) {
            // tagged template calls have a template string here instead of an argument list
            return null;
        }
        int seen = 0;
        for (int i = 0; i < arguments.getNamedChildCount(); i++) {
            var child = arguments.getNamedChild(i);
            if (isAbsent(child) || COMMENT.equals(child.getType())) {
                continue;
            }
            if (seen == index) {
                return child;
            }
            seen++;
        }
        return null;
    }

    AssertionSite classify(ParsedSource source, TSNode argument) {
        var type = argument.getType();
        var text = source.text(argument);
        var line = TreeSitterNodes.startLine(argument);
        var file = source.file();
        int start = argument.getStartByte();
        int end = argument.getEndByte();

        switch (type) {
            case NUMBER -> {
                if (!isValidCode(text)) {
                    var site = new AssertionSite(file, line, type, start, end, text, SiteKind.UNSUPPORTED, null, null);
                    return withProblem(site, TaggingProblem.malformedShortcode(site));
                }
                var comment = trailingComment(argument);
                var message = comment == null ? null : CommentText.extractMessage(source.text(comment));
                return new AssertionSite(file, line, type, start, end, text, SiteKind.TAGGED_CODE, message, null);
            }
            case STRING -> {
                return untagged(file, line, type, start, end, text);
            }
            case TEMPLATE_STRING -> {
                if (TreeSitterNodes.hasChildOfType(argument, TEMPLATE_SUBSTITUTION)) {
                    var site = new AssertionSite(
                            file, line, type, start, end, text, SiteKind.INTERPOLATED_LITERAL, null, null);
                    return withProblem(site, TaggingProblem.unsupportedInterpolation(site));
                }
                return untagged(file, line, type, start, end, text);
            }
            case BINARY_EXPRESSION, CALL_EXPRESSION -> {
                return new AssertionSite(file, line, type, start, end, text, SiteKind.PASS_THROUGH, null, null);
            }
            default -> {
                var site = new AssertionSite(file, line, type, start, end, text, SiteKind.UNSUPPORTED, null, null);
                return withProblem(site, TaggingProblem.unsupportedArgument(site, "Unsupported argument kind: " + type));
            }
        }
    }

    private static AssertionSite untagged(ProjectFile file, int line, String type, int start, int end, String text) {
        var message = text.length() >= 2 ? text.substring(1, text.length() - 1).strip() : "";
        if (message.contains("*/")) {
            var site = new AssertionSite(file, line, type, start, end, text, SiteKind.UNSUPPORTED, message, null);
            return withProblem(
                    site,
                    TaggingProblem.unsupportedArgument(
                            site, "Assertion message contains */ and cannot be preserved in a comment"));
        }
        return new AssertionSite(file, line, type, start, end, text, SiteKind.UNTAGGED_LITERAL, message, null);
    }

    private static AssertionSite withProblem(AssertionSite site, TaggingProblem problem) {
        return new AssertionSite(
                site.file(),
                site.line(),
                site.nodeType(),
                site.startByte(),
                site.endByte(),
                site.text(),
                site.kind(),
                site.message(),
                problem);
    }

    private static boolean isValidCode(String text) {
        if (!ShortCode.isHexLiteral(text)) {
            return false;
        }
        try {
            ShortCode.parse(text);
            return true;
        } catch (NumberFormatException e) {
            logger.debug("Hex literal {} is not a valid short code: {}", text, e.getMessage());
            return false;
        }
    }

    /** A comment directly after {@code node} that starts on the line where {@code node} ends. */
    private static @Nullable TSNode trailingComment(TSNode node) {
        var next = node.getNextSibling();
        if (isAbsent(next) || !COMMENT.equals(next.getType())) {
            return null;
        }
        if (next.getStartPoint().getRow() != node.getEndPoint().getRow()) {
            return null;
        }
        return next;
    }
}
