package ai.asserttagger.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal and text-extraction helpers shared by everything that walks a tree-sitter syntax tree. */
public final class TreeSitterNodes {
    private static final Logger logger = LogManager.getLogger(TreeSitterNodes.class);

    private TreeSitterNodes() {}

    /** True for both a Java null and tree-sitter's null node. */
    public static boolean isAbsent(@Nullable TSNode node) {
        return node == null || node.isNull();
    }

    /** Recursively finds all nodes matching the given predicate, in document (pre-)order. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (isAbsent(node)) {
            return;
        }

        if (predicate.test(node)) {
            results.add(node);
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!isAbsent(child)) {
                findAllNodesRecursiveInternal(child, predicate, results);
            }
        }
    }

    /** Finds all nodes of a specific type within the AST. */
    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    /** True if any direct child of {@code node} has the given type. */
    public static boolean hasChildOfType(TSNode node, String nodeType) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!isAbsent(child) && nodeType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    /** 1-based line on which the node starts. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Extracts the exact (untrimmed) text of a node. Tree-sitter reports UTF-8 byte offsets, so the slice is taken from
     * the encoded source rather than from the Java string.
     */
    public static String nodeText(@Nullable TSNode node, byte[] sourceBytes) {
        if (isAbsent(node)) {
            return "";
        }
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();
        if (startByte < 0 || endByte < startByte) {
            logger.warn("Node {} has an invalid byte range {}..{}", node.getType(), startByte, endByte);
            return "";
        }
        if (endByte > sourceBytes.length) {
            logger.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, sourceBytes.length);
            endByte = sourceBytes.length;
        }
        if (startByte >= endByte) {
            return "";
        }
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
