package ai.asserttagger.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A source file together with its syntax tree. Nodes obtained from {@link #rootNode()} are only valid while this object
 * (and so the tree) is reachable; callers copy whatever they need out of the nodes before letting it go.
 *
 * @param file the file that was parsed
 * @param bytes the UTF-8 encoding of the source the tree was built from; node byte offsets index into this array
 * @param tree the tree-sitter tree
 */
public record ParsedSource(ProjectFile file, byte[] bytes, TSTree tree) {

    public TSNode rootNode() {
        return tree.getRootNode();
    }

    public String text(TSNode node) {
        return TreeSitterNodes.nodeText(node, bytes);
    }
}
