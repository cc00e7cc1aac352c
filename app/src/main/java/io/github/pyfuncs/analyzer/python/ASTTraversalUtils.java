package io.github.pyfuncs.analyzer.python;

import java.nio.charset.StandardCharsets;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Utility methods for walking TreeSitter nodes and reading their text. */
public final class ASTTraversalUtils {
    private static final Logger log = LogManager.getLogger(ASTTraversalUtils.class);

    private ASTTraversalUtils() {}

    /** Recursively finds the first node, in document order, matching the given predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (rootNode == null || rootNode.isNull()) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var child = rootNode.getChild(i);
            if (child != null && !child.isNull()) {
                var result = findNodeRecursive(child, predicate);
                if (result != null) {
                    return result;
                }
            }
        }

        return null;
    }

    /** Finds the first ERROR or MISSING node below (or at) the given node. */
    public static @Nullable TSNode findFirstError(TSNode rootNode) {
        return findNodeRecursive(
                rootNode, node -> PythonTreeSitterNodeTypes.ERROR.equals(node.getType()) || node.isMissing());
    }

    /**
     * Extracts the text of a node. TreeSitter reports UTF-8 byte offsets, so the text is cut from the encoded source
     * rather than from the Java string.
     */
    public static String extractNodeText(@Nullable TSNode node, byte[] sourceBytes) {
        if (node == null || node.isNull()) {
            return "";
        }

        int startByte = node.getStartByte();
        int endByte = node.getEndByte();
        if (startByte < 0 || endByte < startByte || startByte > sourceBytes.length) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    sourceBytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (endByte > sourceBytes.length) {
            log.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, sourceBytes.length);
            endByte = sourceBytes.length;
        }

        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
