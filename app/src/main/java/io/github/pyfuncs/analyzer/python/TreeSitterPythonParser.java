package io.github.pyfuncs.analyzer.python;

import io.github.pyfuncs.analyzer.ParseException;
import io.github.pyfuncs.analyzer.SyntaxNode;
import io.github.pyfuncs.analyzer.SyntaxTreeParser;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/**
 * {@link SyntaxTreeParser} backed by the TreeSitter Python grammar.
 *
 * <p>TreeSitter always produces a tree, marking unparseable regions with ERROR or MISSING nodes. Any such node makes
 * the whole file invalid; the first one in document order supplies the reported line.
 */
public final class TreeSitterPythonParser implements SyntaxTreeParser {
    private static final Logger logger = LogManager.getLogger(TreeSitterPythonParser.class);

    private final TSParser parser;

    public TreeSitterPythonParser() {
        parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("Failed to set TreeSitter Python language on parser");
        }
    }

    @Override
    public SyntaxNode parse(String source, String filename) throws ParseException {
        // the grammar rejects form feeds that CPython treats as whitespace; the swap keeps every byte offset and row
        var tree = parser.parseString(null, source.replace('\f', ' '));
        TSNode root = tree.getRootNode();
        if (root.isNull()) {
            logger.warn("Parsing produced a null root node for {}", filename);
            throw new ParseException(filename, 0);
        }
        if (root.hasError()) {
            var error = ASTTraversalUtils.findFirstError(root);
            int line = error == null ? 0 : error.getStartPoint().getRow() + 1;
            logger.debug("Syntax error in {} at line {}", filename, line);
            throw new ParseException(filename, line);
        }
        logger.trace("Root node type for {}: {}", filename, root.getType());
        return TreeSitterSyntaxNode.wrap(tree, root, source.getBytes(StandardCharsets.UTF_8));
    }
}
