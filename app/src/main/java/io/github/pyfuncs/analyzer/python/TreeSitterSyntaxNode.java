package io.github.pyfuncs.analyzer.python;

import static io.github.pyfuncs.analyzer.python.PythonTreeSitterNodeTypes.*;

import io.github.pyfuncs.analyzer.ImportAlias;
import io.github.pyfuncs.analyzer.NodeKind;
import io.github.pyfuncs.analyzer.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * Adapts a TreeSitter Python node to {@link SyntaxNode}.
 *
 * <p>A {@code decorated_definition} never appears: the definition it wraps takes its place, so a decorated function
 * starts on its {@code def} line. Children of a class or function are the statements of its body block.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    // Nodes point into memory owned by the tree; holding it keeps that memory alive as long as any node is reachable.
    private final TSTree tree;
    private final TSNode node;
    private final byte[] sourceBytes;
    private final NodeKind kind;

    private TreeSitterSyntaxNode(TSTree tree, TSNode node, byte[] sourceBytes) {
        this.tree = tree;
        this.node = node;
        this.sourceBytes = sourceBytes;
        this.kind = classify(node);
    }

    static SyntaxNode wrap(TSTree tree, TSNode node, byte[] sourceBytes) {
        var target = node;
        while (DECORATED_DEFINITION.equals(target.getType())) {
            var definition = target.getChildByFieldName(DEFINITION_FIELD);
            if (definition == null || definition.isNull()) {
                break;
            }
            target = definition;
        }
        return new TreeSitterSyntaxNode(tree, target, sourceBytes);
    }

    private static NodeKind classify(TSNode node) {
        return switch (node.getType()) {
            case FUNCTION_DEFINITION -> isAsync(node) ? NodeKind.ASYNC_FUNCTION : NodeKind.FUNCTION;
            case CLASS_DEFINITION -> NodeKind.CLASS;
            case IMPORT_STATEMENT -> NodeKind.IMPORT;
            case IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT -> NodeKind.IMPORT_FROM;
            default -> NodeKind.OTHER;
        };
    }

    private static boolean isAsync(TSNode functionNode) {
        return functionNode.getChildCount() > 0
                && ASYNC_KEYWORD.equals(functionNode.getChild(0).getType());
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public String name() {
        if (kind != NodeKind.CLASS && !kind.isFunctionLike()) {
            return "";
        }
        return text(node.getChildByFieldName(NAME_FIELD));
    }

    @Override
    public int startLine() {
        return node.getStartPoint().getRow() + 1;
    }

    @Override
    public int endLine() {
        var last = (kind == NodeKind.CLASS || kind.isFunctionLike()) ? lastCodeNode(node) : node;
        var end = last.getEndPoint();
        int startRow = node.getStartPoint().getRow();
        // an end at column 0 means the node stopped right after the previous line's terminator
        if (end.getColumn() == 0 && end.getRow() > startRow) {
            return end.getRow();
        }
        return end.getRow() + 1;
    }

    /**
     * Deepest trailing node that is not a comment. A block swallows comments that sit between its last statement and
     * the dedent, so the definition's own end point can run past its code.
     */
    private static TSNode lastCodeNode(TSNode definition) {
        var current = definition;
        while (true) {
            @Nullable TSNode next = null;
            for (int i = current.getNamedChildCount() - 1; i >= 0; i--) {
                var child = current.getNamedChild(i);
                if (!COMMENT.equals(child.getType())) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
    }

    @Override
    public List<SyntaxNode> children() {
        if (kind == NodeKind.CLASS || kind.isFunctionLike()) {
            var body = node.getChildByFieldName(BODY_FIELD);
            return body == null || body.isNull() ? List.of() : namedChildren(body);
        }
        return namedChildren(node);
    }

    private List<SyntaxNode> namedChildren(TSNode parent) {
        var result = new ArrayList<SyntaxNode>(parent.getNamedChildCount());
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            var child = parent.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(wrap(tree, child, sourceBytes));
            }
        }
        return result;
    }

    @Override
    public String importModule() {
        if (kind != NodeKind.IMPORT_FROM) {
            return "";
        }
        if (FUTURE_IMPORT_STATEMENT.equals(node.getType())) {
            return FUTURE_MODULE;
        }
        var moduleNode = node.getChildByFieldName(MODULE_NAME_FIELD);
        if (moduleNode == null || moduleNode.isNull()) {
            return "";
        }
        if (RELATIVE_IMPORT.equals(moduleNode.getType())) {
            // leading dots are dropped; "from . import x" has no module at all
            for (int i = 0; i < moduleNode.getNamedChildCount(); i++) {
                var part = moduleNode.getNamedChild(i);
                if (DOTTED_NAME.equals(part.getType())) {
                    return dottedName(part);
                }
            }
            return "";
        }
        return dottedName(moduleNode);
    }

    @Override
    public List<ImportAlias> importedNames() {
        if (kind == NodeKind.IMPORT) {
            return importList(node, 0);
        }
        if (kind == NodeKind.IMPORT_FROM) {
            // names follow the "import" keyword; anything before it is the module
            for (int i = 0; i < node.getChildCount(); i++) {
                if (IMPORT_KEYWORD.equals(node.getChild(i).getType())) {
                    return importList(node, i + 1);
                }
            }
        }
        return List.of();
    }

    private List<ImportAlias> importList(TSNode statement, int fromChild) {
        var names = new ArrayList<ImportAlias>();
        for (int i = fromChild; i < statement.getChildCount(); i++) {
            var child = statement.getChild(i);
            switch (child.getType()) {
                case DOTTED_NAME -> names.add(ImportAlias.of(dottedName(child)));
                case ALIASED_IMPORT -> names.add(new ImportAlias(
                        dottedName(child.getChildByFieldName(NAME_FIELD)),
                        text(child.getChildByFieldName(ALIAS_FIELD))));
                case WILDCARD_IMPORT -> names.add(ImportAlias.of("*"));
                default -> {
                    // keywords, commas, parentheses and comments
                }
            }
        }
        return names;
    }

    /** Dotted name with any interior whitespace dropped, e.g. {@code os.path}. */
    private String dottedName(@Nullable TSNode dotted) {
        if (dotted == null || dotted.isNull()) {
            return "";
        }
        var parts = new ArrayList<String>();
        for (int i = 0; i < dotted.getNamedChildCount(); i++) {
            var part = dotted.getNamedChild(i);
            if (IDENTIFIER.equals(part.getType())) {
                parts.add(text(part));
            }
        }
        return parts.isEmpty() ? text(dotted).strip() : String.join(".", parts);
    }

    private String text(@Nullable TSNode n) {
        return ASTTraversalUtils.extractNodeText(n, sourceBytes);
    }

    @Override
    public String toString() {
        return node.getType() + "[" + startLine() + "-" + endLine() + "]";
    }
}
