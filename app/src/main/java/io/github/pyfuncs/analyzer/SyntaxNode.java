package io.github.pyfuncs.analyzer;

import java.util.List;

/**
 * A parser-independent view of one syntax tree node.
 *
 * <p>Implementations adapt a concrete parser's tree. Only the properties the extractor reads are exposed: the node
 * kind, its declared name, its 1-based inclusive line span, its direct children in document order and, for import
 * nodes, the imported names.
 */
public interface SyntaxNode {

    NodeKind kind();

    /** The declared name of a function or class node; empty for every other kind. */
    default String name() {
        return "";
    }

    /** 1-based line of the first character of this node. */
    int startLine();

    /** 1-based line of the last character of this node, inclusive. */
    int endLine();

    /**
     * Direct children in document order. For a class or function this is the list of statements in its body.
     */
    List<SyntaxNode> children();

    /**
     * The source module of a from-import, without any leading relative dots. Empty when the from-import names no
     * module ({@code from . import x}) and for every other kind.
     */
    default String importModule() {
        return "";
    }

    /** The names bound by an import node, in source order; empty for every other kind. */
    default List<ImportAlias> importedNames() {
        return List.of();
    }
}
