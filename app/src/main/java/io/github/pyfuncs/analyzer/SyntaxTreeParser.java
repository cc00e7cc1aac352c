package io.github.pyfuncs.analyzer;

/** Turns source text into a {@link SyntaxNode} tree. */
public interface SyntaxTreeParser {

    /**
     * Parses a complete module.
     *
     * @param source the full source text
     * @param filename used only in diagnostics
     * @return the module root node
     * @throws ParseException if the text is not syntactically valid
     */
    SyntaxNode parse(String source, String filename) throws ParseException;
}
