package io.github.pyfuncs.analyzer;

/** Raised by a {@link SyntaxTreeParser} when source text is not syntactically valid. */
public class ParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String filename;
    private final int line;

    /**
     * @param filename the file being parsed
     * @param line 1-based line of the first error, or 0 when the parser reports no location
     */
    public ParseException(String filename, int line) {
        super(describe(filename, line));
        this.filename = filename;
        this.line = line;
    }

    private static String describe(String filename, int line) {
        return line > 0
                ? "invalid syntax (%s, line %d)".formatted(filename, line)
                : "invalid syntax (%s)".formatted(filename);
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }
}
