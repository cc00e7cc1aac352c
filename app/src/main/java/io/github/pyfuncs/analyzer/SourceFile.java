package io.github.pyfuncs.analyzer;

import io.github.pyfuncs.util.TextCanonicalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The text of one source file together with its line-indexed view. Lines keep their terminators, so any contiguous
 * slice of {@link #lines()} concatenates back to the exact original characters.
 */
public final class SourceFile {

    private final String path;
    private final String text;
    private final List<String> lines;

    private SourceFile(String path, String text) {
        this.path = path;
        this.text = text;
        this.lines = TextCanonicalizer.splitLinesKeepingTerminators(text);
    }

    /**
     * Reads a file as UTF-8. A leading byte-order mark is dropped.
     *
     * @throws IOException if the file is missing, unreadable, or not valid UTF-8
     */
    public static SourceFile read(String path) throws IOException {
        var text = Files.readString(Path.of(path));
        return new SourceFile(path, TextCanonicalizer.stripUtf8Bom(text));
    }

    public static SourceFile of(String path, String text) {
        return new SourceFile(path, TextCanonicalizer.stripUtf8Bom(text));
    }

    /** The path as given by the caller, not normalized. */
    public String path() {
        return path;
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return lines;
    }

    /**
     * Lines {@code startLine..endLine} (1-based, inclusive). Bounds are clamped to the file, so an out-of-range span
     * yields fewer lines rather than an error.
     */
    public List<String> lineSpan(int startLine, int endLine) {
        int from = Math.min(Math.max(startLine - 1, 0), lines.size());
        int to = Math.min(Math.max(endLine, from), lines.size());
        return lines.subList(from, to);
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + ", " + lines.size() + " lines]";
    }
}
