package io.github.pyfuncs.analyzer;

import java.util.List;

/**
 * Reconstructs a function's declaration header and body from raw source lines.
 *
 * <p>The header is found textually: lines are accumulated from the first line of the function until one whose code
 * part (everything before the first {@code #}) ends in {@code :} after trimming trailing whitespace. That terminating
 * line contributes only its code part, so an end-of-line comment after the colon is not part of the header. When no
 * line terminates the header, every line of the span is used.
 */
public final class SignatureSlicer {

    private SignatureSlicer() {}

    /** The header text and verbatim body of one function. */
    public record Slice(String signature, String body) {}

    /** Slices lines {@code startLine..endLine} (1-based, inclusive) of {@code source}. */
    public static Slice slice(SourceFile source, int startLine, int endLine) {
        var span = source.lineSpan(startLine, endLine);
        return new Slice(signature(span), String.join("", span));
    }

    /** Builds the header from the lines of a function, starting at its first line. */
    public static String signature(List<String> spanLines) {
        var sb = new StringBuilder();
        for (String line : spanLines) {
            if (terminatesHeader(line)) {
                sb.append(stripComment(line));
                return sb.toString().stripTrailing();
            }
            sb.append(line);
        }
        return sb.toString().stripTrailing();
    }

    /** True if the line, with any {@code #} comment removed and trailing whitespace trimmed, ends in a colon. */
    public static boolean terminatesHeader(String line) {
        return stripComment(line).stripTrailing().endsWith(":");
    }

    /** Everything before the first {@code #}; the whole line when there is none. */
    static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
