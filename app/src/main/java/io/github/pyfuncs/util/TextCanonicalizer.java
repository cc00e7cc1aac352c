package io.github.pyfuncs.util;

import java.util.ArrayList;
import java.util.List;

public final class TextCanonicalizer {
    private TextCanonicalizer() {
        /* utility class – no instances */
    }

    /**
     * Strips a leading UTF-8 BOM (U+FEFF) from the provided String, if present. Returns the original string if no BOM
     * is present.
     */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /**
     * Splits text after every {@code '\n'}, keeping the terminator on each line, so that concatenating any contiguous
     * run of the result reproduces the original characters exactly. A {@code "\r\n"} pair stays attached to its line.
     * The last line has no terminator when the text does not end with one; empty text yields no lines.
     */
    public static List<String> splitLinesKeepingTerminators(String s) {
        var lines = new ArrayList<String>();
        int lineStart = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                lines.add(s.substring(lineStart, i + 1));
                lineStart = i + 1;
            }
        }
        if (lineStart < s.length()) {
            lines.add(s.substring(lineStart));
        }
        return List.copyOf(lines);
    }
}
