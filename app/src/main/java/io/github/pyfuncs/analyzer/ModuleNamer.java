package io.github.pyfuncs.analyzer;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import java.util.List;

/**
 * Derives a bare module name from a file path: the last path segment without its source extension, e.g.
 * {@code widget} for both {@code a/b/widget.py} and {@code a\b\widget.py}.
 */
public final class ModuleNamer {

    static final List<String> SOURCE_EXTENSIONS = List.of(".py", ".pyi", ".pyw");

    private static final CharMatcher SEPARATORS = CharMatcher.anyOf("/\\");

    private ModuleNamer() {}

    public static String moduleName(String path) {
        String stem = stripExtension(path);
        String last = Iterables.getLast(Splitter.on(SEPARATORS).split(stem), "");
        if (!last.isEmpty()) {
            return last;
        }
        // trailing separator or empty path
        return SEPARATORS.replaceFrom(stem, '.');
    }

    static String stripExtension(String path) {
        for (String ext : SOURCE_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return path.substring(0, path.length() - ext.length());
            }
        }
        return path;
    }
}
