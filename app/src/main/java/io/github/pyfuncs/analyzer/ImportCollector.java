package io.github.pyfuncs.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects every import statement in a tree, at any depth, as normalized single-line text.
 *
 * <p>Plain imports yield one line per imported name ({@code import a}, {@code import b as c}). A from-import yields a
 * single line listing all of its names: {@code from m import x, y as z}. A from-import without a module keeps the
 * empty module slot, rendering as {@code from  import x}.
 */
public final class ImportCollector {
    private static final Logger logger = LogManager.getLogger(ImportCollector.class);

    private ImportCollector() {}

    /** Walks the whole tree in document order and renders each import found. */
    public static List<String> collect(SyntaxNode root) {
        var imports = new ArrayList<String>();
        collectRecursive(root, imports);
        logger.debug("Collected {} import lines", imports.size());
        return List.copyOf(imports);
    }

    private static void collectRecursive(SyntaxNode node, List<String> imports) {
        switch (node.kind()) {
            case IMPORT -> {
                for (var alias : node.importedNames()) {
                    imports.add("import " + alias.render());
                }
            }
            case IMPORT_FROM -> imports.add(renderFromImport(node));
            default -> {
                // not an import; its children may hold some
            }
        }
        for (var child : node.children()) {
            collectRecursive(child, imports);
        }
    }

    static String renderFromImport(SyntaxNode node) {
        var names = node.importedNames().stream().map(ImportAlias::render).collect(Collectors.joining(", "));
        return "from " + node.importModule() + " import " + names;
    }
}
