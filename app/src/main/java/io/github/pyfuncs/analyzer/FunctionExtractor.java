package io.github.pyfuncs.analyzer;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Emits a {@link FunctionRecord} for each module-level function and for each method declared directly in a
 * module-level class.
 *
 * <p>Only the root's direct children and, for classes, their direct children are visited. Functions nested in
 * functions and classes nested in classes are never reached. Records come out in document order.
 */
public final class FunctionExtractor {
    private static final Logger logger = LogManager.getLogger(FunctionExtractor.class);

    private final SourceFile source;
    private final List<String> imports;
    private final String module;

    public FunctionExtractor(SourceFile source, List<String> imports, String module) {
        this.source = source;
        this.imports = List.copyOf(imports);
        this.module = module;
    }

    public List<FunctionRecord> extract(SyntaxNode root) {
        var records = new ArrayList<FunctionRecord>();
        for (var child : root.children()) {
            if (child.kind().isFunctionLike()) {
                records.add(toRecord(child, null));
            } else if (child.kind() == NodeKind.CLASS) {
                for (var member : child.children()) {
                    if (member.kind().isFunctionLike()) {
                        records.add(toRecord(member, child.name()));
                    }
                }
            }
        }
        logger.debug("Extracted {} functions from {}", records.size(), source.path());
        return records;
    }

    private FunctionRecord toRecord(SyntaxNode node, @Nullable String className) {
        int startLine = node.startLine();
        int endLine = Math.max(node.endLine(), startLine);
        var slice = SignatureSlicer.slice(source, startLine, endLine);
        String name = className == null ? node.name() : className + "." + node.name();
        logger.trace("{} spans lines {}-{}", name, startLine, endLine);
        return new FunctionRecord(name, slice.signature(), slice.body(), startLine, endLine, imports, module);
    }
}
