package io.github.pyfuncs.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Metadata for one extracted function or method.
 *
 * @param name bare function name, or {@code ClassName.method} for a method
 * @param signature the declaration header, ending at its terminating colon
 * @param body verbatim source of lines {@code startLine..endLine}
 * @param startLine 1-based first line
 * @param endLine 1-based last line, inclusive
 * @param imports every import of the file, shared by all records of that file
 * @param module the module name derived from the file path
 */
@JsonPropertyOrder({"name", "signature", "body", "start_line", "end_line", "imports", "module"})
public record FunctionRecord(
        @JsonProperty("name") String name,
        @JsonProperty("signature") String signature,
        @JsonProperty("body") String body,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("imports") List<String> imports,
        @JsonProperty("module") String module) {

    public FunctionRecord {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if (name.indexOf('.') != name.lastIndexOf('.')) {
            throw new IllegalArgumentException("name may be qualified by at most one class: " + name);
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid line span %d..%d for %s".formatted(startLine, endLine, name));
        }
        imports = List.copyOf(imports);
    }

    /** True if this function's line span intersects {@code [fromLine, toLine]}. */
    public boolean overlaps(int fromLine, int toLine) {
        return toLine >= startLine && fromLine <= endLine;
    }
}
