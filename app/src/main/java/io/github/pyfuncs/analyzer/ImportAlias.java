package io.github.pyfuncs.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * One imported name of an import statement, e.g. {@code os.path} or {@code numpy as np}.
 *
 * @param name the dotted name as written (or {@code *} for a wildcard)
 * @param alias the {@code as} alias, or null when absent
 */
public record ImportAlias(String name, @Nullable String alias) {

    public ImportAlias {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    public static ImportAlias of(String name) {
        return new ImportAlias(name, null);
    }

    /** Renders {@code name} or {@code name as alias}. */
    public String render() {
        return alias == null ? name : name + " as " + alias;
    }
}
