package io.github.pyfuncs.analyzer;

/** The node categories the extractor distinguishes; everything else is {@link #OTHER}. */
public enum NodeKind {
    FUNCTION,
    ASYNC_FUNCTION,
    CLASS,
    IMPORT,
    IMPORT_FROM,
    OTHER;

    public boolean isFunctionLike() {
        return this == FUNCTION || this == ASYNC_FUNCTION;
    }
}
