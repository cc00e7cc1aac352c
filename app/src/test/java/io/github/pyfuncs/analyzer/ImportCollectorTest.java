package io.github.pyfuncs.analyzer;

import static io.github.pyfuncs.testutil.FakeSyntaxNode.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public final class ImportCollectorTest {

    @Test
    void plainImportEmitsOneLinePerName() {
        var root = module(importOf(1, ImportAlias.of("os"), new ImportAlias("numpy", "np"), ImportAlias.of("os.path")));
        assertEquals(List.of("import os", "import numpy as np", "import os.path"), ImportCollector.collect(root));
    }

    @Test
    void fromImportJoinsNamesOnOneLine() {
        var root = module(fromImport(1, "typing", ImportAlias.of("List"), new ImportAlias("Optional", "Opt")));
        assertEquals(List.of("from typing import List, Optional as Opt"), ImportCollector.collect(root));
    }

    @Test
    void fromImportWithoutModuleKeepsEmptySlot() {
        var root = module(fromImport(1, "", ImportAlias.of("sibling")));
        assertEquals(List.of("from  import sibling"), ImportCollector.collect(root));
    }

    @Test
    void importsAtEveryDepthAreCollectedInDocumentOrder() {
        var root = module(
                importOf(1, ImportAlias.of("os")),
                function(
                        "f",
                        3,
                        8,
                        importOf(4, ImportAlias.of("json")),
                        function("inner", 5, 7, fromImport(6, "re", ImportAlias.of("compile")))),
                cls("C", 9, 12, other(10, 11, importOf(11, ImportAlias.of("sys")))),
                fromImport(13, "collections", ImportAlias.of("deque")));

        assertEquals(
                List.of(
                        "import os",
                        "import json",
                        "from re import compile",
                        "import sys",
                        "from collections import deque"),
                ImportCollector.collect(root));
    }

    @Test
    void noImportsYieldsEmptyList() {
        assertTrue(ImportCollector.collect(module(function("f", 1, 2))).isEmpty());
    }
}
