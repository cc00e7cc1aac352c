package io.github.pyfuncs.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public final class SignatureSlicerTest {

    @Test
    void singleLineHeader() {
        var lines = List.of("def add(a, b):\n", "    return a + b\n");
        assertEquals("def add(a, b):", SignatureSlicer.signature(lines));
    }

    @Test
    void wrappedParameterListSpansLines() {
        var lines = List.of(
                "def build(\n",
                "    name: str,\n",
                "    size: int = 3,\n",
                ") -> dict:\n",
                "    return {}\n");
        assertEquals("def build(\n    name: str,\n    size: int = 3,\n) -> dict:", SignatureSlicer.signature(lines));
    }

    @Test
    void trailingCommentOnTerminatingLineIsExcluded() {
        var lines = List.of("async def fetch(url,\n", "                timeout=10):  # seconds\n", "    pass\n");
        assertEquals("async def fetch(url,\n                timeout=10):", SignatureSlicer.signature(lines));
    }

    @Test
    void colonInsideCommentDoesNotTerminate() {
        var lines = List.of("def f(a,  # note: first\n", "      b):\n", "    pass\n");
        assertEquals("def f(a,  # note: first\n      b):", SignatureSlicer.signature(lines));
    }

    @Test
    void colonNotAtEndDoesNotTerminate() {
        var lines = List.of("def f(a: int,\n", "      b: int) -> int:\n", "    return a\n");
        assertEquals("def f(a: int,\n      b: int) -> int:", SignatureSlicer.signature(lines));
    }

    @Test
    void windowsLineEndingsAreTrimmedFromHeader() {
        var lines = List.of("def f():\r\n", "    pass\r\n");
        assertEquals("def f():", SignatureSlicer.signature(lines));
    }

    @Test
    void fallsBackToWholeSpanWithoutColon() {
        var lines = List.of("def f(\n", "    a\n");
        assertEquals("def f(\n    a", SignatureSlicer.signature(lines));
    }

    @Test
    void terminatesHeaderIgnoresCommentAndWhitespace() {
        assertTrue(SignatureSlicer.terminatesHeader("def f():   \n"));
        assertTrue(SignatureSlicer.terminatesHeader("def f():  # comment\n"));
        assertFalse(SignatureSlicer.terminatesHeader("# def f():\n"));
        assertFalse(SignatureSlicer.terminatesHeader("def f(x: int,\n"));
    }

    @Test
    void sliceReturnsVerbatimBody() {
        var source = SourceFile.of("m.py", "x = 1\ndef f():\n    return 1\r\n\ny = 2\n");
        var slice = SignatureSlicer.slice(source, 2, 3);
        assertEquals("def f():", slice.signature());
        assertEquals("def f():\n    return 1\r\n", slice.body());
    }
}
