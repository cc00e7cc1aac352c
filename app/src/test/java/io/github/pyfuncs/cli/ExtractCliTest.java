package io.github.pyfuncs.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.pyfuncs.analyzer.ParseException;
import io.github.pyfuncs.util.Json;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class ExtractCliTest {

    private static final Path TEST_DIR = Path.of("src/test/resources", "testcode-py");

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(ExtractCli cli, String... args) {
        var cmd = ExtractCli.commandLine(cli);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private int run(String... args) {
        return run(new ExtractCli(), args);
    }

    private static String fixture(String name) {
        return TEST_DIR.resolve(name).toString();
    }

    @Test
    void printsRecordsAsJsonArray() throws Exception {
        int exitCode = run(fixture("widget.py"));

        assertEquals(0, exitCode, err.toString());
        assertEquals("", err.toString());
        JsonNode array = Json.getMapper().readTree(out.toString());
        assertTrue(array.isArray());
        assertEquals(5, array.size());

        JsonNode first = array.get(0);
        var keys = new ArrayList<String>();
        first.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("name", "signature", "body", "start_line", "end_line", "imports", "module"), keys);
        assertEquals("top_level", first.get("name").asText());
        assertEquals(7, first.get("start_line").asInt());
        assertEquals(8, first.get("end_line").asInt());
        assertEquals("widget", first.get("module").asText());
        assertEquals(5, first.get("imports").size());
        assertEquals("Widget.build", array.get(3).get("name").asText());
    }

    @Test
    void outputIsIndented() {
        run(fixture("widget.py"));

        var text = out.toString();
        assertTrue(text.startsWith("[\n  {\n    \"name\": \"top_level\",\n"), text);
        assertTrue(text.endsWith("]\n"), text);
    }

    @Test
    void fileWithoutFunctionsPrintsEmptyArray() {
        int exitCode = run(fixture("no_functions.py"));

        assertEquals(0, exitCode);
        assertEquals("[]\n", out.toString());
    }

    @Test
    void parseFailureWritesJsonErrorToStderr() throws Exception {
        int exitCode = run(fixture("broken.py"));

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
        JsonNode error = Json.getMapper().readTree(err.toString());
        assertTrue(error.has("error"));
        assertTrue(error.get("error").asText().startsWith("invalid syntax ("), err.toString());
        assertTrue(err.toString().startsWith("{\"error\": \""), err.toString());
    }

    @Test
    void unreadableFileWritesJsonErrorToStderr() throws Exception {
        int exitCode = run(tempDir.resolve("missing.py").toString());

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
        JsonNode error = Json.getMapper().readTree(err.toString());
        assertTrue(error.get("error").asText().startsWith("NoSuchFileException: "), err.toString());
    }

    @Test
    void dashPrefixedPathIsTreatedAsTheFile() throws Exception {
        int exitCode = run("-missing.py");

        assertEquals(1, exitCode);
        assertFalse(err.toString().contains("Usage:"), err.toString());
        JsonNode error = Json.getMapper().readTree(err.toString());
        assertEquals("NoSuchFileException: -missing.py", error.get("error").asText());
    }

    @Test
    void doubleDashEndsOptionParsing() throws Exception {
        var file = Files.writeString(tempDir.resolve("-x.py"), "def f():\n    return 1\n");

        int exitCode = run("--", file.toString());

        assertEquals(0, exitCode, err.toString());
        JsonNode array = Json.getMapper().readTree(out.toString());
        assertEquals(1, array.size());
        assertEquals("-x", array.get(0).get("module").asText());
    }

    @Test
    void noArgumentsIsUsageError() {
        var parses = new AtomicInteger();
        int exitCode = run(new ExtractCli(() -> (source, filename) -> {
            parses.incrementAndGet();
            throw new ParseException(filename, 1);
        }));

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Usage:"), err.toString());
        assertEquals(0, parses.get());
    }

    @Test
    void twoArgumentsIsUsageError() {
        int exitCode = run(fixture("widget.py"), fixture("imports.py"));

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Usage:"), err.toString());
    }

    @Test
    void hunkFilterKeepsOverlappingFunctions() throws Exception {
        int exitCode = run("--hunk", "19:1", "--hunk", "31:1", fixture("widget.py"));

        assertEquals(0, exitCode, err.toString());
        JsonNode array = Json.getMapper().readTree(out.toString());
        assertEquals(2, array.size());
        assertEquals("Widget.__init__", array.get(0).get("name").asText());
        assertEquals("last", array.get(1).get("name").asText());
    }

    @Test
    void malformedHunkIsUsageError() {
        int exitCode = run("--hunk", "abc", fixture("widget.py"));

        assertEquals(1, exitCode);
        assertEquals("", out.toString());
    }

    @Test
    void checkModePrintsNothingOnSuccess() {
        assertEquals(0, run("--check", fixture("widget.py")));
        assertEquals("", out.toString());
        assertEquals("", err.toString());
    }

    @Test
    void checkModeReportsSyntaxErrors() throws Exception {
        assertEquals(1, run("--check", fixture("broken.py")));
        assertTrue(Json.getMapper().readTree(err.toString()).has("error"));
    }
}
