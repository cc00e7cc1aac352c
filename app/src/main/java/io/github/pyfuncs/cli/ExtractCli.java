package io.github.pyfuncs.cli;

import io.github.pyfuncs.analyzer.FunctionRecord;
import io.github.pyfuncs.analyzer.LineRange;
import io.github.pyfuncs.analyzer.ParseException;
import io.github.pyfuncs.analyzer.PythonFileAnalyzer;
import io.github.pyfuncs.analyzer.SyntaxTreeParser;
import io.github.pyfuncs.analyzer.python.TreeSitterPythonParser;
import io.github.pyfuncs.util.Json;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * One-shot extractor: prints a JSON array of function records for a single Python file.
 *
 * <p>Exit status is 0 on success and 1 on any failure. Parse and read failures are reported on stderr as
 * {@code {"error": "..."}}; argument errors as plain usage text.
 */
@CommandLine.Command(
        name = "pyfuncs",
        mixinStandardHelpOptions = true,
        version = "pyfuncs 1.0.0",
        exitCodeOnInvalidInput = 1,
        exitCodeOnExecutionException = 1,
        description = {
            "Extract function and method metadata from a Python source file as JSON.",
            "A path that starts with '-' is taken as the file unless it names a known option; '--' ends option parsing."
        })
public final class ExtractCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(ExtractCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "1", paramLabel = "<file_path>", description = "Python file to scan.")
    private String filePath;

    @CommandLine.Option(
            names = "--hunk",
            paramLabel = "START:COUNT",
            converter = LineRangeConverter.class,
            description = "Only emit functions overlapping this changed line range. Can be repeated.")
    private List<LineRange> hunks = new ArrayList<>();

    @CommandLine.Option(names = "--check", description = "Only check that the file parses; print nothing on success.")
    private boolean checkOnly = false;

    private final Supplier<SyntaxTreeParser> parserFactory;

    public ExtractCli() {
        this(TreeSitterPythonParser::new);
    }

    ExtractCli(Supplier<SyntaxTreeParser> parserFactory) {
        this.parserFactory = parserFactory;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new ExtractCli()).execute(args);
        System.exit(exitCode);
    }

    /** Wraps the command so that unknown option-like arguments such as {@code -x.py} bind to the file path. */
    static CommandLine commandLine(ExtractCli cli) {
        return new CommandLine(cli).setUnmatchedOptionsArePositionalParams(true);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        var analyzer = new PythonFileAnalyzer(parserFactory.get());

        try {
            if (checkOnly) {
                analyzer.checkSyntax(filePath);
                return 0;
            }

            List<FunctionRecord> records = analyzer.analyze(filePath);
            if (!hunks.isEmpty()) {
                records = LineRange.filterOverlapping(records, hunks);
                logger.debug("{} functions overlap {} hunks", records.size(), hunks.size());
            }
            out.print(Json.toJson(records));
            out.print('\n');
            out.flush();
            return 0;
        } catch (ParseException e) {
            logger.debug("Parse failure for {}", filePath, e);
            return reportError(err, e.getMessage());
        } catch (IOException | InvalidPathException e) {
            logger.debug("Read failure for {}", filePath, e);
            return reportError(err, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static int reportError(PrintWriter err, String message) {
        err.print(Json.toCompactJson(Map.of("error", message)));
        err.print('\n');
        err.flush();
        return 1;
    }

    public static final class LineRangeConverter implements CommandLine.ITypeConverter<LineRange> {
        @Override
        public LineRange convert(String value) {
            try {
                return LineRange.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
