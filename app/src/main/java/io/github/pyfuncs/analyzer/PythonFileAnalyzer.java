package io.github.pyfuncs.analyzer;

import java.io.IOException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Extracts {@link FunctionRecord}s from one Python file: read, parse, collect imports, derive the module name, then
 * walk module-level and class-level definitions.
 *
 * <p>Every invocation is independent; an instance holds only its parser.
 */
public final class PythonFileAnalyzer {
    private static final Logger logger = LogManager.getLogger(PythonFileAnalyzer.class);

    private final SyntaxTreeParser parser;

    public PythonFileAnalyzer(SyntaxTreeParser parser) {
        this.parser = parser;
    }

    /**
     * Reads and analyzes a file.
     *
     * @param path the file path; also the source of the module name
     * @throws IOException if the file cannot be read
     * @throws ParseException if the file is not valid Python
     */
    public List<FunctionRecord> analyze(String path) throws IOException, ParseException {
        logger.debug("Analyzing {}", path);
        return analyze(SourceFile.read(path));
    }

    public List<FunctionRecord> analyze(SourceFile source) throws ParseException {
        var root = parser.parse(source.text(), source.path());
        var imports = ImportCollector.collect(root);
        var module = ModuleNamer.moduleName(source.path());
        return new FunctionExtractor(source, imports, module).extract(root);
    }

    /**
     * Parses a file without extracting anything.
     *
     * @throws IOException if the file cannot be read
     * @throws ParseException if the file is not valid Python
     */
    public void checkSyntax(String path) throws IOException, ParseException {
        var source = SourceFile.read(path);
        parser.parse(source.text(), source.path());
        logger.debug("{} parsed cleanly", path);
    }
}
