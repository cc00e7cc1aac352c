package io.github.pyfuncs.analyzer.python;

/** Constants for Python TreeSitter node type and field names. */
public final class PythonTreeSitterNodeTypes {

    // Definitions
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";

    // Imports
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";
    public static final String IDENTIFIER = "identifier";

    // Anonymous tokens
    public static final String ASYNC_KEYWORD = "async";
    public static final String IMPORT_KEYWORD = "import";

    // Extras
    public static final String COMMENT = "comment";

    // Errors
    public static final String ERROR = "ERROR";

    // Field names
    public static final String NAME_FIELD = "name";
    public static final String ALIAS_FIELD = "alias";
    public static final String BODY_FIELD = "body";
    public static final String DEFINITION_FIELD = "definition";
    public static final String MODULE_NAME_FIELD = "module_name";

    public static final String FUTURE_MODULE = "__future__";

    private PythonTreeSitterNodeTypes() {}
}
