package org.cinder.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region I/O Errors
    /** The root file does not exist or its path cannot be canonicalized. */
    ROOT_FILE_NOT_FOUND,
    /** The root file exists but cannot be read as UTF-8 text. */
    CANNOT_READ_ROOT_FILE,
    /** An imported file does not exist or cannot be read. */
    CANNOT_READ_IMPORTED_FILE,
    // endregion

    // region Lexical Errors
    /** A character that does not start any token. */
    UNEXPECTED_CHARACTER,
    /** A string literal that is still open at end of input. */
    UNTERMINATED_STRING_LITERAL,
    /** A backslash followed by a character outside the escape set. */
    INVALID_ESCAPE_SEQUENCE,
    /** A single '}' inside a string literal. */
    UNMATCHED_CLOSING_BRACE_IN_STRING_LITERAL,
    /** An embedded expression inside a string literal is not followed by '}'. */
    UNEXPECTED_TOKEN_IN_INTERPOLATION,
    /** A block comment that is still open at end of input. */
    UNTERMINATED_COMMENT,
    /** A line-start block comment that does not start a line. */
    INVALID_BLOCK_COMMENT,
    // endregion

    // region Syntax Errors
    /** A token that cannot start or continue the current construct. */
    UNEXPECTED_TOKEN,
    /** 'import' followed by something other than a name. */
    UNEXPECTED_TOKEN_AFTER_KEYWORD_IMPORT,
    /** 'import' at the end of a line. */
    MISSING_IMPORT_NAME,
    /** An import name followed by something other than a parenthesized path. */
    UNEXPECTED_TOKEN_AFTER_IMPORT_NAME,
    /** Empty parentheses after an import name. */
    MISSING_IMPORT_PATH,
    /** An import path that is not a single plain string literal. */
    INVALID_IMPORT_PATH,
    /** An explicit import path followed by more tokens on the same line. */
    UNEXPECTED_TOKEN_AFTER_IMPORT_PATH,
    /** 'func' followed by something other than a name. */
    UNEXPECTED_TOKEN_AFTER_KEYWORD_FUNC,
    /** 'func' at the end of a line. */
    MISSING_FUNCTION_NAME,
    /** Bracketed type parameters on a function definition, which are not supported yet. */
    TYPE_PARAMETERS_UNSUPPORTED,
    /** An unexpected token inside parentheses. */
    UNEXPECTED_TOKEN_IN_PARENTHESES,
    /** Parentheses still open at end of input. */
    UNCLOSED_PARENTHESIS,
    /** An unexpected token inside brackets. */
    UNEXPECTED_TOKEN_IN_BRACKETS,
    /** Brackets still open at end of input. */
    UNCLOSED_BRACKET,
    /** A '.' not followed by a field name or number. */
    MISSING_FIELD_AFTER_DOT,
    /** An unexpected token inside a block. */
    UNEXPECTED_TOKEN_IN_BLOCK,
    /** A block without its closing 'end'. */
    UNCLOSED_BLOCK,
    /** 'var' without a variable. */
    MISSING_VARIABLE_NAME,
    /** 'var' followed by something other than a bare identifier. */
    INVALID_VARIABLE_NAME,
    /** 'while' at the end of a line. */
    MISSING_CONDITION_AFTER_KEYWORD_WHILE,
    /** 'while' followed by something that is not a condition. */
    UNEXPECTED_TOKEN_AFTER_KEYWORD_WHILE,
    /** A loop condition followed by more tokens on the same line. */
    UNEXPECTED_TOKEN_AFTER_WHILE_CONDITION,
    /** A statement followed by more tokens on the same line. */
    UNEXPECTED_TOKEN_AFTER_STATEMENT,
    // endregion

    // region Semantic Errors
    /** A name bound twice in one file namespace. */
    DUPLICATE_DEFINITION,
    /** An import of a file that is still being imported. */
    CIRCULAR_IMPORT,
    /** An identifier bound neither locally nor in the file namespace. */
    UNDEFINED_IDENTIFIER,
    /** A function parameter that is not a name or a type-annotated name. */
    INVALID_PARAMETER,
    /** An empty slot where an expression is required. */
    MISSING_EXPRESSION,
    /** An operator with a missing operand. */
    MISSING_OPERAND
    // endregion
}
