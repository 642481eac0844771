package org.cinder.compiler.frontend.lexer;

/**
 * Defines all possible types of tokens that the {@link Lexer} can recognize.
 * Keywords and punctuation carry their fixed source text.
 */
public enum TokenType {
    // Literals and names
    DIGITS(null),
    STRING_LITERAL(null),
    IDENTIFIER(null),
    UNDERSCORE("_"),

    // Keywords
    KEYWORD_IMPORT("import"),
    KEYWORD_EXPORT("export"),
    KEYWORD_STRUCT("struct"),
    KEYWORD_FUNC("func"),
    KEYWORD_METHOD("method"),
    KEYWORD_IF("if"),
    KEYWORD_ELSE("else"),
    KEYWORD_WHILE("while"),
    KEYWORD_BREAK("break"),
    KEYWORD_CONTINUE("continue"),
    KEYWORD_RETURN("return"),
    KEYWORD_END("end"),
    KEYWORD_VAR("var"),
    KEYWORD_INT("int"),
    KEYWORD_FLOAT("float"),

    // Operators
    PLUS("+"),
    PLUS_EQUAL("+="),
    HYPHEN("-"),
    HYPHEN_EQUAL("-="),
    HYPHEN_GREATER("->"),
    ASTERISK("*"),
    ASTERISK_EQUAL("*="),
    SLASH("/"),
    SLASH_EQUAL("/="),
    PERCENT("%"),
    PERCENT_EQUAL("%="),
    EQUAL("="),
    DOUBLE_EQUAL("=="),
    EQUAL_GREATER("=>"),
    EXCLAMATION("!"),
    EXCLAMATION_EQUAL("!="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    DOUBLE_GREATER(">>"),
    DOUBLE_GREATER_EQUAL(">>="),
    LESS("<"),
    LESS_EQUAL("<="),
    DOUBLE_LESS("<<"),
    DOUBLE_LESS_EQUAL("<<="),
    AMPERSAND("&"),
    AMPERSAND_EQUAL("&="),
    DOUBLE_AMPERSAND("&&"),
    BAR("|"),
    BAR_EQUAL("|="),
    DOUBLE_BAR("||"),
    CIRCUMFLEX("^"),
    CIRCUMFLEX_EQUAL("^="),

    // Punctuation
    DOT("."),
    COLON(":"),
    SEMICOLON(";"),
    COMMA(","),
    QUESTION("?"),
    TILDE("~"),
    DOLLAR("$"),
    OPENING_PARENTHESIS("("),
    CLOSING_PARENTHESIS(")"),
    OPENING_BRACKET("["),
    CLOSING_BRACKET("]"),
    OPENING_BRACE("{"),
    CLOSING_BRACE("}");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The fixed source text of this token type, or null for literals and identifiers.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up the keyword (or the wildcard {@code _}) spelled by {@code name}.
     * @param name An identifier-shaped word.
     * @return The keyword type, or {@link #IDENTIFIER} if the word is not reserved.
     */
    public static TokenType keywordOrIdentifier(String name) {
        return switch (name) {
            case "import" -> KEYWORD_IMPORT;
            case "export" -> KEYWORD_EXPORT;
            case "struct" -> KEYWORD_STRUCT;
            case "func" -> KEYWORD_FUNC;
            case "method" -> KEYWORD_METHOD;
            case "if" -> KEYWORD_IF;
            case "else" -> KEYWORD_ELSE;
            case "while" -> KEYWORD_WHILE;
            case "break" -> KEYWORD_BREAK;
            case "continue" -> KEYWORD_CONTINUE;
            case "return" -> KEYWORD_RETURN;
            case "end" -> KEYWORD_END;
            case "var" -> KEYWORD_VAR;
            case "int" -> KEYWORD_INT;
            case "float" -> KEYWORD_FLOAT;
            case "_" -> UNDERSCORE;
            default -> IDENTIFIER;
        };
    }
}
