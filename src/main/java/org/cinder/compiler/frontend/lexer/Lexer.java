package org.cinder.compiler.frontend.lexer;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceIndex;
import org.cinder.compiler.api.SourceRange;
import org.cinder.compiler.frontend.io.SourceCursor;
import org.cinder.compiler.frontend.parser.ParseException;
import org.cinder.compiler.frontend.parser.Parser;
import org.cinder.compiler.frontend.parser.ast.StringComponent;
import org.cinder.compiler.frontend.parser.ast.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced lazily, one per call to {@link #readToken(boolean, boolean)}. String
 * literals with embedded expressions re-enter the {@link Parser} on the same cursor, so the
 * lexer and the parser share a single position in the source text.
 */
public class Lexer {

    /**
     * The result of reading one token.
     *
     * @param start The position of the first character of the token, or the end of the text.
     * @param token The token, or null at the end of the text.
     */
    public record Scanned(SourceIndex start, Token token) {}

    private enum StringAction { BORDER, CHAR, EXPR }

    private final SourceCursor cursor;

    /**
     * Creates a new Lexer.
     * @param cursor The cursor over the source text.
     */
    public Lexer(SourceCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * @return The position of the next unread character.
     */
    public SourceIndex peekIndex() {
        return cursor.peekIndex();
    }

    /**
     * Skips whitespace and comments and reads the next token.
     *
     * @param adjacent Whether the previous token ended right where reading starts.
     * @param onNewLine Whether a line break was already seen since the previous token.
     * @return The start position and the token, with a null token at the end of the text.
     * @throws ParseException if the text at the current position is not a valid token.
     */
    public Scanned readToken(boolean adjacent, boolean onNewLine) {
        while (true) {
            int ch = cursor.peekChar();
            if (ch == SourceCursor.END_OF_INPUT) {
                return new Scanned(cursor.peekIndex(), null);
            }
            if (isWhitespace(ch)) {
                adjacent = false;
                if (ch == '\n') {
                    onNewLine = true;
                }
                cursor.consume();
                continue;
            }

            SourceIndex start = cursor.peekIndex();
            cursor.consume();
            if (ch == '-' && cursor.consumeIf('-')) {
                skipLineComment();
                adjacent = false;
                onNewLine = true;
                continue;
            }
            if (ch == '/' && cursor.consumeIf('-')) {
                skipBlockComment(start, '/', '-', '-', '/');
                adjacent = false;
                continue;
            }
            if (ch == '/' && cursor.consumeIf('/')) {
                if (!onNewLine) {
                    throw new ParseException(CompilerErrorCode.INVALID_BLOCK_COMMENT,
                            "A '//' comment must be the first token on its line",
                            SourceRange.ofWidth(start, 2));
                }
                skipBlockComment(start, '/', '/', '\\', '\\');
                skipLineComment();
                adjacent = false;
                onNewLine = true;
                continue;
            }
            return new Scanned(start, scanToken(ch, start, adjacent, onNewLine));
        }
    }

    private Token scanToken(int first, SourceIndex start, boolean adjacent, boolean onNewLine) {
        if (first >= '0' && first <= '9') {
            return token(TokenType.DIGITS, scanDigits(first), adjacent, onNewLine);
        }
        if (first == '"') {
            return new Token(TokenType.STRING_LITERAL, "", scanString(start), adjacent, onNewLine);
        }
        if (first == '_' || Character.isUnicodeIdentifierStart(first)) {
            StringBuilder name = new StringBuilder().appendCodePoint(first);
            while (isIdentifierPart(cursor.peekChar())) {
                name.appendCodePoint(cursor.peekChar());
                cursor.consume();
            }
            String text = name.toString();
            return token(TokenType.keywordOrIdentifier(text), text, adjacent, onNewLine);
        }
        TokenType type = scanOperator(first);
        if (type == null) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_CHARACTER,
                    "Unexpected character '" + new String(Character.toChars(first)) + "'",
                    SourceRange.ofWidth(start, 1));
        }
        return token(type, type.symbol(), adjacent, onNewLine);
    }

    private TokenType scanOperator(int first) {
        return switch (first) {
            case '+' -> cursor.consumeIf('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS;
            case '-' -> {
                if (cursor.consumeIf('=')) yield TokenType.HYPHEN_EQUAL;
                if (cursor.consumeIf('>')) yield TokenType.HYPHEN_GREATER;
                yield TokenType.HYPHEN;
            }
            case '*' -> cursor.consumeIf('=') ? TokenType.ASTERISK_EQUAL : TokenType.ASTERISK;
            case '/' -> cursor.consumeIf('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH;
            case '%' -> cursor.consumeIf('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT;
            case '=' -> {
                if (cursor.consumeIf('=')) yield TokenType.DOUBLE_EQUAL;
                if (cursor.consumeIf('>')) yield TokenType.EQUAL_GREATER;
                yield TokenType.EQUAL;
            }
            case '!' -> cursor.consumeIf('=') ? TokenType.EXCLAMATION_EQUAL : TokenType.EXCLAMATION;
            case '>' -> {
                if (cursor.consumeIf('>')) {
                    yield cursor.consumeIf('=') ? TokenType.DOUBLE_GREATER_EQUAL : TokenType.DOUBLE_GREATER;
                }
                yield cursor.consumeIf('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER;
            }
            case '<' -> {
                if (cursor.consumeIf('<')) {
                    yield cursor.consumeIf('=') ? TokenType.DOUBLE_LESS_EQUAL : TokenType.DOUBLE_LESS;
                }
                yield cursor.consumeIf('=') ? TokenType.LESS_EQUAL : TokenType.LESS;
            }
            case '&' -> {
                if (cursor.consumeIf('&')) yield TokenType.DOUBLE_AMPERSAND;
                if (cursor.consumeIf('=')) yield TokenType.AMPERSAND_EQUAL;
                yield TokenType.AMPERSAND;
            }
            case '|' -> {
                if (cursor.consumeIf('|')) yield TokenType.DOUBLE_BAR;
                if (cursor.consumeIf('=')) yield TokenType.BAR_EQUAL;
                yield TokenType.BAR;
            }
            case '^' -> cursor.consumeIf('=') ? TokenType.CIRCUMFLEX_EQUAL : TokenType.CIRCUMFLEX;
            case ':' -> TokenType.COLON;
            case ';' -> TokenType.SEMICOLON;
            case ',' -> TokenType.COMMA;
            case '?' -> TokenType.QUESTION;
            case '~' -> TokenType.TILDE;
            case '$' -> TokenType.DOLLAR;
            case '.' -> TokenType.DOT;
            case '(' -> TokenType.OPENING_PARENTHESIS;
            case ')' -> TokenType.CLOSING_PARENTHESIS;
            case '[' -> TokenType.OPENING_BRACKET;
            case ']' -> TokenType.CLOSING_BRACKET;
            case '{' -> TokenType.OPENING_BRACE;
            case '}' -> TokenType.CLOSING_BRACE;
            default -> null;
        };
    }

    /**
     * Reads the rest of a numeric literal. Letters and digits are consumed greedily; a sign is
     * only part of the literal directly after an exponent marker. Underscores are dropped.
     */
    private String scanDigits(int first) {
        StringBuilder value = new StringBuilder().appendCodePoint(first);
        boolean afterExponent = false;
        while (true) {
            int ch = cursor.peekChar();
            if (ch == 'e' || ch == 'E') {
                afterExponent = true;
            } else if (isAsciiAlphanumeric(ch) || ch == '_') {
                afterExponent = false;
            } else if ((ch == '+' || ch == '-') && afterExponent) {
                afterExponent = false;
            } else {
                break;
            }
            if (ch != '_') {
                value.appendCodePoint(ch);
            }
            cursor.consume();
        }
        return value.toString();
    }

    private List<StringComponent> scanString(SourceIndex start) {
        List<StringComponent> components = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        StringAction previous = StringAction.BORDER;
        while (true) {
            int ch = cursor.peekChar();
            if (ch == SourceCursor.END_OF_INPUT) {
                throw unterminatedString(start);
            }
            SourceIndex index = cursor.peekIndex();
            cursor.consume();
            StringAction action;
            switch (ch) {
                case '"' -> action = StringAction.BORDER;
                case '{' -> action = cursor.consumeIf('{') ? StringAction.CHAR : StringAction.EXPR;
                case '}' -> {
                    if (!cursor.consumeIf('}')) {
                        throw new ParseException(CompilerErrorCode.UNMATCHED_CLOSING_BRACE_IN_STRING_LITERAL,
                                "Unmatched '}' in string literal; write '}}' for a literal brace",
                                List.of(SourceRange.ofWidth(index, 1), SourceRange.ofWidth(start, 1)));
                    }
                    action = StringAction.CHAR;
                }
                case '\\' -> {
                    ch = scanEscape(start, index);
                    action = StringAction.CHAR;
                }
                default -> action = StringAction.CHAR;
            }

            if (action == StringAction.CHAR) {
                buffer.appendCodePoint(ch);
            } else if (previous == StringAction.CHAR) {
                components.add(new StringComponent.Text(buffer.toString()));
                buffer.setLength(0);
            }
            if (action == StringAction.EXPR) {
                components.add(scanInterpolation(start, SourceRange.ofWidth(index, 1)));
            } else if (action == StringAction.BORDER) {
                return components;
            }
            previous = action;
        }
    }

    private int scanEscape(SourceIndex stringStart, SourceIndex backslash) {
        int next = cursor.peekChar();
        if (next == SourceCursor.END_OF_INPUT) {
            throw unterminatedString(stringStart);
        }
        cursor.consume();
        return switch (next) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '"' -> '"';
            case '\\' -> '\\';
            case '0' -> '\0';
            case '\'' -> '\'';
            default -> throw new ParseException(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE,
                    "Invalid escape sequence '\\" + new String(Character.toChars(next)) + "'",
                    SourceRange.ofWidth(backslash, 2));
        };
    }

    /**
     * Parses the expression after a single '{' up to and including the matching '}'.
     */
    private StringComponent scanInterpolation(SourceIndex stringStart, SourceRange bracePosition) {
        Parser parser = Parser.embedded(this);
        Term term = parser.parseDisjunction(true);
        Token closing = parser.nextToken();
        if (closing == null) {
            throw unterminatedString(stringStart);
        }
        if (!closing.is(TokenType.CLOSING_BRACE)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_IN_INTERPOLATION,
                    "Expected '}' to close the embedded expression but found " + closing.describe(),
                    List.of(parser.nextTokenPosition(), bracePosition));
        }
        return new StringComponent.Interpolation(bracePosition, term);
    }

    private void skipLineComment() {
        while (true) {
            int ch = cursor.peekChar();
            cursor.consume();
            if (ch == SourceCursor.END_OF_INPUT || ch == '\n') {
                return;
            }
        }
    }

    /**
     * Skips a nestable block comment whose opening delimiter has already been consumed.
     * Every unclosed opening delimiter is reported if the text ends inside the comment.
     */
    private void skipBlockComment(SourceIndex start, int open0, int open1, int close0, int close1) {
        List<SourceIndex> openStarts = new ArrayList<>();
        openStarts.add(start);
        while (true) {
            int ch = cursor.peekChar();
            if (ch == SourceCursor.END_OF_INPUT) {
                List<SourceRange> positions = openStarts.stream()
                        .map(index -> SourceRange.ofWidth(index, 2))
                        .toList();
                throw new ParseException(CompilerErrorCode.UNTERMINATED_COMMENT,
                        "Unterminated block comment", positions);
            }
            SourceIndex index = cursor.peekIndex();
            cursor.consume();
            if (ch == open0 && cursor.consumeIf(open1)) {
                openStarts.add(index);
            } else if (ch == close0 && cursor.consumeIf(close1)) {
                openStarts.remove(openStarts.size() - 1);
                if (openStarts.isEmpty()) {
                    return;
                }
            }
        }
    }

    private static ParseException unterminatedString(SourceIndex start) {
        return new ParseException(CompilerErrorCode.UNTERMINATED_STRING_LITERAL,
                "Unterminated string literal", SourceRange.ofWidth(start, 1));
    }

    private static Token token(TokenType type, String text, boolean adjacent, boolean onNewLine) {
        return new Token(type, text, List.of(), adjacent, onNewLine);
    }

    private static boolean isWhitespace(int ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
    }

    private static boolean isAsciiAlphanumeric(int ch) {
        return (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isIdentifierPart(int ch) {
        return ch != SourceCursor.END_OF_INPUT
                && Character.isUnicodeIdentifierPart(ch)
                && !Character.isIdentifierIgnorable(ch);
    }
}
