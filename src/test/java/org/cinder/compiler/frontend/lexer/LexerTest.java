package org.cinder.compiler.frontend.lexer;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceIndex;
import org.cinder.compiler.api.SourceRange;
import org.cinder.compiler.frontend.io.SourceCursor;
import org.cinder.compiler.frontend.parser.ParseError;
import org.cinder.compiler.frontend.parser.ParseException;
import org.cinder.compiler.frontend.parser.ast.StringComponent;
import org.cinder.compiler.frontend.parser.ast.Term;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source text into positioned tokens with the right
 * adjacency and line-break flags, and that malformed text is reported at the right positions.
 */
public class LexerTest {

    private static List<Lexer.Scanned> scanAll(String source) {
        Lexer lexer = new Lexer(new SourceCursor(source));
        List<Lexer.Scanned> result = new ArrayList<>();
        Lexer.Scanned scanned = lexer.readToken(true, true);
        while (scanned.token() != null) {
            result.add(scanned);
            scanned = lexer.readToken(true, false);
        }
        return result;
    }

    private static List<Token> tokens(String source) {
        return scanAll(source).stream().map(Lexer.Scanned::token).toList();
    }

    private static ParseError errorOf(String source) {
        ParseException exception = catchThrowableOfType(() -> scanAll(source), ParseException.class);
        assertThat(exception).as("expected a ParseException for %s", source).isNotNull();
        return exception.getError();
    }

    private static SourceRange at(int line, int column, int width) {
        return SourceRange.ofWidth(new SourceIndex(line, column), width);
    }

    /**
     * Verifies the adjacency and new-line flags: whitespace clears adjacency and a line break
     * marks the following token.
     */
    @Test
    @Tag("unit")
    void testAdjacencyAndNewLineFlags() {
        // Arrange
        String source = "a b\nc(d)";

        // Act
        List<Token> tokens = tokens(source);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("a", "b", "c", "(", "d", ")");
        assertThat(tokens).extracting(Token::adjacent).containsExactly(true, false, false, true, true, true);
        assertThat(tokens).extracting(Token::onNewLine).containsExactly(true, false, true, false, false, false);
    }

    /**
     * Verifies that every token start is the position of its first character.
     */
    @Test
    @Tag("unit")
    void testTokenStartPositions() {
        // Act
        List<Lexer.Scanned> scanned = scanAll("var x\n  x += 10");

        // Assert
        assertThat(scanned).extracting(Lexer.Scanned::start).containsExactly(
                new SourceIndex(0, 0), new SourceIndex(0, 4),
                new SourceIndex(1, 2), new SourceIndex(1, 4), new SourceIndex(1, 7));
    }

    /**
     * Verifies numeric scanning: underscores are dropped, letters are consumed greedily and a sign
     * only belongs to the literal right after an exponent marker.
     */
    @Test
    @Tag("unit")
    void testNumericLiterals() {
        // Act
        List<Token> tokens = tokens("1_000 2e-5 3E+2x 0xFF 4-1");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.DIGITS, "1000"),
                tuple(TokenType.DIGITS, "2e-5"),
                tuple(TokenType.DIGITS, "3E+2x"),
                tuple(TokenType.DIGITS, "0xFF"),
                tuple(TokenType.DIGITS, "4"),
                tuple(TokenType.HYPHEN, "-"),
                tuple(TokenType.DIGITS, "1"));
    }

    /**
     * Verifies that a dot after digits is a separate, adjacent token, so the parser can tell
     * {@code 3.degrees} from {@code 3.5}.
     */
    @Test
    @Tag("unit")
    void testDotAfterDigitsIsSeparateToken() {
        // Act
        List<Token> tokens = tokens("3.degrees");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.DIGITS, TokenType.DOT, TokenType.IDENTIFIER);
        assertThat(tokens).extracting(Token::adjacent).containsExactly(true, true, true);
    }

    /**
     * Verifies that multi-character operators are matched by the longest spelling.
     */
    @Test
    @Tag("unit")
    void testLongestMatchOperators() {
        // Act
        List<Token> tokens = tokens(">>= >> >= > <<= -> -= - == => = && &= & || |= | != !");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DOUBLE_GREATER_EQUAL, TokenType.DOUBLE_GREATER, TokenType.GREATER_EQUAL, TokenType.GREATER,
                TokenType.DOUBLE_LESS_EQUAL, TokenType.HYPHEN_GREATER, TokenType.HYPHEN_EQUAL, TokenType.HYPHEN,
                TokenType.DOUBLE_EQUAL, TokenType.EQUAL_GREATER, TokenType.EQUAL,
                TokenType.DOUBLE_AMPERSAND, TokenType.AMPERSAND_EQUAL, TokenType.AMPERSAND,
                TokenType.DOUBLE_BAR, TokenType.BAR_EQUAL, TokenType.BAR,
                TokenType.EXCLAMATION_EQUAL, TokenType.EXCLAMATION);
    }

    /**
     * Verifies that keywords and a lone underscore get their own token types.
     */
    @Test
    @Tag("unit")
    void testKeywordsAndWildcard() {
        List<Token> tokens = tokens("import func while end var int float _ _x");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD_IMPORT, TokenType.KEYWORD_FUNC, TokenType.KEYWORD_WHILE, TokenType.KEYWORD_END,
                TokenType.KEYWORD_VAR, TokenType.KEYWORD_INT, TokenType.KEYWORD_FLOAT,
                TokenType.UNDERSCORE, TokenType.IDENTIFIER);
        assertThat(tokens.get(8).text()).isEqualTo("_x");
    }

    /**
     * Verifies that identifiers follow the Unicode identifier rules.
     */
    @Test
    @Tag("unit")
    void testUnicodeIdentifiers() {
        // Act
        List<Token> tokens = tokens("größe 変数 x_1");

        // Assert
        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.IDENTIFIER);
        assertThat(tokens).extracting(Token::text).containsExactly("größe", "変数", "x_1");
    }

    /**
     * Verifies that a line comment counts as a line break for the next token.
     */
    @Test
    @Tag("unit")
    void testLineComment() {
        // Act
        List<Token> tokens = tokens("a -- the rest ( is ignored\nb");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("a", "b");
        assertThat(tokens.get(1).onNewLine()).isTrue();
    }

    /**
     * Verifies that {@code /- /- -/ -/} is one closed comment and the text after it is scanned again.
     */
    @Test
    @Tag("unit")
    void testNestedBlockComment() {
        // Act
        List<Token> tokens = tokens("a /- x /- y -/ z -/ b");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("a", "b");
        assertThat(tokens.get(1).adjacent()).isFalse();
        assertThat(tokens.get(1).onNewLine()).isFalse();
    }

    /**
     * Verifies that a block comment still open at the end of the text reports every open start.
     */
    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentReportsEveryOpenStart() {
        // Act
        ParseError error = errorOf("/- a /- b");

        // Assert
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNTERMINATED_COMMENT);
        assertThat(error.positions()).containsExactly(at(0, 0, 2), at(0, 5, 2));
    }

    /**
     * Verifies that a {@code //} comment is accepted as the first token of a line and that the rest
     * of its closing line is skipped.
     */
    @Test
    @Tag("unit")
    void testLineStartBlockComment() {
        // Act
        List<Token> tokens = tokens("a\n// one\n// nested \\\\ two\n\\\\ skipped\nb");

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("a", "b");
        assertThat(tokens.get(1).onNewLine()).isTrue();
    }

    /**
     * Verifies that a {@code //} comment after another token on the same line is rejected.
     */
    @Test
    @Tag("unit")
    void testLineStartBlockCommentAfterToken() {
        // Act
        ParseError error = errorOf("a // b \\\\");

        // Assert
        assertThat(error.code()).isEqualTo(CompilerErrorCode.INVALID_BLOCK_COMMENT);
        assertThat(error.positions()).containsExactly(at(0, 2, 2));
    }

    /**
     * Verifies the supported escape sequences and doubled braces.
     */
    @Test
    @Tag("unit")
    void testStringEscapesAndLiteralBraces() {
        // Act
        List<Token> tokens = tokens("\"a\\n\\t\\\"\\\\\\0\\'{{x}}\"");

        // Assert
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING_LITERAL);
        assertThat(tokens.get(0).components()).containsExactly(new StringComponent.Text("a\n\t\"\\\0'{x}"));
    }

    /**
     * Verifies that {@code ""} is a string literal without components.
     */
    @Test
    @Tag("unit")
    void testEmptyString() {
        List<Token> tokens = tokens("\"\"");

        assertThat(tokens.get(0).components()).isEmpty();
    }

    /**
     * Verifies that {@code "a{1+1}b"} yields the text "a", the parsed expression and the text "b".
     */
    @Test
    @Tag("unit")
    void testStringInterpolation() {
        // Act
        List<StringComponent> components = tokens("\"a{1+1}b\"").get(0).components();

        // Assert
        assertThat(components).hasSize(3);
        assertThat(components.get(0)).isEqualTo(new StringComponent.Text("a"));
        assertThat(components.get(2)).isEqualTo(new StringComponent.Text("b"));

        StringComponent.Interpolation interpolation = (StringComponent.Interpolation) components.get(1);
        assertThat(interpolation.bracePosition()).isEqualTo(at(0, 2, 1));
        assertThat(interpolation.term()).isInstanceOf(Term.BinaryOperation.class);
        Term.BinaryOperation sum = (Term.BinaryOperation) interpolation.term();
        assertThat(sum.operator().name()).isEqualTo("add");
        assertThat(sum.position()).isEqualTo(new SourceRange(new SourceIndex(0, 3), new SourceIndex(0, 6)));
    }

    /**
     * Verifies that scanning continues after a string literal with an embedded expression.
     */
    @Test
    @Tag("unit")
    void testTokensAfterInterpolatedString() {
        // Act
        List<Lexer.Scanned> scanned = scanAll("x = \"{y}\" + z");

        // Assert
        assertThat(scanned).extracting(s -> s.token().type()).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.STRING_LITERAL, TokenType.PLUS, TokenType.IDENTIFIER);
        assertThat(scanned.get(3).start()).isEqualTo(new SourceIndex(0, 10));
    }

    /**
     * Verifies that {@code {}} inside a string is an interpolation without an expression.
     */
    @Test
    @Tag("unit")
    void testEmptyInterpolation() {
        List<StringComponent> components = tokens("\"{}\"").get(0).components();

        assertThat(components).hasSize(1);
        assertThat(((StringComponent.Interpolation) components.get(0)).term()).isNull();
    }

    /**
     * Verifies that a lone closing brace in a string literal is reported with the string start.
     */
    @Test
    @Tag("unit")
    void testUnmatchedClosingBrace() {
        // Act
        ParseError error = errorOf("\"a}b\"");

        // Assert
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNMATCHED_CLOSING_BRACE_IN_STRING_LITERAL);
        assertThat(error.positions()).containsExactly(at(0, 2, 1), at(0, 0, 1));
    }

    /**
     * Verifies that an unknown escape sequence is rejected at the backslash.
     */
    @Test
    @Tag("unit")
    void testInvalidEscape() {
        ParseError error = errorOf("\"\\q\"");

        assertThat(error.code()).isEqualTo(CompilerErrorCode.INVALID_ESCAPE_SEQUENCE);
        assertThat(error.positions()).containsExactly(at(0, 1, 2));
    }

    /**
     * Verifies that a string literal still open at the end of the text is reported at its opening quote.
     */
    @Test
    @Tag("unit")
    void testUnterminatedString() {
        // Act
        ParseError error = errorOf("x = \"abc");

        // Assert
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING_LITERAL);
        assertThat(error.positions()).containsExactly(at(0, 4, 1));
    }

    /**
     * Verifies that an embedded expression must be followed by the closing brace.
     */
    @Test
    @Tag("unit")
    void testUnexpectedTokenInInterpolation() {
        // Act
        ParseError error = errorOf("\"{a)\"");

        // Assert
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN_IN_INTERPOLATION);
        assertThat(error.positions()).containsExactly(at(0, 3, 1), at(0, 1, 1));
    }

    /**
     * Verifies that a character no token can start is rejected.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        ParseError error = errorOf("a @");

        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
        assertThat(error.positions()).containsExactly(at(0, 2, 1));
    }

    /**
     * Verifies that the end of the text is reported with the position after the last character.
     */
    @Test
    @Tag("unit")
    void testEndOfInput() {
        // Arrange
        Lexer lexer = new Lexer(new SourceCursor("a  "));
        lexer.readToken(true, true);

        // Act
        Lexer.Scanned end = lexer.readToken(true, false);

        // Assert
        assertThat(end.token()).isNull();
        assertThat(end.start()).isEqualTo(new SourceIndex(0, 3));
    }
}
