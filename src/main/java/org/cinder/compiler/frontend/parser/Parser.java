package org.cinder.compiler.frontend.parser;

import org.cinder.compiler.api.CompilerErrorCode;
import org.cinder.compiler.api.SourceIndex;
import org.cinder.compiler.api.SourceRange;
import org.cinder.compiler.frontend.lexer.Lexer;
import org.cinder.compiler.frontend.lexer.Token;
import org.cinder.compiler.frontend.lexer.TokenType;
import org.cinder.compiler.frontend.parser.ast.FunctionDefinition;
import org.cinder.compiler.frontend.parser.ast.ImportDeclaration;
import org.cinder.compiler.frontend.parser.ast.ListElement;
import org.cinder.compiler.frontend.parser.ast.Stmt;
import org.cinder.compiler.frontend.parser.ast.StringComponent;
import org.cinder.compiler.frontend.parser.ast.Term;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A recursive-descent parser with precedence climbing. It pulls tokens lazily from a {@link Lexer}
 * with one token of lookahead and produces {@link Term}, {@link Stmt} and {@link FunctionDefinition}
 * trees whose positions span exactly their source text.
 * <p>
 * Every expression entry point returns null when no expression is present. Callers decide whether
 * the absence is an empty slot or an error. Unrecoverable problems are thrown as {@link ParseException}.
 * <p>
 * Outside of delimited lists, an operator on a new line ends the expression, which is what makes
 * line breaks terminate statements.
 */
public class Parser {

    /** Binary operator tiers, from the loosest to the tightest binding. */
    private enum Precedence {
        EQUALITY, INEQUALITY, BIT_OR, BIT_XOR, BIT_AND, BIT_SHIFT, ADD_SUB, MUL_DIV_REM;

        private Precedence tighter() {
            Precedence[] all = values();
            return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
        }
    }

    /**
     * The elements of a delimited list.
     * @param elements The elements, with empty slots before commas.
     * @param trailingComma Whether the list ended without an element after the last comma.
     */
    private record DelimitedList(List<ListElement> elements, boolean trailingComma) {}

    private final Lexer lexer;
    private Token next;
    private SourceIndex nextStart;
    private SourceIndex previousEnd = SourceIndex.ORIGIN;

    /**
     * Creates a parser positioned at the start of a file.
     * @param lexer The lexer over the file.
     * @throws ParseException if the first token is malformed.
     */
    public Parser(Lexer lexer) {
        this(lexer, true);
    }

    private Parser(Lexer lexer, boolean startsOnNewLine) {
        this.lexer = lexer;
        Lexer.Scanned first = lexer.readToken(true, startsOnNewLine);
        this.next = first.token();
        this.nextStart = first.start();
    }

    /**
     * Creates a parser for an expression embedded in a string literal. It shares the lexer's
     * position, so it must be discarded once the closing brace has been read.
     * @param lexer The lexer currently scanning the string literal.
     * @return The new parser.
     */
    public static Parser embedded(Lexer lexer) {
        return new Parser(lexer, false);
    }

    // region Lookahead

    /**
     * Returns the lookahead token without consuming it.
     * @return The next token, or null at the end of the text.
     */
    public Token nextToken() {
        return next;
    }

    /**
     * Returns the lookahead token only if nothing separates it from the previous token.
     * @return The next token, or null if it is not adjacent or the text has ended.
     */
    public Token adjacentToken() {
        return next != null && next.adjacent() ? next : null;
    }

    /**
     * Returns the lookahead token only if it is on the same line as the previous token.
     * @return The next token, or null if a line break precedes it or the text has ended.
     */
    public Token nextTokenOnCurrentLine() {
        return next != null && !next.onNewLine() ? next : null;
    }

    /**
     * @return The start position of the lookahead token, or the end of the text.
     */
    public SourceIndex nextTokenStart() {
        return nextStart;
    }

    /**
     * @return The source range of the lookahead token.
     */
    public SourceRange nextTokenPosition() {
        return new SourceRange(nextStart, lexer.peekIndex());
    }

    /**
     * Builds the range from {@code start} to the end of the last consumed token.
     * @param start The start position.
     * @return The range.
     */
    public SourceRange rangeFrom(SourceIndex start) {
        return new SourceRange(start, previousEnd);
    }

    /**
     * @return true if there is a lookahead token.
     */
    public boolean hasRemainingToken() {
        return next != null;
    }

    /**
     * @return true if there is a lookahead token on the current line.
     */
    public boolean hasRemainingTokenOnCurrentLine() {
        return next != null && !next.onNewLine();
    }

    /**
     * Consumes the lookahead token and reads the next one.
     * @throws ParseException if the next token is malformed.
     */
    public void consumeToken() {
        previousEnd = lexer.peekIndex();
        Lexer.Scanned scanned = lexer.readToken(true, false);
        next = scanned.token();
        nextStart = scanned.start();
    }

    private Token continuation(boolean allowLineBreak) {
        return allowLineBreak ? nextToken() : nextTokenOnCurrentLine();
    }

    private boolean nextIs(TokenType type) {
        return next != null && next.is(type);
    }

    private boolean nextOnCurrentLineIs(TokenType type) {
        Token token = nextTokenOnCurrentLine();
        return token != null && token.is(type);
    }

    // endregion

    // region Declarations

    /**
     * Parses {@code import name} or {@code import name("path")}. The lookahead must be {@code import}.
     * @return The declaration, with the path still unresolved.
     */
    public ImportDeclaration parseImportDeclaration() {
        SourceRange keywordPosition = nextTokenPosition();
        consumeToken();

        Token nameToken = nextTokenOnCurrentLine();
        if (nameToken == null) {
            throw new ParseException(CompilerErrorCode.MISSING_IMPORT_NAME,
                    "Expected a name after 'import'", keywordPosition);
        }
        if (!nameToken.is(TokenType.IDENTIFIER)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_KEYWORD_IMPORT,
                    "Expected a name after 'import' but found " + nameToken.describe(),
                    List.of(nextTokenPosition(), keywordPosition));
        }
        SourceRange namePosition = nextTokenPosition();
        consumeToken();

        Token token = nextTokenOnCurrentLine();
        if (token == null) {
            return new ImportDeclaration(keywordPosition, nameToken.text(), namePosition, null, null);
        }
        if (!token.is(TokenType.OPENING_PARENTHESIS)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_IMPORT_NAME,
                    "Unexpected " + token.describe() + " after import name '" + nameToken.text() + "'",
                    List.of(nextTokenPosition(), namePosition));
        }
        SourceRange openingPosition = nextTokenPosition();
        consumeToken();

        Term path = parseAssign(true);
        Token closing = nextToken();
        if (closing == null) {
            throw new ParseException(CompilerErrorCode.UNCLOSED_PARENTHESIS, "Unclosed '('", openingPosition);
        }
        if (!closing.is(TokenType.CLOSING_PARENTHESIS)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_IN_PARENTHESES,
                    "Unexpected " + closing.describe() + " in import path",
                    List.of(nextTokenPosition(), openingPosition));
        }
        SourceRange closingPosition = nextTokenPosition();
        consumeToken();

        if (path == null) {
            throw new ParseException(CompilerErrorCode.MISSING_IMPORT_PATH,
                    "Expected a path between the parentheses of import '" + nameToken.text() + "'",
                    List.of(openingPosition, closingPosition));
        }
        if (!(path instanceof Term.StringLiteral literal
                && literal.components().size() == 1
                && literal.components().get(0) instanceof StringComponent.Text text)) {
            throw new ParseException(CompilerErrorCode.INVALID_IMPORT_PATH,
                    "An import path must be a plain string literal", path.position());
        }
        if (hasRemainingTokenOnCurrentLine()) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_IMPORT_PATH,
                    "Expected a line break after the path of import '" + nameToken.text()
                            + "' but found " + next.describe(),
                    List.of(nextTokenPosition(), closingPosition));
        }
        return new ImportDeclaration(keywordPosition, nameToken.text(), namePosition, text.text(), path.position());
    }

    /**
     * Parses {@code func name [T] (parameters) -> type} and a block. The lookahead must
     * be {@code func}.
     * @param path The canonical path of the file being parsed.
     * @return The definition.
     */
    public FunctionDefinition parseFunctionDefinition(Path path) {
        SourceRange keywordPosition = nextTokenPosition();
        consumeToken();

        Token nameToken = nextTokenOnCurrentLine();
        if (nameToken == null) {
            throw new ParseException(CompilerErrorCode.MISSING_FUNCTION_NAME,
                    "Expected a name after 'func'", keywordPosition);
        }
        if (!nameToken.is(TokenType.IDENTIFIER)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_KEYWORD_FUNC,
                    "Expected a name after 'func' but found " + nameToken.describe(),
                    List.of(nextTokenPosition(), keywordPosition));
        }
        SourceRange namePosition = nextTokenPosition();
        consumeToken();

        List<ListElement> typeParameters = null;
        if (nextOnCurrentLineIs(TokenType.OPENING_BRACKET)) {
            typeParameters = parseTypeParameters();
        }

        List<ListElement> parameters = null;
        if (nextOnCurrentLineIs(TokenType.OPENING_PARENTHESIS)) {
            SourceRange openingPosition = nextTokenPosition();
            consumeToken();
            parameters = parseList(TokenType.CLOSING_PARENTHESIS, openingPosition).elements();
        }

        // The return type may start a new line; the block follows the header directly.
        FunctionDefinition.ReturnType returnType = null;
        if (nextIs(TokenType.HYPHEN_GREATER)) {
            SourceRange arrowPosition = nextTokenPosition();
            consumeToken();
            returnType = new FunctionDefinition.ReturnType(arrowPosition, parseDisjunction(false));
        }

        List<SourceRange> openBlocks = new ArrayList<>();
        openBlocks.add(keywordPosition);
        List<Stmt> body = parseBlock(openBlocks);
        return new FunctionDefinition(nameToken.text(), namePosition, path, typeParameters, parameters, returnType, body);
    }

    /**
     * Parses the bracketed type parameters of a function. Generics are not supported yet, so this
     * always fails at the opening bracket.
     * @return Never returns normally.
     */
    public List<ListElement> parseTypeParameters() {
        throw new ParseException(CompilerErrorCode.TYPE_PARAMETERS_UNSUPPORTED,
                "Type parameters are not supported yet", nextTokenPosition());
    }

    // endregion

    // region Statements

    /**
     * Parses statements up to and including {@code end}.
     * @param openBlocks The positions of the constructs whose blocks are still open, outermost first.
     * @return The statements of the block.
     */
    public List<Stmt> parseBlock(List<SourceRange> openBlocks) {
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            if (nextIs(TokenType.KEYWORD_END)) {
                consumeToken();
                return statements;
            }
            Stmt statement = parseStmt(openBlocks);
            if (statement != null) {
                statements.add(statement);
            } else if (hasRemainingToken()) {
                List<SourceRange> positions = new ArrayList<>();
                positions.add(nextTokenPosition());
                positions.addAll(openBlocks);
                throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_IN_BLOCK,
                        "Unexpected " + next.describe() + " in block", positions);
            } else {
                throw new ParseException(CompilerErrorCode.UNCLOSED_BLOCK,
                        "Block is not closed by 'end'", openBlocks);
            }
        }
    }

    /**
     * Parses a single statement.
     * @param openBlocks The positions of the enclosing open blocks; extended while a loop body is parsed.
     * @return The statement, or null if the lookahead does not start one.
     */
    public Stmt parseStmt(List<SourceRange> openBlocks) {
        if (nextIs(TokenType.KEYWORD_VAR)) {
            return parseVar();
        }
        if (nextIs(TokenType.KEYWORD_WHILE)) {
            return parseWhile(openBlocks);
        }
        Term term = parseAssign(false);
        if (term == null) {
            return null;
        }
        requireLineBreakAfter(term.position());
        return new Stmt.Expression(term);
    }

    private Stmt parseVar() {
        SourceRange keywordPosition = nextTokenPosition();
        consumeToken();
        Term term = parseAssign(false);
        if (term == null) {
            throw new ParseException(CompilerErrorCode.MISSING_VARIABLE_NAME,
                    "Expected a variable name after 'var'", keywordPosition);
        }
        Term name = term;
        while (name instanceof Term.Parenthesized parenthesized) {
            name = parenthesized.inner();
        }
        if (!(name instanceof Term.Identifier identifier)) {
            throw new ParseException(CompilerErrorCode.INVALID_VARIABLE_NAME,
                    "A variable name must be a plain identifier", term.position());
        }
        requireLineBreakAfter(term.position());
        return new Stmt.Var(keywordPosition, identifier);
    }

    private Stmt parseWhile(List<SourceRange> openBlocks) {
        SourceRange keywordPosition = nextTokenPosition();
        consumeToken();

        if (!hasRemainingTokenOnCurrentLine()) {
            throw new ParseException(CompilerErrorCode.MISSING_CONDITION_AFTER_KEYWORD_WHILE,
                    "Expected a condition on the same line as 'while'", keywordPosition);
        }
        Term condition = parseDisjunction(false);
        if (condition == null) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_KEYWORD_WHILE,
                    "Expected a condition after 'while' but found " + next.describe(),
                    List.of(nextTokenPosition(), keywordPosition));
        }
        if (hasRemainingTokenOnCurrentLine()) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_WHILE_CONDITION,
                    "Expected a line break after the loop condition but found " + next.describe(),
                    List.of(nextTokenPosition(), condition.position()));
        }

        openBlocks.add(keywordPosition);
        List<Stmt> body = parseBlock(openBlocks);
        openBlocks.remove(openBlocks.size() - 1);
        return new Stmt.While(keywordPosition, condition, body);
    }

    private void requireLineBreakAfter(SourceRange statementPosition) {
        if (hasRemainingTokenOnCurrentLine()) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN_AFTER_STATEMENT,
                    "Expected a line break after the statement but found " + next.describe(),
                    List.of(nextTokenPosition(), statementPosition));
        }
    }

    // endregion

    // region Expressions

    /**
     * Parses an assignment, the loosest-binding expression. Assignments are right-associative.
     * @param allowLineBreak Whether operators may continue the expression on a new line.
     * @return The expression, or null if none is present.
     */
    public Term parseAssign(boolean allowLineBreak) {
        SourceIndex start = nextTokenStart();
        Term left = parseDisjunction(allowLineBreak);
        Token token = continuation(allowLineBreak);
        String operator = token == null ? null : assignmentOperator(token.type());
        if (operator == null) {
            return left;
        }
        SourceRange operatorPosition = nextTokenPosition();
        consumeToken();
        Term right = parseAssign(allowLineBreak);
        return new Term.Assignment(rangeFrom(start), left, new Term.MethodName(operatorPosition, operator), right);
    }

    /**
     * Parses a flat chain of {@code ||}.
     * @param allowLineBreak Whether operators may continue the expression on a new line.
     * @return The expression, or null if none is present.
     */
    public Term parseDisjunction(boolean allowLineBreak) {
        SourceIndex start = nextTokenStart();
        Term first = parseConjunction(allowLineBreak);
        if (!continuesWith(TokenType.DOUBLE_BAR, allowLineBreak)) {
            return first;
        }
        List<Term> conditions = new ArrayList<>();
        List<SourceRange> operatorPositions = new ArrayList<>();
        conditions.add(first);
        while (continuesWith(TokenType.DOUBLE_BAR, allowLineBreak)) {
            operatorPositions.add(nextTokenPosition());
            consumeToken();
            conditions.add(parseConjunction(allowLineBreak));
        }
        return new Term.Disjunction(rangeFrom(start),
                Collections.unmodifiableList(conditions), List.copyOf(operatorPositions));
    }

    /**
     * Parses a flat chain of {@code &&}.
     * @param allowLineBreak Whether operators may continue the expression on a new line.
     * @return The expression, or null if none is present.
     */
    public Term parseConjunction(boolean allowLineBreak) {
        SourceIndex start = nextTokenStart();
        Term first = parseBinary(allowLineBreak, Precedence.EQUALITY);
        if (!continuesWith(TokenType.DOUBLE_AMPERSAND, allowLineBreak)) {
            return first;
        }
        List<Term> conditions = new ArrayList<>();
        List<SourceRange> operatorPositions = new ArrayList<>();
        conditions.add(first);
        while (continuesWith(TokenType.DOUBLE_AMPERSAND, allowLineBreak)) {
            operatorPositions.add(nextTokenPosition());
            consumeToken();
            conditions.add(parseBinary(allowLineBreak, Precedence.EQUALITY));
        }
        return new Term.Conjunction(rangeFrom(start),
                Collections.unmodifiableList(conditions), List.copyOf(operatorPositions));
    }

    private boolean continuesWith(TokenType type, boolean allowLineBreak) {
        Token token = continuation(allowLineBreak);
        return token != null && token.is(type);
    }

    private Term parseBinary(boolean allowLineBreak, Precedence precedence) {
        if (precedence == null) {
            return parseFactor(allowLineBreak);
        }
        SourceIndex start = nextTokenStart();
        Term left = parseBinary(allowLineBreak, precedence.tighter());
        while (true) {
            Token token = continuation(allowLineBreak);
            String operator = token == null ? null : infixOperator(token.type(), precedence);
            if (operator == null) {
                return left;
            }
            SourceRange operatorPosition = nextTokenPosition();
            consumeToken();
            Term right = parseBinary(allowLineBreak, precedence.tighter());
            left = new Term.BinaryOperation(rangeFrom(start), left,
                    new Term.MethodName(operatorPosition, operator), right);
        }
    }

    /**
     * Parses a primary factor followed by its postfix chain.
     * @param allowLineBreak Whether postfix operators may continue the factor on a new line.
     * @return The factor, or null if the lookahead does not start one.
     */
    public Term parseFactor(boolean allowLineBreak) {
        SourceIndex start = nextTokenStart();
        Token first = nextToken();
        if (first == null) {
            return null;
        }
        Term factor;
        switch (first.type()) {
            case UNDERSCORE -> {
                consumeToken();
                factor = new Term.Identity(rangeFrom(start));
            }
            case KEYWORD_INT -> {
                consumeToken();
                factor = new Term.IntegerType(rangeFrom(start));
            }
            case KEYWORD_FLOAT -> {
                consumeToken();
                factor = new Term.FloatType(rangeFrom(start));
            }
            case IDENTIFIER -> {
                consumeToken();
                factor = new Term.Identifier(rangeFrom(start), first.text());
            }
            case STRING_LITERAL -> {
                consumeToken();
                factor = new Term.StringLiteral(rangeFrom(start), first.components());
            }
            case DIGITS -> factor = parseNumber(start, first.text());
            case DOT -> factor = parseFractionOnly(start);
            case OPENING_PARENTHESIS -> factor = parseGroup(start);
            default -> {
                String operator = prefixOperator(first.type());
                if (operator == null) {
                    return null;
                }
                SourceRange operatorPosition = nextTokenPosition();
                consumeToken();
                Term operand = parseFactor(allowLineBreak);
                factor = new Term.UnaryOperation(rangeFrom(start),
                        new Term.MethodName(operatorPosition, operator), operand);
            }
        }
        return parsePostfix(start, factor, allowLineBreak);
    }

    /**
     * Parses digits and an optional adjacent fraction. {@code 3.name} is the literal {@code 3}
     * followed by a field access, {@code 3.5} is one literal and a bare {@code 3.} is the literal "3.".
     */
    private Term parseNumber(SourceIndex start, String digits) {
        consumeToken();
        Token dot = adjacentToken();
        if (dot == null || !dot.is(TokenType.DOT)) {
            return new Term.NumericLiteral(rangeFrom(start), digits);
        }
        SourceRange integerPosition = rangeFrom(start);
        consumeToken();
        Token afterDot = adjacentToken();
        if (afterDot != null && afterDot.is(TokenType.IDENTIFIER)) {
            consumeToken();
            return new Term.FieldByName(rangeFrom(start),
                    new Term.NumericLiteral(integerPosition, digits), afterDot.text());
        }
        if (afterDot != null && afterDot.is(TokenType.DIGITS)) {
            consumeToken();
            return new Term.NumericLiteral(rangeFrom(start), digits + "." + afterDot.text());
        }
        return new Term.NumericLiteral(rangeFrom(start), digits + ".");
    }

    private Term parseFractionOnly(SourceIndex start) {
        SourceRange dotPosition = nextTokenPosition();
        consumeToken();
        Token digits = adjacentToken();
        if (digits == null || !digits.is(TokenType.DIGITS)) {
            throw new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN, "Unexpected '.'", dotPosition);
        }
        consumeToken();
        return new Term.NumericLiteral(rangeFrom(start), "." + digits.text());
    }

    private Term parseGroup(SourceIndex start) {
        SourceRange openingPosition = nextTokenPosition();
        consumeToken();
        DelimitedList list = parseList(TokenType.CLOSING_PARENTHESIS, openingPosition);
        if (list.elements().size() == 1 && !list.trailingComma()
                && list.elements().get(0) instanceof ListElement.NonEmpty element) {
            return new Term.Parenthesized(rangeFrom(start), element.term());
        }
        return new Term.Tuple(rangeFrom(start), list.elements());
    }

    private Term parsePostfix(SourceIndex start, Term factor, boolean allowLineBreak) {
        while (true) {
            Token token = continuation(allowLineBreak);
            if (token == null) {
                return factor;
            }
            switch (token.type()) {
                case DOT -> factor = parseFieldAccess(start, factor);
                case COLON -> {
                    SourceRange colonPosition = nextTokenPosition();
                    consumeToken();
                    Term type = parseFactor(allowLineBreak);
                    factor = new Term.TypeAnnotation(rangeFrom(start), factor, colonPosition, type);
                }
                case HYPHEN_GREATER -> {
                    SourceRange arrowPosition = nextTokenPosition();
                    consumeToken();
                    Term returnType = parseFactor(allowLineBreak);
                    factor = new Term.ReturnType(rangeFrom(start), arrowPosition, factor, returnType);
                }
                case OPENING_PARENTHESIS -> {
                    SourceRange openingPosition = nextTokenPosition();
                    consumeToken();
                    List<ListElement> arguments = parseList(TokenType.CLOSING_PARENTHESIS, openingPosition).elements();
                    factor = new Term.FunctionCall(rangeFrom(start), factor, arguments);
                }
                case OPENING_BRACKET -> {
                    SourceRange openingPosition = nextTokenPosition();
                    consumeToken();
                    List<ListElement> parameters = parseList(TokenType.CLOSING_BRACKET, openingPosition).elements();
                    factor = new Term.TypeParameters(rangeFrom(start), factor, parameters);
                }
                default -> {
                    return factor;
                }
            }
        }
    }

    private Term parseFieldAccess(SourceIndex start, Term left) {
        SourceRange dotPosition = nextTokenPosition();
        consumeToken();
        Token field = nextToken();
        if (field != null && field.is(TokenType.IDENTIFIER)) {
            consumeToken();
            return new Term.FieldByName(rangeFrom(start), left, field.text());
        }
        if (field != null && field.is(TokenType.DIGITS)) {
            consumeToken();
            return new Term.FieldByNumber(rangeFrom(start), left, field.text());
        }
        throw new ParseException(CompilerErrorCode.MISSING_FIELD_AFTER_DOT,
                "Expected a field name or number after '.'", dotPosition);
    }

    /**
     * Parses comma-separated elements up to and including {@code closing}. The opening delimiter
     * has already been consumed. Line breaks are allowed anywhere inside the list.
     */
    private DelimitedList parseList(TokenType closing, SourceRange openingPosition) {
        boolean parentheses = closing == TokenType.CLOSING_PARENTHESIS;
        List<ListElement> elements = new ArrayList<>();
        while (true) {
            Term element = parseAssign(true);
            Token token = nextToken();
            if (token == null) {
                throw new ParseException(
                        parentheses ? CompilerErrorCode.UNCLOSED_PARENTHESIS : CompilerErrorCode.UNCLOSED_BRACKET,
                        parentheses ? "Unclosed '('" : "Unclosed '['", openingPosition);
            }
            if (token.is(closing)) {
                consumeToken();
                if (element != null) {
                    elements.add(new ListElement.NonEmpty(element));
                }
                return new DelimitedList(Collections.unmodifiableList(elements), element == null);
            }
            if (!token.is(TokenType.COMMA)) {
                throw new ParseException(
                        parentheses ? CompilerErrorCode.UNEXPECTED_TOKEN_IN_PARENTHESES
                                : CompilerErrorCode.UNEXPECTED_TOKEN_IN_BRACKETS,
                        "Unexpected " + token.describe() + (parentheses ? " in parentheses" : " in brackets"),
                        List.of(nextTokenPosition(), openingPosition));
            }
            SourceRange commaPosition = nextTokenPosition();
            consumeToken();
            elements.add(element != null ? new ListElement.NonEmpty(element) : new ListElement.Empty(commaPosition));
        }
    }

    // endregion

    private static String prefixOperator(TokenType type) {
        return switch (type) {
            case PLUS -> "plus";
            case HYPHEN -> "minus";
            case SLASH -> "reciprocal";
            case EXCLAMATION -> "logical_not";
            case TILDE -> "bitwise_not";
            default -> null;
        };
    }

    private static String infixOperator(TokenType type, Precedence precedence) {
        return switch (precedence) {
            case MUL_DIV_REM -> switch (type) {
                case ASTERISK -> "mul";
                case SLASH -> "div";
                case PERCENT -> "rem";
                default -> null;
            };
            case ADD_SUB -> switch (type) {
                case PLUS -> "add";
                case HYPHEN -> "sub";
                default -> null;
            };
            case BIT_SHIFT -> switch (type) {
                case DOUBLE_GREATER -> "right_shift";
                case DOUBLE_LESS -> "left_shift";
                default -> null;
            };
            case BIT_AND -> type == TokenType.AMPERSAND ? "bitwise_and" : null;
            case BIT_XOR -> type == TokenType.CIRCUMFLEX ? "bitwise_xor" : null;
            case BIT_OR -> type == TokenType.BAR ? "bitwise_or" : null;
            case INEQUALITY -> switch (type) {
                case GREATER -> "greater";
                case GREATER_EQUAL -> "greater_or_equal";
                case LESS -> "less";
                case LESS_EQUAL -> "less_or_equal";
                default -> null;
            };
            case EQUALITY -> switch (type) {
                case DOUBLE_EQUAL -> "equal";
                case EXCLAMATION_EQUAL -> "not_equal";
                default -> null;
            };
        };
    }

    private static String assignmentOperator(TokenType type) {
        return switch (type) {
            case EQUAL -> "assign";
            case PLUS_EQUAL -> "add_assign";
            case HYPHEN_EQUAL -> "sub_assign";
            case ASTERISK_EQUAL -> "mul_assign";
            case SLASH_EQUAL -> "div_assign";
            case PERCENT_EQUAL -> "rem_assign";
            case DOUBLE_GREATER_EQUAL -> "right_shift_assign";
            case DOUBLE_LESS_EQUAL -> "left_shift_assign";
            case AMPERSAND_EQUAL -> "bitwise_and_assign";
            case CIRCUMFLEX_EQUAL -> "bitwise_xor_assign";
            case BAR_EQUAL -> "bitwise_or_assign";
            default -> null;
        };
    }
}
