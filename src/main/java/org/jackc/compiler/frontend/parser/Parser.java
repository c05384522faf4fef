package org.jackc.compiler.frontend.parser;

import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.jackc.compiler.frontend.lexer.Keyword;
import org.jackc.compiler.frontend.lexer.Symbol;
import org.jackc.compiler.frontend.lexer.Token;
import org.jackc.compiler.frontend.lexer.TokenType;
import org.jackc.compiler.frontend.parser.ast.BinaryOp;
import org.jackc.compiler.frontend.parser.ast.ClassNode;
import org.jackc.compiler.frontend.parser.ast.ClassVarDecNode;
import org.jackc.compiler.frontend.parser.ast.ExpressionNode;
import org.jackc.compiler.frontend.parser.ast.IdentifierNode;
import org.jackc.compiler.frontend.parser.ast.KeywordConstant;
import org.jackc.compiler.frontend.parser.ast.ParameterNode;
import org.jackc.compiler.frontend.parser.ast.StatementNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineBodyNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineCallNode;
import org.jackc.compiler.frontend.parser.ast.SubroutineDecNode;
import org.jackc.compiler.frontend.parser.ast.TermNode;
import org.jackc.compiler.frontend.parser.ast.TypeNode;
import org.jackc.compiler.frontend.parser.ast.UnaryOp;
import org.jackc.compiler.frontend.parser.ast.VarDecNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for the Jack language. It consumes a list of tokens
 * from the {@link org.jackc.compiler.frontend.lexer.Lexer} and produces the
 * Abstract Syntax Tree of exactly one class.
 * <p>
 * Parsing stops at the first mismatch: the error is reported to the
 * {@link DiagnosticsEngine} and no tree is returned.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final ParserOptions options;
    private int current = 0;

    /**
     * Constructs a new Parser with default grammar options.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, ParserOptions.DEFAULTS);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param options The grammar switches.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, ParserOptions options) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * Parses the first class of the token stream. Tokens after its closing brace are
     * not consumed; a warning records that they were ignored.
     *
     * @return The class, or empty if the stream holds no tokens or a syntax error was reported.
     */
    public Optional<ClassNode> parse() {
        if (isAtEnd()) {
            return Optional.empty();
        }
        try {
            ClassNode classNode = classDeclaration();
            if (!isAtEnd()) {
                Token extra = peek();
                diagnostics.reportWarning(CompilerErrorCode.TRAILING_TOKENS,
                        "Ignoring tokens after class '" + classNode.name().name() + "', starting with " + extra.describe(),
                        extra.fileName(), extra.line());
            }
            return Optional.of(classNode);
        } catch (ParseException ex) {
            return Optional.empty();
        }
    }

    // region Program structure

    private ClassNode classDeclaration() {
        consume(Keyword.CLASS);
        IdentifierNode name = identifier("class name");
        consume(Symbol.LEFT_CURLY_BRACE);

        List<ClassVarDecNode> classVarDecs = new ArrayList<>();
        while (check(Keyword.STATIC) || check(Keyword.FIELD)) {
            classVarDecs.add(classVarDec());
        }

        List<SubroutineDecNode> subroutineDecs = new ArrayList<>();
        while (check(Keyword.CONSTRUCTOR) || check(Keyword.FUNCTION) || check(Keyword.METHOD)) {
            subroutineDecs.add(subroutineDec());
        }

        consume(Symbol.RIGHT_CURLY_BRACE);
        return new ClassNode(name, classVarDecs, subroutineDecs);
    }

    private ClassVarDecNode classVarDec() {
        ClassVarDecNode.Kind kind = advance().is(Keyword.STATIC)
                ? ClassVarDecNode.Kind.STATIC
                : ClassVarDecNode.Kind.FIELD;
        TypeNode type = type();
        List<IdentifierNode> names = nameList();
        consume(Symbol.SEMICOLON);
        return new ClassVarDecNode(kind, type, names);
    }

    private SubroutineDecNode subroutineDec() {
        Token kindToken = advance();
        SubroutineDecNode.Kind kind;
        if (kindToken.is(Keyword.CONSTRUCTOR)) {
            kind = SubroutineDecNode.Kind.CONSTRUCTOR;
        } else if (kindToken.is(Keyword.FUNCTION)) {
            kind = SubroutineDecNode.Kind.FUNCTION;
        } else {
            kind = SubroutineDecNode.Kind.METHOD;
        }

        Optional<TypeNode> returnType = match(Keyword.VOID) ? Optional.empty() : Optional.of(type());
        IdentifierNode name = identifier("subroutine name");

        consume(Symbol.LEFT_PARENTHESIS);
        List<ParameterNode> parameters = parameterList();
        consume(Symbol.RIGHT_PARENTHESIS);

        return new SubroutineDecNode(kind, returnType, name, parameters, subroutineBody());
    }

    private List<ParameterNode> parameterList() {
        List<ParameterNode> parameters = new ArrayList<>();
        if (check(Symbol.RIGHT_PARENTHESIS)) {
            return parameters;
        }
        do {
            TypeNode type = type();
            parameters.add(new ParameterNode(type, identifier("parameter name")));
        } while (match(Symbol.COMMA));
        return parameters;
    }

    private SubroutineBodyNode subroutineBody() {
        consume(Symbol.LEFT_CURLY_BRACE);
        List<VarDecNode> varDecs = new ArrayList<>();
        while (match(Keyword.VAR)) {
            TypeNode type = type();
            List<IdentifierNode> names = nameList();
            consume(Symbol.SEMICOLON);
            varDecs.add(new VarDecNode(type, names));
        }
        List<StatementNode> statements = statements();
        consume(Symbol.RIGHT_CURLY_BRACE);
        return new SubroutineBodyNode(varDecs, statements);
    }

    private List<IdentifierNode> nameList() {
        List<IdentifierNode> names = new ArrayList<>();
        do {
            names.add(identifier("variable name"));
        } while (match(Symbol.COMMA));
        return names;
    }

    private TypeNode type() {
        if (check(Keyword.INT) || check(Keyword.CHAR) || check(Keyword.BOOLEAN)) {
            return new TypeNode.Primitive((Keyword) advance().value());
        }
        if (check(TokenType.IDENTIFIER)) {
            return new TypeNode.ClassType(new IdentifierNode(advance()));
        }
        throw error("a type (int, char, boolean or a class name)");
    }

    // endregion

    // region Statements

    private List<StatementNode> statements() {
        List<StatementNode> statements = new ArrayList<>();
        while (true) {
            if (match(Keyword.LET)) {
                statements.add(letStatement());
            } else if (match(Keyword.IF)) {
                statements.add(ifStatement());
            } else if (match(Keyword.WHILE)) {
                statements.add(whileStatement());
            } else if (match(Keyword.DO)) {
                statements.add(doStatement());
            } else if (match(Keyword.RETURN)) {
                statements.add(returnStatement());
            } else {
                return statements;
            }
        }
    }

    private StatementNode letStatement() {
        IdentifierNode target = identifier("variable name");
        Optional<ExpressionNode> index = Optional.empty();
        if (match(Symbol.LEFT_SQUARE_BRACKET)) {
            index = Optional.of(expression());
            consume(Symbol.RIGHT_SQUARE_BRACKET);
        }
        consume(Symbol.EQUAL);
        ExpressionNode value = expression();
        consume(Symbol.SEMICOLON);
        return new StatementNode.Let(target, index, value);
    }

    private StatementNode ifStatement() {
        ExpressionNode condition = parenthesizedCondition();
        List<StatementNode> thenBranch = block();
        Optional<List<StatementNode>> elseBranch = match(Keyword.ELSE) ? Optional.of(block()) : Optional.empty();
        return new StatementNode.If(condition, thenBranch, elseBranch);
    }

    private StatementNode whileStatement() {
        ExpressionNode condition = parenthesizedCondition();
        return new StatementNode.While(condition, block());
    }

    private StatementNode doStatement() {
        SubroutineCallNode call = subroutineCall();
        consume(Symbol.SEMICOLON);
        return new StatementNode.Do(call);
    }

    private StatementNode returnStatement() {
        if (match(Symbol.SEMICOLON)) {
            return new StatementNode.Return(Optional.empty());
        }
        ExpressionNode value = expression();
        consume(Symbol.SEMICOLON);
        return new StatementNode.Return(Optional.of(value));
    }

    private ExpressionNode parenthesizedCondition() {
        consume(Symbol.LEFT_PARENTHESIS);
        ExpressionNode condition = expression();
        consume(Symbol.RIGHT_PARENTHESIS);
        return condition;
    }

    private List<StatementNode> block() {
        consume(Symbol.LEFT_CURLY_BRACE);
        List<StatementNode> statements = statements();
        consume(Symbol.RIGHT_CURLY_BRACE);
        return statements;
    }

    // endregion

    // region Expressions

    /**
     * Parses an expression. Without chained operators only one {@code (op term)} pair
     * is taken, so in {@code a + b + c} the second {@code +} is left unconsumed.
     * @return The parsed expression.
     */
    private ExpressionNode expression() {
        TermNode head = term();
        List<ExpressionNode.OpTerm> tail = new ArrayList<>();
        Optional<BinaryOp> op = binaryOp();
        while (op.isPresent()) {
            tail.add(new ExpressionNode.OpTerm(op.get(), term()));
            op = options.chainedOperators() ? binaryOp() : Optional.empty();
        }
        return new ExpressionNode(head, tail);
    }

    private Optional<BinaryOp> binaryOp() {
        if (!check(TokenType.SYMBOL)) {
            return Optional.empty();
        }
        Optional<BinaryOp> op = BinaryOp.fromSymbol((Symbol) peek().value());
        op.ifPresent(ignored -> advance());
        return op;
    }

    private TermNode term() {
        Token token = peek();
        switch (token.type()) {
            case KEYWORD: {
                Optional<KeywordConstant> constant = KeywordConstant.fromKeyword((Keyword) token.value());
                if (constant.isPresent()) {
                    advance();
                    return new TermNode.KeywordConstantTerm(constant.get());
                }
                break;
            }
            case SYMBOL: {
                Optional<UnaryOp> unary = UnaryOp.fromSymbol((Symbol) token.value());
                if (unary.isPresent()) {
                    advance();
                    return new TermNode.UnaryOpTerm(unary.get(), term());
                }
                if (token.is(Symbol.LEFT_PARENTHESIS)) {
                    advance();
                    ExpressionNode inner = expression();
                    consume(Symbol.RIGHT_PARENTHESIS);
                    return new TermNode.Parenthesized(inner);
                }
                break;
            }
            case INTEGER_CONSTANT:
                advance();
                return new TermNode.IntegerConstant((Integer) token.value());
            case STRING_CONSTANT:
                advance();
                return new TermNode.StringConstant((String) token.value());
            case IDENTIFIER:
                // One token of extra lookahead decides between the three identifier forms.
                if (checkNext(Symbol.LEFT_SQUARE_BRACKET)) {
                    IdentifierNode name = new IdentifierNode(advance());
                    advance();
                    ExpressionNode index = expression();
                    consume(Symbol.RIGHT_SQUARE_BRACKET);
                    return new TermNode.ArrayElement(name, index);
                }
                if (checkNext(Symbol.LEFT_PARENTHESIS) || checkNext(Symbol.DOT)) {
                    return subroutineCall();
                }
                return new TermNode.VarName(new IdentifierNode(advance()));
            default:
                break;
        }
        throw error("a term");
    }

    private SubroutineCallNode subroutineCall() {
        IdentifierNode first = identifier("subroutine, class or variable name");
        if (match(Symbol.LEFT_PARENTHESIS)) {
            List<ExpressionNode> arguments = expressionList();
            consume(Symbol.RIGHT_PARENTHESIS);
            return new SubroutineCallNode.Call(first, arguments);
        }
        if (match(Symbol.DOT)) {
            IdentifierNode subroutineName = identifier("subroutine name");
            consume(Symbol.LEFT_PARENTHESIS);
            List<ExpressionNode> arguments = expressionList();
            consume(Symbol.RIGHT_PARENTHESIS);
            return new SubroutineCallNode.ClassCall(first, subroutineName, arguments);
        }
        throw error("'(' or '.'");
    }

    private List<ExpressionNode> expressionList() {
        List<ExpressionNode> expressions = new ArrayList<>();
        if (check(Symbol.RIGHT_PARENTHESIS)) {
            return expressions;
        }
        do {
            expressions.add(expression());
        } while (match(Symbol.COMMA));
        return expressions;
    }

    // endregion

    // region Token cursor

    private boolean match(Keyword keyword) {
        if (check(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean match(Symbol symbol) {
        if (check(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    private boolean check(Symbol symbol) {
        return peek().is(symbol);
    }

    /**
     * Checks the token after the current one without consuming anything.
     * @param symbol The symbol to check.
     * @return true if the next token is the given symbol.
     */
    private boolean checkNext(Symbol symbol) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).is(symbol);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(Keyword keyword) {
        if (check(keyword)) return advance();
        throw error("keyword '" + keyword.lexeme() + "'");
    }

    private Token consume(Symbol symbol) {
        if (check(symbol)) return advance();
        throw error("symbol '" + symbol.character() + "'");
    }

    private IdentifierNode identifier(String what) {
        if (check(TokenType.IDENTIFIER)) return new IdentifierNode(advance());
        throw error(what);
    }

    private ParseException error(String expected) {
        Token unexpected = peek();
        ParseException ex = new ParseException(expected, unexpected);
        diagnostics.reportError(CompilerErrorCode.SYNTAX_ERROR, ex.getMessage(), unexpected.fileName(), unexpected.line());
        return ex;
    }

    // endregion
}
