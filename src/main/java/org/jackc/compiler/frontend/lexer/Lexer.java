package org.jackc.compiler.frontend.lexer;

import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * Whitespace and comments are dropped; the stream always ends with one
 * {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    /** The largest integer constant the target machine can push. */
    public static final int MAX_INTEGER_CONSTANT = 32767;

    private final SourceText source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int startColumn = 1;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(new SourceText("<memory>", source), diagnostics);
    }

    /**
     * Creates a new Lexer over an owned source buffer.
     * @param source The source buffer, including its logical file name.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(SourceText source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, source, current, current, null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            case '"':
                string();
                break;
            case '/':
                if (peek() == '/') {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (peek() == '*') {
                    blockComment();
                } else {
                    addToken(TokenType.SYMBOL, Symbol.SLASH);
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    Symbol.fromChar(c).ifPresentOrElse(
                            symbol -> addToken(TokenType.SYMBOL, symbol),
                            () -> diagnostics.reportError(CompilerErrorCode.UNEXPECTED_CHARACTER,
                                    "Unexpected character: " + c, source.fileName(), line));
                }
                break;
        }
    }

    private void blockComment() {
        advance(); // the '*'
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newLine();
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        Keyword.fromLexeme(source.slice(start, current)).ifPresentOrElse(
                keyword -> addToken(TokenType.KEYWORD, keyword),
                () -> addToken(TokenType.IDENTIFIER, null));
    }

    private void number() {
        while (isDigit(peek())) advance();

        String numberString = source.slice(start, current);
        try {
            int value = Integer.parseInt(numberString);
            if (value > MAX_INTEGER_CONSTANT) {
                throw new NumberFormatException(numberString);
            }
            addToken(TokenType.INTEGER_CONSTANT, value);
        } catch (NumberFormatException e) {
            diagnostics.reportError(CompilerErrorCode.INTEGER_OUT_OF_RANGE,
                    "Integer constant out of range 0.." + MAX_INTEGER_CONSTANT + ": " + numberString,
                    source.fileName(), line);
        }
    }

    private void string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }

        if (peek() != '"') {
            diagnostics.reportError(CompilerErrorCode.UNTERMINATED_STRING,
                    "Unterminated string.", source.fileName(), line);
            return;
        }

        // The closing "
        advance();

        // The lexeme keeps its quotes, the value is the content only.
        String value = source.slice(start + 1, current - 1);
        addToken(TokenType.STRING_CONSTANT, value);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source, start, current, value, line, startColumn));
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private char advance() {
        column++;
        return source.content().charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.content().charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.content().charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
