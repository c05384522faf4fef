package org.jackc.compiler.frontend.lexer;

import org.jackc.compiler.api.CompilerErrorCode;
import org.jackc.compiler.diagnostics.Diagnostic;
import org.jackc.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is turned into keyword, symbol, constant and
 * identifier tokens, that comments are dropped and that lexical errors are reported.
 */
public class LexerTest {

    private static List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(new SourceText("Test.jack", source), diagnostics).scanTokens();
    }

    /**
     * Verifies the token types, lexemes and values of a small statement.
     */
    @Test
    @Tag("unit")
    void testLetStatementTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("let x = a[1] + \"hi\";", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.SYMBOL, TokenType.IDENTIFIER,
                TokenType.SYMBOL, TokenType.INTEGER_CONSTANT, TokenType.SYMBOL, TokenType.SYMBOL,
                TokenType.STRING_CONSTANT, TokenType.SYMBOL, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo(Keyword.LET);
        assertThat(tokens.get(1)).extracting(Token::text, Token::value).containsExactly("x", null);
        assertThat(tokens.get(1)).extracting(Token::start, Token::end).containsExactly(4, 5);
        assertThat(tokens.get(4).value()).isEqualTo(Symbol.LEFT_SQUARE_BRACKET);
        assertThat(tokens.get(5).value()).isEqualTo(1);
        assertThat(tokens.get(8)).extracting(Token::text, Token::value).containsExactly("\"hi\"", "hi");
    }

    /**
     * Verifies that line comments, block comments and doc comments are skipped
     * while line numbers keep counting through them.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkippedAndLinesCounted() {
        // Arrange
        String source = String.join("\n",
                "// header",
                "/** doc",
                "  comment */ class",
                "/* x */ Main");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan(source, diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(0)).extracting(Token::value, Token::line).containsExactly(Keyword.CLASS, 3);
        assertThat(tokens.get(1)).extracting(Token::text, Token::line, Token::column).containsExactly("Main", 4, 9);
    }

    /**
     * Verifies that a division symbol is not mistaken for a comment.
     */
    @Test
    @Tag("unit")
    void testSlashIsSymbol() {
        List<Token> tokens = scan("a/b", new DiagnosticsEngine());

        assertThat(tokens.get(1).is(Symbol.SLASH)).isTrue();
        assertThat(tokens).hasSize(4);
    }

    /**
     * Verifies that every keyword is recognized and that a word merely starting with a keyword is an identifier.
     */
    @Test
    @Tag("unit")
    void testKeywordsAndIdentifiers() {
        // Arrange
        StringBuilder source = new StringBuilder();
        for (Keyword keyword : Keyword.values()) {
            source.append(keyword.lexeme()).append(' ');
        }
        source.append("classy _tmp $x x1");

        // Act
        List<Token> tokens = scan(source.toString(), new DiagnosticsEngine());

        // Assert
        int n = Keyword.values().length;
        assertThat(n).isEqualTo(21);
        for (int i = 0; i < n; i++) {
            assertThat(tokens.get(i).value()).isEqualTo(Keyword.values()[i]);
        }
        assertThat(tokens.subList(n, n + 4)).extracting(Token::type).containsOnly(TokenType.IDENTIFIER);
        assertThat(tokens.subList(n, n + 4)).extracting(Token::text).containsExactly("classy", "_tmp", "$x", "x1");
    }

    /**
     * Verifies the upper bound of integer constants.
     */
    @Test
    @Tag("unit")
    void testIntegerRange() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("32767 32768", diagnostics);

        // Assert
        assertThat(tokens.get(0).value()).isEqualTo(Lexer.MAX_INTEGER_CONSTANT);
        assertThat(diagnostics.getDiagnostics(Diagnostic.Type.ERROR))
                .extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.INTEGER_OUT_OF_RANGE);
    }

    /**
     * Verifies that a string is not allowed to span lines.
     */
    @Test
    @Tag("unit")
    void testUnterminatedString() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("\"abc\nlet", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::lineNumber)
                .containsExactly(CompilerErrorCode.UNTERMINATED_STRING, 1);
        assertThat(tokens).extracting(Token::type).contains(TokenType.KEYWORD);
    }

    /**
     * Verifies that scanning continues after an unexpected character so all errors of a file are reported.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharactersAreAllReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("x # y\n@", diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::code, Diagnostic::lineNumber)
                .containsExactly(
                        tuple(CompilerErrorCode.UNEXPECTED_CHARACTER, 1),
                        tuple(CompilerErrorCode.UNEXPECTED_CHARACTER, 2));
        assertThat(tokens).extracting(Token::text).containsExactly("x", "y", "<eof>");
    }

    /**
     * Verifies that the token stream of empty input holds only the end marker.
     */
    @Test
    @Tag("unit")
    void testEmptyInput() {
        List<Token> tokens = scan("  \n\t ", new DiagnosticsEngine());

        assertThat(tokens).singleElement().extracting(Token::type).isEqualTo(TokenType.END_OF_FILE);
    }
}
