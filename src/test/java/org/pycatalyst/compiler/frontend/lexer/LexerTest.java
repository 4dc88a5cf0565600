package org.pycatalyst.compiler.frontend.lexer;

import org.pycatalyst.compiler.diagnostics.Diagnostic;
import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts script source into a token stream,
 * including the layout tokens that stand for line ends and indentation changes.
 */
public class LexerTest {

    /**
     * Verifies the token stream of a small block, including NEWLINE, INDENT and DEDENT.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        String source = String.join("\n",
                "x = 10",
                "if x > 3:",
                "    y = 2.5",
                "");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.OPERATOR, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.END_OF_FILE);
        assertThat(tokens.get(2)).extracting(Token::text, Token::value).containsExactly("10", 10L);
        assertThat(tokens.get(4)).extracting(Token::text).isEqualTo("if");
        assertThat(tokens.get(13)).extracting(Token::value).isEqualTo(2.5);
    }

    /**
     * Verifies line and column positions; columns are 0-based and the end column is exclusive.
     */
    @Test
    @Tag("unit")
    void testTokenPositions() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("\nx = 10\n", diagnostics, "demo.py").scanTokens();

        Token number = tokens.get(2);
        assertThat(number).extracting(Token::line, Token::column, Token::endLine, Token::endColumn)
                .containsExactly(2, 4, 2, 6);
        assertThat(number.fileName()).isEqualTo("demo.py");
    }

    @Test
    @Tag("unit")
    void testNewlinesInsideBracketsDoNotEndTheLine() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("a = [1,\n     2]\n", diagnostics).scanTokens();

        assertThat(tokens).extracting(Token::text)
                .containsExactly("a", "=", "[", "1", ",", "2", "]", "\n", "");
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).isEmpty();
    }

    /**
     * Comment-only lines produce no tokens, and trailing comments are dropped.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkipped() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("# header\nx = 1  # trailing\n", diagnostics).scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).line()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testStringLiterals() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("s = 'a\\tb'\nt = \"\"\"one\ntwo\"\"\"\n", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "a\tb");
        Token triple = tokens.get(6);
        assertThat(triple.value()).isEqualTo("one\ntwo");
        assertThat(triple.line()).isEqualTo(2);
        assertThat(triple.endLine()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testNumberLiterals() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("0x1F 1_000 1e3 .5\n", diagnostics).scanTokens();

        assertThat(tokens).extracting(Token::value).startsWith(31L, 1000L, 1000.0, 0.5);
    }

    @Test
    @Tag("unit")
    void testIntegersBeyondLongAreKept() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("9223372036854775807 99999999999999999999 0xFFFFFFFFFFFFFFFFFF\n", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::value).startsWith(
                Long.MAX_VALUE,
                new BigInteger("99999999999999999999"),
                new BigInteger("FFFFFFFFFFFFFFFFFF", 16));
    }

    /**
     * Verifies that lexical problems are reported as errors instead of being thrown.
     */
    @Test
    @Tag("unit")
    void testErrorsAreReported() {
        DiagnosticsEngine unexpected = new DiagnosticsEngine();
        new Lexer("x = $\n", unexpected).scanTokens();

        DiagnosticsEngine unterminated = new DiagnosticsEngine();
        new Lexer("s = 'abc\n", unterminated).scanTokens();

        DiagnosticsEngine dedent = new DiagnosticsEngine();
        new Lexer("if x:\n    y = 1\n  z = 2\n", dedent).scanTokens();

        assertThat(unexpected.ofType(Diagnostic.Type.ERROR)).extracting(Diagnostic::message)
                .containsExactly("Unexpected character: $");
        assertThat(unterminated.ofType(Diagnostic.Type.ERROR)).extracting(Diagnostic::message)
                .containsExactly("Unterminated string literal.");
        assertThat(dedent.ofType(Diagnostic.Type.ERROR)).extracting(Diagnostic::message, Diagnostic::lineNumber)
                .containsExactly(tuple("Unindent does not match any outer indentation level.", 3));
    }
}
