package org.pycatalyst.compiler.frontend.lexer;

import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Besides the usual tokens it produces the layout tokens of an indentation-sensitive
 * language: {@link TokenType#NEWLINE} at the end of each logical line and
 * {@link TokenType#INDENT}/{@link TokenType#DEDENT} whenever the indentation changes.
 * Newlines inside brackets and after a backslash do not end the logical line.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=");

    private static final int TAB_SIZE = 8;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 0;
    private int current = 0;
    private int line = 1;
    private int column = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.indentStack.push(0);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                indentation();
                if (isAtEnd()) break;
                if (atLineStart) continue;
            }
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        if (!tokens.isEmpty() && lastType() != TokenType.NEWLINE && lastType() != TokenType.DEDENT) {
            addLayoutToken(TokenType.NEWLINE);
        }
        while (indentStack.size() > 1) {
            indentStack.pop();
            addLayoutToken(TokenType.DEDENT);
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, line, column, logicalFileName));
        return tokens;
    }

    private void indentation() {
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            char c = advance();
            width = c == '\t' ? (width / TAB_SIZE + 1) * TAB_SIZE : c == ' ' ? width + 1 : 0;
        }
        if (isAtEnd()) return;
        char c = peek();
        if (c == '#') {
            while (!isAtEnd() && peek() != '\n') advance();
        }
        if (isAtEnd()) return;
        if (peek() == '\r' || peek() == '\n') {
            if (peek() == '\r') advance();
            if (!isAtEnd() && peek() == '\n') {
                advance();
                newline();
            }
            return;
        }
        atLineStart = false;
        start = current;
        startLine = line;
        startColumn = column;
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addLayoutToken(TokenType.INDENT);
        } else if (width < top) {
            while (indentStack.size() > 1 && width < indentStack.peek()) {
                indentStack.pop();
                addLayoutToken(TokenType.DEDENT);
            }
            if (width != indentStack.peek()) {
                diagnostics.reportError("Unindent does not match any outer indentation level.", logicalFileName, line);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\f', '\r':
                break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '\\':
                if (peek() == '\r') advance();
                if (peek() == '\n') {
                    advance();
                    newline();
                } else {
                    diagnostics.reportError("Unexpected character after line continuation.", logicalFileName, line);
                }
                break;
            case '\n':
                if (bracketDepth == 0 && !tokens.isEmpty() && lastType() != TokenType.NEWLINE) {
                    tokens.add(new Token(TokenType.NEWLINE, "\n", null, startLine, startColumn, startLine, startColumn + 1, logicalFileName));
                }
                newline();
                if (bracketDepth == 0) {
                    atLineStart = true;
                }
                break;
            case '"', '\'':
                string("", c);
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    operator();
                }
                break;
        }
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && STRING_PREFIXES.contains(text.toLowerCase())) {
            string(text.toLowerCase(), advance());
            return;
        }
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER, null);
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0' && "xXoObB".indexOf(peek()) >= 0) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            while (isIdentifierPart(peek())) advance();
            String digits = source.substring(start + 2, current).replace("_", "");
            try {
                addToken(TokenType.NUMBER, integer(new BigInteger(digits, radix)));
            } catch (NumberFormatException e) {
                diagnostics.reportError("Invalid number literal: " + source.substring(start, current), logicalFileName, line);
            }
            return;
        }

        boolean floating = first == '.';
        digits();
        if (!floating && peek() == '.') {
            floating = true;
            advance();
            digits();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            floating = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            digits();
        }
        if (peek() == 'j' || peek() == 'J') {
            advance();
            diagnostics.reportError("Complex literals are not supported: " + source.substring(start, current), logicalFileName, line);
            return;
        }

        String text = source.substring(start, current).replace("_", "");
        try {
            if (floating) {
                addToken(TokenType.NUMBER, Double.parseDouble(text));
            } else {
                addToken(TokenType.NUMBER, integer(new BigInteger(text)));
            }
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number literal: " + source.substring(start, current), logicalFileName, line);
        }
    }

    /** Integers are unbounded; values that fit are kept as {@link Long}. */
    private static Object integer(BigInteger value) {
        return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
    }

    private void digits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    private void string(String prefix, char quote) {
        boolean raw = prefix.contains("r");
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                diagnostics.reportError("Unterminated string literal.", logicalFileName, startLine);
                return;
            }
            char c = advance();
            if (c == quote && (!triple || (peek() == quote && peekNext() == quote))) {
                if (triple) {
                    advance();
                    advance();
                }
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    diagnostics.reportError("Unterminated string literal.", logicalFileName, startLine);
                    newline();
                    atLineStart = bracketDepth == 0;
                    return;
                }
                newline();
                value.append('\n');
            } else if (c == '\\') {
                escape(value, raw);
            } else {
                value.append(c);
            }
        }
        addToken(TokenType.STRING, value.toString());
    }

    private void escape(StringBuilder value, boolean raw) {
        if (isAtEnd()) {
            value.append('\\');
            return;
        }
        char c = advance();
        if (c == '\n') {
            newline();
            if (raw) value.append("\\\n");
            return;
        }
        if (raw) {
            value.append('\\').append(c);
            return;
        }
        switch (c) {
            case '\\' -> value.append('\\');
            case '\'' -> value.append('\'');
            case '"' -> value.append('"');
            case 'a' -> value.append('\u0007');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'n' -> value.append('\n');
            case 'r' -> value.append('\r');
            case 't' -> value.append('\t');
            case 'v' -> value.append('\u000B');
            case 'x' -> value.appendCodePoint(hexEscape(2));
            case 'u' -> value.appendCodePoint(hexEscape(4));
            case 'U' -> value.appendCodePoint(hexEscape(8));
            default -> {
                if (c >= '0' && c <= '7') {
                    int code = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        code = code * 8 + (advance() - '0');
                    }
                    value.append((char) code);
                } else {
                    value.append('\\').append(c);
                }
            }
        }
    }

    private int hexEscape(int length) {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < length && Character.digit(peek(), 16) >= 0; i++) {
            digits.append(advance());
        }
        if (digits.length() != length) {
            diagnostics.reportError("Truncated escape sequence in string literal.", logicalFileName, line);
            return '?';
        }
        int codePoint = Integer.parseInt(digits.toString(), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            diagnostics.reportError("Invalid escape sequence in string literal.", logicalFileName, line);
            return '?';
        }
        return codePoint;
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, start)) {
                while (current < start + op.length()) advance();
                switch (op) {
                    case "(", "[", "{" -> bracketDepth++;
                    case ")", "]", "}" -> bracketDepth = Math.max(0, bracketDepth - 1);
                    default -> { }
                }
                addToken(TokenType.OPERATOR, null);
                return;
            }
        }
        diagnostics.reportError("Unexpected character: " + source.charAt(start), logicalFileName, line);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, line, column, logicalFileName));
    }

    private void addLayoutToken(TokenType type) {
        tokens.add(new Token(type, "", null, line, column, line, column, logicalFileName));
    }

    private TokenType lastType() {
        return tokens.get(tokens.size() - 1).type();
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private void newline() {
        line++;
        column = 0;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
