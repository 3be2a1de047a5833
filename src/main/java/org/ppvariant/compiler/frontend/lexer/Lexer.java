package org.ppvariant.compiler.frontend.lexer;

import org.ppvariant.compiler.diagnostics.DiagnosticsEngine;
import org.ppvariant.compiler.model.Token;
import org.ppvariant.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns Verilog-style source text into tokens. Only the conditional and definition
 * directives are given their own token types; everything else is classified coarsely
 * into identifiers, numbers, strings, macro calls and symbols.
 * <p>
 * Problems are reported to the {@link DiagnosticsEngine} and scanning continues.
 */
public class Lexer {

    private static final String[] MULTI_CHAR_SYMBOLS = {
            "===", "!==", "<<<", ">>>",
            "==", "!=", "<=", ">=", "&&", "||", "<<", ">>", "::", "->", "**", "+:", "-:"
    };

    private final String source;
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a lexer for an unnamed source.
     * @param source The source text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, "", diagnostics);
    }

    /**
     * @param source The source text.
     * @param fileName The file name recorded in each token.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, String fileName, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The tokens in source order; comments and whitespace are dropped.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            markStart();
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n', '\f' -> { }
            case '`' -> scanBacktick();
            case '"' -> scanString();
            case '/' -> {
                if (match('/')) {
                    skipLineComment();
                } else if (match('*')) {
                    skipBlockComment();
                } else {
                    addToken(TokenType.SYMBOL);
                }
            }
            default -> {
                if (isDigit(c) || (c == '\'' && isBaseChar(peek()))) {
                    scanNumber();
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                    addToken(TokenType.IDENTIFIER);
                } else {
                    scanSymbol();
                }
            }
        }
    }

    private void scanBacktick() {
        if (!isIdentifierStart(peek())) {
            diagnostics.reportWarning("Stray '`' without a directive or macro name", fileName, line);
            addToken(TokenType.SYMBOL);
            return;
        }
        scanIdentifier();
        String name = source.substring(start + 1, current);
        switch (name) {
            case "ifdef" -> directiveWithMacroName(TokenType.PP_IFDEF);
            case "ifndef" -> directiveWithMacroName(TokenType.PP_IFNDEF);
            case "elsif" -> directiveWithMacroName(TokenType.PP_ELSIF);
            case "else" -> addToken(TokenType.PP_ELSE);
            case "endif" -> addToken(TokenType.PP_ENDIF);
            case "define" -> scanDefine();
            default -> addToken(TokenType.MACRO_CALL);
        }
    }

    private void directiveWithMacroName(TokenType type) {
        addToken(type);
        String directive = source.substring(start, current);
        skipWhitespace();
        markStart();
        if (isIdentifierStart(peek())) {
            advance();
            scanIdentifier();
            addToken(TokenType.PP_IDENTIFIER);
        } else {
            diagnostics.reportError("Expected macro name after '" + directive + "'", fileName, line);
        }
    }

    private void scanDefine() {
        addToken(TokenType.PP_DEFINE);
        skipHorizontalWhitespace();
        markStart();
        if (!isIdentifierStart(peek())) {
            diagnostics.reportError("Expected macro name after '`define'", fileName, line);
            return;
        }
        advance();
        scanIdentifier();
        addToken(TokenType.PP_IDENTIFIER);

        skipHorizontalWhitespace();
        markStart();
        StringBuilder body = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == '\\' && (peek() == '\n' || (peek() == '\r' && peekNext() == '\n'))) {
                if (peek() == '\r') advance();
                advance();
                body.append('\n');
            } else if (c != '\r') {
                body.append(c);
            }
        }
        String text = body.toString().strip();
        if (!text.isEmpty()) {
            tokens.add(new Token(TokenType.PP_DEFINE_BODY, text, startLine, startColumn, fileName));
        }
    }

    private void scanString() {
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            if (peek() == '\\' && peekNext() != '\0') advance();
            advance();
        }
        if (isAtEnd() || peek() == '\n') {
            diagnostics.reportError("Unterminated string", fileName, startLine);
            addToken(TokenType.STRING);
            return;
        }
        advance();
        addToken(TokenType.STRING);
    }

    private void scanNumber() {
        while (isDigit(peek()) || peek() == '_') advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        // Sized or based literal such as 8'hFF or 'b1010.
        if (peek() == '\'' && (isBaseChar(peekNext()) || isSignedBase())) {
            advance();
        }
        if (source.charAt(current - 1) == '\'') {
            if (peek() == 's' || peek() == 'S') advance();
            if (isBaseChar(peek())) advance();
            while (isHexDigit(peek()) || "xXzZ?_".indexOf(peek()) >= 0) advance();
        }
        addToken(TokenType.NUMBER);
    }

    private boolean isSignedBase() {
        if (current + 2 >= source.length()) return false;
        char s = source.charAt(current + 1);
        return (s == 's' || s == 'S') && isBaseChar(source.charAt(current + 2));
    }

    private void scanIdentifier() {
        while (isIdentifierPart(peek())) advance();
    }

    private void scanSymbol() {
        for (String symbol : MULTI_CHAR_SYMBOLS) {
            if (source.startsWith(symbol, start)) {
                for (int i = 1; i < symbol.length(); i++) advance();
                break;
            }
        }
        addToken(TokenType.SYMBOL);
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipBlockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        diagnostics.reportError("Unterminated block comment", fileName, startLine);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private void skipHorizontalWhitespace() {
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) advance();
    }

    // --- Character navigation ---

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), startLine, startColumn, fileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isBaseChar(char c) {
        return "bBoOdDhH".indexOf(c) >= 0;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
