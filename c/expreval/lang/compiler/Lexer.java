// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - lexical analysis.
 *
 * Copyright (c) 2007-2013 Madis Janson
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package expreval.lang.compiler;

import java.util.HashMap;
import java.util.Map;

/**
 * Splits a character source into tokens, with one token of lookahead.
 * Lexical errors are reported into the diagnostics collector and
 * produce {@link TokenKind#INVALID} tokens, scanning never stops on them.
 */
public final class Lexer {
    static final int TAB_WIDTH = 4;

    // capitalized reserved word -> keyword kind
    private static final Map<String, TokenKind> RESERVED = new HashMap<>();

    static {
        TokenKind[] kinds = TokenKind.values();
        for (int i = 0; i < kinds.length; ++i) {
            if (kinds[i].isKeyword())
                RESERVED.put(capitalize(kinds[i].symbol()), kinds[i]);
        }
    }

    private final CharSource src;
    private final DiagnosticsCollector diagnostics;
    private int line = 1;
    private int column = 1;
    private int indentation;
    private boolean eol;
    private Token peeked;

    public Lexer(CharSource src, DiagnosticsCollector diagnostics) {
        this.src = src;
        this.diagnostics = diagnostics;
    }

    public Lexer(CharSequence text, DiagnosticsCollector diagnostics) {
        this(CharSource.of(text), diagnostics);
    }

    public DiagnosticsCollector getDiagnostics() {
        return diagnostics;
    }

    /** Line of the next unread character. */
    public int getLine() {
        return line;
    }

    /** Column of the next unread character. */
    public int getColumn() {
        return column;
    }

    /** Indentation width of the current line. */
    public int getIndentation() {
        return indentation;
    }

    /** Whether the next unread character is a line terminator. */
    public boolean isEndOfLine() {
        peekChar();
        return eol;
    }

    public boolean isAtEndOfInput() {
        return peek().getKind() == TokenKind.END_OF_FILE;
    }

    /**
     * Returns the next token without consuming it.
     * Repeated calls return the same token until {@link #read()}.
     */
    public Token peek() {
        if (peeked == null)
            peeked = scan();
        return peeked;
    }

    public Token read() {
        Token t = peeked;
        if (t == null)
            return scan();
        peeked = null;
        return t;
    }

    private int peekChar() {
        int c = src.peek();
        eol = c == '\n' || c == '\r';
        return c;
    }

    private int readChar() {
        int c = src.read();
        if (c != CharSource.EOF)
            ++column;
        return c;
    }

    private Token scan() {
        int c, line = this.line, col = column;
        if ((c = peekChar()) == CharSource.EOF)
            return new Token(TokenKind.END_OF_FILE, line, col, "");
        if (c == ' ' || c == '\t')
            return blanks(col == 1);
        if (Character.isLetter((char) c)) {
            StringBuilder buf = new StringBuilder();
            do {
                buf.append((char) readChar());
            } while ((c = peekChar()) != CharSource.EOF &&
                     Character.isLetterOrDigit((char) c));
            String s = buf.toString();
            TokenKind kind = RESERVED.get(capitalize(s));
            return new Token(kind == null ? TokenKind.IDENTIFIER : kind,
                             line, col, s);
        }
        if (c >= '0' && c <= '9') {
            StringBuilder buf = new StringBuilder();
            do {
                buf.append((char) readChar());
            } while ((c = peekChar()) >= '0' && c <= '9');
            return new Token(TokenKind.NUMBER, line, col, buf.toString());
        }
        readChar();
        switch (c) {
            case '+': return op(TokenKind.PLUS, line, col);
            case '-': return op(TokenKind.MINUS, line, col);
            case '*': return op(TokenKind.STAR, line, col);
            case '/': return op(TokenKind.SLASH, line, col);
            case '%': return op(TokenKind.PERCENT, line, col);
            case '^': return op(TokenKind.CARET, line, col);
            case ',': return op(TokenKind.COMMA, line, col);
            case '.': return op(TokenKind.PERIOD, line, col);
            case ';': return op(TokenKind.SEMICOLON, line, col);
            case ':': return op(TokenKind.COLON, line, col);
            case '(': return op(TokenKind.OPEN_PAREN, line, col);
            case ')': return op(TokenKind.CLOSE_PAREN, line, col);
            case '=':
                return op2('=', TokenKind.EQUAL, TokenKind.ASSIGN,
                           line, col);
            case '!':
                return op2('=', TokenKind.NOT_EQUAL, TokenKind.NEGATE,
                           line, col);
            case '<':
                return op2('=', TokenKind.LESS_OR_EQUAL, TokenKind.LESS,
                           line, col);
            case '>':
                return op2('=', TokenKind.GREATER_OR_EQUAL,
                           TokenKind.GREATER, line, col);
            case '&':
                // no single & operator
                return op2('&', TokenKind.AND, null, line, col);
            case '|':
                return op2('|', TokenKind.OR, null, line, col);
            case '\r':
                // \r\n or a lone \r
                if (peekChar() != '\n')
                    return newline(line, col, "\r");
                readChar();
                return newline(line, col, "\r\n");
            case '\n':
                return newline(line, col, "\n");
        }
        return invalid((char) c, line, col);
    }

    private Token newline(int line, int col, String text) {
        ++this.line;
        column = 1;
        indentation = 0;
        return new Token(TokenKind.NEWLINE, line, col, text);
    }

    // indentation run when at line start, plain whitespace otherwise
    private Token blanks(boolean lineStart) {
        int line = this.line, col = column, c;
        StringBuilder buf = new StringBuilder();
        while ((c = peekChar()) == ' ' || c == '\t') {
            buf.append((char) readChar());
            if (lineStart)
                indentation += c == '\t' ? TAB_WIDTH : 1;
        }
        return new Token(TokenKind.WHITESPACE, line, col, buf.toString());
    }

    private Token op(TokenKind kind, int line, int col) {
        return new Token(kind, line, col, kind.symbol());
    }

    private Token op2(char second, TokenKind kind2, TokenKind kind1,
                      int line, int col) {
        if (peekChar() == second) {
            readChar();
            return op(kind2, line, col);
        }
        if (kind1 == null)
            return invalid(kind2.symbol().charAt(0), line, col);
        return op(kind1, line, col);
    }

    private Token invalid(char c, int line, int col) {
        diagnostics.add(new Diagnostic(new SourceSpan(
                new SourceLocation(line, col),
                new SourceLocation(this.line, column)),
            Diagnostic.INVALID_TOKEN, String.valueOf(c)));
        return new Token(TokenKind.INVALID, line, col, String.valueOf(c));
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
