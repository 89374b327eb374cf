// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - syntax analysis.
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

import java.util.ArrayList;
import java.util.List;

/*
   Syntax.

expr:    <term> { ('+' | '-') <term> }
term:    <power> { ('*' | '/' | '%') <power> }
power:   <unary> [ '^' <power> ]
unary:   ('+' | '-') <unary> | <primary>
primary: <number> | <identifier> | '(' <expr> ')'
number:  digits [ '.' [ digits ] ] | '.' digits

Expressions are separated by ';' or line breaks outside of parentheses.
*/

/**
 * Recursive descent parser building {@link Expression} trees from
 * the lexer's token stream. Syntax errors are reported into the
 * lexer's diagnostics collector and replaced by
 * {@link Expression.Invalid} nodes, so parsing always yields a tree.
 */
public final class Parser {
    private static final int ADD_LEVEL = 1;
    private static final int MUL_LEVEL = 2;
    private static final int POW_LEVEL = 3;

    /** Deepest accepted nesting of subexpressions. */
    static final int MAX_NESTING = 500;

    private final Lexer lexer;
    private final DiagnosticsCollector diagnostics;
    private int depth; // open parentheses
    private int nesting;

    // unwinds the descent when MAX_NESTING is exceeded
    private static final class TooComplex extends RuntimeException {
        final Token at;

        TooComplex(Token at) {
            super(null, null, false, false);
            this.at = at;
        }
    }

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        this.diagnostics = lexer.getDiagnostics();
    }

    private static int opLevel(TokenKind kind) {
        switch (kind) {
            case PLUS: case MINUS:
                return ADD_LEVEL;
            case STAR: case SLASH: case PERCENT:
                return MUL_LEVEL;
            case CARET:
                return POW_LEVEL;
        }
        return -1;
    }

    private static boolean isSeparator(TokenKind kind) {
        return kind == TokenKind.SEMICOLON || kind == TokenKind.NEWLINE ||
               kind == TokenKind.END_OF_FILE;
    }

    private void error(Token at, String key, Object... args) {
        diagnostics.add(new Diagnostic(at.span(), key, args));
    }

    // next significant token
    private Token fetch() {
        for (;;) {
            Token t = lexer.peek();
            if (t.getKind() == TokenKind.WHITESPACE ||
                    t.getKind() == TokenKind.NEWLINE && depth > 0) {
                lexer.read();
            } else {
                return t;
            }
        }
    }

    public boolean isAtEnd() {
        return fetch().getKind() == TokenKind.END_OF_FILE;
    }

    /**
     * Parses one expression and the separator following it.
     * Trailing garbage before the separator is reported and skipped.
     */
    public Expression parseExpression() {
        depth = 0;
        nesting = 0;
        Token first = fetch();
        Expression e;
        try {
            e = parseBinary(ADD_LEVEL);
        } catch (TooComplex ex) {
            error(ex.at, Diagnostic.TOO_COMPLEX);
            depth = 0;
            while (!isSeparator(lexer.peek().getKind()))
                lexer.read();
            e = new Expression.Invalid(first);
        }
        Token t = fetch();
        if (!isSeparator(t.getKind())) {
            error(t, Diagnostic.UNEXPECTED_TOKEN, t.describe());
            while (!isSeparator(lexer.peek().getKind()))
                lexer.read();
        }
        if (lexer.peek().getKind() != TokenKind.END_OF_FILE)
            lexer.read();
        return e;
    }

    /**
     * Parses the whole input as a single expression,
     * optionally followed by separators.
     */
    public Expression parse() {
        Expression e = parseExpression();
        for (Token t; (t = fetch()).getKind() != TokenKind.END_OF_FILE;) {
            if (t.getKind() == TokenKind.SEMICOLON ||
                    t.getKind() == TokenKind.NEWLINE) {
                lexer.read();
            } else {
                error(t, Diagnostic.UNEXPECTED_TOKEN, t.describe());
                while (!lexer.isAtEndOfInput())
                    lexer.read();
            }
        }
        return e;
    }

    /**
     * Parses all expressions until the end of input.
     * Empty statements are skipped.
     */
    public List<Expression> parseAll() {
        List<Expression> result = new ArrayList<>();
        for (;;) {
            TokenKind kind = fetch().getKind();
            if (kind == TokenKind.END_OF_FILE)
                return result;
            if (kind == TokenKind.SEMICOLON || kind == TokenKind.NEWLINE)
                lexer.read();
            else
                result.add(parseExpression());
        }
    }

    private void enter(Token at) {
        if (++nesting > MAX_NESTING)
            throw new TooComplex(at);
    }

    private Expression parseBinary(int minLevel) {
        enter(fetch());
        try {
            Expression left = parseUnary();
            for (;;) {
                Token op = fetch();
                // lexer has already reported these
                while (op.getKind() == TokenKind.INVALID) {
                    lexer.read();
                    op = fetch();
                }
                int level = opLevel(op.getKind());
                if (level < minLevel)
                    return left;
                lexer.read();
                Expression right =
                    parseBinary(level == POW_LEVEL ? level : level + 1);
                left = new Expression.Binary(left, op, right);
            }
        } finally {
            --nesting;
        }
    }

    private Expression parseUnary() {
        Token t = fetch();
        if (t.getKind() != TokenKind.PLUS && t.getKind() != TokenKind.MINUS)
            return parsePrimary();
        lexer.read();
        enter(t);
        try {
            return new Expression.Unary(t, parseUnary());
        } finally {
            --nesting;
        }
    }

    private Expression parsePrimary() {
        Token t = fetch();
        switch (t.getKind()) {
            case NUMBER:
                lexer.read();
                return number(t);
            case IDENTIFIER:
                lexer.read();
                return new Expression.Identifier(t);
            case INVALID:
                lexer.read();
                return new Expression.Invalid(t);
            case OPEN_PAREN:
                lexer.read();
                ++depth;
                Expression inner = parseBinary(ADD_LEVEL);
                Token close = fetch();
                if (close.getKind() == TokenKind.CLOSE_PAREN)
                    lexer.read();
                else
                    error(close, Diagnostic.EXPECTED_TOKEN, ")",
                          close.describe());
                --depth;
                return new Expression.Parenthesized(t, inner);
            case PERIOD:
                lexer.read();
                if (adjacent(t, lexer.peek(), TokenKind.NUMBER)) {
                    Token digits = lexer.read();
                    return real(t, "0." + digits.getText());
                }
                break;
            case CLOSE_PAREN:
            case SEMICOLON:
            case NEWLINE:
            case END_OF_FILE:
                error(t, Diagnostic.EXPECTED_EXPRESSION, t.describe());
                return new Expression.Invalid(t);
            default:
                lexer.read();
        }
        error(t, Diagnostic.EXPECTED_EXPRESSION, t.describe());
        return new Expression.Invalid(t);
    }

    private static boolean adjacent(Token a, Token b, TokenKind kind) {
        return b.getKind() == kind && a.getLine() == b.getLine() &&
               a.getColumn() + a.getLength() == b.getColumn();
    }

    // lexer gives only digit runs, the decimal point is glued here
    private Expression number(Token t) {
        String s = t.getText();
        if (adjacent(t, lexer.peek(), TokenKind.PERIOD)) {
            Token point = lexer.read();
            s += '.';
            if (adjacent(point, lexer.peek(), TokenKind.NUMBER))
                s += lexer.read().getText();
            return real(t, s);
        }
        try {
            return new Expression.IntegerLiteral(t, Long.parseLong(s));
        } catch (NumberFormatException ex) {
            // beyond long range, approximate as double
            return real(t, s);
        }
    }

    private static Expression real(Token t, String s) {
        return new Expression.RealLiteral(t, Double.parseDouble(s));
    }
}
