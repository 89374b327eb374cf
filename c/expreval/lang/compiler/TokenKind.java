// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - token kinds.
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

public enum TokenKind {
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    CARET("^"),
    ASSIGN("="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    NEGATE("!"),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    AND("&&"),
    OR("||"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    COMMA(","),
    PERIOD("."),
    SEMICOLON(";"),
    COLON(":"),

    NUMBER(null),
    IDENTIFIER(null),

    LET_KEYWORD("let"),
    IN_KEYWORD("in"),
    IF_KEYWORD("if"),
    THEN_KEYWORD("then"),
    ELSE_KEYWORD("else"),

    WHITESPACE(null),
    NEWLINE(null),
    END_OF_FILE(null),
    INVALID(null);

    private final String symbol;

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Fixed source text of this kind, or null when tokens
     * of this kind have variable text.
     */
    public String symbol() {
        return symbol;
    }

    public boolean isKeyword() {
        return name().endsWith("_KEYWORD");
    }

    /** Whitespace, indentation and line breaks. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE;
    }
}
