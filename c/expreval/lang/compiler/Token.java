// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - lexical token.
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

/**
 * Immutable lexical unit. Positions are 1-based and {@code length}
 * is always the length of {@code text}.
 */
public final class Token {
    private final TokenKind kind;
    private final int line;
    private final int column;
    private final String text;

    public Token(TokenKind kind, int line, int column, String text) {
        if (kind == null || text == null)
            throw new IllegalArgumentException("Token(" + kind + ", " + line
                        + ", " + column + ", " + text + ")");
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.text = text;
    }

    public TokenKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getLength() {
        return text.length();
    }

    public String getText() {
        return text;
    }

    public SourceSpan span() {
        return new SourceSpan(new SourceLocation(line, column),
                              new SourceLocation(line, column + text.length()));
    }

    /** Human readable form used in diagnostics. */
    String describe() {
        switch (kind) {
            case END_OF_FILE: return "end of input";
            case NEWLINE: return "end of line";
        }
        return '\'' + text + '\'';
    }

    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        Token t = (Token) o;
        return kind == t.kind && line == t.line && column == t.column &&
               text.equals(t.text);
    }

    public int hashCode() {
        return ((kind.hashCode() * 31 + line) * 31 + column) * 31
                + text.hashCode();
    }

    public String toString() {
        return kind + "@" + line + ":" + column + (kind == TokenKind.NEWLINE
                ? "" : " `" + text + '\'');
    }
}
