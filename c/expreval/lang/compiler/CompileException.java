// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - compilation errors.
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
 * Thrown by {@link ExpressionCompiler} when the source had lexical
 * or syntax errors. All collected diagnostics are available through
 * {@link #getDiagnostics()}, the message describes the first one.
 */
public class CompileException extends RuntimeException {
    String fn;
    int line;
    int col;
    String what;
    private final DiagnosticBag diagnostics;

    public CompileException(String fn, DiagnosticBag diagnostics) {
        this.fn = fn;
        this.diagnostics = diagnostics;
        if (diagnostics.isEmpty()) {
            what = "compilation failed";
        } else {
            Diagnostic first = diagnostics.get(0);
            line = first.getSpan().getStart().getLine();
            col = first.getSpan().getStart().getColumn();
            what = first.getMessage();
            if (diagnostics.size() > 1)
                what += " (and " + (diagnostics.size() - 1) + " more)";
        }
    }

    public DiagnosticBag getDiagnostics() {
        return diagnostics;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return col;
    }

    public String getMessage() {
        return (fn == null ? "" : fn + ":") +
               (line == 0 ? "" : line + (col > 0 ? ":" + col + ": " : ": ")) +
               what;
    }
}
