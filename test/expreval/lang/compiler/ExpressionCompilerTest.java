// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - entry point tests.
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

import java.io.File;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;
import org.objectweb.asm.MethodTooLargeException;

import expreval.lang.CompiledFunction;

public class ExpressionCompilerTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void evaluate() {
        ExpressionCompiler compiler = new ExpressionCompiler();
        assertEquals(14.0, compiler.evaluate("2+3*4"), 0.0);
        assertEquals(20.0, compiler.evaluate("(2+3)*4"), 0.0);
        assertEquals(512.0, compiler.evaluate("2^3^2"), 0.0);
        assertEquals(2.0, compiler.evaluate("-3+5"), 0.0);
        assertEquals(2.5, compiler.evaluate("10/4"), 0.0);
        assertEquals(2.0, compiler.evaluate("5%3"), 0.0);
        assertEquals(80.0, compiler.evaluate("  (2 + 3) * 4 ^ 2\n"), 0.0);
    }

    @Test
    public void compiledFunctionIsReusable() {
        CompiledFunction f = new ExpressionCompiler().compile("1.5 * 4");
        assertEquals(6.0, f.apply(), 0.0);
        assertEquals(6.0, f.apply(), 0.0);
    }

    @Test
    public void errorsPreventCompilation() {
        final List<Diagnostic> warned = new ArrayList<>();
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
                warned.add(diagnostic);
            }
        };
        try {
            compiler.compile("2 +");
            fail("expected CompileException");
        } catch (CompileException ex) {
            assertEquals("1:4: expected expression, found end of input",
                         ex.getMessage());
            assertEquals(1, ex.getLine());
            assertEquals(4, ex.getColumn());
            assertEquals(1, ex.getDiagnostics().size());
            assertEquals(ex.getDiagnostics().toList(), warned);
        }
    }

    @Test
    public void errorMessageCountsDiagnostics() {
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
            }
        };
        compiler.setSourceName("limits.expr");
        try {
            compiler.compile("1 @ + #");
            fail("expected CompileException");
        } catch (CompileException ex) {
            assertEquals(2, ex.getDiagnostics().size());
            assertEquals("limits.expr:1:3: invalid token '@' (and 1 more)",
                         ex.getMessage());
        }
    }

    @Test
    public void bestEffortCompilation() {
        ExpressionCompiler compiler = new ExpressionCompiler();
        DiagnosticBag diagnostics = new DiagnosticBag();
        Expression tree = compiler.parse("1 + @", diagnostics);
        assertEquals(1, diagnostics.size());
        assertEquals(1.0, compiler.compile(tree).apply(), 0.0);
    }

    @Test
    public void hugeIntegerLiteral() {
        assertEquals(1e20, new ExpressionCompiler()
                                .evaluate("99999999999999999999"), 0.0);
    }

    private static String repeat(String s, int n) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < n; ++i)
            buf.append(s);
        return buf.toString();
    }

    @Test
    public void longSum() {
        ExpressionCompiler compiler = new ExpressionCompiler();
        assertEquals(10000.0, compiler.evaluate("1" + repeat("+1", 9999)),
                     0.0);
        assertEquals(20001.0, compiler.evaluate("1" + repeat("+1", 20000)),
                     0.0);
    }

    @Test
    public void methodTooLarge() {
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
            }
        };
        try {
            compiler.compile("2" + repeat("+2", 20000));
            fail("expected CompileException");
        } catch (CompileException ex) {
            assertEquals(1, ex.getDiagnostics().size());
            assertEquals(Diagnostic.TOO_COMPLEX,
                         ex.getDiagnostics().get(0).getKey());
            assertEquals("1:1: expression is too complex", ex.getMessage());
            assertTrue(ex.getCause() instanceof MethodTooLargeException);
        }
    }

    @Test
    public void deepNesting() {
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
            }
        };
        try {
            compiler.compile(repeat("(", 10000) + "1" + repeat(")", 10000));
            fail("expected CompileException");
        } catch (CompileException ex) {
            assertEquals(1, ex.getDiagnostics().size());
            assertEquals(Diagnostic.TOO_COMPLEX,
                         ex.getDiagnostics().get(0).getKey());
        }
    }

    @Test
    public void identifiersEvaluateToZero() {
        assertEquals(1.0, new ExpressionCompiler().evaluate("x * 2 + 1"), 0.0);
    }

    @Test
    public void compileAll() {
        List<CompiledFunction> all =
            new ExpressionCompiler().compileAll("1+1; 2*3\n2^10\n");
        assertEquals(3, all.size());
        assertEquals(2.0, all.get(0).apply(), 0.0);
        assertEquals(6.0, all.get(1).apply(), 0.0);
        assertEquals(1024.0, all.get(2).apply(), 0.0);
    }

    @Test(expected = CompileException.class)
    public void compileAllRejectsAnyError() {
        ExpressionCompiler compiler = new ExpressionCompiler() {
            protected void warn(Diagnostic diagnostic) {
            }
        };
        compiler.compileAll("1+1\n2*\n3");
    }

    @Test
    public void compileReader() {
        CompiledFunction f = new ExpressionCompiler()
            .compile(new StringReader("(10 - 4) / 4"));
        assertEquals(1.5, f.apply(), 0.0);
    }

    @Test
    public void classDump() throws Exception {
        File dir = tmp.newFolder("classes");
        ExpressionCompiler compiler = new ExpressionCompiler();
        compiler.setClassDumpDir(dir.getPath());
        compiler.compile("1 + 2");
        File dumped = new File(dir, "expreval/eval/Expr1.class");
        assertTrue(dumped.isFile());
        assertTrue(dumped.length() > 0);
    }

    @Test
    public void printParseTree() {
        final List<String> logged = new ArrayList<>();
        Handler handler = new Handler() {
            public void publish(LogRecord record) {
                logged.add(record.getMessage());
            }

            public void flush() {
            }

            public void close() {
            }
        };
        Logger log = Logger.getLogger(ExpressionCompiler.class.getName());
        log.addHandler(handler);
        try {
            new ExpressionCompiler(ExpressionCompiler.CF_PRINT_PARSE_TREE)
                .compile("1 + 2 * x");
        } finally {
            log.removeHandler(handler);
        }
        assertTrue(logged.toString(), logged.contains("(+ 1 (* 2 x))"));
    }
}
