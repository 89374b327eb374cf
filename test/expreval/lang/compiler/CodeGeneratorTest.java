// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - bytecode generator tests.
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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import expreval.lang.CompiledFunction;

public class CodeGeneratorTest {
    private CodeGenerator generator;

    @Before
    public void setUp() {
        generator = new CodeGenerator();
    }

    private double run(String src) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        Expression tree = new Parser(new Lexer(src, diagnostics)).parse();
        assertTrue(diagnostics.toString(), diagnostics.isEmpty());
        return generator.compile(tree).apply();
    }

    private static Token token(TokenKind kind, String text) {
        return new Token(kind, 1, 1, text);
    }

    private static Expression integer(long v) {
        return new Expression.IntegerLiteral(
                    token(TokenKind.NUMBER, String.valueOf(v)), v);
    }

    private static Expression real(double v) {
        return new Expression.RealLiteral(
                    token(TokenKind.NUMBER, String.valueOf(v)), v);
    }

    @Test
    public void arithmetic() {
        assertEquals(14.0, run("2+3*4"), 0.0);
        assertEquals(20.0, run("(2+3)*4"), 0.0);
        assertEquals(512.0, run("2^3^2"), 0.0);
        assertEquals(2.0, run("-3+5"), 0.0);
        assertEquals(2.5, run("10/4"), 0.0);
        assertEquals(2.0, run("5%3"), 0.0);
        assertEquals(4.0, run("-2^2"), 0.0);
        assertEquals(0.5, run("2^-1"), 0.0);
        assertEquals(-1.5, run("+-1.5"), 0.0);
    }

    @Test
    public void matchesJavaFloatingPoint() {
        assertEquals(7.0 - 2.0 * 3.0 % 4.0 + Math.pow(2.0, 0.5),
                     run("7 - 2 * 3 % 4 + 2 ^ .5"), 0.0);
        assertEquals((1.1 + 2.2) * 3.3 / -4.4,
                     run("(1.1 + 2.2) * 3.3 / -4.4"), 0.0);
        assertEquals(-7.5 % 2.0, run("-7.5 % 2"), 0.0);
        assertEquals(Math.pow(Math.pow(2.0, 0.5), 3.0),
                     run("(2 ^ 0.5) ^ 3"), 0.0);
    }

    @Test
    public void floatingPointDivision() {
        assertEquals(Double.POSITIVE_INFINITY, run("1/0"), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, run("-1/0"), 0.0);
        assertTrue(Double.isNaN(run("0/0")));
        assertTrue(Double.isNaN(run("5%0")));
    }

    @Test
    public void integerConstants() {
        long[] values = { 0, 1, -1, 5, 6, 127, 128, -128, -129, 32767,
                          32768, -32769, Integer.MAX_VALUE, Integer.MIN_VALUE,
                          Integer.MAX_VALUE + 1L, 10000000000L,
                          Long.MAX_VALUE };
        for (int i = 0; i < values.length; ++i) {
            assertEquals(String.valueOf(values[i]), (double) values[i],
                         generator.compile(integer(values[i])).apply(), 0.0);
        }
    }

    @Test
    public void realConstants() {
        assertEquals(0.0, generator.compile(real(0.0)).apply(), 0.0);
        assertEquals(1.0, generator.compile(real(1.0)).apply(), 0.0);
        assertEquals(0.1, generator.compile(real(0.1)).apply(), 0.0);
        double negZero = generator.compile(real(-0.0)).apply();
        assertEquals(Double.NEGATIVE_INFINITY, 1.0 / negZero, 0.0);
    }

    @Test
    public void identifiersAreZero() {
        assertEquals(0.0, run("x"), 0.0);
        assertEquals(1.0, run("width * 2 + 1"), 0.0);
    }

    @Test
    public void invalidNodesAreZero() {
        Expression tree = new Expression.Binary(integer(3),
                token(TokenKind.PLUS, "+"),
                new Expression.Invalid(token(TokenKind.INVALID, "@")));
        assertEquals(3.0, generator.compile(tree).apply(), 0.0);
    }

    @Test
    public void unsupportedBinaryOperator() {
        Expression tree = new Expression.Binary(integer(1),
                new Token(TokenKind.EQUAL, 1, 3, "=="), integer(1));
        try {
            generator.compile(tree);
            fail("expected IllegalStateException");
        } catch (IllegalStateException ex) {
            assertEquals("Operation not supported: EQUAL at 1:3",
                         ex.getMessage());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void unsupportedUnaryOperator() {
        generator.compile(new Expression.Unary(
                token(TokenKind.NEGATE, "!"), integer(1)));
    }

    @Test
    public void repeatedInvocation() {
        CompiledFunction f = generator.compile(
            new Parser(new Lexer("3.7 ^ 1.3 % 2", new DiagnosticBag())).parse());
        double first = f.apply();
        for (int i = 0; i < 1000; ++i)
            assertEquals(first, f.apply(), 0.0);
        assertEquals(first, f.getAsDouble(), 0.0);
    }

    @Test
    public void concurrentInvocation() throws Exception {
        final CompiledFunction f = generator.compile(
            new Parser(new Lexer("(1 + 2) * 3 ^ 2", new DiagnosticBag())).parse());
        final List<Throwable> failures = new ArrayList<>();
        Thread[] threads = new Thread[4];
        for (int i = 0; i < threads.length; ++i) {
            threads[i] = new Thread() {
                public void run() {
                    for (int j = 0; j < 10000; ++j) {
                        if (f.apply() != 27.0) {
                            synchronized (failures) {
                                failures.add(new AssertionError(j));
                            }
                            return;
                        }
                    }
                }
            };
            threads[i].start();
        }
        for (int i = 0; i < threads.length; ++i)
            threads[i].join();
        assertTrue(failures.isEmpty());
    }

    @Test
    public void everyCompileDefinesNewClass() {
        CompiledFunction a = generator.compile(integer(1));
        CompiledFunction b = generator.compile(integer(1));
        assertNotSame(a.getClass(), b.getClass());
        assertEquals("expreval.eval.Expr1", a.getClass().getName());
        assertEquals("expreval.eval.Expr2", b.getClass().getName());
    }

    @Test
    public void everyClassHasItsOwnLoader() {
        ClassLoader parent = CodeGenerator.class.getClassLoader();
        List<ClassLoader> loaders = new ArrayList<>();
        for (int i = 0; i < 1000; ++i) {
            ClassLoader loader =
                generator.compile(integer(i)).getClass().getClassLoader();
            assertTrue(loader instanceof FunctionLoader);
            assertSame(parent, loader.getParent());
            loaders.add(loader);
        }
        assertEquals(1000, new HashSet<>(loaders).size());
    }

    @Test
    public void generatorKeepsNoFunctions() throws Exception {
        WeakReference<CompiledFunction> ref =
            new WeakReference<>(generator.compile(integer(7)));
        for (int i = 0; i < 50 && ref.get() != null; ++i) {
            System.gc();
            Thread.sleep(10);
        }
        assertNull(ref.get());
    }

    private static Expression sum(int terms) {
        Expression e = integer(1);
        for (int i = 1; i < terms; ++i)
            e = new Expression.Binary(e, token(TokenKind.PLUS, "+"),
                                      integer(1));
        return e;
    }

    @Test
    public void longLeftChain() {
        assertEquals(10000.0, generator.compile(sum(10000)).apply(), 0.0);
        assertEquals(9.0, run("20" + repeat(" - 1", 11)), 0.0);
    }

    private static String repeat(String s, int n) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < n; ++i)
            buf.append(s);
        return buf.toString();
    }

    @Test
    public void codeWriterReceivesClasses() {
        final List<String> names = new ArrayList<>();
        generator.setCodeWriter(new CodeWriter() {
            public void writeClass(String name, byte[] code) {
                names.add(name);
                assertTrue(code.length > 0);
            }
        });
        generator.compile(integer(2));
        assertEquals(1, names.size());
        assertEquals("expreval/eval/Expr1.class", names.get(0));
    }
}
