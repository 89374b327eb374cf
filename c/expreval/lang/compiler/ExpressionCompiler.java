// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - java-friendly entry point.
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
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.objectweb.asm.MethodTooLargeException;
import expreval.lang.CompiledFunction;

/**
 * Compiles arithmetic expressions into {@link CompiledFunction}s.
 *
 * <pre>
 * ExpressionCompiler compiler = new ExpressionCompiler();
 * CompiledFunction f = compiler.compile("(2+3)*4^2");
 * System.out.println(f.apply()); // 80.0
 * </pre>
 *
 * Sources with lexical or syntax errors are not compiled, a
 * {@link CompileException} carrying the diagnostics is thrown instead.
 * Callers wanting the best-effort tree anyway can use
 * {@link #parse(String, DiagnosticBag)} and {@link #compile(Expression)}.
 */
public class ExpressionCompiler {
    /** Log every parsed tree at INFO level. */
    public static final int CF_PRINT_PARSE_TREE = 2;

    private final static Logger LOG =
        Logger.getLogger(ExpressionCompiler.class.getName());
    private final CodeGenerator generator = new CodeGenerator();
    private final int flags;
    private String sourceName;

    public ExpressionCompiler() {
        this(0);
    }

    /**
     * @param flags combination of CF_* flags
     */
    public ExpressionCompiler(int flags) {
        this.flags = flags;
    }

    /**
     * Name used in error messages and in generated class files.
     */
    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
        generator.setSourceName(sourceName == null ? "<expr>" : sourceName);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Also writes generated classes as .class files under the given
     * directory. Null disables it.
     */
    public void setClassDumpDir(String dir) {
        generator.setCodeWriter(dir == null ? null : new ToFile(new File(dir)));
    }

    /**
     * Override to get the diagnostics of a failed compilation
     * before the {@link CompileException} is thrown.
     * Default implementation uses java.util.logging.
     *
     * @param diagnostic to log
     */
    protected void warn(Diagnostic diagnostic) {
        LOG.warning((sourceName == null ? "" : sourceName + ":")
                    + diagnostic);
    }

    private Parser parser(CharSource src, DiagnosticBag diagnostics) {
        return new Parser(new Lexer(src, diagnostics));
    }

    private void check(DiagnosticBag diagnostics) {
        if (diagnostics.isEmpty())
            return;
        for (Diagnostic d : diagnostics)
            warn(d);
        throw new CompileException(sourceName, diagnostics);
    }

    private void printTree(Expression tree) {
        if ((flags & CF_PRINT_PARSE_TREE) != 0)
            LOG.info(tree.toString());
    }

    /**
     * Parses a single expression, reporting errors into diagnostics.
     * Always returns a tree, possibly with {@link Expression.Invalid}
     * placeholders.
     */
    public Expression parse(String expression, DiagnosticBag diagnostics) {
        Expression tree =
            parser(CharSource.of(expression), diagnostics).parse();
        printTree(tree);
        return tree;
    }

    /**
     * Parses separated expressions (by ';' or line breaks).
     */
    public List<Expression> parseAll(String source,
                                     DiagnosticBag diagnostics) {
        List<Expression> trees =
            parser(CharSource.of(source), diagnostics).parseAll();
        for (Expression tree : trees)
            printTree(tree);
        return trees;
    }

    // code generation limits, reported like syntax errors
    private CompileException tooComplex(Expression tree, Throwable cause) {
        SourceLocation at =
            new SourceLocation(tree.getLine(), tree.getColumn());
        Diagnostic diagnostic = new Diagnostic(new SourceSpan(at, at),
                                               Diagnostic.TOO_COMPLEX);
        DiagnosticBag diagnostics = new DiagnosticBag();
        diagnostics.add(diagnostic);
        warn(diagnostic);
        CompileException ex = new CompileException(sourceName, diagnostics);
        ex.initCause(cause);
        return ex;
    }

    /**
     * Generates code for an already parsed tree, without looking
     * at any diagnostics.
     *
     * @throws CompileException when the tree is too large or too deep
     *         to be compiled into a single method
     */
    public CompiledFunction compile(Expression tree) {
        CompiledFunction f;
        try {
            f = generator.compile(tree);
        } catch (MethodTooLargeException ex) {
            throw tooComplex(tree, ex);
        } catch (StackOverflowError ex) {
            throw tooComplex(tree, ex);
        }
        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Compiled " + tree + " into " + f.getClass().getName());
        return f;
    }

    /**
     * @throws CompileException on lexical or syntax errors
     */
    public CompiledFunction compile(String expression) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        Expression tree = parse(expression, diagnostics);
        check(diagnostics);
        return compile(tree);
    }

    /**
     * Reads one expression from the reader, which is not closed.
     *
     * @throws CompileException on lexical or syntax errors
     * @throws java.io.UncheckedIOException when reading fails
     */
    public CompiledFunction compile(Reader source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        Expression tree = parser(CharSource.of(source), diagnostics).parse();
        printTree(tree);
        check(diagnostics);
        return compile(tree);
    }

    /**
     * Compiles every expression of a multi-expression source.
     * Nothing is compiled when any of them has errors.
     *
     * @throws CompileException on lexical or syntax errors
     */
    public List<CompiledFunction> compileAll(String source) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Expression> trees = parseAll(source, diagnostics);
        check(diagnostics);
        List<CompiledFunction> result = new ArrayList<>(trees.size());
        for (Expression tree : trees)
            result.add(compile(tree));
        return result;
    }

    /**
     * Compiles and applies the expression once.
     *
     * @throws CompileException on lexical or syntax errors
     */
    public double evaluate(String expression) {
        return compile(expression).apply();
    }
}
