// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler java bytecode generator.
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import expreval.lang.CompiledFunction;

final class Ctx implements Opcodes {
    final ClassWriter cw;
    private MethodVisitor m;
    private int lastLine;

    Ctx(ClassWriter cw) {
        this.cw = cw;
    }

    Ctx newMethod(int flags, String name, String type) {
        Ctx ctx = new Ctx(cw);
        ctx.m = cw.visitMethod(flags, name, type, null, null);
        ctx.m.visitCode();
        return ctx;
    }

    void closeMethod() {
        m.visitMaxs(0, 0);
        m.visitEnd();
    }

    // public no-arg constructor chaining to the parent's
    void createInit(String parent) {
        Ctx init = newMethod(ACC_PUBLIC, "<init>", "()V");
        init.m.visitVarInsn(ALOAD, 0);
        init.methodInsn(INVOKESPECIAL, parent, "<init>", "()V");
        init.insn(RETURN);
        init.closeMethod();
    }

    void insn(int opcode) {
        m.visitInsn(opcode);
    }

    void doubleConst(double v) {
        // -0.0 must not become DCONST_0
        if (Double.doubleToRawLongBits(v) == 0L) {
            insn(DCONST_0);
        } else if (v == 1.0) {
            insn(DCONST_1);
        } else {
            m.visitLdcInsn(Double.valueOf(v));
        }
    }

    void methodInsn(int opcode, String owner, String name, String desc) {
        m.visitMethodInsn(opcode, owner, name, desc, false);
    }

    void visitLine(int line) {
        if (line != 0 && lastLine != line) {
            Label label = new Label();
            m.visitLabel(label);
            m.visitLineNumber(line, label);
            lastLine = line;
        }
    }
}

// Defines a single generated class. The class and its loader become
// unreachable together with the last reference to the function.
final class FunctionLoader extends ClassLoader {
    FunctionLoader(ClassLoader parent) {
        super(parent);
    }

    Class<?> define(String name, byte[] code) {
        return defineClass(name, code, 0, code.length);
    }
}

/**
 * Translates expression trees into JVM classes extending
 * {@link CompiledFunction}. Every class is defined in its own
 * class loader, so the generator keeps no reference to the
 * functions it has produced.
 * Not thread-safe; the produced functions are.
 */
public final class CodeGenerator implements Opcodes {
    static final String FUN_CLASS = "expreval/lang/CompiledFunction";
    static final String CLASS_PREFIX = "expreval/eval/Expr";

    private final ClassLoader parent = CodeGenerator.class.getClassLoader();
    private CodeWriter writer;
    private String sourceName = "<expr>";
    private int classCounter;

    /** Source file name recorded into generated classes. */
    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    /** Additional receiver of the generated class files, may be null. */
    public void setCodeWriter(CodeWriter writer) {
        this.writer = writer;
    }

    /**
     * Generates, loads and instantiates the class for the tree.
     *
     * @throws org.objectweb.asm.MethodTooLargeException when the
     *         code does not fit into a single JVM method
     */
    public CompiledFunction compile(Expression expression) {
        String className = CLASS_PREFIX + ++classCounter;
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        cw.visit(V1_8, ACC_PUBLIC | ACC_FINAL | ACC_SUPER | ACC_SYNTHETIC,
                 className, null, FUN_CLASS, null);
        cw.visitSource(sourceName, null);
        Ctx ctx = new Ctx(cw);
        ctx.createInit(FUN_CLASS);
        Ctx m = ctx.newMethod(ACC_PUBLIC | ACC_FINAL, "apply", "()D");
        expression.accept(new Gen(m));
        m.insn(DRETURN);
        m.closeMethod();
        cw.visitEnd();

        byte[] code = cw.toByteArray();
        if (writer != null) {
            String name = className + ".class";
            try {
                writer.writeClass(name, code);
            } catch (IOException ex) {
                throw new UncheckedIOException(name + ": " + ex.getMessage(),
                                               ex);
            }
        }
        String javaName = className.replace('/', '.');
        try {
            return (CompiledFunction) new FunctionLoader(parent)
                .define(javaName, code)
                .getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException("Cannot instantiate generated "
                        + javaName, ex);
        }
    }

    static IllegalStateException unsupported(Token op) {
        return new IllegalStateException("Operation not supported: "
                    + op.getKind() + " at " + op.getLine() + ':'
                    + op.getColumn());
    }

    // post-order walk leaving one double on the stack per node
    private static final class Gen implements Expression.Visitor {
        private final Ctx ctx;

        Gen(Ctx ctx) {
            this.ctx = ctx;
        }

        public void visitIdentifier(Expression.Identifier e) {
            // no bindings yet, every name is 0
            ctx.doubleConst(0.0);
        }

        public void visitIntegerLiteral(Expression.IntegerLiteral e) {
            // same rounding as L2D at run time
            ctx.doubleConst((double) e.getValue());
        }

        public void visitRealLiteral(Expression.RealLiteral e) {
            ctx.doubleConst(e.getValue());
        }

        public void visitParenthesized(Expression.Parenthesized e) {
            e.getInner().accept(this);
        }

        public void visitBinary(Expression.Binary e) {
            // left-associative chains are walked without recursion
            List<Expression.Binary> chain = new ArrayList<>();
            Expression left = e;
            do {
                Expression.Binary b = (Expression.Binary) left;
                chain.add(b);
                left = b.getLeft();
            } while (left instanceof Expression.Binary);
            left.accept(this);
            for (int i = chain.size(); --i >= 0;) {
                Expression.Binary b = chain.get(i);
                b.getRight().accept(this);
                binaryOp(b.getOperator());
            }
        }

        private void binaryOp(Token op) {
            ctx.visitLine(op.getLine());
            switch (op.getKind()) {
                case PLUS:    ctx.insn(DADD); break;
                case MINUS:   ctx.insn(DSUB); break;
                case STAR:    ctx.insn(DMUL); break;
                case SLASH:   ctx.insn(DDIV); break;
                case PERCENT: ctx.insn(DREM); break;
                case CARET:
                    ctx.methodInsn(INVOKESTATIC, "java/lang/Math",
                                   "pow", "(DD)D");
                    break;
                default:
                    throw unsupported(op);
            }
        }

        public void visitUnary(Expression.Unary e) {
            e.getOperand().accept(this);
            Token op = e.getOperator();
            switch (op.getKind()) {
                case MINUS:
                    ctx.visitLine(op.getLine());
                    ctx.insn(DNEG);
                    break;
                case PLUS: // identity
                    break;
                default:
                    throw unsupported(op);
            }
        }

        public void visitInvalid(Expression.Invalid e) {
            ctx.doubleConst(0.0);
        }
    }
}
