// ex: se sts=4 sw=4 expandtab:

/*
 * Expression compiler - expression tree.
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
 * Immutable expression tree node. The set of node kinds is closed,
 * every kind has its own {@link Visitor} method.
 */
public abstract class Expression {
    final int line;
    final int col;

    private Expression(int line, int col) {
        this.line = line;
        this.col = col;
    }

    private Expression(Token first) {
        this(first.getLine(), first.getColumn());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return col;
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {
        void visitIdentifier(Identifier e);
        void visitIntegerLiteral(IntegerLiteral e);
        void visitRealLiteral(RealLiteral e);
        void visitParenthesized(Parenthesized e);
        void visitBinary(Binary e);
        void visitUnary(Unary e);
        void visitInvalid(Invalid e);
    }

    public static final class Identifier extends Expression {
        private final String name;

        public Identifier(Token token) {
            super(token);
            name = token.getText();
        }

        public String getName() {
            return name;
        }

        public void accept(Visitor visitor) {
            visitor.visitIdentifier(this);
        }

        public String toString() {
            return name;
        }
    }

    public static final class IntegerLiteral extends Expression {
        private final long value;

        public IntegerLiteral(Token token, long value) {
            super(token);
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        public void accept(Visitor visitor) {
            visitor.visitIntegerLiteral(this);
        }

        public String toString() {
            return Long.toString(value);
        }
    }

    public static final class RealLiteral extends Expression {
        private final double value;

        public RealLiteral(Token token, double value) {
            super(token);
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        public void accept(Visitor visitor) {
            visitor.visitRealLiteral(this);
        }

        public String toString() {
            return Double.toString(value);
        }
    }

    public static final class Parenthesized extends Expression {
        private final Expression inner;

        public Parenthesized(Token open, Expression inner) {
            super(open);
            this.inner = inner;
        }

        public Expression getInner() {
            return inner;
        }

        public void accept(Visitor visitor) {
            visitor.visitParenthesized(this);
        }

        public String toString() {
            return "(`paren " + inner + ')';
        }
    }

    public static final class Binary extends Expression {
        private final Expression left;
        private final Token operator;
        private final Expression right;

        public Binary(Expression left, Token operator, Expression right) {
            super(left.line, left.col);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public Expression getLeft() {
            return left;
        }

        public Token getOperator() {
            return operator;
        }

        public Expression getRight() {
            return right;
        }

        public void accept(Visitor visitor) {
            visitor.visitBinary(this);
        }

        public String toString() {
            return "(" + operator.getText() + ' ' + left + ' ' + right + ')';
        }
    }

    public static final class Unary extends Expression {
        private final Token operator;
        private final Expression operand;

        public Unary(Token operator, Expression operand) {
            super(operator);
            this.operator = operator;
            this.operand = operand;
        }

        public Token getOperator() {
            return operator;
        }

        public Expression getOperand() {
            return operand;
        }

        public void accept(Visitor visitor) {
            visitor.visitUnary(this);
        }

        public String toString() {
            return "(" + operator.getText() + ' ' + operand + ')';
        }
    }

    /**
     * Placeholder for an operand that could not be parsed.
     * Trees containing these come with at least one diagnostic.
     */
    public static final class Invalid extends Expression {
        private final Token token;

        public Invalid(Token token) {
            super(token);
            this.token = token;
        }

        public Token getToken() {
            return token;
        }

        public void accept(Visitor visitor) {
            visitor.visitInvalid(this);
        }

        public String toString() {
            return "`invalid";
        }
    }
}
