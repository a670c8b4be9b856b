/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.autodiff.engine.ir.operator;

import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.errors.InternalEngineError;
import org.autodiff.engine.ir.Expression;

import javax.annotation.Nullable;
import java.util.List;

/** A named primitive operator.
 * Operators are created by the {@link OperatorRegistry} the first time they are referenced;
 * their properties are filled in when they are declared and defined.
 * Operators are compared by reference. */
public final class Operator {
    /** How an application of the operator is printed. */
    public enum Syntax {
        /** name(arg,arg) */
        CALL,
        /** left symbol right */
        INFIX,
        /** symbol arg */
        PREFIX
    }

    /** Precedence of expressions that never need parentheses. */
    public static final int ATOM = Integer.MAX_VALUE;
    /** Precedence required in positions where any expression can appear without parentheses. */
    public static final int ANY = 0;

    public final String name;
    /** Number of arguments; null if the operator accepts any number of arguments. */
    @Nullable
    private Integer arity;
    private boolean commutative;
    private boolean associative;
    private Syntax syntax = Syntax.CALL;
    private String symbol;
    private int precedence = ATOM;
    @Nullable
    private INumericEvaluator evaluator;
    /** Derivative templates, one per argument, written over the variables 1..arity. */
    @Nullable
    private List<Expression> derivatives;

    Operator(String name) {
        this.name = name;
        this.symbol = name;
    }

    @Nullable
    public Integer getArity() {
        return this.arity;
    }

    public boolean isCommutative() {
        return this.commutative;
    }

    public boolean isAssociative() {
        return this.associative;
    }

    public Syntax getSyntax() {
        return this.syntax;
    }

    public String getSymbol() {
        return this.symbol;
    }

    /** Precedence of an application of this operator when printed. */
    public int getPrecedence() {
        return this.syntax == Syntax.CALL ? ATOM : this.precedence;
    }

    /** Precedence required of the argument with the specified index. */
    public int requiredPrecedence(int argument) {
        return switch (this.syntax) {
            case CALL -> ANY;
            case PREFIX -> this.precedence;
            case INFIX -> argument == 0 || this.associative ? this.precedence : this.precedence + 1;
        };
    }

    @Nullable
    public INumericEvaluator getEvaluator() {
        return this.evaluator;
    }

    @Nullable
    public List<Expression> getDerivatives() {
        return this.derivatives;
    }

    public boolean isDefined() {
        return this.derivatives != null;
    }

    /** Check that an application with the specified number of arguments is legal. */
    public void checkArity(int argumentCount) {
        if (this.arity != null && this.arity != argumentCount)
            throw ArityError.argumentCount(this.name, this.arity, argumentCount);
    }

    void setArity(int arity) {
        if (this.arity != null && this.arity != arity)
            throw new ArityError("Operator " + this.name + " already declared with " + this.arity +
                    " argument(s), cannot redeclare with " + arity);
        this.arity = arity;
    }

    void setCommutative(boolean commutative) {
        this.commutative = commutative;
    }

    void setAssociative(boolean associative) {
        this.associative = associative;
    }

    void setSyntax(Syntax syntax, String symbol, int precedence) {
        this.syntax = syntax;
        this.symbol = symbol;
        this.precedence = precedence;
    }

    void setEvaluator(@Nullable INumericEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    void setDerivatives(List<Expression> derivatives) {
        if (this.derivatives != null)
            throw new InternalEngineError("Operator " + this.name + " is already defined");
        this.derivatives = List.copyOf(derivatives);
    }

    @Override
    public String toString() {
        return this.name;
    }
}
