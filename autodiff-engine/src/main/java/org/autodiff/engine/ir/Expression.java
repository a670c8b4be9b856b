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

package org.autodiff.engine.ir;

import org.autodiff.engine.Environment;
import org.autodiff.engine.visitors.ExpressionVisitor;
import org.autodiff.util.ICastable;
import org.autodiff.util.ToIndentableString;

import java.util.List;

/** A node of the expression DAG.
 *
 * <p>There are exactly three kinds of expressions: {@link Variable}, {@link Constant} and
 * {@link Application}.  Expressions are immutable and are only created by an {@link Environment},
 * which guarantees that structurally equal expressions are the same Java object.
 * Consequently, expressions are always compared using reference equality. */
public interface Expression extends ICastable, ToIndentableString {
    /** The environment which owns this expression. */
    Environment getEnvironment();

    /** Maximum variable index appearing in this expression, 0 if there is none.
     * This is the number of formal arguments needed to substitute the expression. */
    int nvars();

    /** Category of the expression in the canonical order of arguments. */
    ExpressionOrder.Category category();

    default int childCount() {
        return 0;
    }

    default List<Expression> children() {
        return List.of();
    }

    /** Number of distinct operator applications in the DAG rooted at this expression. */
    default int cost() {
        return 0;
    }

    /** Memoized derivatives of this expression. */
    DerivativeCache derivatives();

    void accept(ExpressionVisitor visitor);

    /** True if this is a constant with the specified value. */
    default boolean isConstant(double value) {
        Constant constant = this.as(Constant.class);
        return constant != null && constant.value == value;
    }

    default Expression add(Expression other) {
        return this.getEnvironment().add(this, other);
    }

    default Expression add(double other) {
        return this.add(this.getEnvironment().constant(other));
    }

    default Expression sub(Expression other) {
        return this.getEnvironment().sub(this, other);
    }

    default Expression sub(double other) {
        return this.sub(this.getEnvironment().constant(other));
    }

    default Expression mul(Expression other) {
        return this.getEnvironment().mul(this, other);
    }

    default Expression mul(double other) {
        return this.mul(this.getEnvironment().constant(other));
    }

    default Expression div(Expression other) {
        return this.getEnvironment().div(this, other);
    }

    default Expression div(double other) {
        return this.div(this.getEnvironment().constant(other));
    }

    default Expression neg() {
        return this.getEnvironment().neg(this);
    }

    /** Derivative of this expression with respect to a variable. */
    default Expression derivative(Expression variable) {
        return this.getEnvironment().derivative(this, variable);
    }

    /** Render the expression, sharing repeated subexpressions. */
    default String render() {
        return this.getEnvironment().render(List.of(this));
    }
}
