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
import org.autodiff.engine.visitors.VisitDecision;
import org.autodiff.util.IIndentStream;

/** The p-th free input of an expression, p &gt;= 1. */
public final class Variable implements Expression {
    public final int index;
    final Environment environment;
    final DerivativeCache derivatives;

    Variable(Environment environment, int index) {
        this.environment = environment;
        this.index = index;
        this.derivatives = new DerivativeCache();
    }

    @Override
    public Environment getEnvironment() {
        return this.environment;
    }

    @Override
    public int nvars() {
        return this.index;
    }

    @Override
    public ExpressionOrder.Category category() {
        return ExpressionOrder.Category.VARIABLE;
    }

    @Override
    public DerivativeCache derivatives() {
        return this.derivatives;
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("v").append(this.index);
    }

    @Override
    public String toString() {
        return "v" + this.index;
    }
}
