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

package org.autodiff.engine.visitors;

import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.util.Linq;
import org.autodiff.util.Logger;

import java.util.List;

/** Substitutes the formal variables 1..n of an expression with a list of actual arguments.
 * Every rebuilt application goes through the canonicalizer, so the result is canonical. */
public class Rename extends TranslateVisitor<Expression> {
    final List<Expression> arguments;

    public Rename(Environment environment, List<Expression> arguments) {
        super(environment);
        this.arguments = arguments;
    }

    @Override
    public void postorder(Variable node) {
        if (node.index > this.arguments.size())
            throw new ArityError("Expression refers to variable " + node + " but only " +
                    this.arguments.size() + " argument(s) were supplied");
        this.set(node, this.arguments.get(node.index - 1));
    }

    @Override
    public void postorder(Constant node) {
        this.set(node, node);
    }

    @Override
    public void postorder(Application node) {
        List<Expression> arguments = Linq.map(node.arguments, this::get);
        Expression result = this.environment.apply(node.operator, arguments);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Rename ")
                .appendSupplier(node::toString)
                .append(" to ")
                .appendSupplier(result::toString)
                .newline();
        this.set(node, result);
    }
}
