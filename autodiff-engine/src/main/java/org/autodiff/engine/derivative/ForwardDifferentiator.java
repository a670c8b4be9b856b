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

package org.autodiff.engine.derivative;

import org.autodiff.engine.Environment;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Logger;

import javax.annotation.Nullable;

/** Forward-mode differentiation by the chain rule.
 * The derivative of op(a1, ..., an) is the sum over i of da_i * partial_i,
 * where partial_i is the operator's derivative template instantiated on the arguments.
 * Results are memoized on each expression, so shared subexpressions are differentiated once. */
public class ForwardDifferentiator implements IDifferentiator, IWritesLogs {
    final Environment environment;

    public ForwardDifferentiator(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Expression derivative(Expression expression, Variable variable) {
        Expression cached = expression.derivatives().get(variable);
        if (cached != null)
            return cached;

        Expression result;
        if (expression.is(Variable.class)) {
            result = this.environment.constant(expression == variable ? 1 : 0);
        } else if (expression.is(Constant.class)) {
            result = this.environment.constant(0);
        } else {
            result = this.chainRule(expression.to(Application.class), variable);
        }
        Logger.INSTANCE.belowLevel(this, 3)
                .append("d/d")
                .append(variable.toString())
                .append(" ")
                .appendSupplier(expression::toString)
                .append(" = ")
                .appendSupplier(result::toString)
                .newline();
        return expression.derivatives().put(variable, result);
    }

    Expression chainRule(Application application, Variable variable) {
        @Nullable Expression sum = null;
        for (int i = 0; i < application.childCount(); i++) {
            Expression argument = application.argument(i);
            // Arguments which cannot contain the variable have a zero derivative
            if (argument.nvars() < variable.index)
                continue;
            Expression derivative = this.derivative(argument, variable);
            if (derivative.isConstant(0))
                continue;
            Expression term = this.environment.mul(derivative, application.partial(i));
            sum = sum == null ? term : this.environment.add(sum, term);
        }
        return sum == null ? this.environment.constant(0) : sum;
    }
}
