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
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.INumericEvaluator;

/** Computes the numeric value of an expression for given values of its variables.
 * Variable p takes the value at index p-1. */
public class Evaluate extends TranslateVisitor<Double> {
    final double[] values;

    public Evaluate(Environment environment, double... values) {
        super(environment);
        this.values = values;
    }

    @Override
    public void postorder(Variable node) {
        if (node.index > this.values.length)
            throw new ArityError("No value supplied for variable " + node +
                    "; only " + this.values.length + " value(s) given");
        this.set(node, this.values[node.index - 1]);
    }

    @Override
    public void postorder(Constant node) {
        this.set(node, node.value);
    }

    @Override
    public void postorder(Application node) {
        INumericEvaluator evaluator = node.operator.getEvaluator();
        if (evaluator == null)
            throw new UnimplementedException("Operator " + node.operator.name + " cannot be evaluated");
        double[] arguments = new double[node.arguments.size()];
        for (int i = 0; i < arguments.length; i++)
            arguments[i] = this.get(node.arguments.get(i));
        this.set(node, evaluator.evaluate(arguments));
    }
}
