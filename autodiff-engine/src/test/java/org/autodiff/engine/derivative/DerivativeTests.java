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

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.FiniteDifferencesDifferentiator;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.TypeError;
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.INumericEvaluator;
import org.autodiff.engine.ir.operator.Primitives;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.function.Function;

public class DerivativeTests {
    final Environment env = new Environment();
    final Variable x = this.env.variable(1);
    final Variable y = this.env.variable(2);

    Expression sin(Expression e) {
        return this.env.apply(Primitives.SIN, e);
    }

    Expression cos(Expression e) {
        return this.env.apply(Primitives.COS, e);
    }

    /** Derivative of a function of one variable at a point, computed by finite differences. */
    static double numeric(UnivariateFunction function, double point) {
        FiniteDifferencesDifferentiator differentiator = new FiniteDifferencesDifferentiator(7, 1.0e-3);
        UnivariateDifferentiableFunction derivative = differentiator.differentiate(function);
        return derivative.value(new DerivativeStructure(1, 1, 0, point)).getPartialDerivative(1);
    }

    void checkAgainstFiniteDifferences(Expression expression, double... points) {
        Expression derivative = this.env.derivative(expression, this.x);
        for (double point: points) {
            double expected = numeric(v -> this.env.evaluate(expression, v), point);
            double actual = this.env.evaluate(derivative, point);
            Assert.assertEquals("d/dx " + expression + " at " + point,
                    expected, actual, 1.0e-6 * Math.max(1, Math.abs(expected)));
        }
    }

    @Test
    public void symbolic() {
        Assert.assertSame(this.y, this.env.derivative(this.x.mul(this.y), this.x));
        Assert.assertSame(this.x, this.env.derivative(this.x.mul(this.y), this.y));
        Assert.assertTrue(this.env.derivative(this.x.add(this.y), this.x).isConstant(1));
        Assert.assertSame(this.cos(this.x), this.env.derivative(this.sin(this.x), this.x));
        Assert.assertSame(this.x.add(this.x), this.env.derivative(this.x.mul(this.x), this.x));
        Assert.assertTrue(this.env.derivative(this.x, this.x).isConstant(1));
        Assert.assertTrue(this.env.derivative(this.y, this.x).isConstant(0));
        Assert.assertTrue(this.env.derivative(this.env.constant(3), this.x).isConstant(0));
        Assert.assertTrue(this.env.derivative(this.sin(this.y), this.x).isConstant(0));
    }

    @Test
    public void chainRule() {
        // d/dx sin(x * y) = y * cos(x * y)
        Expression xy = this.x.mul(this.y);
        Assert.assertSame(this.y.mul(this.cos(xy)), this.env.derivative(this.sin(xy), this.x));
    }

    @Test
    public void memoization() {
        Expression e = this.sin(this.x.mul(this.x)).add(this.x);
        Expression first = this.env.derivative(e, this.x);
        int count = this.env.applicationCount();
        Expression second = this.env.derivative(e, this.x);
        Assert.assertSame(first, second);
        Assert.assertEquals(count, this.env.applicationCount());
        Assert.assertSame(first, e.derivatives().get(this.x));
        Assert.assertEquals(1, e.derivatives().size());
    }

    @Test
    public void finiteDifferences() {
        Expression one = this.env.constant(1);
        Expression e = this.sin(this.x).mul(this.env.apply(Primitives.EXP, this.x))
                .add(this.x.mul(this.x).div(one.add(this.x.mul(this.x))))
                .add(this.env.apply(Primitives.POW, this.x, this.env.constant(3)))
                .add(this.env.apply(Primitives.TANH, this.x).mul(this.env.apply(Primitives.SQRT, this.x)))
                .add(this.env.apply(Primitives.LOG, this.x))
                .sub(this.env.apply(Primitives.TAN, this.x.div(4)));
        this.checkAgainstFiniteDifferences(e, 0.5, 1.3, 2.0);
    }

    @Test
    public void power() {
        // Both arguments depend on x
        Expression e = this.env.apply(Primitives.POW, this.x, this.cos(this.x).add(2));
        this.checkAgainstFiniteDifferences(e, 0.7, 1.5);
        Expression abs = this.env.apply(Primitives.ABS, this.x.sub(1)).mul(this.x);
        this.checkAgainstFiniteDifferences(abs, -0.5, 2.5);
    }

    @Test
    public void gradient() {
        Expression e = this.x.mul(this.y).add(this.sin(this.x.mul(this.y))).add(this.x.div(this.y));
        List<Expression> gradient = this.env.gradient(e);
        Assert.assertEquals(2, gradient.size());
        double px = 0.8;
        double py = 1.7;
        Function<double[], Double> f = p -> this.env.evaluate(e, p);
        double dx = numeric(v -> f.apply(new double[] { v, py }), px);
        double dy = numeric(v -> f.apply(new double[] { px, v }), py);
        Assert.assertEquals(dx, this.env.evaluate(gradient.get(0), px, py), 1.0e-6);
        Assert.assertEquals(dy, this.env.evaluate(gradient.get(1), px, py), 1.0e-6);
    }

    @Test
    public void higherOrder() {
        Expression sin = this.sin(this.x);
        Assert.assertSame(sin, this.env.derivative(sin, this.x, 0));
        Assert.assertSame(sin.neg(), this.env.derivative(sin, this.x, 2));
        Assert.assertSame(this.cos(this.x).neg(), this.env.derivative(sin, this.x, 3));
        Expression cube = this.env.apply(Primitives.POW, this.x, this.env.constant(3));
        Assert.assertEquals(6 * 1.5, this.env.evaluate(this.env.derivative(cube, this.x, 2), 1.5), 1.0e-9);
    }

    @Test
    public void userDefinedOperator() {
        Variable v1 = this.env.variable(1);
        this.env.define("square", 1, INumericEvaluator.unary(v -> v * v), v1.mul(2));
        Expression e = this.env.apply("square", this.sin(this.x));
        Assert.assertEquals(Math.pow(Math.sin(0.3), 2), this.env.evaluate(e, 0.3), 1.0e-12);
        this.checkAgainstFiniteDifferences(e, 0.3, 1.1);
    }

    @Test
    public void nonVariable() {
        Assert.assertThrows(TypeError.class, () -> this.env.derivative(this.x.mul(this.y), this.x.add(this.y)));
        Assert.assertThrows(TypeError.class, () -> this.env.derivative(this.x, this.env.constant(1)));
        Environment other = new Environment();
        Assert.assertThrows(TypeError.class, () -> this.env.derivative(this.x, other.variable(1)));
    }

    @Test
    public void missingTemplates() {
        this.env.registry.declare("opaque", 1, false, false);
        Expression e = this.env.apply("opaque", this.x);
        Assert.assertThrows(UnimplementedException.class, () -> this.env.derivative(e, this.x));
        Assert.assertThrows(UnimplementedException.class, () -> this.env.evaluate(e, 1.0));
    }
}
