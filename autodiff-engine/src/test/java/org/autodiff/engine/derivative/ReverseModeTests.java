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

import org.autodiff.engine.EngineOptions;
import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.GraphConsistencyError;
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.Primitives;
import org.autodiff.util.graph.Dominators;
import org.junit.Assert;
import org.junit.Test;

import java.util.function.Function;

public class ReverseModeTests {
    static Environment reverseEnvironment() {
        EngineOptions options = new EngineOptions();
        options.reverseMode = true;
        return new Environment(options);
    }

    /** Builds the same function in an environment. */
    static Expression sample(Environment env) {
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Expression xy = x.mul(y);
        Expression s = env.apply(Primitives.SIN, xy);
        return s.mul(s).add(xy.div(env.apply(Primitives.EXP, x))).sub(env.apply(Primitives.LOG, y.add(x.mul(x))));
    }

    @Test
    public void selectsStrategy() {
        Assert.assertTrue(reverseEnvironment().getDifferentiator() instanceof ReverseModeDifferentiator);
        Assert.assertTrue(new Environment().getDifferentiator() instanceof ForwardDifferentiator);
    }

    @Test
    public void agreesWithForwardMode() {
        Environment reverse = reverseEnvironment();
        Environment forward = new Environment();
        Expression r = sample(reverse);
        Expression f = sample(forward);
        double[][] points = { { 0.5, 1.5 }, { 1.2, 0.3 }, { -0.7, 2.0 } };
        for (int v = 1; v <= 2; v++) {
            Expression dr = reverse.derivative(r, reverse.variable(v));
            Expression df = forward.derivative(f, forward.variable(v));
            for (double[] point: points)
                Assert.assertEquals(forward.evaluate(df, point), reverse.evaluate(dr, point), 1.0e-9);
        }
    }

    @Test
    public void sameExpressionAsForwardMode() {
        Environment env = reverseEnvironment();
        ForwardDifferentiator forward = new ForwardDifferentiator(env);
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Function<Expression, Expression> check = e -> {
            Expression reverse = env.derivative(e, x);
            Assert.assertSame(reverse, forward.derivative(e, x));
            return reverse;
        };
        Assert.assertSame(y, check.apply(x.mul(y)));
        check.apply(env.apply(Primitives.SIN, x.mul(y)));
        check.apply(x.mul(x).add(y));
        Assert.assertTrue(check.apply(y.mul(y)).isConstant(0));
    }

    @Test
    public void dominators() {
        Environment env = reverseEnvironment();
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Expression xy = x.mul(y);
        Expression e = env.apply(Primitives.SIN, xy);
        ReverseModeDifferentiator differentiator = (ReverseModeDifferentiator) env.getDifferentiator();
        differentiator.derivative(e, x);
        Dominators<Expression> dominators = differentiator.getLastDominators();
        Assert.assertNotNull(dominators);
        Assert.assertSame(e, dominators.immediateDominator(e));
        Assert.assertSame(e, dominators.immediateDominator(xy));
        Assert.assertSame(xy, dominators.immediateDominator(x));
        // y does not depend on x, so it is pruned
        Assert.assertFalse(dominators.contains(y));
    }

    @Test
    public void sharedNodeDominators() {
        Environment env = reverseEnvironment();
        Variable x = env.variable(1);
        Expression s = env.apply(Primitives.SIN, x);
        Expression e = s.mul(env.apply(Primitives.EXP, s));
        ReverseModeDifferentiator differentiator = (ReverseModeDifferentiator) env.getDifferentiator();
        differentiator.derivative(e, x);
        Dominators<Expression> dominators = differentiator.getLastDominators();
        Assert.assertNotNull(dominators);
        // s is reached directly and through exp(s)
        Assert.assertSame(e, dominators.immediateDominator(s));
        Assert.assertSame(s, dominators.immediateDominator(x));
    }

    @Test
    public void underivableSubtreeIsIgnored() {
        Environment env = reverseEnvironment();
        env.registry.declare("opaque", 1, false, false);
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Expression opaque = env.apply("opaque", x);
        Expression e = y.mul(opaque);
        Assert.assertSame(opaque, env.derivative(e, y));
        Assert.assertSame(opaque, new ForwardDifferentiator(env).derivative(e, y));
        Assert.assertThrows(UnimplementedException.class, () -> env.derivative(e, x));
    }

    @Test
    public void pruning() {
        Environment env = new Environment();
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Variable z = env.variable(3);
        Expression sinZ = env.apply(Primitives.SIN, z);
        Expression e = x.mul(y).add(sinZ);
        DependencyGraph graph = new DependencyGraph(e);
        Assert.assertTrue(graph.contains(sinZ));
        Assert.assertTrue(graph.prune(x));
        Assert.assertFalse(graph.contains(sinZ));
        Assert.assertFalse(graph.contains(z));
        Assert.assertFalse(graph.contains(y));
        Assert.assertEquals(1, graph.getFanout(e));
        Assert.assertEquals(1, graph.getFanout(x.mul(y)));

        DependencyGraph other = new DependencyGraph(sinZ);
        Assert.assertFalse(other.prune(x));
    }

    @Test
    public void removeMissingEdge() {
        Environment env = new Environment();
        Variable x = env.variable(1);
        Variable y = env.variable(2);
        Application e = (Application) env.apply(Primitives.SIN, x);
        Application cosY = (Application) env.apply(Primitives.COS, y);
        DependencyGraph graph = new DependencyGraph(e);
        Assert.assertThrows(GraphConsistencyError.class,
                () -> graph.removeEdge(e, new DependencyGraph.Edge(cosY, 0)));
        Assert.assertThrows(GraphConsistencyError.class,
                () -> graph.removeEdge(y, new DependencyGraph.Edge(e, 0)));
    }
}
