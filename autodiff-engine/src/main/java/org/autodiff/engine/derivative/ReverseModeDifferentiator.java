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
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Logger;
import org.autodiff.util.graph.Dominators;
import org.autodiff.util.graph.Port;

import javax.annotation.Nullable;
import java.util.IdentityHashMap;
import java.util.Map;

/** Experimental differentiation strategy working on the dependency graph of the expression.
 * The graph is pruned to the nodes which depend on the variable, and the derivative
 * is the sum over all paths from the root to the variable of the product of the
 * partial derivatives on the path.  The dominator tree of the pruned graph is computed
 * and logged, but not used for accumulation yet.  Results are not memoized on the expressions. */
public class ReverseModeDifferentiator implements IDifferentiator, IWritesLogs {
    final Environment environment;
    @Nullable
    Dominators<Expression> lastDominators;

    public ReverseModeDifferentiator(Environment environment) {
        this.environment = environment;
        this.lastDominators = null;
    }

    /** Dominator tree of the graph pruned in the last call to {@link #derivative}. */
    @Nullable
    public Dominators<Expression> getLastDominators() {
        return this.lastDominators;
    }

    @Override
    public Expression derivative(Expression expression, Variable variable) {
        DependencyGraph graph = new DependencyGraph(expression);
        if (!graph.prune(variable)) {
            this.lastDominators = null;
            return this.environment.constant(0);
        }
        Logger.INSTANCE.belowLevel(this, 4)
                .append(graph)
                .newline();
        Dominators<Expression> dominators = Dominators.compute(graph, expression);
        this.lastDominators = dominators;
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Dominators of d/d")
                .append(variable.toString())
                .append(" ")
                .appendSupplier(expression::toString)
                .increase()
                .appendSupplier(dominators::toString)
                .decrease()
                .newline();
        Map<Expression, Expression> accumulated = new IdentityHashMap<>();
        return this.accumulate(graph, expression, variable, accumulated);
    }

    Expression accumulate(DependencyGraph graph, Expression node, Variable variable,
                          Map<Expression, Expression> accumulated) {
        if (node == variable)
            return this.environment.constant(1);
        Expression known = accumulated.get(node);
        if (known != null)
            return known;
        @Nullable Expression sum = null;
        for (Port<Expression> port: graph.getSuccessors(node)) {
            DependencyGraph.Edge edge = (DependencyGraph.Edge) port;
            Expression below = this.accumulate(graph, edge.node(), variable, accumulated);
            if (below.isConstant(0))
                continue;
            Expression term = this.environment.mul(below, edge.partial());
            sum = sum == null ? term : this.environment.add(sum, term);
        }
        Expression result = sum == null ? this.environment.constant(0) : sum;
        accumulated.put(node, result);
        return result;
    }
}
