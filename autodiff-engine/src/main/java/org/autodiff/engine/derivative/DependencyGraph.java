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

import org.autodiff.engine.errors.GraphConsistencyError;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.util.IIndentStream;
import org.autodiff.util.ToIndentableString;
import org.autodiff.util.Utilities;
import org.autodiff.util.graph.DiGraph;
import org.autodiff.util.graph.Port;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Graph of the expression DAG below a root.
 * There is an edge from every application to each of its arguments;
 * the port of the edge is the argument index.  Partial derivatives are instantiated
 * only when an edge is used, so pruned edges never touch the derivative templates. */
public final class DependencyGraph implements DiGraph<Expression>, ToIndentableString {
    /** An edge from an application to one of its arguments. */
    public static final class Edge extends Port<Expression> {
        public final Application source;

        public Edge(Application source, int port) {
            super(source.argument(port), port);
            this.source = source;
        }

        /** Partial derivative of the source with respect to the destination. */
        public Expression partial() {
            return this.source.partial(this.port);
        }
    }

    public final Expression root;
    // Expressions are interned, so the maps compare nodes by identity
    final Map<Expression, List<Port<Expression>>> edges;

    public DependencyGraph(Expression root) {
        this.root = root;
        this.edges = new LinkedHashMap<>();
        Deque<Expression> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Expression node = work.pop();
            if (this.edges.containsKey(node))
                continue;
            List<Port<Expression>> successors = new ArrayList<>();
            this.edges.put(node, successors);
            Application application = node.as(Application.class);
            if (application == null)
                continue;
            for (int i = 0; i < application.childCount(); i++) {
                Edge edge = new Edge(application, i);
                successors.add(edge);
                work.push(edge.node());
            }
        }
    }

    @Override
    public Iterable<Expression> getNodes() {
        return this.edges.keySet();
    }

    public boolean contains(Expression node) {
        return this.edges.containsKey(node);
    }

    @Override
    public List<Port<Expression>> getSuccessors(Expression node) {
        return Utilities.getExists(this.edges, node);
    }

    public void removeEdge(Expression source, Port<Expression> edge) {
        List<Port<Expression>> successors = this.edges.get(source);
        if (successors == null || !successors.remove(edge))
            throw new GraphConsistencyError("Cannot remove edge " + source + " -> " + edge.node() +
                    " at port " + edge.port() + ": no such edge");
    }

    /** Remove the nodes which do not depend on the variable, and all edges to them.
     * @return True if the root depends on the variable. */
    public boolean prune(Variable variable) {
        Map<Expression, Boolean> depends = new IdentityHashMap<>();
        for (Expression node: this.edges.keySet())
            this.dependsOn(node, variable, depends);
        for (Expression node: new ArrayList<>(this.edges.keySet())) {
            if (!depends.get(node)) {
                this.edges.remove(node);
                continue;
            }
            for (Port<Expression> edge: new ArrayList<>(this.edges.get(node))) {
                if (!depends.get(edge.node()))
                    this.removeEdge(node, edge);
            }
        }
        return depends.get(this.root);
    }

    boolean dependsOn(Expression node, Variable variable, Map<Expression, Boolean> depends) {
        Boolean known = depends.get(node);
        if (known != null)
            return known;
        boolean result = node == variable;
        if (node.nvars() >= variable.index) {
            for (Port<Expression> edge: this.edges.get(node))
                result = this.dependsOn(edge.node(), variable, depends) || result;
        }
        depends.put(node, result);
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("DependencyGraph {").increase();
        for (var entry: this.edges.entrySet()) {
            builder.append(entry.getKey().toString());
            for (Port<Expression> port: entry.getValue()) {
                builder.append(" ->")
                        .append(port.port())
                        .append(" ")
                        .append(port.node().toString());
            }
            builder.newline();
        }
        return builder.decrease().append("}");
    }
}
