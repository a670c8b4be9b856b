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

package org.autodiff.util.graph;

import org.autodiff.engine.errors.GraphConsistencyError;
import org.autodiff.util.Utilities;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Immediate dominators of a rooted directed graph.
 * Iterative algorithm from Cooper, Harvey and Kennedy, "A Simple, Fast Dominance Algorithm".
 * Nodes are numbered in postorder of a depth-first traversal from the root, so the
 * root has the highest number; dominators are computed on these numbers.
 *
 * <p>The algorithm only needs a successor function, so it works for any node type. */
public class Dominators<Node> {
    public final Node root;
    final DFSOrder<Node> order;
    /** Immediate dominator of each node, indexed by postorder number.  -1 means unknown. */
    final int[] idom;

    static final int UNDEFINED = -1;

    public Dominators(Node root, Function<Node, ? extends Iterable<Node>> successors) {
        this.root = root;
        this.order = new DFSOrder<>(root, successors);
        int count = this.order.size();
        this.idom = new int[count];
        Arrays.fill(this.idom, UNDEFINED);
        // The root dominates itself
        this.idom[count - 1] = count - 1;
        List<int[]> predecessors = new ArrayList<>(count);
        for (Node node: this.order.postorder()) {
            List<Node> preds = this.order.predecessors(node);
            int[] numbers = new int[preds.size()];
            for (int i = 0; i < numbers.length; i++)
                numbers[i] = this.order.postNumber(preds.get(i));
            predecessors.add(numbers);
        }
        this.solve(predecessors);
    }

    private void solve(List<int[]> predecessors) {
        boolean changed = true;
        while (changed) {
            changed = false;
            // Reverse postorder, skipping the root
            for (int b = this.idom.length - 2; b >= 0; b--) {
                int newIdom = UNDEFINED;
                for (int p: predecessors.get(b)) {
                    if (this.idom[p] == UNDEFINED)
                        continue;
                    if (newIdom == UNDEFINED)
                        newIdom = p;
                    else
                        newIdom = this.intersect(p, newIdom);
                }
                if (this.idom[b] != newIdom) {
                    this.idom[b] = newIdom;
                    changed = true;
                }
            }
        }
    }

    /** Two-finger walk up the dominator tree until both fingers meet. */
    private int intersect(int finger1, int finger2) {
        while (finger1 != finger2) {
            while (finger1 < finger2)
                finger1 = this.idom[finger1];
            while (finger2 < finger1)
                finger2 = this.idom[finger2];
        }
        return finger1;
    }

    /** Compute the immediate dominators of all nodes reachable from the root of a graph.
     * @throws GraphConsistencyError if some node in the graph is not reachable from the root. */
    public static <Node> Dominators<Node> compute(DiGraph<Node> graph, Node root) {
        Dominators<Node> result = new Dominators<>(root, graph::getSuccessorNodes);
        for (Node node: graph.getNodes()) {
            if (!result.order.visited(node))
                throw new GraphConsistencyError("Node " + node + " is not reachable from root " + root);
        }
        return result;
    }

    /** Map each node reachable from the root to its immediate dominator; the root maps to itself. */
    public static <Node> Map<Node, Node> compute(Node root, Function<Node, ? extends Iterable<Node>> successors) {
        return new Dominators<>(root, successors).asMap();
    }

    /** True if the node was reached from the root. */
    public boolean contains(Node node) {
        return this.order.visited(node);
    }

    public Node immediateDominator(Node node) {
        if (!this.order.visited(node))
            throw new GraphConsistencyError("Node " + node + " is not reachable from root " + this.root);
        int index = this.idom[this.order.postNumber(node)];
        Utilities.enforce(index != UNDEFINED);
        return this.order.postorder().get(index);
    }

    /** True if every path from the root to 'node' passes through 'dominator'. */
    public boolean dominates(Node dominator, Node node) {
        int d = this.order.postNumber(dominator);
        int n = this.order.postNumber(node);
        while (n != d) {
            int next = this.idom[n];
            if (next == n)
                return false;
            n = next;
        }
        return true;
    }

    /** Children of a node in the dominator tree, in postorder. */
    public List<Node> dominated(Node node) {
        int index = this.order.postNumber(node);
        List<Node> result = new ArrayList<>();
        for (int i = 0; i < this.idom.length; i++)
            if (i != index && this.idom[i] == index)
                result.add(this.order.postorder().get(i));
        return result;
    }

    public Map<Node, Node> asMap() {
        Map<Node, Node> result = new LinkedHashMap<>();
        List<Node> nodes = this.order.postorder();
        for (int i = nodes.size() - 1; i >= 0; i--)
            result.put(nodes.get(i), nodes.get(this.idom[i]));
        return result;
    }

    /** The dominator tree, one line per node with dominated children, root first. */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        List<Node> nodes = this.order.postorder();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            List<Node> children = this.dominated(nodes.get(i));
            if (children.isEmpty())
                continue;
            builder.append(nodes.get(i))
                    .append(" => ")
                    .append(children)
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }
}
