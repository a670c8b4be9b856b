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

import org.autodiff.util.Utilities;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Computes depth-first order of a graph.
 * The traversal uses an explicit stack, so deep graphs do not overflow the Java stack. */
public class DFSOrder<Node> {
    /** Maps each visited node to its postorder number. */
    final Map<Node, Integer> post;
    final List<Node> preorder;
    final List<Node> postorder;
    /** For each visited node the sources of the edges traversed into it, in traversal order. */
    final Map<Node, List<Node>> predecessors;
    int postCounter;

    record Frame<Node>(Node node, Iterator<Node> successors) {}

    private DFSOrder() {
        this.post = new HashMap<>();
        this.postorder = new ArrayList<>();
        this.preorder = new ArrayList<>();
        this.predecessors = new HashMap<>();
    }

    /** Depth-first traversal of all nodes of a graph. */
    public DFSOrder(DiGraph<Node> graph) {
        this();
        for (Node v: graph.getNodes())
            if (!this.predecessors.containsKey(v))
                this.dfs(v, graph::getSuccessorNodes);
    }

    /** Depth-first traversal of the nodes reachable from a root.
     * @param root        Node where traversal starts; it receives the highest postorder number.
     * @param successors  Function returning the successors of a node. */
    public DFSOrder(Node root, Function<Node, ? extends Iterable<Node>> successors) {
        this();
        this.dfs(root, successors);
    }

    private void dfs(Node start, Function<Node, ? extends Iterable<Node>> successors) {
        Deque<Frame<Node>> stack = new ArrayDeque<>();
        this.discover(start);
        stack.push(new Frame<>(start, successors.apply(start).iterator()));
        while (!stack.isEmpty()) {
            Frame<Node> top = stack.peek();
            if (top.successors().hasNext()) {
                Node w = top.successors().next();
                boolean seen = this.predecessors.containsKey(w);
                if (!seen)
                    this.discover(w);
                this.predecessors.get(w).add(top.node());
                if (!seen)
                    stack.push(new Frame<>(w, successors.apply(w).iterator()));
            } else {
                stack.pop();
                this.postorder.add(top.node());
                Utilities.putNew(this.post, top.node(), this.postCounter++);
            }
        }
    }

    private void discover(Node v) {
        this.preorder.add(v);
        this.predecessors.put(v, new ArrayList<>());
    }

    public int size() {
        return this.postorder.size();
    }

    public boolean visited(Node node) {
        return this.post.containsKey(node);
    }

    /** Postorder number of a visited node. */
    public int postNumber(Node node) {
        return Utilities.getExists(this.post, node);
    }

    /** Nodes in postorder; the position of a node is its postorder number. */
    public List<Node> postorder() {
        return this.postorder;
    }

    public List<Node> preorder() {
        return this.preorder;
    }

    /** Sources of all traversed edges ending in node. */
    public List<Node> predecessors(Node node) {
        return Utilities.getExists(this.predecessors, node);
    }
}
