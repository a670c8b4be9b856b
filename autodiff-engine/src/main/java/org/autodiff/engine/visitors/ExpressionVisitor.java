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
import org.autodiff.engine.errors.InternalEngineError;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.util.IHasId;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Logger;
import org.autodiff.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an expression DAG.
 * Shared subexpressions are visited once for each path reaching them,
 * unless a subclass stops the traversal in a preorder method. */
@SuppressWarnings({"SameReturnValue", "unused"})
public abstract class ExpressionVisitor implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    public final Environment environment;
    protected final List<Expression> context;

    protected ExpressionVisitor(Environment environment) {
        this.id = crtId++;
        this.environment = environment;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(Expression expression) {
        this.context.add(expression);
    }

    public void pop(Expression expression) {
        Expression last = Utilities.removeLast(this.context);
        if (expression != last)
            throw new InternalEngineError("Corrupted visitor context: popping " + expression
                    + " instead of " + last, expression);
    }

    @Nullable
    public Expression getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(Expression expression) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should not descend below the current node.
    public VisitDecision preorder(Expression ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Variable node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Constant node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Application node) {
        return this.preorder((Expression) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(Expression ignored) {}

    public void postorder(Variable node) {
        this.postorder((Expression) node);
    }

    public void postorder(Constant node) {
        this.postorder((Expression) node);
    }

    public void postorder(Application node) {
        this.postorder((Expression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    public Expression apply(Expression expression) {
        this.startVisit(expression);
        expression.accept(this);
        this.endVisit();
        return expression;
    }

    /** Visit several roots in order, as a single traversal. */
    public void apply(List<? extends Expression> expressions) {
        if (expressions.isEmpty())
            return;
        this.startVisit(expressions.get(0));
        for (Expression expression: expressions)
            expression.accept(this);
        this.endVisit();
    }
}
