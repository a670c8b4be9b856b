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

package org.autodiff.engine.ir;

import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.operator.Operator;
import org.autodiff.engine.visitors.ExpressionVisitor;
import org.autodiff.engine.visitors.VisitDecision;
import org.autodiff.util.IHasId;
import org.autodiff.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/** An operator applied to a list of arguments. */
public final class Application implements Expression, IHasId {
    public final Operator operator;
    public final List<Expression> arguments;
    /** Creation order; used to order applications canonically. */
    public final long id;
    final int nvars;
    final Environment environment;
    final DerivativeCache derivatives;
    /** Partial derivatives with respect to each argument, computed on demand. */
    @Nullable
    private volatile List<Expression> partials;
    private volatile int cost = -1;

    Application(Environment environment, long id, Operator operator, List<Expression> arguments) {
        this.environment = environment;
        this.id = id;
        this.operator = operator;
        this.arguments = List.copyOf(arguments);
        int nvars = 0;
        for (Expression argument: this.arguments)
            nvars = Math.max(nvars, argument.nvars());
        this.nvars = nvars;
        this.derivatives = new DerivativeCache();
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public Environment getEnvironment() {
        return this.environment;
    }

    @Override
    public int nvars() {
        return this.nvars;
    }

    @Override
    public ExpressionOrder.Category category() {
        return ExpressionOrder.Category.APPLICATION;
    }

    @Override
    public int childCount() {
        return this.arguments.size();
    }

    @Override
    public List<Expression> children() {
        return this.arguments;
    }

    public Expression argument(int index) {
        return this.arguments.get(index);
    }

    @Override
    public DerivativeCache derivatives() {
        return this.derivatives;
    }

    /** The partial derivatives of this application with respect to each of its arguments,
     * obtained by substituting the arguments into the operator's derivative templates. */
    public List<Expression> getPartials() {
        List<Expression> result = this.partials;
        if (result == null) {
            result = this.environment.instantiatePartials(this);
            synchronized (this) {
                if (this.partials == null)
                    this.partials = result;
                else
                    result = this.partials;
            }
        }
        return result;
    }

    /** Partial derivative with respect to the argument with the specified index (0-based). */
    public Expression partial(int index) {
        List<Expression> partials = this.getPartials();
        if (index >= partials.size())
            throw new UnimplementedException("Operator " + this.operator.name + " has no derivative for argument " +
                    index + " of " + this.arguments.size());
        return partials.get(index);
    }

    @Override
    public int cost() {
        if (this.cost < 0) {
            Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            Deque<Expression> work = new ArrayDeque<>();
            work.push(this);
            while (!work.isEmpty()) {
                Expression next = work.pop();
                if (!next.is(Application.class) || !seen.add(next))
                    continue;
                for (Expression child: next.children())
                    work.push(child);
            }
            this.cost = seen.size();
        }
        return this.cost;
    }

    @Override
    public void accept(ExpressionVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.render());
    }

    @Override
    public String toString() {
        return this.render();
    }
}
