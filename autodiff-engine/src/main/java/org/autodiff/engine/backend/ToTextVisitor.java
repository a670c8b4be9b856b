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

package org.autodiff.engine.backend;

import org.autodiff.engine.Environment;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.Operator;
import org.autodiff.engine.visitors.ExpressionVisitor;
import org.autodiff.engine.visitors.VisitDecision;
import org.autodiff.util.IIndentStream;
import org.autodiff.util.IndentStream;
import org.autodiff.util.Logger;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Renders expressions as text.
 *
 * <p>Applications which are referenced more than once from the rendered roots are
 * bound to names r0, r1, ... and printed once, in a let block:
 * <pre>
 * let
 *   r0 = v1 + v2
 * in
 *   r0 * r0
 * end
 * </pre>
 * Names are assigned in the order in which the shared applications are first reached
 * in a preorder traversal of the roots; a binding may therefore refer to a name
 * bound after it.  Parentheses are only emitted where operator precedence requires them. */
public class ToTextVisitor extends ExpressionVisitor {
    final IIndentStream builder;
    /** Names of the shared applications. */
    final Map<Application, String> names;
    /** Precedence required by the position where the current expression is printed. */
    int requiredPrecedence;
    /** Shared application which is being printed in full rather than by name. */
    @Nullable
    Application expanding;

    public ToTextVisitor(Environment environment, IIndentStream builder, Map<Application, String> names) {
        super(environment);
        this.builder = builder;
        this.names = names;
        this.requiredPrecedence = Operator.ANY;
        this.expanding = null;
    }

    void visit(Expression expression, int requiredPrecedence) {
        int saved = this.requiredPrecedence;
        this.requiredPrecedence = requiredPrecedence;
        expression.accept(this);
        this.requiredPrecedence = saved;
    }

    /** Print the definition of a shared application. */
    void expand(Application application) {
        this.expanding = application;
        this.visit(application, Operator.ANY);
    }

    @Override
    public VisitDecision preorder(Variable node) {
        this.builder.append("v").append(node.index);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Constant node) {
        this.builder.append(Double.toString(node.value));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Application node) {
        String name = this.names.get(node);
        if (name != null && node != this.expanding) {
            this.builder.append(name);
            return VisitDecision.STOP;
        }
        this.expanding = null;

        Operator operator = node.operator;
        boolean parens = operator.getPrecedence() < this.requiredPrecedence;
        if (parens)
            this.builder.append("(");
        switch (operator.getSyntax()) {
            case CALL -> {
                this.builder.append(operator.getSymbol()).append("(");
                for (int i = 0; i < node.childCount(); i++) {
                    if (i > 0)
                        this.builder.append(",");
                    this.visit(node.argument(i), operator.requiredPrecedence(i));
                }
                this.builder.append(")");
            }
            case INFIX -> {
                this.visit(node.argument(0), operator.requiredPrecedence(0));
                this.builder.append(" ")
                        .append(operator.getSymbol())
                        .append(" ");
                this.visit(node.argument(1), operator.requiredPrecedence(1));
            }
            case PREFIX -> {
                this.builder.append(operator.getSymbol());
                this.visit(node.argument(0), operator.requiredPrecedence(0));
            }
        }
        if (parens)
            this.builder.append(")");
        return VisitDecision.STOP;
    }

    void roots(List<? extends Expression> roots) {
        boolean first = true;
        for (Expression root: roots) {
            if (!first)
                this.builder.append(", ");
            first = false;
            this.visit(root, Operator.ANY);
        }
    }

    /** Render a list of expressions, binding the shared subexpressions to names. */
    public static String render(Environment environment, List<? extends Expression> roots) {
        UsageCounter counter = new UsageCounter(environment);
        counter.apply(roots);
        List<Application> shared = counter.shared();
        Map<Application, String> names = new HashMap<>();
        for (Application application: shared)
            names.put(application, "r" + names.size());

        StringBuilder result = new StringBuilder();
        IndentStream stream = new IndentStream(result).setIndentAmount(2);
        ToTextVisitor visitor = new ToTextVisitor(environment, stream, names);
        Logger.INSTANCE.belowLevel(visitor, 2)
                .append("Rendering ")
                .append(roots.size())
                .append(" root(s) with ")
                .append(shared.size())
                .append(" shared subexpression(s)")
                .newline();
        if (shared.isEmpty()) {
            visitor.roots(roots);
            return result.toString();
        }
        stream.append("let").increase();
        for (Application application: shared) {
            stream.append(names.get(application)).append(" = ");
            visitor.expand(application);
            stream.newline();
        }
        stream.decrease().append("in").increase();
        visitor.roots(roots);
        stream.decrease().newline().append("end").newline();
        return result.toString();
    }
}
