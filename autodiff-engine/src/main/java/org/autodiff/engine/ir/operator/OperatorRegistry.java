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

package org.autodiff.engine.ir.operator;

import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.errors.TypeError;
import org.autodiff.engine.ir.Expression;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The operators known to an environment, by name.
 * An operator is created the first time its name is referenced,
 * so derivative templates can mention operators which are defined later. */
public final class OperatorRegistry implements IWritesLogs {
    final Map<String, Operator> operators;

    public OperatorRegistry() {
        this.operators = Collections.synchronizedMap(new LinkedHashMap<>());
    }

    /** The operator with the specified name; created, without properties, if it does not exist. */
    public Operator get(String name) {
        return this.operators.computeIfAbsent(name, Operator::new);
    }

    /** The operator with the specified name, or null if it was never referenced. */
    @Nullable
    public Operator lookup(String name) {
        return this.operators.get(name);
    }

    /** Declare the properties of a function-call style operator. */
    public Operator declare(String name, int arity, boolean commutative, boolean associative) {
        return this.declare(name, arity, commutative, associative, Operator.Syntax.CALL, name, Operator.ATOM);
    }

    /** Declare the properties of an operator, including the way it is printed. */
    public Operator declare(String name, int arity, boolean commutative, boolean associative,
                            Operator.Syntax syntax, String symbol, int precedence) {
        if (arity < 0)
            throw new ArityError("Operator " + name + " cannot have negative arity " + arity);
        if ((commutative || associative) && arity != 2)
            throw new ArityError("Only binary operators can be commutative or associative; " +
                    name + " has arity " + arity);
        if (syntax == Operator.Syntax.INFIX && arity != 2)
            throw new ArityError("Infix operator " + name + " must be binary");
        if (syntax == Operator.Syntax.PREFIX && arity != 1)
            throw new ArityError("Prefix operator " + name + " must be unary");
        Operator operator = this.get(name);
        operator.setArity(arity);
        operator.setCommutative(commutative);
        operator.setAssociative(associative);
        operator.setSyntax(syntax, symbol, precedence);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Declared ")
                .append(name)
                .append("/")
                .append(arity)
                .newline();
        return operator;
    }

    /** Supply the numeric evaluator and the derivative templates of an operator.
     * Template i is the partial derivative with respect to argument i, written
     * over the variables 1..arity.  Templates are validated immediately. */
    public Operator define(String name, @Nullable INumericEvaluator evaluator, Expression... derivatives) {
        return this.define(name, evaluator, Arrays.asList(derivatives));
    }

    public Operator define(String name, @Nullable INumericEvaluator evaluator, List<Expression> derivatives) {
        Operator operator = this.get(name);
        Integer arity = operator.getArity();
        if (arity != null && derivatives.size() != arity)
            throw new ArityError("Operator " + name + " has arity " + arity + " but " +
                    derivatives.size() + " derivative(s) were supplied");
        int maxVars = arity != null ? arity : derivatives.size();
        for (Expression template: derivatives) {
            if (template.nvars() > maxVars)
                throw new ArityError("Derivative " + template + " of " + name +
                        " refers to variable v" + template.nvars() + " but the operator has " +
                        maxVars + " argument(s)");
        }
        if (!derivatives.isEmpty()) {
            var environment = derivatives.get(0).getEnvironment();
            for (Expression template: derivatives)
                if (template.getEnvironment() != environment)
                    throw new TypeError("Derivatives of " + name + " belong to different environments");
        }
        operator.setDerivatives(derivatives);
        operator.setEvaluator(evaluator);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Defined ")
                .append(name)
                .append(" with derivatives ")
                .appendSupplier(() -> derivatives.toString())
                .newline();
        return operator;
    }

    public Collection<Operator> operators() {
        synchronized (this.operators) {
            return new ArrayList<>(this.operators.values());
        }
    }
}
