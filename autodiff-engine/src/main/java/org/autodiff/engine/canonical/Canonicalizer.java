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

package org.autodiff.engine.canonical;

import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.TypeError;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.ExpressionOrder;
import org.autodiff.engine.ir.ExpressionTable;
import org.autodiff.engine.ir.operator.INumericEvaluator;
import org.autodiff.engine.ir.operator.Operator;
import org.autodiff.engine.ir.operator.Primitives;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/** Builds applications in canonical form.
 *
 * <p>Every application is created through {@link #makeApplication}, which applies
 * a fixed sequence of rewrites before interning the node.  The first rewrite
 * that matches wins; its result is itself built through this class:
 * <ol>
 *     <li>constant folding, when all arguments are constants</li>
 *     <li>ordering the arguments of commutative operators</li>
 *     <li>re-associating nested associative operators to the right</li>
 *     <li>algebraic identities of the arithmetic operators</li>
 * </ol>
 * Whatever is left is interned in the {@link ExpressionTable}. */
public final class Canonicalizer implements IWritesLogs {
    final Environment environment;
    final ExpressionTable table;

    public Canonicalizer(Environment environment, ExpressionTable table) {
        this.environment = environment;
        this.table = table;
    }

    public Expression makeApplication(Operator operator, List<Expression> arguments) {
        operator.checkArity(arguments.size());
        for (Expression argument: arguments) {
            if (argument.getEnvironment() != this.environment)
                throw new TypeError("Argument " + argument + " of " + operator.name +
                        " belongs to a different environment");
        }

        Expression result = this.fold(operator, arguments);
        if (result == null)
            result = this.reorder(operator, arguments);
        if (result == null)
            result = this.reassociate(operator, arguments);
        if (result == null)
            result = this.identity(operator, arguments);
        if (result != null) {
            Logger.INSTANCE.belowLevel(this, 3)
                    .append(operator.name)
                    .appendSupplier(arguments::toString)
                    .append(" => ")
                    .appendSupplier(result::toString)
                    .newline();
            return result;
        }
        return this.table.intern(operator, arguments);
    }

    Expression make(String operator, Expression... arguments) {
        return this.makeApplication(this.environment.registry.get(operator), List.of(arguments));
    }

    @Nullable
    Expression fold(Operator operator, List<Expression> arguments) {
        INumericEvaluator evaluator = operator.getEvaluator();
        if (evaluator == null || arguments.isEmpty())
            return null;
        double[] values = new double[arguments.size()];
        for (int i = 0; i < values.length; i++) {
            Constant constant = arguments.get(i).as(Constant.class);
            if (constant == null)
                return null;
            values[i] = constant.value;
        }
        return this.table.constant(evaluator.evaluate(values));
    }

    @Nullable
    Expression reorder(Operator operator, List<Expression> arguments) {
        if (!operator.isCommutative() || arguments.size() != 2)
            return null;
        Expression left = arguments.get(0);
        Expression right = arguments.get(1);
        if (ExpressionOrder.INSTANCE.compare(left, right) <= 0)
            return null;
        return this.makeApplication(operator, List.of(right, left));
    }

    /** op(op(a, b), c) => op(a, op(b, c)) */
    @Nullable
    Expression reassociate(Operator operator, List<Expression> arguments) {
        if (!operator.isAssociative() || arguments.size() != 2)
            return null;
        Application left = arguments.get(0).as(Application.class);
        if (left == null || left.operator != operator)
            return null;
        Expression inner = this.makeApplication(operator, List.of(left.argument(1), arguments.get(1)));
        return this.makeApplication(operator, List.of(left.argument(0), inner));
    }

    @Nullable
    Expression identity(Operator operator, List<Expression> arguments) {
        return switch (operator.name) {
            case Primitives.NEG -> this.negIdentity(arguments.get(0));
            case Primitives.ADD -> this.addIdentity(arguments.get(0), arguments.get(1));
            case Primitives.SUB -> this.subIdentity(arguments.get(0), arguments.get(1));
            case Primitives.MUL -> this.mulIdentity(arguments.get(0), arguments.get(1));
            case Primitives.DIV -> this.divIdentity(arguments.get(0), arguments.get(1));
            default -> null;
        };
    }

    @Nullable
    Expression negIdentity(Expression argument) {
        Application application = argument.as(Application.class);
        if (application != null && application.operator.name.equals(Primitives.NEG))
            return application.argument(0);
        return null;
    }

    @Nullable
    Expression mulIdentity(Expression left, Expression right) {
        if (right.isConstant(1))
            return left;
        if (left.isConstant(1))
            return right;
        if (right.isConstant(0) || left.isConstant(0))
            return this.table.constant(0);
        if (right.isConstant(-1))
            return this.make(Primitives.NEG, left);
        if (left.isConstant(-1))
            return this.make(Primitives.NEG, right);
        return null;
    }

    @Nullable
    Expression addIdentity(Expression left, Expression right) {
        if (right.isConstant(0))
            return left;
        if (left.isConstant(0))
            return right;
        return this.commonFactor(left, right);
    }

    /** x*a + x*b => x*(a+b), where x may be either factor of each product. */
    @Nullable
    Expression commonFactor(Expression left, Expression right) {
        Application l = this.asProduct(left);
        Application r = this.asProduct(right);
        if (l == null || r == null)
            return null;
        Expression l0 = l.argument(0);
        Expression l1 = l.argument(1);
        Expression r0 = r.argument(0);
        Expression r1 = r.argument(1);
        if (l0 == r0)
            return this.make(Primitives.MUL, l0, this.make(Primitives.ADD, l1, r1));
        if (l0 == r1)
            return this.make(Primitives.MUL, l0, this.make(Primitives.ADD, l1, r0));
        if (l1 == r0)
            return this.make(Primitives.MUL, l1, this.make(Primitives.ADD, l0, r1));
        if (l1 == r1)
            return this.make(Primitives.MUL, l1, this.make(Primitives.ADD, l0, r0));
        return null;
    }

    @Nullable
    Application asProduct(Expression expression) {
        Application application = expression.as(Application.class);
        if (application == null || !application.operator.name.equals(Primitives.MUL))
            return null;
        return application;
    }

    @Nullable
    Expression subIdentity(Expression left, Expression right) {
        if (left == right)
            return this.table.constant(0);
        if (right.isConstant(0))
            return left;
        if (left.isConstant(0))
            return this.make(Primitives.NEG, right);
        return null;
    }

    @Nullable
    Expression divIdentity(Expression left, Expression right) {
        if (right.isConstant(1))
            return left;
        if (right.isConstant(-1))
            return this.make(Primitives.NEG, left);
        if (left == right)
            return this.table.constant(1);
        return null;
    }
}
