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

package org.autodiff.engine;

import org.autodiff.engine.backend.ToTextVisitor;
import org.autodiff.engine.canonical.Canonicalizer;
import org.autodiff.engine.derivative.ForwardDifferentiator;
import org.autodiff.engine.derivative.IDifferentiator;
import org.autodiff.engine.derivative.ReverseModeDifferentiator;
import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.errors.TypeError;
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.ExpressionTable;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.INumericEvaluator;
import org.autodiff.engine.ir.operator.Operator;
import org.autodiff.engine.ir.operator.OperatorRegistry;
import org.autodiff.engine.ir.operator.Primitives;
import org.autodiff.engine.visitors.Evaluate;
import org.autodiff.engine.visitors.Rename;
import org.autodiff.util.IWritesLogs;
import org.autodiff.util.Linq;
import org.autodiff.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Scope of all the engine's state: the operator registry and the tables
 * which guarantee that each expression exists only once.
 * Expressions of different environments cannot be mixed.
 * Nothing is ever removed from an environment. */
public class Environment implements IWritesLogs {
    public final EngineOptions options;
    public final OperatorRegistry registry;
    final ExpressionTable table;
    final Canonicalizer canonicalizer;
    final IDifferentiator differentiator;

    public Environment(EngineOptions options) {
        this.options = options;
        this.registry = new OperatorRegistry();
        this.table = new ExpressionTable(this);
        this.canonicalizer = new Canonicalizer(this, this.table);
        if (options.reverseMode)
            this.differentiator = new ReverseModeDifferentiator(this);
        else
            this.differentiator = new ForwardDifferentiator(this);
        Primitives.register(this);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Created environment with ")
                .append(this.registry.operators().size())
                .append(" operators, using ")
                .append(this.differentiator.getClass().getSimpleName())
                .newline();
    }

    public Environment() {
        this(new EngineOptions());
    }

    public IDifferentiator getDifferentiator() {
        return this.differentiator;
    }

    /** Number of distinct applications created so far. */
    public int applicationCount() {
        return this.table.applicationCount();
    }

    public Variable variable(int index) {
        return this.table.variable(index);
    }

    public Constant constant(double value) {
        return this.table.constant(value);
    }

    /** Apply the named operator to the arguments; the result is canonical. */
    public Expression apply(String operator, Expression... arguments) {
        return this.apply(this.registry.get(operator), Arrays.asList(arguments));
    }

    public Expression apply(Operator operator, List<Expression> arguments) {
        return this.canonicalizer.makeApplication(operator, arguments);
    }

    /** Apply the named operator to values which are converted to expressions.
     * Numbers become constants; expressions are used as they are. */
    public Expression applyValues(String operator, Object... values) {
        return this.apply(this.registry.get(operator), Linq.map(values, this::toExpression));
    }

    public Expression toExpression(@Nullable Object value) {
        if (value instanceof Expression expression)
            return expression;
        if (value instanceof Number number)
            return this.constant(number.doubleValue());
        throw new TypeError("Cannot convert " + value +
                (value == null ? "" : " of type " + value.getClass().getSimpleName()) +
                " to an expression");
    }

    public Expression add(Expression left, Expression right) {
        return this.apply(Primitives.ADD, left, right);
    }

    public Expression sub(Expression left, Expression right) {
        return this.apply(Primitives.SUB, left, right);
    }

    public Expression mul(Expression left, Expression right) {
        return this.apply(Primitives.MUL, left, right);
    }

    public Expression div(Expression left, Expression right) {
        return this.apply(Primitives.DIV, left, right);
    }

    public Expression neg(Expression expression) {
        return this.apply(Primitives.NEG, expression);
    }

    /** Declare and define a new operator in one step. */
    public Operator define(String name, int arity, @Nullable INumericEvaluator evaluator, Expression... derivatives) {
        this.registry.declare(name, arity, false, false);
        return this.registry.define(name, evaluator, derivatives);
    }

    Variable checkVariable(Expression variable) {
        Variable result = variable.as(Variable.class);
        if (result == null)
            throw new TypeError("Cannot differentiate with respect to " + variable +
                    ", which is not a variable");
        if (result.getEnvironment() != this)
            throw new TypeError("Variable " + variable + " belongs to a different environment");
        return result;
    }

    /** Derivative of an expression with respect to a variable. */
    public Expression derivative(Expression expression, Expression variable) {
        Variable v = this.checkVariable(variable);
        if (expression.getEnvironment() != this)
            throw new TypeError("Expression " + expression + " belongs to a different environment");
        return this.differentiator.derivative(expression, v);
    }

    /** Derivative of the specified order; order 0 is the expression itself. */
    public Expression derivative(Expression expression, Expression variable, int order) {
        if (order < 0)
            throw new ArityError("Derivative order cannot be negative: " + order);
        Expression result = expression;
        for (int i = 0; i < order; i++)
            result = this.derivative(result, variable);
        return result;
    }

    /** Derivatives with respect to the variables 1..nvars. */
    public List<Expression> gradient(Expression expression) {
        List<Expression> result = new ArrayList<>();
        for (int i = 1; i <= expression.nvars(); i++)
            result.add(this.derivative(expression, this.variable(i)));
        return result;
    }

    /** Partial derivatives of an application, obtained by substituting its arguments
     * into the derivative templates of its operator. */
    public List<Expression> instantiatePartials(Application application) {
        List<Expression> templates = application.operator.getDerivatives();
        if (templates == null)
            throw new UnimplementedException("Operator " + application.operator.name +
                    " has no derivatives defined");
        Rename rename = new Rename(this, application.arguments);
        return Linq.map(templates, rename::translate);
    }

    /** Substitute the variables 1..n of an expression with the arguments. */
    public Expression rename(Expression expression, List<Expression> arguments) {
        return new Rename(this, arguments).translate(expression);
    }

    public double evaluate(Expression expression, double... values) {
        return new Evaluate(this, values).translate(expression);
    }

    public String render(List<? extends Expression> roots) {
        return ToTextVisitor.render(this, roots);
    }
}
