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
import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.ir.operator.Operator;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/** Interning tables of an {@link Environment}: at most one node exists for each variable index,
 * each constant value, and each operator applied to a list of (interned) arguments.
 * This class does not simplify anything; simplification is done before calling {@link #intern}. */
public final class ExpressionTable {
    /** Key of an application.  Arguments are interned, so list equality is reference equality
     * of the elements; operators are compared by reference too. */
    record ApplicationKey(Operator operator, List<Expression> arguments) {}

    final Environment environment;
    final ConcurrentMap<Integer, Variable> variables;
    final ConcurrentMap<Double, Constant> constants;
    final ConcurrentMap<ApplicationKey, Application> applications;
    final AtomicLong nextId;

    public ExpressionTable(Environment environment) {
        this.environment = environment;
        this.variables = new ConcurrentHashMap<>();
        this.constants = new ConcurrentHashMap<>();
        this.applications = new ConcurrentHashMap<>();
        this.nextId = new AtomicLong();
    }

    public Variable variable(int index) {
        if (index <= 0)
            throw new ArityError("Variable index must be positive, got " + index);
        return this.variables.computeIfAbsent(index, i -> new Variable(this.environment, i));
    }

    public Constant constant(double value) {
        // -0.0 and 0.0 are the same constant
        if (value == 0.0)
            value = 0.0;
        return this.constants.computeIfAbsent(value, v -> new Constant(this.environment, v));
    }

    /** The unique application of the operator to the arguments; creates it if needed. */
    public Application intern(Operator operator, List<Expression> arguments) {
        ApplicationKey key = new ApplicationKey(operator, List.copyOf(arguments));
        return this.applications.computeIfAbsent(key,
                k -> new Application(this.environment, this.nextId.getAndIncrement(), k.operator(), k.arguments()));
    }

    public int applicationCount() {
        return this.applications.size();
    }
}
