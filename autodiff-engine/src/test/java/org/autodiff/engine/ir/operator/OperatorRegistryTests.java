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

import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.errors.InternalEngineError;
import org.autodiff.engine.errors.UnimplementedException;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class OperatorRegistryTests {
    final Environment env = new Environment();
    final Variable v1 = this.env.variable(1);
    final Variable v2 = this.env.variable(2);

    @Test
    public void primitives() {
        OperatorRegistry registry = this.env.registry;
        for (String name: List.of(Primitives.NEG, Primitives.ADD, Primitives.SUB, Primitives.MUL, Primitives.DIV,
                Primitives.EXP, Primitives.LOG, Primitives.SIN, Primitives.COS, Primitives.TAN, Primitives.SQRT,
                Primitives.POW, Primitives.SIGN, Primitives.ABS, Primitives.TANH)) {
            Operator operator = registry.lookup(name);
            Assert.assertNotNull(name, operator);
            Assert.assertTrue(name, operator.isDefined());
            Assert.assertNotNull(name, operator.getEvaluator());
            Assert.assertEquals(name, operator.getArity().intValue(), operator.getDerivatives().size());
        }
        Operator add = registry.lookup(Primitives.ADD);
        Assert.assertNotNull(add);
        Assert.assertTrue(add.isCommutative());
        Assert.assertTrue(add.isAssociative());
        Assert.assertEquals(Operator.Syntax.INFIX, add.getSyntax());
        Assert.assertEquals("+", add.getSymbol());
        Operator sub = registry.lookup(Primitives.SUB);
        Assert.assertNotNull(sub);
        Assert.assertFalse(sub.isCommutative());
        Assert.assertEquals(Primitives.ADDITIVE_PRECEDENCE + 1, sub.requiredPrecedence(1));
    }

    @Test
    public void createdOnFirstReference() {
        OperatorRegistry registry = this.env.registry;
        Assert.assertNull(registry.lookup("later"));
        Operator later = registry.get("later");
        Assert.assertSame(later, registry.get("later"));
        Assert.assertFalse(later.isDefined());
        Assert.assertNull(later.getArity());
        // Templates may refer to operators defined afterwards
        Expression template = this.env.apply("later", this.v1);
        this.env.define("user", 1, null, template);
        this.env.define("later", 1, INumericEvaluator.unary(v -> 2 * v), this.env.constant(2));
        Assert.assertEquals(16.0, this.env.evaluate(this.env.apply("later", this.v1), 8), 0);
        Assert.assertSame(template, this.env.derivative(this.env.apply("user", this.v1), this.v1));
    }

    @Test
    public void templateBeyondArity() {
        Assert.assertThrows(ArityError.class, () -> this.env.define("bad", 1, null, this.v2));
    }

    @Test
    public void templateCountMismatch() {
        this.env.registry.declare("twoArgs", 2, false, false);
        Assert.assertThrows(ArityError.class, () -> this.env.registry.define("twoArgs", null, this.v1));
    }

    @Test
    public void redefinition() {
        Assert.assertThrows(InternalEngineError.class,
                () -> this.env.registry.define(Primitives.SIN, INumericEvaluator.unary(Math::sin), this.v1));
    }

    @Test
    public void redeclarationWithOtherArity() {
        Assert.assertThrows(ArityError.class, () -> this.env.registry.declare(Primitives.SIN, 2, false, false));
    }

    @Test
    public void commutativeMustBeBinary() {
        Assert.assertThrows(ArityError.class, () -> this.env.registry.declare("f", 1, true, false));
    }

    @Test
    public void partialOutOfRange() {
        Expression e = this.env.apply(Primitives.SIN, this.v1);
        Application application = e.to(Application.class);
        Assert.assertThrows(UnimplementedException.class, () -> application.partial(1));
    }
}
