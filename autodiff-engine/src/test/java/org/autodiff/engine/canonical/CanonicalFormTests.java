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
import org.autodiff.engine.errors.ArityError;
import org.autodiff.engine.errors.TypeError;
import org.autodiff.engine.ir.Application;
import org.autodiff.engine.ir.Constant;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.Primitives;
import org.junit.Assert;
import org.junit.Test;

public class CanonicalFormTests {
    final Environment env = new Environment();
    final Variable x = this.env.variable(1);
    final Variable y = this.env.variable(2);
    final Variable z = this.env.variable(3);

    @Test
    public void sharing() {
        Expression a = this.x.add(this.y);
        Expression b = this.x.add(this.y);
        Assert.assertSame(a, b);
        Assert.assertSame(this.x, this.env.variable(1));
        Assert.assertSame(this.env.constant(2.5), this.env.constant(2.5));
        Assert.assertSame(this.env.constant(0.0), this.env.constant(-0.0));
    }

    @Test
    public void commutativity() {
        Assert.assertSame(this.x.add(this.y), this.y.add(this.x));
        Assert.assertSame(this.x.mul(this.y), this.y.mul(this.x));
        Expression sin = this.env.apply(Primitives.SIN, this.x);
        Assert.assertSame(sin.mul(3), this.env.constant(3).mul(sin));
        // Not commutative
        Assert.assertNotSame(this.x.sub(this.y), this.y.sub(this.x));
    }

    @Test
    public void argumentOrder() {
        // Variables first, then applications, then constants
        Application product = this.env.constant(2).mul(this.env.apply(Primitives.EXP, this.y)).mul(this.x)
                .to(Application.class);
        Assert.assertSame(this.x, product.argument(0));
        Application rest = product.argument(1).to(Application.class);
        Assert.assertTrue(rest.argument(0).is(Application.class));
        Assert.assertTrue(rest.argument(1).isConstant(2));
    }

    @Test
    public void idempotence() {
        Application e = this.x.mul(this.y).add(this.z.div(this.x)).to(Application.class);
        Expression rebuilt = this.env.apply(e.operator, e.arguments);
        Assert.assertSame(e, rebuilt);
        int count = this.env.applicationCount();
        this.env.apply(e.operator, e.arguments);
        Assert.assertEquals(count, this.env.applicationCount());
    }

    @Test
    public void identities() {
        Assert.assertSame(this.x, this.x.mul(1));
        Assert.assertSame(this.x, this.env.constant(1).mul(this.x));
        Assert.assertTrue(this.x.mul(0).isConstant(0));
        Assert.assertSame(this.x.neg(), this.x.mul(-1));
        Assert.assertSame(this.x, this.x.add(0));
        Assert.assertSame(this.x, this.env.constant(0).add(this.x));
        Assert.assertTrue(this.x.sub(this.x).isConstant(0));
        Assert.assertSame(this.x, this.x.sub(0));
        Assert.assertSame(this.x.neg(), this.env.constant(0).sub(this.x));
        Assert.assertSame(this.x, this.x.div(1));
        Assert.assertSame(this.x.neg(), this.x.div(-1));
        Assert.assertTrue(this.x.div(this.x).isConstant(1));
        Assert.assertSame(this.x, this.x.neg().neg());
    }

    @Test
    public void constantFolding() {
        Expression five = this.env.constant(2).add(this.env.constant(3));
        Assert.assertSame(this.env.constant(5), five);
        Expression folded = this.env.apply(Primitives.EXP, this.env.constant(0));
        Assert.assertTrue(folded.isConstant(1));
        Expression power = this.env.applyValues(Primitives.POW, 2, 10);
        Assert.assertEquals(1024.0, power.to(Constant.class).value, 0);
    }

    @Test
    public void reassociation() {
        // (x + y) + 3 => x + (y + 3)
        Application sum = this.x.add(this.y).add(3).to(Application.class);
        Assert.assertSame(this.x, sum.argument(0));
        Assert.assertSame(this.y.add(3), sum.argument(1));

        Expression xy = this.x.add(this.y);
        // Created after xy, so it is ordered after it
        Expression exp = this.env.apply(Primitives.EXP, this.z);
        Assert.assertSame(this.x.add(this.y.add(exp)), xy.add(exp));
    }

    @Test
    public void reorderingPrecedesReassociation() {
        // (x + y) + z: the variable z is moved first, so nothing is re-associated
        Application sum = this.x.add(this.y).add(this.z).to(Application.class);
        Assert.assertSame(this.z, sum.argument(0));
        Assert.assertSame(this.x.add(this.y), sum.argument(1));
    }

    @Test
    public void constantsAreCollected() {
        // (x + 2) + 3 => x + 5
        Expression e = this.x.add(2).add(3);
        Assert.assertSame(this.x.add(5), e);
        Expression p = this.x.mul(2).mul(3);
        Assert.assertSame(this.x.mul(6), p);
    }

    @Test
    public void commonFactor() {
        Expression sum = this.x.mul(this.y).add(this.x.mul(this.z));
        Assert.assertSame(this.x.mul(this.y.add(this.z)), sum);
        Expression other = this.y.mul(this.x).add(this.z.mul(this.x));
        Assert.assertSame(sum, other);
        Expression twice = this.x.mul(this.y).add(this.x.mul(this.y));
        Assert.assertSame(this.x.mul(this.y.add(this.y)), twice);
    }

    @Test
    public void nvars() {
        Assert.assertEquals(0, this.env.constant(1).nvars());
        Assert.assertEquals(2, this.y.nvars());
        Assert.assertEquals(3, this.x.mul(this.z).nvars());
        Expression sin = this.env.apply(Primitives.SIN, this.x);
        Assert.assertEquals(3, sin.mul(sin).add(sin).cost());
    }

    @Test
    public void arityError() {
        Assert.assertThrows(ArityError.class, () -> this.env.apply(Primitives.ADD, this.x));
        Assert.assertThrows(ArityError.class, () -> this.env.apply(Primitives.SIN, this.x, this.y));
        Assert.assertThrows(ArityError.class, () -> this.env.variable(0));
    }

    @Test
    public void typeError() {
        Environment other = new Environment();
        Assert.assertThrows(TypeError.class, () -> this.x.add(other.variable(1)));
        Assert.assertThrows(TypeError.class, () -> this.env.applyValues(Primitives.ADD, this.x, "one"));
        Assert.assertSame(this.x.add(1), this.env.applyValues(Primitives.ADD, this.x, 1));
    }
}
