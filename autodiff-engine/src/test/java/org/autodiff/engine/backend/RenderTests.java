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
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;
import org.autodiff.engine.ir.operator.Primitives;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class RenderTests {
    final Environment env = new Environment();
    final Variable x = this.env.variable(1);
    final Variable y = this.env.variable(2);
    final Variable z = this.env.variable(3);

    String render(Expression... roots) {
        return this.env.render(List.of(roots));
    }

    @Test
    public void leaves() {
        Assert.assertEquals("v1", this.render(this.x));
        Assert.assertEquals("2.5", this.render(this.env.constant(2.5)));
        Assert.assertEquals("v1, v2", this.render(this.x, this.y));
        Assert.assertEquals("", this.render());
    }

    @Test
    public void sharing() {
        Expression sum = this.x.add(this.y);
        Expression square = sum.mul(sum);
        Assert.assertEquals("""
                let
                  r0 = v1 + v2
                in
                  r0 * r0
                end
                """, this.render(square));
        Assert.assertEquals("r0 * r0", square.toString().lines().toList().get(3).trim());
    }

    @Test
    public void sharingAcrossRoots() {
        Expression sum = this.x.add(this.y);
        Expression product = sum.mul(this.z);
        Assert.assertEquals("v3 * (v1 + v2)", this.render(product));
        Assert.assertEquals("""
                let
                  r0 = v1 + v2
                in
                  v3 * r0, r0
                end
                """, this.render(product, sum));
    }

    @Test
    public void nestedBindings() {
        Expression sum = this.x.add(this.y);
        Expression sin = this.env.apply(Primitives.SIN, sum);
        Expression e = sin.mul(sin).sub(sum);
        // sum is first reached inside sin, so it is named after it
        Assert.assertEquals("""
                let
                  r0 = sin(r1)
                  r1 = v1 + v2
                in
                  r0 * r0 - r1
                end
                """, this.render(e));

        Expression f = sin.mul(sin).add(sum);
        Assert.assertEquals("""
                let
                  r0 = v1 + v2
                  r1 = sin(r0)
                in
                  r0 + r1 * r1
                end
                """, this.render(f));
    }

    @Test
    public void leavesAreNotBound() {
        Expression e = this.x.mul(this.x).add(this.x);
        Assert.assertEquals("v1 + v1 * v1", this.render(e));
    }

    @Test
    public void precedence() {
        Assert.assertEquals("v1 + v2 * v3", this.render(this.x.add(this.y.mul(this.z))));
        Assert.assertEquals("v1 * (v2 + v3)", this.render(this.x.mul(this.y.add(this.z))));
        Assert.assertEquals("v1 - (v2 - v3)", this.render(this.x.sub(this.y.sub(this.z))));
        Assert.assertEquals("v1 - v2 - v3", this.render(this.x.sub(this.y).sub(this.z)));
        Assert.assertEquals("v1 / (v2 * v3)", this.render(this.x.div(this.y.mul(this.z))));
        Assert.assertEquals("v1 * v2 / v3", this.render(this.x.mul(this.y).div(this.z)));
        Assert.assertEquals("-(v1 + v2)", this.render(this.x.add(this.y).neg()));
        Assert.assertEquals("v2 * -v1", this.render(this.x.neg().mul(this.y)));
        Assert.assertEquals("-(v1 * v2)", this.render(this.x.mul(this.y).neg()));
    }

    @Test
    public void calls() {
        Expression e = this.env.apply(Primitives.POW, this.x.add(1), this.env.apply(Primitives.SIN, this.y));
        Assert.assertEquals("pow(v1 + 1.0,sin(v2))", this.render(e));
        Assert.assertEquals("sin(v2) * 2.0", this.render(this.env.apply(Primitives.SIN, this.y).mul(2)));
    }

    @Test
    public void usageCounts() {
        Expression sum = this.x.add(this.y);
        Expression e = sum.mul(sum).mul(sum);
        UsageCounter counter = new UsageCounter(this.env);
        counter.apply(e);
        Assert.assertEquals(0, counter.getCount(this.x));
        Assert.assertEquals(List.of(sum), counter.shared());
    }
}
