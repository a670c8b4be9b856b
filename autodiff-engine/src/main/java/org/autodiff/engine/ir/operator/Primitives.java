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
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.Variable;

/** The built-in operators of every environment.
 * All operators are declared first, then defined in dependency order:
 * the derivative templates of an operator are built from operators which
 * are already declared, and are canonicalized when they are built. */
public final class Primitives {
    private Primitives() {}

    public static final String NEG = "neg";
    public static final String ADD = "add";
    public static final String SUB = "sub";
    public static final String MUL = "mul";
    public static final String DIV = "div";
    public static final String EXP = "exp";
    public static final String LOG = "log";
    public static final String SIN = "sin";
    public static final String COS = "cos";
    public static final String TAN = "tan";
    public static final String SQRT = "sqrt";
    public static final String POW = "pow";
    public static final String SIGN = "sign";
    public static final String ABS = "abs";
    public static final String TANH = "tanh";

    public static final int ADDITIVE_PRECEDENCE = 1;
    public static final int MULTIPLICATIVE_PRECEDENCE = 2;
    public static final int PREFIX_PRECEDENCE = 3;

    static void declare(OperatorRegistry registry) {
        registry.declare(NEG, 1, false, false,
                Operator.Syntax.PREFIX, "-", PREFIX_PRECEDENCE);
        registry.declare(ADD, 2, true, true,
                Operator.Syntax.INFIX, "+", ADDITIVE_PRECEDENCE);
        registry.declare(SUB, 2, false, false,
                Operator.Syntax.INFIX, "-", ADDITIVE_PRECEDENCE);
        registry.declare(MUL, 2, true, true,
                Operator.Syntax.INFIX, "*", MULTIPLICATIVE_PRECEDENCE);
        registry.declare(DIV, 2, false, false,
                Operator.Syntax.INFIX, "/", MULTIPLICATIVE_PRECEDENCE);
        for (String unary: new String[] { EXP, LOG, SIN, COS, TAN, SQRT, SIGN, ABS, TANH })
            registry.declare(unary, 1, false, false);
        registry.declare(POW, 2, false, false);
    }

    /** Register all primitive operators in an environment. */
    public static void register(Environment environment) {
        OperatorRegistry registry = environment.registry;
        declare(registry);

        Variable v1 = environment.variable(1);
        Variable v2 = environment.variable(2);
        Expression one = environment.constant(1);

        registry.define(NEG, INumericEvaluator.unary(x -> -x),
                environment.constant(-1));
        registry.define(ADD, INumericEvaluator.binary(Double::sum),
                one, one);
        registry.define(SUB, INumericEvaluator.binary((x, y) -> x - y),
                one, environment.constant(-1));
        registry.define(MUL, INumericEvaluator.binary((x, y) -> x * y),
                v2, v1);
        registry.define(DIV, INumericEvaluator.binary((x, y) -> x / y),
                one.div(v2),
                v1.div(v2.mul(v2)).neg());

        Expression exp = environment.apply(EXP, v1);
        registry.define(EXP, INumericEvaluator.unary(Math::exp), exp);
        registry.define(LOG, INumericEvaluator.unary(Math::log), one.div(v1));

        Expression sin = environment.apply(SIN, v1);
        Expression cos = environment.apply(COS, v1);
        registry.define(SIN, INumericEvaluator.unary(Math::sin), cos);
        registry.define(COS, INumericEvaluator.unary(Math::cos), sin.neg());
        registry.define(TAN, INumericEvaluator.unary(Math::tan), one.div(cos.mul(cos)));

        Expression sqrt = environment.apply(SQRT, v1);
        registry.define(SQRT, INumericEvaluator.unary(Math::sqrt), environment.constant(0.5).div(sqrt));

        Expression pow = environment.apply(POW, v1, v2);
        registry.define(POW, INumericEvaluator.binary(Math::pow),
                v2.mul(environment.apply(POW, v1, v2.sub(1))),
                environment.apply(LOG, v1).mul(pow));

        registry.define(SIGN, INumericEvaluator.unary(Math::signum), environment.constant(0));
        registry.define(ABS, INumericEvaluator.unary(Math::abs), environment.apply(SIGN, v1));

        Expression tanh = environment.apply(TANH, v1);
        registry.define(TANH, INumericEvaluator.unary(Math::tanh), one.sub(tanh.mul(tanh)));
    }
}
