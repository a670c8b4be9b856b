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

import java.util.Comparator;

/** Total order on canonical expressions, used to put the arguments of commutative
 * operators in a unique order.  Variables come first, then applications, then constants.
 * Variables are ordered by index, applications by creation order, constants by value. */
public final class ExpressionOrder implements Comparator<Expression> {
    public enum Category {
        VARIABLE,
        APPLICATION,
        CONSTANT
    }

    public static final ExpressionOrder INSTANCE = new ExpressionOrder();

    private ExpressionOrder() {}

    @Override
    public int compare(Expression left, Expression right) {
        if (left == right)
            return 0;
        int result = left.category().compareTo(right.category());
        if (result != 0)
            return result;
        return switch (left.category()) {
            case VARIABLE -> Integer.compare(left.to(Variable.class).index, right.to(Variable.class).index);
            case APPLICATION -> Long.compare(left.to(Application.class).id, right.to(Application.class).id);
            case CONSTANT -> Double.compare(left.to(Constant.class).value, right.to(Constant.class).value);
        };
    }
}
