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
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.visitors.ExpressionVisitor;
import org.autodiff.engine.visitors.VisitDecision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Counts how many times each application is referenced from a set of roots.
 * The arguments of an application are only visited the first time it is reached.
 * Variables and constants are not counted: they are cheap to repeat. */
public class UsageCounter extends ExpressionVisitor {
    /** Keeps the order in which applications were first reached, in preorder. */
    final Map<Application, Integer> counts;

    public UsageCounter(Environment environment) {
        super(environment);
        this.counts = new LinkedHashMap<>();
    }

    @Override
    public VisitDecision preorder(Application node) {
        int count = this.counts.getOrDefault(node, 0);
        this.counts.put(node, count + 1);
        if (count > 0)
            return VisitDecision.STOP;
        return VisitDecision.CONTINUE;
    }

    public int getCount(Expression expression) {
        return this.counts.getOrDefault(expression, 0);
    }

    /** Applications reached more than once, in the order they were first reached. */
    public List<Application> shared() {
        List<Application> result = new ArrayList<>();
        for (Map.Entry<Application, Integer> entry: this.counts.entrySet())
            if (entry.getValue() > 1)
                result.add(entry.getKey());
        return result;
    }
}
