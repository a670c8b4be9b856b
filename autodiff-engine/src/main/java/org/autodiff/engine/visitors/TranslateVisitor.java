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

package org.autodiff.engine.visitors;

import org.autodiff.engine.Environment;
import org.autodiff.engine.errors.InternalEngineError;
import org.autodiff.engine.ir.Expression;
import org.autodiff.util.Utilities;

import java.util.IdentityHashMap;
import java.util.Map;

/** A visitor which computes a translation for every expression node, in postorder.
 * Each distinct node is translated once, even if it is reachable along many paths.
 * @param <T> Type of the translation. */
public abstract class TranslateVisitor<T> extends ExpressionVisitor {
    static class TranslationMap<T> {
        final Map<Expression, T> translation;

        TranslationMap() {
            this.translation = new IdentityHashMap<>();
        }

        public void putNew(Expression node, T translation) {
            Utilities.putNew(this.translation, node, translation);
        }

        public T get(Expression node) {
            return Utilities.getExists(this.translation, node);
        }

        public boolean containsKey(Expression node) {
            return this.translation.containsKey(node);
        }
    }

    final TranslationMap<T> translationMap;

    protected TranslateVisitor(Environment environment) {
        super(environment);
        this.translationMap = new TranslationMap<>();
    }

    protected void set(Expression node, T translation) {
        if (this.translationMap.containsKey(node)) {
            T old = this.translationMap.get(node);
            if (old != translation)
                throw new InternalEngineError("Changing value of " + node + " from " +
                        old + " to " + translation, node);
            return;
        }
        this.translationMap.putNew(node, translation);
    }

    public T get(Expression node) {
        return this.translationMap.get(node);
    }

    @Override
    public VisitDecision preorder(Expression node) {
        if (this.translationMap.containsKey(node))
            return VisitDecision.STOP;
        return VisitDecision.CONTINUE;
    }

    /** Translate a node, reusing the translations computed by previous calls. */
    public T translate(Expression node) {
        node.accept(this);
        return this.get(node);
    }
}
