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

package org.autodiff.util;

import org.autodiff.engine.Environment;
import org.autodiff.engine.canonical.Canonicalizer;
import org.autodiff.engine.errors.InternalEngineError;
import org.autodiff.engine.errors.OptionsError;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class IndentStreamTests {
    @Test
    public void indentation() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder).setIndentAmount(2);
        stream.append("a {")
                .increase()
                .append("b\nc")
                .newline()
                .decrease()
                .append("}")
                .join(", ", List.of("x", "y"));
        Assert.assertEquals("a {\n  b\n  c\n}x, y", builder.toString());
    }

    @Test
    public void negativeIndent() {
        IndentStream stream = new IndentStream(new StringBuilder());
        Assert.assertThrows(InternalEngineError.class, stream::decrease);
    }

    @Test
    public void logging() {
        StringBuilder builder = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(builder);
        int level = Logger.INSTANCE.setLoggingLevel("Canonicalizer", 3);
        try {
            Environment env = new Environment();
            builder.setLength(0);
            env.variable(1).mul(1);
            Assert.assertTrue(builder.toString().contains("mul[v1, 1.0] => v1"));
        } finally {
            Logger.INSTANCE.setLoggingLevel(Canonicalizer.class, level);
            Logger.INSTANCE.setDebugStream(previous);
        }
        Assert.assertThrows(OptionsError.class, () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
    }
}
