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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import org.autodiff.engine.errors.OptionsError;
import org.autodiff.util.Logger;
import org.autodiff.util.Utilities;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Options of the engine, and command-line options of {@link EngineMain}. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class EngineOptions {
    @Parameter(names = "--reverse", description = "Differentiate using the experimental reverse-mode strategy")
    public boolean reverseMode = false;
    @Parameter(names = "--order", description = "Order of the derivatives to compute")
    public int order = 1;
    @Parameter(names = "--json", description = "Emit the derivatives as JSON")
    public boolean emitJson = false;
    @Parameter(names = "-o", description = "Output file; stdout if not specified")
    public String outputFile = "";
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = {"-h", "--help"}, help = true, description = "Show this message and exit")
    public boolean help = false;
    @Parameter(description = "Names of the operators to differentiate")
    public List<String> operators = new ArrayList<>();

    /** Throws {@link OptionsError} if the options are inconsistent. */
    public void validate() {
        if (this.order < 1)
            throw new OptionsError("Derivative order must be at least 1, got " + this.order);
    }

    /** Set the logging levels requested with -T. */
    public void applyLoggingLevels() {
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new OptionsError("-T option must be followed by 'class=number'; could not parse " +
                        Utilities.singleQuote(entry.getKey() + "=" + entry.getValue()));
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    @Override
    public String toString() {
        return "EngineOptions{" +
                "\n\treverseMode=" + this.reverseMode +
                ",\n\torder=" + this.order +
                ",\n\temitJson=" + this.emitJson +
                ",\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                ",\n\tloggingLevel=" + this.loggingLevel +
                ",\n\toperators=" + this.operators +
                '}';
    }
}
