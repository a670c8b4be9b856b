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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.autodiff.engine.errors.BaseEngineException;
import org.autodiff.engine.errors.OptionsError;
import org.autodiff.engine.ir.Expression;
import org.autodiff.engine.ir.operator.Operator;
import org.autodiff.util.Utilities;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/** Developer tool: prints the derivatives of primitive operators.
 * For each operator name, the operator is applied to the variables v1..vn,
 * and the result is differentiated with respect to each variable. */
public class EngineMain {
    final EngineOptions options;
    final PrintStream defaultOutput;

    EngineMain(PrintStream defaultOutput) {
        this.options = new EngineOptions();
        this.defaultOutput = defaultOutput;
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("autodiff");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            commander.usage();
            return 1;
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.outputFile;
        if (outputFile.isEmpty())
            return this.defaultOutput;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)));
    }

    /** The derivatives of an operator applied to variables, one per variable. */
    List<Expression> derivatives(Environment environment, Expression application) {
        List<Expression> result = new ArrayList<>();
        for (int i = 1; i <= application.nvars(); i++)
            result.add(environment.derivative(application, environment.variable(i), this.options.order));
        return result;
    }

    Expression applyToVariables(Environment environment, String name) {
        Operator operator = environment.registry.lookup(name);
        if (operator == null || !operator.isDefined())
            throw new OptionsError("Unknown operator " + Utilities.singleQuote(name));
        Integer arity = operator.getArity();
        int count = arity == null ? operator.getDerivatives().size() : arity;
        Expression[] arguments = new Expression[count];
        for (int i = 0; i < count; i++)
            arguments[i] = environment.variable(i + 1);
        return environment.apply(name, arguments);
    }

    void run(PrintStream output) {
        this.options.validate();
        this.options.applyLoggingLevels();
        Environment environment = new Environment(this.options);
        List<String> names = this.options.operators;
        if (names.isEmpty()) {
            names = new ArrayList<>();
            for (Operator operator: environment.registry.operators())
                names.add(operator.name);
        }

        ObjectMapper mapper = new ObjectMapper();
        ArrayNode json = mapper.createArrayNode();
        for (String name: names) {
            Expression application = this.applyToVariables(environment, name);
            List<Expression> derivatives = this.derivatives(environment, application);
            if (this.options.emitJson) {
                ObjectNode node = json.addObject();
                node.put("operator", name);
                node.put("arity", application.childCount());
                node.put("expression", application.render());
                ArrayNode array = node.putArray("derivatives");
                for (Expression derivative: derivatives)
                    array.add(derivative.render());
                int cost = 0;
                for (Expression derivative: derivatives)
                    cost += derivative.cost();
                node.put("cost", cost);
            } else {
                String text = environment.render(derivatives);
                output.println(application.render() + ":");
                output.print(text);
                if (!text.endsWith("\n"))
                    output.println();
            }
        }
        if (this.options.emitJson)
            output.println(json.toPrettyString());
    }

    /** Run the tool, writing to the default output unless -o is given.
     * @return The exit code. */
    int execute(String... argv) {
        int exitCode = this.parseOptions(argv);
        if (exitCode != 0)
            return exitCode;
        PrintStream stream;
        try {
            stream = this.getOutputStream();
        } catch (IOException ex) {
            System.err.println("error: Error writing to output file: " + ex.getMessage());
            return 1;
        }
        try {
            this.run(stream);
        } catch (BaseEngineException ex) {
            System.err.println(ex.format());
            return 1;
        } finally {
            if (stream != this.defaultOutput)
                stream.close();
        }
        return 0;
    }

    /** Run the tool, writing to the specified stream unless -o is given.
     * @return The exit code. */
    public static int execute(PrintStream output, String... argv) {
        return new EngineMain(output).execute(argv);
    }

    public static void main(String[] argv) {
        System.exit(execute(System.out, argv));
    }
}
