/*
 * The MIT License
 *
 * Copyright 2025 ModernTest contributors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.moderntest;

import io.moderntest.cli.RunCommand;
import io.moderntest.core.TestProvider;
import io.moderntest.core.TestRegistry;
import io.moderntest.output.LogContext;

import java.util.ServiceLoader;

/**
 * Command-line entry point. Collects the tests of every {@link TestProvider} found on the
 * class path ({@code META-INF/services/io.moderntest.core.TestProvider}) and runs them.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return RunCommand.execute(discover(), args);
    }

    static TestRegistry discover() {
        TestRegistry.Builder builder = TestRegistry.builder();
        for (TestProvider provider : ServiceLoader.load(TestProvider.class)) {
            LogContext.RUNTIME_LOGGER.debug("test provider: {}", provider.getClass().getName());
            provider.register(builder);
        }
        return builder.build();
    }

}
