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
package io.moderntest.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Main entry point for running tests programmatically.
 * <p>
 * Example usage:
 * <pre>
 * SuiteResult result = Runner.registry(registry)
 *     .filter("*Math*")
 *     .outputXml("target/moderntest.xml")
 *     .run();
 * </pre>
 */
public final class Runner {

    private Runner() {
    }

    /**
     * Start building a run over the tests of a registry.
     */
    public static Builder registry(TestRegistry registry) {
        return new Builder().registry(registry);
    }

    /**
     * Get a new builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<TestCase> tests = new ArrayList<>();
        private final List<ResultListener> resultListeners = new ArrayList<>();

        private String filter;
        private Path outputXml;
        private Path outputJson;
        private boolean outputConsoleSummary = true;

        Builder() {
        }

        /**
         * Add all tests of a registry, in registration order.
         */
        public Builder registry(TestRegistry registry) {
            if (registry != null) {
                tests.addAll(registry.listAll());
            }
            return this;
        }

        public Builder tests(Collection<TestCase> values) {
            if (values != null) {
                tests.addAll(values);
            }
            return this;
        }

        /**
         * Set the glob-style name filter ({@code *} and {@code ?} wildcards).
         */
        public Builder filter(String pattern) {
            this.filter = pattern;
            return this;
        }

        /**
         * Write the XML report to this file. No report is written when unset.
         */
        public Builder outputXml(String path) {
            if (path != null && !path.isEmpty()) {
                this.outputXml = Path.of(path);
            }
            return this;
        }

        public Builder outputXml(Path path) {
            this.outputXml = path;
            return this;
        }

        /**
         * Write the JSON summary report to this file. No report is written when unset.
         */
        public Builder outputJson(String path) {
            if (path != null && !path.isEmpty()) {
                this.outputJson = Path.of(path);
            }
            return this;
        }

        public Builder outputJson(Path path) {
            this.outputJson = path;
            return this;
        }

        /**
         * Enable/disable progress lines and the summary on the console.
         */
        public Builder outputConsoleSummary(boolean enabled) {
            this.outputConsoleSummary = enabled;
            return this;
        }

        /**
         * Add a result listener for streaming test results.
         */
        public Builder resultListener(ResultListener listener) {
            if (listener != null) {
                resultListeners.add(listener);
            }
            return this;
        }

        /**
         * Execute the tests. This is the terminal operation.
         *
         * @return the test results
         */
        public SuiteResult run() {
            return buildSuite().run();
        }

        /**
         * Build the Suite without running it.
         */
        public Suite buildSuite() {
            Suite suite = Suite.of(tests);
            suite.filter(filter);
            suite.outputXml(outputXml);
            suite.outputJson(outputJson);
            suite.outputConsoleSummary(outputConsoleSummary);
            for (ResultListener listener : resultListeners) {
                suite.resultListener(listener);
            }
            return suite;
        }

        String getFilter() {
            return filter;
        }

        Path getOutputXml() {
            return outputXml;
        }

        Path getOutputJson() {
            return outputJson;
        }

        @Override
        public String toString() {
            return "Runner.Builder{tests=" + tests.size() + ", filter=" + filter + "}";
        }
    }

}
