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

import io.moderntest.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of declared test cases.
 * <p>
 * Tests are kept in declaration order and never reordered or removed. Duplicate names
 * are legal and run independently. Registration is expected to complete before a run
 * starts; the runner works on a snapshot taken when the run begins.
 * <p>
 * Example usage:
 * <pre>
 * TestRegistry registry = TestRegistry.builder()
 *     .test("Math works", t -&gt; t.expect(1 + 1).isEqualTo(2))
 *     .skip("Not ready", t -&gt; t.expect(false).isEqualTo(true))
 *     .build();
 * </pre>
 */
public class TestRegistry {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final TestRegistry GLOBAL = new TestRegistry();

    private final List<TestCase> tests = new ArrayList<>();

    public TestRegistry() {
    }

    /**
     * The process-wide registry used by {@link io.moderntest.ModernTest}.
     */
    public static TestRegistry global() {
        return GLOBAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void register(String name, TestAction action, TestStatus status, SourceLocation location) {
        TestCase testCase = new TestCase(name, action, status, location);
        tests.add(testCase);
        logger.trace("registered: {}", testCase);
    }

    public List<TestCase> listAll() {
        return Collections.unmodifiableList(tests);
    }

    public int size() {
        return tests.size();
    }

    // ========== Builder ==========

    public static class Builder {

        private final TestRegistry registry = new TestRegistry();

        Builder() {
        }

        public Builder test(String name, TestAction action) {
            registry.register(name, action, TestStatus.NORMAL, SourceLocation.capture());
            return this;
        }

        public Builder skip(String name, TestAction action) {
            registry.register(name, action, TestStatus.SKIP, SourceLocation.capture());
            return this;
        }

        /**
         * Register a focused test: while any ONLY test exists, all others are skipped.
         */
        public Builder only(String name, TestAction action) {
            registry.register(name, action, TestStatus.ONLY, SourceLocation.capture());
            return this;
        }

        public TestRegistry build() {
            return registry;
        }

    }

}
