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

import io.moderntest.match.Expectation;
import io.moderntest.match.InvocationExpectation;
import io.moderntest.match.SequenceExpectation;
import io.moderntest.mock.Invocable;
import io.moderntest.output.Console;
import io.moderntest.output.LogContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Execution state of one test body: the failed flag, the failure messages in the order
 * they were recorded and the captured log.
 * <p>
 * A fresh context is created by the runner for every executed test and passed to the
 * {@link TestAction}; every expectation created from it reports back into it.
 * A context is not thread-safe. It must only be used from the thread running the
 * test body, and work spawned by the body must not assert through it concurrently.
 */
public class TestContext {

    private final TestCase testCase;
    private final List<String> failureMessages = new ArrayList<>();
    private final LogContext logContext = new LogContext();
    private boolean failed;

    public TestContext(TestCase testCase) {
        this.testCase = testCase;
    }

    // ========== Assertions ==========

    public <T> Expectation<T> expect(T actual) {
        return new Expectation<>(actual, SourceLocation.capture(), this);
    }

    public <E> SequenceExpectation<E> expect(Iterable<E> actual) {
        return new SequenceExpectation<>(actual, SourceLocation.capture(), this);
    }

    public InvocationExpectation expect(Invocable actual) {
        return new InvocationExpectation(actual, SourceLocation.capture(), this);
    }

    /**
     * Record a failure and keep going. The failure is also printed right away in the
     * compiler-style {@code file:line: error: message} format.
     */
    public void fail(SourceLocation location, String message) {
        failed = true;
        failureMessages.add(location + ": " + message);
        Console.println(Console.red(location + ": error: " + message));
    }

    /**
     * Record a failure at the current call site.
     */
    public void fail(String message) {
        fail(SourceLocation.capture(), message);
    }

    // ========== Logging ==========

    /**
     * Log a message into the test result, using SLF4J-style {@code {}} placeholders.
     */
    public void log(String format, Object... args) {
        logContext.log(format, args);
    }

    // ========== Accessors ==========

    public TestCase getTestCase() {
        return testCase;
    }

    public boolean isFailed() {
        return failed;
    }

    public List<String> getFailureMessages() {
        return Collections.unmodifiableList(failureMessages);
    }

    public String getLog() {
        return logContext.isEmpty() ? null : logContext.collect();
    }

}
