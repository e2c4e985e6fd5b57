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

/**
 * Interface for receiving test results as they stream in.
 * <p>
 * Listeners are purely observational: an exception thrown by a listener is logged and
 * does not affect the run or the results.
 * <p>
 * Example usage:
 * <pre>
 * Runner.registry(registry)
 *     .resultListener(new TelemetryListener())
 *     .run();
 * </pre>
 */
public interface ResultListener {

    /**
     * Called when the suite starts execution.
     *
     * @param suite the suite about to run
     */
    default void onSuiteStart(Suite suite) {
    }

    /**
     * Called before a test body is invoked. Not called for skipped tests.
     *
     * @param testCase the test about to run
     */
    default void onTestStart(TestCase testCase) {
    }

    /**
     * Called for every result, skipped tests included.
     *
     * @param result the test result
     */
    default void onTestEnd(TestResult result) {
    }

    /**
     * Called when the suite completes execution.
     *
     * @param result the final suite result
     */
    default void onSuiteEnd(SuiteResult result) {
    }

}
