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
package io.moderntest.match;

import io.moderntest.core.SourceLocation;
import io.moderntest.core.TestContext;

/**
 * Fluent assertion on a single actual value.
 * <p>
 * Usage:
 * <pre>
 * t.expect(1 + 1).isEqualTo(2);
 * t.expect(2 * 2).not().isEqualTo(5);
 * t.expect(Math.abs(value)).isLessThan(1.0);
 * </pre>
 * Matchers are terminal and non-fatal: a failed matcher records a failure against the
 * {@link TestContext} that created this expectation and the test body keeps running.
 * {@link #not()} flips the negation flag, so applying it twice cancels out.
 *
 * @param <T> type of the actual value
 */
public class Expectation<T> {

    protected final T actual;
    protected final SourceLocation location;
    protected final TestContext context;
    protected boolean inverted;

    public Expectation(T actual, SourceLocation location, TestContext context) {
        this.actual = actual;
        this.location = location;
        this.context = context;
    }

    public Expectation<T> not() {
        inverted = !inverted;
        return this;
    }

    // ========== Relational Matchers ==========

    public void isEqualTo(Object expected) {
        check(expected, "==", Values.equal(actual, expected));
    }

    public void isNotEqualTo(Object expected) {
        check(expected, "!=", !Values.equal(actual, expected));
    }

    public void isGreaterThan(Object expected) {
        Integer cmp = Values.compare(actual, expected);
        check(expected, ">", cmp != null && cmp > 0);
    }

    public void isLessThan(Object expected) {
        Integer cmp = Values.compare(actual, expected);
        check(expected, "<", cmp != null && cmp < 0);
    }

    private void check(Object expected, String operator, boolean raw) {
        boolean result = inverted != raw;
        if (!result) {
            fail((inverted ? "Expected NOT [" : "Expected [") + Values.render(actual) + "] "
                    + operator + " [" + Values.render(expected) + "]");
        }
    }

    protected void fail(String message) {
        context.fail(location, message);
    }

    // ========== Accessors ==========

    public T getActual() {
        return actual;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isInverted() {
        return inverted;
    }

}
