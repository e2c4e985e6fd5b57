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
import io.moderntest.mock.Arguments;
import io.moderntest.mock.Invocable;

/**
 * Expectation on a call-recording value such as a {@link io.moderntest.mock.Mock}.
 */
public class InvocationExpectation extends Expectation<Invocable> {

    public InvocationExpectation(Invocable actual, SourceLocation location, TestContext context) {
        super(actual, location, context);
    }

    @Override
    public InvocationExpectation not() {
        super.not();
        return this;
    }

    public void toHaveBeenCalledTimes(int times) {
        int count = actual.getCallCount();
        boolean match = count == times;
        if (inverted == match) {
            fail("Mock call count mismatch. Expected" + (inverted ? " NOT " : " ") + times + ", actual: " + count);
        }
    }

    public void toHaveBeenCalled() {
        int count = actual.getCallCount();
        boolean called = count > 0;
        if (inverted == called) {
            fail(inverted ? "Expected mock NOT to have been called, actual calls: " + count
                    : "Expected mock to have been called, actual calls: 0");
        }
    }

    public void toHaveBeenCalledWith(Object... args) {
        Arguments expected = Arguments.of(args);
        boolean found = actual.getCalls().contains(expected);
        if (inverted == found) {
            fail("Expected mock" + (inverted ? " NOT" : "") + " to have been called with "
                    + expected + ", actual calls: " + actual.getCalls());
        }
    }

}
