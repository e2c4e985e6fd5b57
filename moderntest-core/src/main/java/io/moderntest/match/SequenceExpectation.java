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
 * Expectation on a sequence-like value, adding containment and emptiness matchers.
 * <p>
 * Both follow the same rule: the matcher fails when the negation flag and the observed
 * condition agree, i.e. found-and-negated or not-found-and-not-negated.
 *
 * @param <E> element type
 */
public class SequenceExpectation<E> extends Expectation<Iterable<E>> {

    public SequenceExpectation(Iterable<E> actual, SourceLocation location, TestContext context) {
        super(actual, location, context);
    }

    @Override
    public SequenceExpectation<E> not() {
        super.not();
        return this;
    }

    public void toContain(Object element) {
        if (actual == null) {
            fail("Expected a sequence" + (inverted ? " NOT" : "") + " to contain ["
                    + Values.render(element) + "], actual: null");
            return;
        }
        Sequence<E> sequence = Sequences.of(actual);
        boolean found = sequence.contains(element);
        if (inverted == found) {
            fail("Expected " + Values.render(sequence) + (inverted ? " NOT" : "")
                    + " to contain [" + Values.render(element) + "]");
        }
    }

    public void isEmpty() {
        if (actual == null) {
            fail("Expected a sequence" + (inverted ? " NOT" : "") + " to be empty, actual: null");
            return;
        }
        Sequence<E> sequence = Sequences.of(actual);
        boolean empty = sequence.isEmpty();
        if (inverted == empty) {
            fail("Expected " + Values.render(sequence) + (inverted ? " NOT" : "") + " to be empty");
        }
    }

}
