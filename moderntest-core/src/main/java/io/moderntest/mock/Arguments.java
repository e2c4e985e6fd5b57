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
package io.moderntest.mock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * The argument tuple of a single mock invocation, in parameter order.
 * Two tuples are equal when their values are pairwise equal.
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(Collections.emptyList());

    private final List<Object> values;

    private Arguments(List<Object> values) {
        this.values = values;
    }

    public static Arguments of(Object... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        // nulls are legal argument values, so List.of() cannot be used
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))));
    }

    @SuppressWarnings("unchecked")
    public <T> T get(int index) {
        return (T) values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Object> asList() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arguments)) {
            return false;
        }
        return Arrays.deepEquals(values.toArray(), ((Arguments) o).values.toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values.toArray());
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Object value : values) {
            joiner.add(value instanceof Object[] array ? Arrays.deepToString(array) : String.valueOf(value));
        }
        return joiner.toString();
    }

}
