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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Comparison and rendering rules shared by the matchers.
 */
public final class Values {

    private Values() {
    }

    /**
     * Boxed numbers of different types are equal when their numeric values are equal,
     * so {@code 2} equals {@code 2L} and {@code 2.0}. Floating values count by their exact
     * binary value, so {@code 0.1f} is not {@code 0.1d}. NaN is never equal to anything.
     */
    public static boolean equal(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            if (isNaN(a) || isNaN(b)) {
                return false;
            }
            Integer cmp = compareNumbers(a, b);
            return cmp != null && cmp == 0;
        }
        return Objects.deepEquals(actual, expected);
    }

    /**
     * @return negative, zero or positive like {@link Comparable#compareTo}, or null when
     * the two values cannot be ordered against each other
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Integer compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return null;
        }
        if (actual instanceof Number a && expected instanceof Number b) {
            if (isNaN(a) || isNaN(b)) {
                return null;
            }
            return compareNumbers(a, b);
        }
        if (actual instanceof Comparable c && actual.getClass().isInstance(expected)) {
            try {
                return c.compareTo(expected);
            } catch (ClassCastException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isNaN(Number n) {
        return (n instanceof Double d && d.isNaN()) || (n instanceof Float f && f.isNaN());
    }

    private static Integer compareNumbers(Number a, Number b) {
        BigDecimal left = toBigDecimal(a);
        BigDecimal right = toBigDecimal(b);
        if (left == null || right == null) { // infinities
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return left.compareTo(right);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            // exact binary value, so 0.1f and 0.1d stay distinct
            return Double.isInfinite(d) || Double.isNaN(d) ? null : new BigDecimal(d);
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Object[] array) {
            return Arrays.deepToString(array);
        }
        if (value.getClass().isArray()) {
            return Arrays.deepToString(new Object[]{value}).replaceAll("^\\[|\\]$", "");
        }
        if (value instanceof Iterable<?> iterable && !(value instanceof java.util.Collection)) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            Iterator<?> iterator = iterable.iterator();
            while (iterator.hasNext()) {
                joiner.add(render(iterator.next()));
            }
            return joiner.toString();
        }
        return String.valueOf(value);
    }

}
