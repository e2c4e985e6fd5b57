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

import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Factory methods for mocks shaped like the {@code java.util.function} interfaces.
 * <p>
 * Usage:
 * <pre>
 * MockFunction&lt;Integer, Integer&gt; square = Mocks.function(x -&gt; x * x);
 * service.compute(square);
 * t.expect(square).toHaveBeenCalledTimes(1);
 * t.expect(square.getCall(0)).isEqualTo(Arguments.of(10));
 * </pre>
 */
public final class Mocks {

    private Mocks() {
    }

    public static <T, R> MockFunction<T, R> function(Function<T, R> behavior) {
        return new MockFunction<>(null, behavior);
    }

    /**
     * A function mock without behavior, returning the default value of {@code returnType}.
     */
    public static <T, R> MockFunction<T, R> function(Class<R> returnType) {
        return new MockFunction<>(returnType, null);
    }

    public static <T, U, R> MockBiFunction<T, U, R> biFunction(BiFunction<T, U, R> behavior) {
        return new MockBiFunction<>(null, behavior);
    }

    public static <T, U, R> MockBiFunction<T, U, R> biFunction(Class<R> returnType) {
        return new MockBiFunction<>(returnType, null);
    }

    public static <R> MockSupplier<R> supplier(Supplier<R> behavior) {
        return new MockSupplier<>(null, behavior);
    }

    public static <R> MockSupplier<R> supplier(Class<R> returnType) {
        return new MockSupplier<>(returnType, null);
    }

    public static <T> MockConsumer<T> consumer(Consumer<T> behavior) {
        return new MockConsumer<>(behavior);
    }

    public static <T> MockConsumer<T> consumer() {
        return new MockConsumer<>(null);
    }

    public static MockRunnable runnable(Runnable behavior) {
        return new MockRunnable(behavior);
    }

    public static MockRunnable runnable() {
        return new MockRunnable(null);
    }

}
