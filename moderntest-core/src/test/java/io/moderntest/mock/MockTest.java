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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class MockTest {

    @Test
    void testCallLogOrder() {
        MockFunction<Integer, Integer> square = Mocks.function(x -> x * x);

        assertEquals(100, square.apply(10));
        assertEquals(4, square.apply(2));

        assertEquals(2, square.getCallCount());
        assertEquals(Arguments.of(10), square.getCall(0));
        assertEquals(Arguments.of(2), square.getCall(1));
        assertEquals(List.of(Arguments.of(10), Arguments.of(2)), square.getCalls());
    }

    @Test
    void testCallIsRecordedEvenWhenBehaviorThrows() {
        MockFunction<String, String> broken = Mocks.function(s -> {
            throw new IllegalStateException("broken: " + s);
        });

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> broken.apply("x"));

        assertEquals("broken: x", e.getMessage());
        assertEquals(1, broken.getCallCount());
        assertEquals("x", broken.getCall(0).get(0));
    }

    @Test
    void testDefaultReturnValues() {
        assertEquals(0, Mocks.<String, Integer>function(Integer.class).apply("a"));
        assertEquals(0L, Mocks.<Long>supplier(Long.class).get());
        assertEquals(false, Mocks.<Boolean>supplier(Boolean.class).get());
        assertEquals(0.0, Mocks.<Double>supplier(Double.class).get());
        assertEquals('\0', Mocks.<Character>supplier(Character.class).get());
        assertNull(Mocks.<String>supplier(String.class).get());
        assertNull(new Mock<>().invoke());
    }

    @Test
    void testBiFunction() {
        MockBiFunction<Integer, Integer, Integer> add = Mocks.biFunction(Integer::sum);
        assertEquals(5, add.apply(2, 3));
        assertEquals(Arguments.of(2, 3), add.getCall(0));
        assertEquals(2, add.getCall(0).size());

        MockBiFunction<String, String, Boolean> noBehavior = Mocks.biFunction(Boolean.class);
        assertEquals(false, noBehavior.apply("a", "b"));
    }

    @Test
    void testConsumerAndRunnable() {
        List<String> seen = new ArrayList<>();
        MockConsumer<String> consumer = Mocks.consumer(seen::add);
        consumer.accept("one");
        consumer.accept(null);
        assertEquals(2, consumer.getCallCount());
        assertEquals(Arguments.of((Object) null), consumer.getCall(1));
        assertEquals(2, seen.size());

        MockRunnable runnable = Mocks.runnable();
        runnable.run();
        runnable.run();
        assertEquals(2, runnable.getCallCount());
        assertEquals(0, runnable.getCall(0).size());

        int[] counter = new int[1];
        MockRunnable counting = Mocks.runnable(() -> counter[0]++);
        counting.run();
        assertEquals(1, counter[0]);

        MockConsumer<Integer> silent = Mocks.consumer();
        silent.accept(7);
        assertEquals(Arguments.of(7), silent.getCall(0));
    }

    @Test
    void testSupplierBehavior() {
        MockSupplier<String> supplier = Mocks.supplier(() -> "value");
        assertEquals("value", supplier.get());
        assertEquals(1, supplier.getCallCount());
    }

    @Test
    void testUsableAsPlainFunction() {
        MockFunction<String, Integer> length = Mocks.function(String::length);
        Function<String, Integer> function = length;
        List<Integer> lengths = new ArrayList<>();
        for (String s : List.of("a", "bb", "ccc")) {
            lengths.add(function.apply(s));
        }
        assertEquals(List.of(1, 2, 3), lengths);
        assertEquals(3, length.getCallCount());
    }

    @Test
    void testCallsAreReadOnly() {
        MockFunction<Integer, Integer> identity = Mocks.function(x -> x);
        identity.apply(1);
        assertThrows(UnsupportedOperationException.class, () -> identity.getCalls().clear());
        assertThrows(IndexOutOfBoundsException.class, () -> identity.getCall(1));
        assertEquals("Mock{calls=1}", identity.toString());
    }

    @Test
    void testArguments() {
        Arguments args = Arguments.of("a", 1, null);
        assertEquals(3, args.size());
        assertEquals("a", args.get(0));
        assertEquals(1, (int) args.get(1));
        assertNull(args.get(2));
        assertEquals("(a, 1, null)", args.toString());
        assertEquals(Arguments.of("a", 1, null), args);
        assertEquals(Arguments.of("a", 1, null).hashCode(), args.hashCode());
        assertNotEquals(Arguments.of("a", 1), args);
        assertEquals(Arguments.of(new int[]{1}), Arguments.of(new int[]{1}));
        assertEquals("()", Arguments.of().toString());
        assertThrows(UnsupportedOperationException.class, () -> args.asList().add("x"));
    }

}
