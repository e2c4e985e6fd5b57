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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A call-recording stand-in for a function-shaped dependency.
 * <p>
 * Every invocation appends its arguments to the call log before anything else happens,
 * so a call is recorded even when the behavior throws. Without a behavior, the default
 * value of the declared return type is returned ({@code 0}, {@code false} etc. for
 * primitive wrappers, {@code null} otherwise).
 * <p>
 * Not thread-safe: a mock belongs to the test body that created it.
 *
 * @param <R> the return type
 */
public class Mock<R> implements Invocable {

    private static final Map<Class<?>, Object> DEFAULTS = Map.of(
            Integer.class, 0,
            Long.class, 0L,
            Short.class, (short) 0,
            Byte.class, (byte) 0,
            Double.class, 0.0d,
            Float.class, 0.0f,
            Character.class, '\0',
            Boolean.class, false
    );

    private final List<Arguments> calls = new ArrayList<>();
    private final Class<R> returnType;
    private final Function<Arguments, R> behavior;

    public Mock() {
        this(null, null);
    }

    public Mock(Class<R> returnType) {
        this(returnType, null);
    }

    public Mock(Class<R> returnType, Function<Arguments, R> behavior) {
        this.returnType = returnType;
        this.behavior = behavior;
    }

    public R invoke(Object... args) {
        Arguments arguments = Arguments.of(args);
        calls.add(arguments);
        if (behavior != null) {
            return behavior.apply(arguments);
        }
        return defaultValue(returnType);
    }

    @SuppressWarnings("unchecked")
    static <R> R defaultValue(Class<R> type) {
        if (type == null) {
            return null;
        }
        return (R) DEFAULTS.get(type);
    }

    @Override
    public List<Arguments> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    @Override
    public String toString() {
        return "Mock{calls=" + calls.size() + "}";
    }

}
