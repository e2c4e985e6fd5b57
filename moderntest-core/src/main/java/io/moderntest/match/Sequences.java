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

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;

/**
 * Adapters from common Java values to {@link Sequence}.
 */
public final class Sequences {

    private Sequences() {
    }

    @SuppressWarnings("unchecked")
    public static <E> Sequence<E> of(Iterable<E> iterable) {
        if (iterable == null) {
            throw new IllegalArgumentException("iterable must not be null");
        }
        if (iterable instanceof Sequence) {
            return (Sequence<E>) iterable;
        }
        if (iterable instanceof Collection) {
            return new CollectionSequence<>((Collection<E>) iterable);
        }
        return new IterableSequence<>(iterable);
    }

    @SafeVarargs
    public static <E> Sequence<E> of(E... elements) {
        return new CollectionSequence<>(Arrays.asList(elements));
    }

    /**
     * Adapts text to a sequence of characters.
     * {@code contains} accepts a {@link Character} or a {@link CharSequence} (substring test).
     */
    public static Sequence<Character> ofChars(CharSequence text) {
        return new CharSequenceSequence(text);
    }

    static class CollectionSequence<E> implements Sequence<E> {

        private final Collection<E> collection;

        CollectionSequence(Collection<E> collection) {
            this.collection = collection;
        }

        @Override
        public boolean isEmpty() {
            return collection.isEmpty();
        }

        @Override
        public boolean contains(Object element) {
            try {
                return collection.contains(element);
            } catch (ClassCastException | NullPointerException e) {
                // some collections reject foreign types or nulls instead of answering false
                return false;
            }
        }

        @Override
        public Iterator<E> iterator() {
            return collection.iterator();
        }

        @Override
        public String toString() {
            return collection.toString();
        }

    }

    static class IterableSequence<E> implements Sequence<E> {

        private final Iterable<E> iterable;

        IterableSequence(Iterable<E> iterable) {
            this.iterable = iterable;
        }

        @Override
        public boolean isEmpty() {
            return !iterable.iterator().hasNext();
        }

        @Override
        public boolean contains(Object element) {
            for (E e : iterable) {
                if (Objects.equals(e, element)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Iterator<E> iterator() {
            return iterable.iterator();
        }

        @Override
        public String toString() {
            return Values.render(iterable);
        }

    }

    static class CharSequenceSequence implements Sequence<Character> {

        private final CharSequence text;

        CharSequenceSequence(CharSequence text) {
            this.text = text;
        }

        @Override
        public boolean isEmpty() {
            return text.length() == 0;
        }

        @Override
        public boolean contains(Object element) {
            if (element instanceof Character c) {
                return text.toString().indexOf(c) != -1;
            }
            if (element instanceof CharSequence s) {
                return text.toString().contains(s);
            }
            return false;
        }

        @Override
        public Iterator<Character> iterator() {
            return text.chars().mapToObj(c -> (char) c).iterator();
        }

        @Override
        public String toString() {
            return text.toString();
        }

    }

}
