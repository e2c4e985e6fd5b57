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

import java.util.Set;

/**
 * File name and line number of a registration or assertion call site.
 */
public record SourceLocation(String file, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0);

    // frames of these classes are skipped when looking for the caller
    private static final Set<String> INTERNAL_CLASSES = Set.of(
            "io.moderntest.ModernTest",
            "io.moderntest.core.SourceLocation",
            "io.moderntest.core.TestRegistry",
            "io.moderntest.core.TestContext",
            "io.moderntest.match.Expectation",
            "io.moderntest.match.SequenceExpectation",
            "io.moderntest.match.InvocationExpectation"
    );

    private static final StackWalker WALKER = StackWalker.getInstance();

    /**
     * @return the location of the first caller outside the framework entry points
     */
    public static SourceLocation capture() {
        return WALKER.walk(frames -> frames
                .filter(f -> !isInternal(f.getClassName()))
                .findFirst()
                .map(f -> new SourceLocation(f.getFileName() == null ? UNKNOWN.file : f.getFileName(), Math.max(f.getLineNumber(), 0)))
                .orElse(UNKNOWN));
    }

    private static boolean isInternal(String className) {
        int pos = className.indexOf('$');
        String outer = pos == -1 ? className : className.substring(0, pos);
        return INTERNAL_CLASSES.contains(outer);
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }

}
