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

/**
 * A named, registered unit of behavior. Immutable once registered.
 */
public final class TestCase {

    private final String name;
    private final TestAction action;
    private final TestStatus status;
    private final SourceLocation location;

    public TestCase(String name, TestAction action, TestStatus status, SourceLocation location) {
        if (name == null) {
            throw new IllegalArgumentException("test name must not be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("test action must not be null: " + name);
        }
        this.name = name;
        this.action = action;
        this.status = status == null ? TestStatus.NORMAL : status;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public String getName() {
        return name;
    }

    public TestAction getAction() {
        return action;
    }

    public TestStatus getStatus() {
        return status;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSourceFile() {
        return location.file();
    }

    public int getSourceLine() {
        return location.line();
    }

    @Override
    public String toString() {
        return name + " [" + status + "] " + location;
    }

}
