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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one executed or skipped test case within a single run.
 * Name and source location are always copied from the originating {@link TestCase}.
 */
public class TestResult {

    private final String name;
    private final String sourceFile;
    private final int sourceLine;
    private final boolean passed;
    private final boolean skipped;
    private final double durationMillis;
    private final List<String> failureMessages;
    private final String log;

    private TestResult(TestCase testCase, boolean passed, boolean skipped, double durationMillis,
                       List<String> failureMessages, String log) {
        this.name = testCase.getName();
        this.sourceFile = testCase.getSourceFile();
        this.sourceLine = testCase.getSourceLine();
        this.passed = passed;
        this.skipped = skipped;
        this.durationMillis = Math.max(0, durationMillis);
        this.failureMessages = Collections.unmodifiableList(new ArrayList<>(failureMessages));
        this.log = log;
    }

    public static TestResult skipped(TestCase testCase) {
        return new TestResult(testCase, false, true, 0, List.of(), null);
    }

    public static TestResult executed(TestContext context, double durationMillis) {
        return new TestResult(context.getTestCase(), !context.isFailed(), false, durationMillis,
                context.getFailureMessages(), context.getLog());
    }

    public String getName() {
        return name;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getSourceLine() {
        return sourceLine;
    }

    /**
     * Meaningless when {@link #isSkipped()} is true.
     */
    public boolean isPassed() {
        return passed;
    }

    public boolean isFailed() {
        return !skipped && !passed;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public double getDurationMillis() {
        return durationMillis;
    }

    public List<String> getFailureMessages() {
        return failureMessages;
    }

    public String getFailureMessage() {
        return failureMessages.isEmpty() ? null : failureMessages.get(0);
    }

    public String getLog() {
        return log;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("file", sourceFile);
        map.put("line", sourceLine);
        map.put("status", skipped ? "skipped" : passed ? "passed" : "failed");
        map.put("durationMillis", durationMillis);
        if (!failureMessages.isEmpty()) {
            map.put("failures", new ArrayList<>(failureMessages));
        }
        if (log != null) {
            map.put("log", log);
        }
        return map;
    }

    @Override
    public String toString() {
        return name + " [" + (skipped ? "skipped" : passed ? "passed" : "failed") + "]";
    }

}
