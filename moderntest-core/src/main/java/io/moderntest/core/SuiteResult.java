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

import io.moderntest.common.Json;
import io.moderntest.output.Console;
import io.moderntest.output.Console.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of one run, in execution order. A new instance is created for every run.
 */
public class SuiteResult {

    private final List<TestResult> testResults = new ArrayList<>();
    private long startNanos;
    private long endNanos;

    public SuiteResult() {
    }

    public void setStartNanos(long startNanos) {
        this.startNanos = startNanos;
    }

    public void setEndNanos(long endNanos) {
        this.endNanos = endNanos;
    }

    public void addTestResult(TestResult result) {
        testResults.add(result);
    }

    public List<TestResult> getTestResults() {
        return Collections.unmodifiableList(testResults);
    }

    // ========== Aggregation ==========

    public int getTestCount() {
        return testResults.size();
    }

    public int getPassedCount() {
        return (int) testResults.stream().filter(r -> !r.isSkipped() && r.isPassed()).count();
    }

    public int getFailedCount() {
        return (int) testResults.stream().filter(TestResult::isFailed).count();
    }

    public int getSkippedCount() {
        return (int) testResults.stream().filter(TestResult::isSkipped).count();
    }

    public boolean isPassed() {
        return getFailedCount() == 0;
    }

    public boolean isFailed() {
        return getFailedCount() > 0;
    }

    public double getDurationMillis() {
        return Math.max(0, endNanos - startNanos) / 1_000_000.0;
    }

    public List<TestResult> getFailedTests() {
        List<TestResult> failed = new ArrayList<>();
        for (TestResult tr : testResults) {
            if (tr.isFailed()) {
                failed.add(tr);
            }
        }
        return failed;
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (TestResult tr : testResults) {
            errors.addAll(tr.getFailureMessages());
        }
        return errors;
    }

    /**
     * @return 0 when no test failed (an all-skipped run included), 1 otherwise
     */
    public int getExitCode() {
        return isFailed() ? 1 : 0;
    }

    // ========== Serialization ==========

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        List<Map<String, Object>> tests = new ArrayList<>();
        for (TestResult tr : testResults) {
            tests.add(tr.toJson());
        }
        map.put("suite", Suite.NAME);
        map.put("tests", tests);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("test_count", getTestCount());
        summary.put("passed", getPassedCount());
        summary.put("failed", getFailedCount());
        summary.put("skipped", getSkippedCount());
        summary.put("duration_millis", getDurationMillis());
        summary.put("status", isFailed() ? "failed" : "passed");
        map.put("summary", summary);
        return map;
    }

    public String toJsonPretty() {
        return Json.of(toJson()).toStringPretty();
    }

    // ========== Console Output ==========

    /**
     * Print the end-of-run summary: counts and the names of failed tests.
     */
    public void printSummary() {
        int total = getTestCount();
        int passed = getPassedCount();
        int skipped = getSkippedCount();
        int failed = getFailedCount();

        Console.status(Tag.BANNER, total + " " + plural(total) + " from 1 test suite ran. ("
                + Math.round(getDurationMillis()) + " ms total)");
        Console.status(Tag.PASSED, passed + " " + plural(passed) + ".");
        if (skipped > 0) {
            Console.status(Tag.SKIPPED, skipped + " " + plural(skipped) + ".");
        }
        if (failed > 0) {
            Console.status(Tag.FAILED, failed + " " + plural(failed) + ", listed below:");
            for (TestResult tr : getFailedTests()) {
                Console.status(Tag.FAILED, tr.getName());
            }
            Console.println();
            Console.println(" " + failed + " FAILED " + (failed == 1 ? "TEST" : "TESTS"));
        }
    }

    private static String plural(int count) {
        return count == 1 ? "test" : "tests";
    }

}
