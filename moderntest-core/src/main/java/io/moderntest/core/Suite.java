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

import io.moderntest.output.Console;
import io.moderntest.output.Console.Tag;
import io.moderntest.output.JsonReportWriter;
import io.moderntest.output.JunitXmlWriter;
import io.moderntest.output.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One run over a fixed list of test cases.
 * <p>
 * Tests run sequentially in registration order on the calling thread. When any test is
 * marked {@link TestStatus#ONLY}, every other test is skipped. Tests rejected by the name
 * filter produce no result at all.
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    /** The single suite name, also used for suite-qualified filter matching */
    public static final String NAME = "ModernTest";

    private final List<TestCase> tests;

    // Configuration
    private NameFilter filter = NameFilter.ALL;
    private Path outputXml;
    private Path outputJson;
    private boolean outputConsoleSummary = true;

    private final List<ResultListener> resultListeners = new ArrayList<>();

    // Results
    private SuiteResult result;

    private Suite(List<TestCase> tests) {
        this.tests = List.copyOf(tests);
    }

    public static Suite of(TestRegistry registry) {
        return new Suite(registry.listAll());
    }

    public static Suite of(List<TestCase> tests) {
        return new Suite(tests);
    }

    // ========== Configuration (Builder Pattern) ==========

    public Suite filter(String pattern) {
        this.filter = NameFilter.compile(pattern);
        return this;
    }

    public Suite outputXml(Path outputXml) {
        this.outputXml = outputXml;
        return this;
    }

    public Suite outputJson(Path outputJson) {
        this.outputJson = outputJson;
        return this;
    }

    public Suite outputConsoleSummary(boolean outputConsoleSummary) {
        this.outputConsoleSummary = outputConsoleSummary;
        return this;
    }

    public Suite resultListener(ResultListener listener) {
        this.resultListeners.add(listener);
        return this;
    }

    // ========== Execution ==========

    public boolean hasOnly() {
        for (TestCase tc : tests) {
            if (tc.getStatus() == TestStatus.ONLY) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the tests that pass the name filter, in registration order
     */
    public List<TestCase> getSelectedTests() {
        List<TestCase> selected = new ArrayList<>();
        for (TestCase tc : tests) {
            if (filter.matchesTest(tc.getName())) {
                selected.add(tc);
            }
        }
        return selected;
    }

    public SuiteResult run() {
        result = new SuiteResult();
        result.setStartNanos(System.nanoTime());
        boolean hasOnly = hasOnly();
        List<TestCase> selected = getSelectedTests();
        logger.debug("running {} of {} tests, filter: {}, only: {}", selected.size(), tests.size(), filter, hasOnly);
        try {
            for (ResultListener listener : resultListeners) {
                notify(listener, () -> listener.onSuiteStart(this));
            }
            if (outputConsoleSummary) {
                Console.status(Tag.BANNER, "Running " + selected.size() + " "
                        + (selected.size() == 1 ? "test" : "tests") + " from 1 test suite.");
                Console.status(Tag.SEPARATOR, selected.size() + " from " + NAME);
            }
            for (TestCase tc : selected) {
                boolean skip = tc.getStatus() == TestStatus.SKIP || (hasOnly && tc.getStatus() != TestStatus.ONLY);
                TestResult tr = skip ? TestResult.skipped(tc) : execute(tc);
                result.addTestResult(tr);
                if (outputConsoleSummary) {
                    printResult(tr);
                }
                for (ResultListener listener : resultListeners) {
                    notify(listener, () -> listener.onTestEnd(tr));
                }
            }
        } finally {
            result.setEndNanos(System.nanoTime());
            for (ResultListener listener : resultListeners) {
                notify(listener, () -> listener.onSuiteEnd(result));
            }
            if (outputConsoleSummary) {
                Console.status(Tag.SEPARATOR, selected.size() + " from " + NAME
                        + " (" + Math.round(result.getDurationMillis()) + " ms total)");
                Console.println();
                result.printSummary();
            }
            if (outputXml != null) {
                JunitXmlWriter.write(result, outputXml);
            }
            if (outputJson != null) {
                JsonReportWriter.write(result, outputJson);
            }
        }
        return result;
    }

    private TestResult execute(TestCase tc) {
        for (ResultListener listener : resultListeners) {
            notify(listener, () -> listener.onTestStart(tc));
        }
        if (outputConsoleSummary) {
            Console.status(Tag.RUN, tc.getName());
        }
        TestContext context = new TestContext(tc);
        long start = System.nanoTime();
        try {
            tc.getAction().run(context);
        } catch (Throwable t) {
            String description = t.getMessage();
            context.fail(tc.getLocation(), "Unhandled exception: "
                    + (description == null || description.isBlank() ? t.getClass().getName() : description));
            logger.debug("unhandled exception in test: {}", tc.getName(), t);
        }
        double durationMillis = (System.nanoTime() - start) / 1_000_000.0;
        return TestResult.executed(context, durationMillis);
    }

    private void printResult(TestResult tr) {
        String millis = " (" + Math.round(tr.getDurationMillis()) + " ms)";
        if (tr.isSkipped()) {
            Console.status(Tag.SKIPPED, tr.getName() + millis);
        } else if (tr.isPassed()) {
            Console.status(Tag.OK, tr.getName() + millis);
        } else {
            Console.status(Tag.FAILED, tr.getName() + millis);
        }
    }

    private void notify(ResultListener listener, Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            logger.warn("result listener {} failed: {}", listener.getClass().getName(), e.getMessage());
        }
    }

    // ========== Accessors ==========

    public List<TestCase> getTests() {
        return tests;
    }

    public NameFilter getFilter() {
        return filter;
    }

    public Path getOutputXml() {
        return outputXml;
    }

    public Path getOutputJson() {
        return outputJson;
    }

    public SuiteResult getResult() {
        return result;
    }

}
