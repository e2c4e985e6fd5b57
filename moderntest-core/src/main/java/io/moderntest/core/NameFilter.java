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

import io.moderntest.output.LogContext;
import org.slf4j.Logger;

import java.util.regex.Pattern;

/**
 * Glob-style filter over test names.
 * <p>
 * {@code *} matches any run of characters (including none), {@code ?} matches exactly one
 * character and everything else is literal. The whole name must match. An empty pattern
 * matches every name. If the pattern cannot be compiled the filter falls back to a plain
 * substring test, so filtering never fails a run.
 */
public class NameFilter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final NameFilter ALL = new NameFilter("", null);

    private final String pattern;
    private final Pattern regex;

    private NameFilter(String pattern, Pattern regex) {
        this.pattern = pattern;
        this.regex = regex;
    }

    public static NameFilter compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return ALL;
        }
        try {
            return new NameFilter(pattern, Pattern.compile(toRegex(pattern), Pattern.DOTALL));
        } catch (RuntimeException e) {
            logger.debug("filter '{}' falls back to substring match: {}", pattern, e.getMessage());
            return new NameFilter(pattern, null);
        }
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return sb.toString();
    }

    public boolean matches(String candidate) {
        if (pattern.isEmpty()) {
            return true;
        }
        if (candidate == null) {
            return false;
        }
        if (regex == null) {
            return candidate.contains(pattern);
        }
        return regex.matcher(candidate).matches();
    }

    /**
     * A test passes the filter if either its bare name or its suite-qualified name
     * ({@code ModernTest.<name>}) matches.
     */
    public boolean matchesTest(String testName) {
        return matches(testName) || matches(Suite.NAME + "." + testName);
    }

    public String getPattern() {
        return pattern;
    }

    public boolean isSubstringFallback() {
        return !pattern.isEmpty() && regex == null;
    }

    @Override
    public String toString() {
        return pattern.isEmpty() ? "*" : pattern;
    }

}
