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
package io.moderntest.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Log collector for a single test body.
 * Messages logged from a test go to the report ({@code system-out} in the XML report)
 * and cascade to the {@link #TEST_LOGGER} SLF4J category.
 */
public class LogContext {

    // ========== Category Loggers ==========

    /** Logger for the framework itself (Suite, Runner, registry, reports, config) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("moderntest.runtime");

    /** Logger for messages logged from inside test bodies */
    public static final Logger TEST_LOGGER = LoggerFactory.getLogger("moderntest.test");

    /** Logger for console output (test progress and summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("moderntest.console");

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Set the runtime log level for SLF4J/Logback.
     * Uses reflection to avoid compile-time dependency on Logback.
     * Sets the level on the "moderntest" logger, which affects all subcategories.
     *
     * @param level the log level (trace, debug, info, warn, error)
     * @return true if the level was set successfully, false if Logback is not available
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("Runtime log level not supported: not using Logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "moderntest");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("Set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("Failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

    // ========== Logging ==========

    /**
     * Log a message using SLF4J-style {@code {}} placeholders.
     */
    public void log(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        buffer.append(message).append('\n');
        TEST_LOGGER.info(message);
    }

    public String collect() {
        return buffer.toString();
    }

    public boolean isEmpty() {
        return buffer.length() == 0;
    }

}
