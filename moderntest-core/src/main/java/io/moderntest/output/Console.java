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

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * Terminal writer for the run log. Every line printed here is also mirrored, without
 * escape codes, to the {@code moderntest.console} logger at TRACE.
 * <p>
 * Status lines use fixed-width bracketed tags, see {@link Tag}.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final String ESC = "\u001B[";
    private static final String RESET = ESC + "0m";
    private static final String BOLD = ESC + "1m";
    private static final String RED = ESC + "31m";
    private static final String GREEN = ESC + "32m";
    private static final String YELLOW = ESC + "33m";
    private static final String GRAY = ESC + "90m";

    private static final Pattern ESCAPES = Pattern.compile("\u001B\\[[;\\d]*m");

    /**
     * Status tags of the run log. Labels are padded to ten columns inside the brackets.
     */
    public enum Tag {

        BANNER("==========", GREEN),
        SEPARATOR("----------", GREEN),
        RUN(" RUN      ", GREEN),
        OK("       OK ", GREEN),
        PASSED("  PASSED  ", GREEN),
        SKIPPED("  SKIPPED ", GRAY),
        FAILED("  FAILED  ", RED + BOLD);

        private final String label;
        private final String style;

        Tag(String label, String style) {
            this.label = "[" + label + "]";
            this.style = style;
        }

        public String getLabel() {
            return label;
        }

    }

    private static boolean colorsEnabled = colorsByDefault();
    private static PrintStream out = System.out;

    private Console() {
    }

    private static boolean colorsByDefault() {
        if (System.getenv("NO_COLOR") != null) { // https://no-color.org/
            return false;
        }
        String force = System.getenv("FORCE_COLOR");
        if (force != null) {
            return !"0".equals(force);
        }
        return System.console() != null || System.getenv("COLORTERM") != null;
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    public static PrintStream getOutput() {
        return out;
    }

    private static String paint(String style, String text) {
        return colorsEnabled ? style + text + RESET : text;
    }

    public static String red(String text) {
        return paint(RED, text);
    }

    public static String green(String text) {
        return paint(GREEN, text);
    }

    public static String gray(String text) {
        return paint(GRAY, text);
    }

    public static String warn(String text) {
        return paint(YELLOW, text);
    }

    public static String fail(String text) {
        return paint(RED + BOLD, text);
    }

    /**
     * Formats a status line: the styled tag, one space, then the plain text.
     */
    public static String tagged(Tag tag, String text) {
        return paint(tag.style, tag.label) + " " + text;
    }

    public static void status(Tag tag, String text) {
        println(tagged(tag, text));
    }

    static String stripAnsi(String text) {
        return ESCAPES.matcher(text).replaceAll("");
    }

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

    public static void println() {
        out.println();
    }

}
