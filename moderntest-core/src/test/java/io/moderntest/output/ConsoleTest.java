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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    private final PrintStream original = Console.getOutput();

    @AfterEach
    void afterEach() {
        Console.setOutput(original);
        Console.setColorsEnabled(true);
    }

    @Test
    void testColorFormatting() {
        Console.setColorsEnabled(true);

        String red = Console.red("error");
        assertTrue(red.contains("\u001B[31m"));
        assertTrue(red.contains("error"));
        assertTrue(red.endsWith("\u001B[0m"));

        assertTrue(Console.green("success").contains("\u001B[32m"));
        assertTrue(Console.gray("skipped").contains("\u001B[90m"));
        assertEquals("\u001B[31m\u001B[1mfailed\u001B[0m", Console.fail("failed"));
    }

    @Test
    void testColorFormattingDisabled() {
        Console.setColorsEnabled(false);

        assertFalse(Console.isColorsEnabled());
        assertEquals("error", Console.red("error"));
        assertEquals("success", Console.green("success"));
        assertEquals("failed", Console.fail("failed"));
        assertEquals("warning", Console.warn("warning"));
    }

    @Test
    void testStripAnsi() {
        Console.setColorsEnabled(true);
        assertEquals("[  FAILED  ] name", Console.stripAnsi(Console.fail("[  FAILED  ]") + " name"));
    }

    @Test
    void testPrintlnGoesToOutput() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        Console.println("hello");
        Console.println();

        assertEquals("hello" + System.lineSeparator() + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testTagLabelsShareOneWidth() {
        for (Console.Tag tag : Console.Tag.values()) {
            assertEquals(12, tag.getLabel().length(), tag.name());
        }
        assertEquals("[ RUN      ]", Console.Tag.RUN.getLabel());
        assertEquals("[       OK ]", Console.Tag.OK.getLabel());
        assertEquals("[  FAILED  ]", Console.Tag.FAILED.getLabel());
    }

    @Test
    void testTaggedStylesOnlyTheTag() {
        Console.setColorsEnabled(true);
        assertEquals("\u001B[31m\u001B[1m[  FAILED  ]\u001B[0m Math.add", Console.tagged(Console.Tag.FAILED, "Math.add"));
        assertEquals("\u001B[90m[  SKIPPED ]\u001B[0m 2 tests.", Console.tagged(Console.Tag.SKIPPED, "2 tests."));
        Console.setColorsEnabled(false);
        assertEquals("[==========] Running 1 test", Console.tagged(Console.Tag.BANNER, "Running 1 test"));
    }

    @Test
    void testStatusPrintsTaggedLine() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);

        Console.status(Console.Tag.RUN, "Math.add");
        Console.status(Console.Tag.OK, "Math.add (0 ms)");

        assertEquals("[ RUN      ] Math.add" + System.lineSeparator()
                + "[       OK ] Math.add (0 ms)" + System.lineSeparator(), buffer.toString(StandardCharsets.UTF_8));
    }

}
