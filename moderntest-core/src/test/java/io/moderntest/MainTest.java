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
package io.moderntest;

import io.moderntest.core.TestRegistry;
import io.moderntest.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private PrintStream original;

    @BeforeEach
    void beforeEach() {
        original = Console.getOutput();
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(original);
        Console.setColorsEnabled(true);
    }

    @Test
    void testDiscoverProviders() {
        TestRegistry registry = Main.discover();
        assertEquals(4, registry.size());
        assertEquals("Sample arithmetic", registry.listAll().get(0).getName());
        assertEquals("SampleTestProvider.java", registry.listAll().get(0).getSourceFile());
    }

    @Test
    void testExecute() {
        assertEquals(0, Main.execute());
        String out = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("[       OK ] Sample mock"));
        assertTrue(out.contains("[  SKIPPED ] Sample pending"));
        assertTrue(out.contains("[  PASSED  ] 3 tests."));
    }

    @Test
    void testExecuteListOnly() {
        assertEquals(0, Main.execute("--gtest_list_tests"));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("  Sample collections"));
    }

}
