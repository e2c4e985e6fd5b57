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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TestConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseMinimalConfig() {
        TestConfig config = TestConfig.parse("{}");

        assertNull(config.getFilter());
        assertNull(config.getColor());
        assertNull(config.getLogLevel());
        assertNull(config.getOutputXml());
        assertNull(config.getOutputJson());
    }

    @Test
    void testParseFullConfig() {
        String json = """
            {
              "filter": "*Math*",
              "color": false,
              "logLevel": "debug",
              "output": {
                "xml": "target/moderntest.xml",
                "json": "target/moderntest.json"
              }
            }
            """;

        TestConfig config = TestConfig.parse(json);

        assertEquals("*Math*", config.getFilter());
        assertEquals(Boolean.FALSE, config.getColor());
        assertEquals("debug", config.getLogLevel());
        assertEquals("target/moderntest.xml", config.getOutputXml());
        assertEquals("target/moderntest.json", config.getOutputJson());
    }

    @Test
    void testParseInvalidConfig() {
        assertThrows(RuntimeException.class, () -> TestConfig.parse("not json"));
        assertThrows(RuntimeException.class, () -> TestConfig.parse("[1, 2]"));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("moderntest.json");
        Files.writeString(file, """
            { "filter": "ModernTest.*", "output": { "xml": "out.xml" } }
            """);

        TestConfig config = TestConfig.load(file);

        assertEquals("ModernTest.*", config.getFilter());
        assertEquals("out.xml", config.getOutputXml());
        assertNull(config.getOutputJson());
    }

    @Test
    void testLoadMissingFile() {
        RuntimeException e = assertThrows(RuntimeException.class,
                () -> TestConfig.load(tempDir.resolve("missing.json")));
        assertTrue(e.getMessage().startsWith("Failed to load config from: "));
    }

    @Test
    void testApplyToBuilder() {
        TestConfig config = TestConfig.parse("""
            { "filter": "*a*", "output": { "xml": "a.xml", "json": "a.json" } }
            """);
        Runner.Builder builder = config.applyTo(Runner.builder());

        assertEquals("*a*", builder.getFilter());
        assertEquals(Path.of("a.xml"), builder.getOutputXml());
        assertEquals(Path.of("a.json"), builder.getOutputJson());

        // later builder calls override the file
        builder.filter("*b*");
        assertEquals("*b*", builder.getFilter());
    }

    @Test
    void testApplyEmptyConfigKeepsBuilderValues() {
        Runner.Builder builder = Runner.builder().filter("keep").outputXml("keep.xml");
        TestConfig.parse("{}").applyTo(builder);

        assertEquals("keep", builder.getFilter());
        assertEquals(Path.of("keep.xml"), builder.getOutputXml());
    }

}
