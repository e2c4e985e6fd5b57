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
package io.moderntest.common;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void testObject() {
        Json json = Json.of("{ \"a\": 1, \"b\": { \"c\": \"d\" } }");

        assertTrue(json.isObject());
        assertFalse(json.isArray());
        assertEquals(1, json.<Integer>get("a").intValue());
        assertEquals("d", json.get("b.c"));
        assertEquals("d", json.get("$.b.c"));
        assertTrue(json.pathExists("b"));
        assertFalse(json.pathExists("x"));
        assertEquals(Optional.empty(), json.getOptional("x.y"));
        assertEquals("fallback", json.get("missing", "fallback"));
    }

    @Test
    void testArray() {
        Json json = Json.of("[1, 2, 3]");
        assertTrue(json.isArray());
        assertEquals(2, json.<Integer>get("[1]").intValue());
        assertEquals(List.of(1, 2, 3), json.value());
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> Json.of(null));
        assertThrows(IllegalArgumentException.class, () -> Json.of("  "));
        assertThrows(IllegalArgumentException.class, () -> Json.of(42));
        assertThrows(RuntimeException.class, () -> Json.of("\"just a string\""));
        assertThrows(RuntimeException.class, () -> Json.parse("{ broken"));
    }

    @Test
    void testParseKeepsKeyOrder() {
        Map<String, Object> map = Json.of("{ \"z\": 1, \"a\": 2, \"m\": 3 }").value();
        assertEquals(List.of("z", "a", "m"), List.copyOf(map.keySet()));
    }

    @Test
    void testToStringPretty() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "a \"quoted\" value");
        map.put("count", 2);
        map.put("items", List.of(1, 2));
        map.put("empty", new LinkedHashMap<>());
        map.put("missing", null);

        String expected = """
            {
              "name": "a \\"quoted\\" value",
              "count": 2,
              "items": [
                1,
                2
              ],
              "empty": {},
              "missing": null
            }""";
        assertEquals(expected, Json.of(map).toStringPretty());
    }

    @Test
    void testToStringPrettyIsParseable() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ratio", 0.25);
        map.put("flags", List.of(true, false));
        Json json = Json.of(Json.of(map).toStringPretty());
        assertEquals(0.25, json.<Double>get("ratio").doubleValue());
        assertEquals(List.of(true, false), json.get("flags"));
    }

}
