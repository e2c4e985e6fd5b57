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

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin wrapper over a JSON document (object or array) with path-based reads
 * and deterministic pretty printing that keeps key order.
 */
public class Json {

    private final DocumentContext doc;
    private final boolean array;
    private final boolean object;
    private final String prefix;

    private String prefix(String path) {
        return path.charAt(0) == '$' ? path : prefix + path;
    }

    public static Json of(Object any) {
        if (any == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (any instanceof String s) {
            if (s.isBlank()) {
                throw new IllegalArgumentException("input string must not be empty or blank");
            }
            return new Json(JsonPath.parse(parse(s)));
        } else if (any instanceof List || any instanceof Map) {
            return new Json(JsonPath.parse(any));
        } else {
            throw new IllegalArgumentException("not a JSON object or array: " + any.getClass().getName());
        }
    }

    /**
     * Parse text keeping the key order of objects.
     *
     * @throws RuntimeException if the text is not a JSON object or array
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new RuntimeException("invalid json: input is null or blank");
        }
        Object result = JSONValue.parseKeepingOrder(json);
        if (!(result instanceof Map || result instanceof List)) {
            throw new RuntimeException("invalid json: not a JSON object or array");
        }
        return result;
    }

    private Json(DocumentContext doc) {
        this.doc = doc;
        array = (doc.json() instanceof List);
        object = (doc.json() instanceof Map);
        prefix = array ? "$" : "$.";
    }

    public <T> T get(String path) {
        return doc.read(prefix(path));
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String path, T defaultValue) {
        return (T) getOptional(path).orElse(defaultValue);
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            return Optional.ofNullable(get(path));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean pathExists(String path) {
        try {
            return doc.read(prefix(path)) != null;
        } catch (PathNotFoundException e) {
            return false;
        }
    }

    public boolean isArray() {
        return array;
    }

    public boolean isObject() {
        return object;
    }

    public <T> T value() {
        return doc.read("$");
    }

    @Override
    public String toString() {
        return doc.jsonString();
    }

    public String toStringPretty() {
        StringBuilder sb = new StringBuilder();
        formatRecurse(value(), sb, 0);
        return sb.toString();
    }

    private static void formatRecurse(Object o, StringBuilder sb, int depth) {
        if (o == null) {
            sb.append("null");
        } else if (o instanceof List<?> list) {
            sb.append('[');
            if (!list.isEmpty()) {
                sb.append('\n');
            }
            Iterator<?> iterator = list.iterator();
            while (iterator.hasNext()) {
                pad(sb, depth + 1);
                formatRecurse(iterator.next(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            if (!list.isEmpty()) {
                pad(sb, depth);
            }
            sb.append(']');
        } else if (o instanceof Map<?, ?> map) {
            sb.append('{');
            if (!map.isEmpty()) {
                sb.append('\n');
            }
            Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<?, ?> entry = iterator.next();
                pad(sb, depth + 1);
                sb.append('"').append(escape(String.valueOf(entry.getKey()))).append('"');
                sb.append(':').append(' ');
                formatRecurse(entry.getValue(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            if (!map.isEmpty()) {
                pad(sb, depth);
            }
            sb.append('}');
        } else if (o instanceof Double d && (d.isNaN() || d.isInfinite())) {
            sb.append("null");
        } else if (o instanceof Number || o instanceof Boolean) {
            sb.append(o);
        } else {
            sb.append('"').append(escape(o.toString())).append('"');
        }
    }

    private static void pad(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(' ').append(' ');
        }
    }

    public static String escape(String raw) {
        return JSONValue.escape(raw, JSONStyle.LT_COMPRESS);
    }

}
