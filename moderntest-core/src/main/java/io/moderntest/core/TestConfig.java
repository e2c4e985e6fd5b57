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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Project configuration loaded from {@code moderntest.json}.
 * <p>
 * Example:
 * <pre>
 * {
 *   "filter": "*Math*",
 *   "color": false,
 *   "logLevel": "debug",
 *   "output": {
 *     "xml": "target/moderntest.xml",
 *     "json": "target/moderntest.json"
 *   }
 * }
 * </pre>
 * Every field is optional. Command-line options take precedence over these values.
 */
public class TestConfig {

    public static final String DEFAULT_FILE = "moderntest.json";

    private String filter;
    private Boolean color;
    private String logLevel;
    private String outputXml;
    private String outputJson;

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static TestConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + configPath, e);
        }
    }

    /**
     * @throws RuntimeException if the text is not a JSON object
     */
    public static TestConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        TestConfig config = new TestConfig();
        j.<String>getOptional("filter").ifPresent(config::setFilter);
        j.<Boolean>getOptional("color").ifPresent(config::setColor);
        j.<String>getOptional("logLevel").ifPresent(config::setLogLevel);
        if (j.pathExists("output")) {
            j.<String>getOptional("output.xml").ifPresent(config::setOutputXml);
            j.<String>getOptional("output.json").ifPresent(config::setOutputJson);
        }
        return config;
    }

    /**
     * Copy the run settings into a builder. Values set on the builder afterwards win.
     */
    public Runner.Builder applyTo(Runner.Builder builder) {
        if (filter != null) {
            builder.filter(filter);
        }
        if (outputXml != null) {
            builder.outputXml(outputXml);
        }
        if (outputJson != null) {
            builder.outputJson(outputJson);
        }
        return builder;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    /**
     * @return null when the file does not say, leaving color to auto-detection
     */
    public Boolean getColor() {
        return color;
    }

    public void setColor(Boolean color) {
        this.color = color;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

    public String getOutputXml() {
        return outputXml;
    }

    public void setOutputXml(String outputXml) {
        this.outputXml = outputXml;
    }

    public String getOutputJson() {
        return outputJson;
    }

    public void setOutputJson(String outputJson) {
        this.outputJson = outputJson;
    }

}
