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
package io.moderntest.cli;

import io.moderntest.core.Runner;
import io.moderntest.core.Suite;
import io.moderntest.core.SuiteResult;
import io.moderntest.core.TestCase;
import io.moderntest.core.TestConfig;
import io.moderntest.core.TestRegistry;
import io.moderntest.output.Console;
import io.moderntest.output.LogContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs the tests of a registry from command-line arguments.
 * <p>
 * Usage examples:
 * <pre>
 * # Run all tests (uses moderntest.json if present)
 * app
 *
 * # Run tests whose name contains "Math", with an XML report
 * app --gtest_filter=*Math* --gtest_output=xml:target/report.xml
 *
 * # Same, long form
 * app --filter "*Math*" --output target/report.xml
 *
 * # List the tests without running them
 * app --list-tests
 * </pre>
 * Arguments that are not recognized are ignored.
 */
@Command(
        name = "moderntest",
        mixinStandardHelpOptions = true,
        versionProvider = RunCommand.VersionProvider.class,
        description = "Run the registered tests"
)
public class RunCommand implements Callable<Integer> {

    static final String XML_PREFIX = "xml:";

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = RunCommand.class.getPackage().getImplementationVersion();
            return new String[]{"ModernTest " + (version == null ? "dev" : version)};
        }
    }

    @Option(
            names = {"--gtest_filter", "--filter"},
            description = "Glob pattern on test names ('*' and '?' wildcards)"
    )
    String filter;

    @Option(
            names = {"--gtest_output", "--output"},
            description = "Path of the XML report (an 'xml:' prefix is accepted)"
    )
    String output;

    @Option(
            names = {"--json"},
            description = "Path of the JSON summary report"
    )
    String json;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"--gtest_color"},
            description = "Colored output: 'no' disables it"
    )
    String gtestColor;

    @Option(
            names = {"--gtest_list_tests", "--list-tests"},
            description = "List the test names without running them"
    )
    boolean listTests;

    @Option(
            names = {"--config"},
            description = "Path to project file (default: moderntest.json)"
    )
    String configFile;

    @Option(
            names = {"--log-level"},
            description = "Runtime log level (trace, debug, info, warn, error)"
    )
    String logLevel;

    private final TestRegistry registry;

    private TestConfig config;

    public RunCommand(TestRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parse the arguments, run and return the process exit code.
     */
    public static int execute(TestRegistry registry, String... args) {
        CommandLine cmd = new CommandLine(new RunCommand(registry))
                .setUnmatchedArgumentsAllowed(true)
                .setOut(new PrintWriter(Console.getOutput(), true))
                .setErr(new PrintWriter(Console.getOutput(), true));
        int exitCode = cmd.execute(args);
        cmd.getOut().flush();
        return exitCode;
    }

    @Override
    public Integer call() {
        loadConfig();

        String effectiveLogLevel = resolveLogLevel();
        if (effectiveLogLevel != null) {
            LogContext.setRuntimeLogLevel(effectiveLogLevel);
        }
        Boolean color = resolveColor();
        if (color != null) {
            Console.setColorsEnabled(color);
        }

        Runner.Builder builder = Runner.registry(registry);
        if (config != null) {
            config.applyTo(builder);
        }
        // command line overrides the config file
        if (filter != null) {
            builder.filter(filter);
        }
        if (output != null) {
            builder.outputXml(stripXmlPrefix(output));
        }
        if (json != null) {
            builder.outputJson(json);
        }

        Suite suite = builder.buildSuite();
        if (listTests) {
            listTests(suite);
            return 0;
        }
        SuiteResult result = suite.run();
        return result.getExitCode();
    }

    private void listTests(Suite suite) {
        Console.println(Suite.NAME + ".");
        for (TestCase tc : suite.getSelectedTests()) {
            Console.println("  " + tc.getName());
        }
    }

    private void loadConfig() {
        Path configPath = Path.of(configFile != null ? configFile : TestConfig.DEFAULT_FILE);
        if (configFile == null && !Files.exists(configPath)) {
            return;
        }
        try {
            config = TestConfig.load(configPath);
            LogContext.RUNTIME_LOGGER.debug("Loaded: {}", configPath);
        } catch (Exception e) {
            String message = e.getCause() == null ? e.getMessage() : e.getMessage() + ": " + e.getCause().getMessage();
            Console.println(Console.warn("Failed to load config: " + message));
        }
    }

    private String resolveLogLevel() {
        if (logLevel != null) {
            return logLevel;
        }
        return config == null ? null : config.getLogLevel();
    }

    /**
     * @return null when color is left to auto-detection
     */
    private Boolean resolveColor() {
        if (noColor || "no".equalsIgnoreCase(gtestColor)) {
            return false;
        }
        if ("yes".equalsIgnoreCase(gtestColor)) {
            return true;
        }
        return config == null ? null : config.getColor();
    }

    static String stripXmlPrefix(String value) {
        return value.startsWith(XML_PREFIX) ? value.substring(XML_PREFIX.length()) : value;
    }

    // ========== Getters for programmatic access ==========

    public String getFilter() {
        return filter;
    }

    public String getOutput() {
        return output;
    }

    public boolean isListTests() {
        return listTests;
    }

    public TestConfig getConfig() {
        return config;
    }

}
