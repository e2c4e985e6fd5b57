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

import io.moderntest.core.Suite;
import io.moderntest.core.SuiteResult;
import io.moderntest.core.TestResult;
import org.slf4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Generates the XML report in the JUnit / Google Test format understood by CI systems
 * and IDE test adapters.
 * <p>
 * Output:
 * <pre>
 * &lt;testsuites name="AllTests" tests="N" failures="N" skipped="N" errors="0" time="secs"&gt;
 *   &lt;testsuite name="ModernTest" tests="N" failures="N" skipped="N" errors="0" time="secs"&gt;
 *     &lt;testcase name="test" classname="ModernTest" file="Foo.java" line="12" time="secs" status="run" result="completed"&gt;
 *       &lt;failure message="Foo.java:14: Expected [2] == [3]"&gt;...&lt;/failure&gt;
 *       &lt;system-out&gt;log&lt;/system-out&gt;
 *     &lt;/testcase&gt;
 *   &lt;/testsuite&gt;
 * &lt;/testsuites&gt;
 * </pre>
 */
public final class JunitXmlWriter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private JunitXmlWriter() {
    }

    /**
     * Write the report. This is best-effort: when the file cannot be written a warning
     * is logged and the run is otherwise unaffected.
     *
     * @param result the suite result to convert
     * @param path   the report file
     * @return true if the report was written
     */
    public static boolean write(SuiteResult result, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toXml(result));
            logger.debug("XML report written: {}", path);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to write XML report to {}: {}", path, e.getMessage());
            return false;
        }
    }

    public static String toXml(SuiteResult result) {
        DecimalFormat formatter = (DecimalFormat) NumberFormat.getNumberInstance(Locale.US);
        formatter.applyPattern("0.###");
        String time = formatter.format(result.getDurationMillis() / 1000.0);

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<testsuites");
        appendCounts(xml, result, time);
        xml.append(" name=\"AllTests\">\n");

        xml.append("  <testsuite name=\"").append(escape(Suite.NAME)).append("\"");
        appendCounts(xml, result, time);
        xml.append(">\n");

        for (TestResult tr : result.getTestResults()) {
            writeTestcase(xml, tr, formatter);
        }

        xml.append("  </testsuite>\n");
        xml.append("</testsuites>\n");
        return xml.toString();
    }

    private static void appendCounts(StringBuilder xml, SuiteResult result, String time) {
        xml.append(" tests=\"").append(result.getTestCount()).append("\"");
        xml.append(" failures=\"").append(result.getFailedCount()).append("\"");
        xml.append(" skipped=\"").append(result.getSkippedCount()).append("\"");
        xml.append(" disabled=\"0\"");
        xml.append(" errors=\"0\"");
        xml.append(" time=\"").append(time).append("\"");
    }

    private static void writeTestcase(StringBuilder xml, TestResult tr, DecimalFormat formatter) {
        xml.append("    <testcase");
        xml.append(" name=\"").append(escape(tr.getName())).append("\"");
        xml.append(" classname=\"").append(escape(Suite.NAME)).append("\"");
        xml.append(" file=\"").append(escape(tr.getSourceFile())).append("\"");
        xml.append(" line=\"").append(tr.getSourceLine()).append("\"");
        xml.append(" time=\"").append(formatter.format(tr.getDurationMillis() / 1000.0)).append("\"");
        xml.append(" status=\"").append(tr.isSkipped() ? "notrun" : "run").append("\"");
        xml.append(" result=\"").append(tr.isSkipped() ? "skipped" : "completed").append("\"");

        boolean hasBody = tr.isSkipped() || tr.isFailed() || tr.getLog() != null;
        if (!hasBody) {
            xml.append("/>\n");
            return;
        }
        xml.append(">\n");
        if (tr.isSkipped()) {
            xml.append("      <skipped message=\"skipped\"/>\n");
        } else {
            for (String message : tr.getFailureMessages()) {
                String escaped = escape(message);
                xml.append("      <failure message=\"").append(escaped).append("\" type=\"\">");
                xml.append(escaped);
                xml.append("</failure>\n");
            }
        }
        if (tr.getLog() != null) {
            xml.append("      <system-out>").append(escape(tr.getLog())).append("</system-out>\n");
        }
        xml.append("    </testcase>\n");
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }

}
