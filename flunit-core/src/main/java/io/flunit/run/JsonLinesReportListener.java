/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
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
package io.flunit.run;

import io.flunit.log.LogContext;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link ResultListener} that streams results to a JSON Lines (.jsonl) file, one line
 * per test as it completes.
 * <pre>
 * {"t":"run","time":"2025-12-16T10:30:00Z","threads":4,"tests":12}
 * {"t":"test","name":"com.example.MathTests.ADDITION","outcome":"passed","results":[...],"ms":12}
 * {"t":"run_end","tests":12,"passed":11,"failed":1,"skipped":0,"results":30,"resultsFailed":1,"ms":345}
 * </pre>
 * Write errors are logged, never thrown: a broken report must not fail the run.
 */
public class JsonLinesReportListener implements ResultListener {

    public static final String FILE_NAME = "flunit-results.jsonl";

    private static final Logger logger = LogContext.REPORT_LOGGER;
    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ISO_INSTANT;

    private final Path outputDir;
    private final Path jsonlPath;
    private BufferedWriter writer;

    public JsonLinesReportListener(Path outputDir) {
        this.outputDir = outputDir;
        this.jsonlPath = outputDir.resolve(FILE_NAME);
    }

    @Override
    public void onRunStart(TestRun run) {
        try {
            Files.createDirectories(outputDir);
            writer = Files.newBufferedWriter(jsonlPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            Map<String, Object> header = new LinkedHashMap<>();
            header.put("t", "run");
            header.put("time", ISO_FORMAT.format(Instant.now()));
            header.put("threads", run.getThreadCount());
            header.put("tests", run.getTests().size());
            writeLine(JSONValue.toJSONString(header));
            logger.debug("JSON Lines report started: {}", jsonlPath);
        } catch (IOException e) {
            logger.warn("Failed to start JSON Lines report: {}", e.getMessage());
        }
    }

    @Override
    public void onTestEnd(TestResult result) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("t", "test");
        line.putAll(result.toMap());
        try {
            writeLine(JSONValue.toJSONString(line));
        } catch (IOException e) {
            logger.warn("Failed to write test to JSON Lines: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void onRunEnd(RunResult result) {
        if (writer == null) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("t", "run_end");
        line.putAll(result.toMap());
        try {
            writeLine(JSONValue.toJSONString(line));
            writer.close();
            logger.info("JSON Lines report written to: {}", jsonlPath);
        } catch (IOException e) {
            logger.warn("Failed to complete JSON Lines report: {}", e.getMessage());
        } finally {
            writer = null;
        }
    }

    private synchronized void writeLine(String json) throws IOException {
        if (writer != null) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    public Path getJsonlPath() {
        return jsonlPath;
    }

}
