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
package io.flunit.config;

import io.flunit.run.TestOutcome;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Settings of a whole test run, usually loaded from {@code flunit.json}.
 * <p>
 * Example:
 * <pre>
 * {
 *   "parallel": true,
 *   "threads": 4,
 *   "test": {
 *     "arrangementFailureOutcome": "failed"
 *   },
 *   "output": {
 *     "dir": "target/flunit-reports",
 *     "jsonLines": true,
 *     "logLevel": "debug"
 *   }
 * }
 * </pre>
 * Every key is optional.
 */
public class RunSettings {

    public static final String DEFAULT_FILE_NAME = "flunit.json";

    private boolean parallel;
    private int threads = 1;
    private TestConfiguration testConfiguration = new TestConfiguration();
    private Output output = new Output();

    /**
     * Output settings nested object.
     */
    public static class Output {
        private String dir = "target/flunit-reports";
        private boolean jsonLines;
        private String logLevel;  // trace, debug, info, warn, error

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isJsonLines() {
            return jsonLines;
        }

        public void setJsonLines(boolean jsonLines) {
            this.jsonLines = jsonLines;
        }

        public String getLogLevel() {
            return logLevel;
        }

        public void setLogLevel(String logLevel) {
            this.logLevel = logLevel;
        }
    }

    /**
     * Load settings from a JSON file.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static RunSettings load(Path path) {
        try {
            String content = Files.readString(path);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load settings from: " + path, e);
        }
    }

    /**
     * Load {@code flunit.json} from the given directory, or the defaults if there is none.
     */
    public static RunSettings loadOrDefaults(Path dir) {
        Path path = dir.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(path) ? load(path) : new RunSettings();
    }

    /**
     * Parse settings from a JSON string.
     *
     * @throws RuntimeException if the JSON is invalid or not an object
     * @throws IllegalArgumentException if a value is out of range
     */
    @SuppressWarnings("unchecked")
    public static RunSettings parse(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (ParseException e) {
            throw new RuntimeException("Invalid settings: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new RuntimeException("Invalid settings: expected JSON object");
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        RunSettings settings = new RunSettings();
        Boolean parallel = get(map, "parallel", Boolean.class);
        if (parallel != null) {
            settings.setParallel(parallel);
        }
        Number threads = get(map, "threads", Number.class);
        if (threads != null) {
            settings.setThreads(threads.intValue());
        }
        Map<String, Object> test = getObject(map, "test");
        if (test != null) {
            String outcome = get(test, "arrangementFailureOutcome", String.class);
            if (outcome != null) {
                settings.getTestConfiguration().setArrangementFailureOutcome(TestOutcome.fromString(outcome));
            }
        }
        Map<String, Object> out = getObject(map, "output");
        if (out != null) {
            Output output = settings.getOutput();
            String dir = get(out, "dir", String.class);
            if (dir != null) {
                output.setDir(dir);
            }
            Boolean jsonLines = get(out, "jsonLines", Boolean.class);
            if (jsonLines != null) {
                output.setJsonLines(jsonLines);
            }
            output.setLogLevel(get(out, "logLevel", String.class));
        }
        return settings;
    }

    private static <T> T get(Map<String, Object> map, String key, Class<T> type) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new RuntimeException("Invalid settings: '" + key + "' should be of type " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getObject(Map<String, Object> map, String key) {
        return get(map, key, Map.class);
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.threads = threads;
    }

    /**
     * The configuration every test of the run starts from.
     */
    public TestConfiguration getTestConfiguration() {
        return testConfiguration;
    }

    public void setTestConfiguration(TestConfiguration testConfiguration) {
        this.testConfiguration = testConfiguration != null ? testConfiguration : new TestConfiguration();
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output != null ? output : new Output();
    }

}
