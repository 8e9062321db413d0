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
package io.flunit.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers. All of them live under the "flunit" logger, so one level setting on
 * "flunit" affects every category.
 */
public final class LogContext {

    /** Logger for the core and the execution driver (arrangement, acting, run lifecycle) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("flunit.runtime");

    /** Logger for report writers */
    public static final Logger REPORT_LOGGER = LoggerFactory.getLogger("flunit.report");

    /** Logger for console output (run summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("flunit.console");

    private LogContext() {
    }

    /**
     * Set the level of the "flunit" logger when Logback is the SLF4J backend.
     * Uses reflection so that Logback stays an optional runtime dependency.
     *
     * @param level the log level (trace, debug, info, warn, error)
     * @return true if the level was set, false if Logback is not available
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("Runtime log level not supported: not using Logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "flunit");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("Set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("Failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

}
