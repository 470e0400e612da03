/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tessera.examples.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Console output helper for Tessera examples.
 *
 * <p>Prints formatted progress to standard output and mirrors every line to SLF4J, so a
 * run can be followed on the console and in the log at the same time.
 *
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("My Example");
 * log.step(1, "Registering workflow...");
 * log.success("Workflow registered");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_WARNING = "⚠";
    private static final String SYMBOL_ARROW = "→";

    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private ExampleLogger(Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.out = System.out;
        this.err = System.err;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz);
    }

    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: {}", title);
    }

    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.info("Step {}: {}", stepNumber, description);
    }

    public void event(String description) {
        print(out, SYMBOL_ARROW, description);
        logger.debug("Event: {}", description);
    }

    public void detail(String message) {
        print(out, null, message);
        logger.debug("{}", message);
    }

    public void success(String message) {
        print(out, SYMBOL_SUCCESS, message);
        logger.info("{}", message);
    }

    public void warning(String message) {
        print(out, SYMBOL_WARNING, message);
        logger.warn("{}", message);
    }

    public void failure(String message) {
        print(err, SYMBOL_FAILURE, message);
        logger.error("{}", message);
    }

    public void failure(String message, Throwable cause) {
        print(err, SYMBOL_FAILURE, message + ": " + cause.getMessage());
        logger.error(message, cause);
    }

    public void completion(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed ===");
        logger.info("{} completed", exampleName);
    }

    private static void print(PrintStream stream, String symbol, String message) {
        stream.println(symbol != null ? INDENT + symbol + " " + message : INDENT + message);
    }
}
