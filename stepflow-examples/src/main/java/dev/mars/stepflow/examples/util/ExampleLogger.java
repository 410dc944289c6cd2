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

package dev.mars.stepflow.examples.util;

import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.StepDescriptor;
import dev.mars.stepflow.engine.StepExecution;

import java.io.PrintStream;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console output helper for the StepFlow examples.
 *
 * <p>Prints flow progress, execution plans and step status tables to the
 * console and mirrors every line to java.util.logging, so the same run can be
 * captured in a log file.</p>
 *
 * <p>Usage:
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.exampleStart("Blog Writer Flow", "research -> write -> edit");
 * log.executionPlan(flow.getExecutionPlan());
 * log.flowResult(flow.execute(input));
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class ExampleLogger {

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_WARNING = "⚠";
    private static final String SYMBOL_ARROW = "→";

    private static final String INDENT = "   ";
    private static final String DOUBLE_INDENT = "      ";

    ExampleLogger(Class<?> clazz, PrintStream out, PrintStream err) {
        this.logger = Logger.getLogger(clazz.getName());
        this.out = out;
        this.err = err;
        configureLogger();
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz, System.out, System.err);
    }

    private void configureLogger() {
        // Only add handler if none exist
        if (logger.getHandlers().length == 0) {
            Handler consoleHandler = new ConsoleHandler();
            consoleHandler.setFormatter(new SimpleExampleFormatter());
            consoleHandler.setLevel(Level.INFO);
            logger.addHandler(consoleHandler);
            logger.setUseParentHandlers(false);
        }
    }

    // ========== Layout ==========

    public void section(String title) {
        out.println();
        out.println("--- " + title + " ---");
        logger.fine("Section: " + title);
    }

    /**
     * Print a numbered step of the example walkthrough.
     * Example: 1. Registering steps...
     */
    public void step(int stepNumber, String description) {
        out.println(stepNumber + ". " + description);
        logger.fine("Step " + stepNumber + ": " + description);
    }

    public void info(String message) {
        out.println(message);
        logger.fine(message);
    }

    public void subDetail(String message) {
        out.println(DOUBLE_INDENT + message);
        logger.finer(message);
    }

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.fine("SUCCESS: " + message);
    }

    public void failure(String message) {
        out.println(INDENT + SYMBOL_FAILURE + " " + message);
        logger.warning("FAILURE: " + message);
    }

    public void warning(String message) {
        out.println(INDENT + SYMBOL_WARNING + " " + message);
        logger.warning(message);
    }

    // ========== Flow Output ==========

    /**
     * Print each step with its prerequisites.
     * Example: research → write
     */
    public void dependencies(List<StepDescriptor> steps) {
        for (StepDescriptor step : steps) {
            String from = step.getRequires().isEmpty() ? "(start)" : String.join(", ", step.getRequires());
            out.println(INDENT + from + " " + SYMBOL_ARROW + " " + step.getName());
            logger.fine(from + " -> " + step.getName());
        }
    }

    /**
     * Print the execution plan one level per line.
     * Example: Level 1: [activities, logistics]
     */
    public void executionPlan(List<List<String>> plan) {
        for (int i = 0; i < plan.size(); i++) {
            keyValue("Level " + i, plan.get(i));
        }
    }

    /**
     * Print the outcome, a status table of every step, and the recorded failures.
     */
    public void flowResult(FlowResult result) {
        section("Results");
        keyValue("Outcome", result.getOutcome());
        keyValue("Duration", result.getDuration().toMillis() + " ms");
        for (StepExecution execution : result.getStepExecutions()) {
            out.println(INDENT + statusLine(execution));
            logger.fine(execution.toString());
        }
        for (StepFailure failure : result.getFailures()) {
            String line = failure.getStepName() + ": " + failure.getErrorMessage();
            if (failure.isRecovered()) {
                warning(line + " (recovered)");
            } else {
                failure(line);
            }
        }
    }

    static String statusLine(StepExecution execution) {
        StringBuilder line = new StringBuilder(String.format("%-12s %-10s", execution.getStepName(),
                execution.getStatus()));
        execution.getDuration().ifPresent(d -> line.append(' ').append(d.toMillis()).append(" ms"));
        execution.getSkipReason().ifPresent(reason -> {
            line.append(' ').append(reason);
            if (!execution.getSkippedBecauseOf().isEmpty()) {
                line.append(" after ").append(String.join(", ", execution.getSkippedBecauseOf()));
            }
        });
        return line.toString().stripTrailing();
    }

    private void keyValue(String key, Object value) {
        out.println(INDENT + key + ": " + value);
        logger.fine(key + "=" + value);
    }

    // ========== Example Lifecycle ==========

    public void exampleStart(String exampleName, String description) {
        out.println();
        out.println("=== StepFlow " + exampleName + " ===");
        out.println(INDENT + description);
        logger.info("Example started: " + exampleName);
    }

    public void exampleComplete(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed successfully! ===");
        logger.info("Example completed: " + exampleName);
    }

    /**
     * Print an unexpected error (for example failures).
     */
    public void unexpectedError(String context, Throwable t) {
        err.println();
        err.println("UNEXPECTED ERROR occurred during " + context + ":");
        err.println("Error: " + t.getMessage());
        logger.log(Level.SEVERE, "Unexpected error in " + context, t);
    }

    private static class SimpleExampleFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            return String.format("[%s] %s: %s%n",
                    record.getLevel().getName(),
                    record.getLoggerName().substring(record.getLoggerName().lastIndexOf('.') + 1),
                    record.getMessage());
        }
    }
}
