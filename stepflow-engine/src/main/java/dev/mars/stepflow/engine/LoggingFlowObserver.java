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

package dev.mars.stepflow.engine;

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepFailure;

import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the step lifecycle to {@code java.util.logging}.
 */
public class LoggingFlowObserver implements FlowObserver {

    private static final Logger logger = Logger.getLogger(LoggingFlowObserver.class.getName());

    @Override
    public void onFlowStarted(String executionId, String flowName, int stepCount) {
        logger.info("Starting flow execution: " + executionId + " (" + flowName + ", " + stepCount + " steps)");
    }

    @Override
    public void onStepStarted(String executionId, FlowStep step) {
        logger.fine("Step started: " + step.getName() + " [" + executionId + "]");
    }

    @Override
    public void onStepCompleted(String executionId, String stepName, Duration duration) {
        logger.info("Step completed: " + stepName + " in " + duration.toMillis() + " ms");
    }

    @Override
    public void onStepRecovered(String executionId, StepFailure failure, Duration duration) {
        logger.warning("Step recovered: " + failure.getStepName() + " after failure: " + failure.getErrorMessage());
    }

    @Override
    public void onStepFailed(String executionId, StepFailure failure) {
        // Log without stack trace for cleaner output
        logger.log(Level.WARNING, "Step failed: " + failure.getStepName() + " (" + failure.getKind() + ") - " +
                failure.getErrorMessage());

        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Step failure details for: " + failure.getStepName(), failure.getError());
        }
    }

    @Override
    public void onStepSkipped(String executionId, String stepName, SkipReason reason, List<String> causes) {
        if (reason == SkipReason.DEPENDENCY_FAILED) {
            logger.info("Step skipped: " + stepName + " because of failed dependencies " + causes);
        } else {
            logger.info("Step skipped: " + stepName + " (" + reason + ")");
        }
    }

    @Override
    public void onFlowCompleted(FlowResult result) {
        logger.info("Flow execution completed: " + result.getExecutionId() + " with outcome: " +
                result.getOutcome() + " in " + result.getDuration().toMillis() + " ms");
    }
}
