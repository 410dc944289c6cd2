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

/**
 * Receives lifecycle notifications of flow executions.
 *
 * <p>All callbacks of one execution are delivered from the thread that drives the
 * execution, in the order the scheduler observed the events. Exceptions thrown by an
 * observer are logged and otherwise ignored.</p>
 */
public interface FlowObserver {

    FlowObserver NO_OP = new FlowObserver() {
    };

    default void onFlowStarted(String executionId, String flowName, int stepCount) {
    }

    default void onStepStarted(String executionId, FlowStep step) {
    }

    default void onStepCompleted(String executionId, String stepName, Duration duration) {
    }

    /**
     * The unit of work failed and the recovery handler supplied a substitute result.
     */
    default void onStepRecovered(String executionId, StepFailure failure, Duration duration) {
    }

    /**
     * The step failed without recovery. Called once per recorded failure, so a failed
     * recovery handler produces two calls.
     */
    default void onStepFailed(String executionId, StepFailure failure) {
    }

    /**
     * @param causes for {@link SkipReason#DEPENDENCY_FAILED}, the failed upstream steps
     */
    default void onStepSkipped(String executionId, String stepName, SkipReason reason, List<String> causes) {
    }

    default void onFlowCompleted(FlowResult result) {
    }
}
