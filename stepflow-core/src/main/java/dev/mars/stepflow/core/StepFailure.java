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

package dev.mars.stepflow.core;

import dev.mars.stepflow.core.exceptions.StepExecutionException;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a flow result's failure list.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class StepFailure {

    public enum Kind {
        /** The unit of work failed. */
        STEP_EXECUTION,
        /** The recovery handler itself failed. */
        HANDLER_EXECUTION,
        /** The step was not dispatched before the flow deadline. */
        TIMEOUT,
        /** The step was not dispatched because the flow was interrupted. */
        CANCELLED
    }

    private final String stepName;
    private final Kind kind;
    private final StepExecutionException error;
    private final boolean recovered;
    private final Instant occurredAt;

    public StepFailure(String stepName, Kind kind, StepExecutionException error, boolean recovered, Instant occurredAt) {
        this.stepName = Objects.requireNonNull(stepName, "Step name cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.error = Objects.requireNonNull(error, "Error cannot be null");
        this.recovered = recovered;
        this.occurredAt = Objects.requireNonNull(occurredAt, "Occurrence time cannot be null");
    }

    public String getStepName() {
        return stepName;
    }

    public Kind getKind() {
        return kind;
    }

    public StepExecutionException getError() {
        return error;
    }

    /**
     * The failure description without the step prefix added by {@link StepExecutionException#getMessage()}.
     */
    public String getErrorMessage() {
        return error.getReason();
    }

    /**
     * Whether a recovery handler replaced this failure with a substitute result.
     */
    public boolean isRecovered() {
        return recovered;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "StepFailure{" +
               "stepName='" + stepName + '\'' +
               ", kind=" + kind +
               ", error='" + error.getReason() + '\'' +
               ", recovered=" + recovered +
               '}';
    }
}
