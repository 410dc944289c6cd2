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

import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents the final state of a single step within one flow execution.
 */
public class StepExecution {

    private final String stepName;
    private final StepStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final SkipReason skipReason;
    private final List<String> skippedBecauseOf;
    private final String errorMessage;

    public StepExecution(String stepName, StepStatus status, Instant startTime, Instant endTime,
                         SkipReason skipReason, List<String> skippedBecauseOf, String errorMessage) {
        this.stepName = Objects.requireNonNull(stepName, "Step name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startTime = startTime;
        this.endTime = endTime;
        this.skipReason = skipReason;
        this.skippedBecauseOf = skippedBecauseOf != null ? List.copyOf(skippedBecauseOf) : List.of();
        this.errorMessage = errorMessage;
    }

    public String getStepName() {
        return stepName;
    }

    public StepStatus getStatus() {
        return status;
    }

    /**
     * Empty for steps that never ran.
     */
    public Optional<Instant> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Optional<Duration> getDuration() {
        return startTime != null && endTime != null
                ? Optional.of(Duration.between(startTime, endTime))
                : Optional.empty();
    }

    public Optional<SkipReason> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    /**
     * For steps skipped because of a dependency failure, the failed steps that caused the skip.
     */
    public List<String> getSkippedBecauseOf() {
        return skippedBecauseOf;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    @Override
    public String toString() {
        return "StepExecution{" +
               "stepName='" + stepName + '\'' +
               ", status=" + status +
               (skipReason != null ? ", skipReason=" + skipReason : "") +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
               '}';
    }
}
