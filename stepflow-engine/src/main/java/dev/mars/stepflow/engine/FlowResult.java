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
import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.core.StepStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only snapshot of a finished flow execution: the final context, the status of
 * every step in insertion order and the failures in the order they occurred.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowResult {

    private final String executionId;
    private final String flowName;
    private final Instant startTime;
    private final Instant endTime;
    private final Map<String, Map<String, Object>> context;
    private final Map<String, StepExecution> stepExecutions;
    private final List<StepFailure> failures;

    public FlowResult(String executionId, String flowName, Instant startTime, Instant endTime,
                      Map<String, Map<String, Object>> context, List<StepExecution> stepExecutions,
                      List<StepFailure> failures) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.flowName = Objects.requireNonNull(flowName, "Flow name cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.endTime = Objects.requireNonNull(endTime, "End time cannot be null");
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
        Map<String, StepExecution> executions = new LinkedHashMap<>();
        if (stepExecutions != null) {
            for (StepExecution execution : stepExecutions) {
                executions.put(execution.getStepName(), execution);
            }
        }
        this.stepExecutions = Collections.unmodifiableMap(executions);
        this.failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getFlowName() {
        return flowName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * Results of every completed or recovered step, keyed by step name.
     */
    public Map<String, Map<String, Object>> getContext() {
        return context;
    }

    public Optional<Map<String, Object>> getResult(String stepName) {
        return Optional.ofNullable(context.get(stepName));
    }

    public StepStatus getStatus(String stepName) {
        StepExecution execution = stepExecutions.get(stepName);
        if (execution == null) {
            throw new IllegalArgumentException("Unknown step '" + stepName + "'");
        }
        return execution.getStatus();
    }

    /**
     * Status of every step in insertion order.
     */
    public Map<String, StepStatus> getStatuses() {
        Map<String, StepStatus> statuses = new LinkedHashMap<>();
        stepExecutions.forEach((name, execution) -> statuses.put(name, execution.getStatus()));
        return Collections.unmodifiableMap(statuses);
    }

    public Optional<StepExecution> getStepExecution(String stepName) {
        return Optional.ofNullable(stepExecutions.get(stepName));
    }

    public List<StepExecution> getStepExecutions() {
        return List.copyOf(stepExecutions.values());
    }

    public List<String> getStepsWithStatus(StepStatus status) {
        List<String> names = new ArrayList<>();
        stepExecutions.forEach((name, execution) -> {
            if (execution.getStatus() == status) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Failures in the order they were recorded, including recovered ones.
     */
    public List<StepFailure> getFailures() {
        return failures;
    }

    /**
     * For a step skipped because of failed dependencies, the failed steps that caused it.
     */
    public List<String> getSkipCauses(String stepName) {
        StepExecution execution = stepExecutions.get(stepName);
        if (execution == null || execution.getSkipReason().orElse(null) != SkipReason.DEPENDENCY_FAILED) {
            return List.of();
        }
        return execution.getSkippedBecauseOf();
    }

    public boolean isSuccessful() {
        return getOutcome() == FlowOutcome.SUCCESS;
    }

    public FlowOutcome getOutcome() {
        long successful = stepExecutions.values().stream().filter(StepExecution::isSuccessful).count();
        if (successful == stepExecutions.size()) {
            return FlowOutcome.SUCCESS;
        }
        return successful == 0 ? FlowOutcome.FAILURE : FlowOutcome.PARTIAL_SUCCESS;
    }

    public int getStepCount() {
        return stepExecutions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowResult that = (FlowResult) o;
        return Objects.equals(executionId, that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "FlowResult{" +
               "executionId='" + executionId + '\'' +
               ", flowName='" + flowName + '\'' +
               ", outcome=" + getOutcome() +
               ", statuses=" + getStatuses() +
               ", failures=" + failures.size() +
               '}';
    }
}
