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

package dev.mars.stepflow.engine.observability;

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.engine.FlowObserver;
import dev.mars.stepflow.engine.FlowResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes flow lifecycle events to {@link FlowMetrics}.
 */
public class MetricsFlowObserver implements FlowObserver {

    private final FlowMetrics metrics;
    // executionId -> flow name, for step events that only carry the execution id
    private final Map<String, String> flowNames = new ConcurrentHashMap<>();

    public MetricsFlowObserver(FlowMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    @Override
    public void onFlowStarted(String executionId, String flowName, int stepCount) {
        flowNames.put(executionId, flowName);
        metrics.recordFlowStarted(flowName);
    }

    @Override
    public void onStepStarted(String executionId, FlowStep step) {
        metrics.recordStepStarted(flowName(executionId), step.getName());
    }

    @Override
    public void onStepCompleted(String executionId, String stepName, Duration duration) {
        metrics.recordStepCompleted(flowName(executionId), stepName, toSeconds(duration));
    }

    @Override
    public void onStepRecovered(String executionId, StepFailure failure, Duration duration) {
        metrics.recordStepRecovered(flowName(executionId), failure.getStepName(), toSeconds(duration));
    }

    @Override
    public void onStepFailed(String executionId, StepFailure failure) {
        metrics.recordStepFailed(flowName(executionId), failure.getStepName(), failure.getKind().name());
    }

    @Override
    public void onStepSkipped(String executionId, String stepName, SkipReason reason, List<String> causes) {
        metrics.recordStepSkipped(flowName(executionId), stepName, reason.name());
    }

    @Override
    public void onFlowCompleted(FlowResult result) {
        flowNames.remove(result.getExecutionId());
        int successful = result.getStepsWithStatus(StepStatus.COMPLETED).size() +
                         result.getStepsWithStatus(StepStatus.RECOVERED).size();
        metrics.recordFlowFinished(result.getFlowName(), toSeconds(result.getDuration()), successful,
                result.getStepCount());
    }

    private String flowName(String executionId) {
        return flowNames.getOrDefault(executionId, "unknown");
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
