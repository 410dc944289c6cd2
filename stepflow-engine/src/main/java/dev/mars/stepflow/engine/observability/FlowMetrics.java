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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the flow engine.
 *
 * Provides the following metrics:
 * - stepflow.flow.active (gauge) - Currently running flow executions
 * - stepflow.flow.total (counter) - Total flows started
 * - stepflow.flow.completed (counter) - Flows where every step succeeded
 * - stepflow.flow.partial (counter) - Flows with some failed or skipped steps
 * - stepflow.flow.failed (counter) - Flows where no step succeeded
 * - stepflow.step.total (counter) - Steps started
 * - stepflow.step.completed / failed / recovered / skipped (counters) - Step outcomes
 * - stepflow.flow.duration.seconds (histogram) - Flow duration distribution
 * - stepflow.step.duration.seconds (histogram) - Step duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowMetrics {

    private static final Logger logger = Logger.getLogger(FlowMetrics.class.getName());
    private static final String METER_NAME = "stepflow-engine";

    // Singleton instance
    private static FlowMetrics instance;

    // Counters
    private final LongCounter flowsTotal;
    private final LongCounter flowsCompleted;
    private final LongCounter flowsPartial;
    private final LongCounter flowsFailed;
    private final LongCounter stepsTotal;
    private final LongCounter stepsCompleted;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRecovered;
    private final LongCounter stepsSkipped;

    // Histograms
    private final DoubleHistogram flowDuration;
    private final DoubleHistogram stepDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeFlows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> FLOW_NAME_KEY = AttributeKey.stringKey("flow.name");
    private static final AttributeKey<String> STEP_NAME_KEY = AttributeKey.stringKey("step.name");
    private static final AttributeKey<String> FAILURE_KIND_KEY = AttributeKey.stringKey("failure.kind");
    private static final AttributeKey<String> SKIP_REASON_KEY = AttributeKey.stringKey("skip.reason");

    /**
     * Creates the instruments on the given meter.
     */
    public FlowMetrics(Meter meter) {
        flowsTotal = meter.counterBuilder("stepflow.flow.total")
                .setDescription("Total number of flows started")
                .setUnit("1")
                .build();

        flowsCompleted = meter.counterBuilder("stepflow.flow.completed")
                .setDescription("Number of flows where every step succeeded")
                .setUnit("1")
                .build();

        flowsPartial = meter.counterBuilder("stepflow.flow.partial")
                .setDescription("Number of flows that finished with some failed or skipped steps")
                .setUnit("1")
                .build();

        flowsFailed = meter.counterBuilder("stepflow.flow.failed")
                .setDescription("Number of flows where no step succeeded")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("stepflow.step.total")
                .setDescription("Total number of steps started")
                .setUnit("1")
                .build();

        stepsCompleted = meter.counterBuilder("stepflow.step.completed")
                .setDescription("Number of completed steps")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("stepflow.step.failed")
                .setDescription("Number of step failures without recovery")
                .setUnit("1")
                .build();

        stepsRecovered = meter.counterBuilder("stepflow.step.recovered")
                .setDescription("Number of steps recovered by their handler")
                .setUnit("1")
                .build();

        stepsSkipped = meter.counterBuilder("stepflow.step.skipped")
                .setDescription("Number of skipped steps")
                .setUnit("1")
                .build();

        // Initialize histograms
        flowDuration = meter.histogramBuilder("stepflow.flow.duration.seconds")
                .setDescription("Flow duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("stepflow.step.duration.seconds")
                .setDescription("Step duration in seconds")
                .setUnit("s")
                .build();

        // Initialize gauges
        meter.gaugeBuilder("stepflow.flow.active")
                .setDescription("Number of currently running flow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeFlows.get()));

        logger.info("FlowMetrics initialized");
    }

    /**
     * Get the singleton instance backed by the global OpenTelemetry meter provider.
     */
    public static synchronized FlowMetrics getInstance() {
        if (instance == null) {
            instance = new FlowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    public void recordFlowStarted(String flowName) {
        flowsTotal.add(1, flowAttributes(flowName));
        activeFlows.incrementAndGet();
    }

    /**
     * Record a finished flow.
     *
     * @param successful number of completed or recovered steps
     * @param stepCount  number of steps in the flow
     */
    public void recordFlowFinished(String flowName, double durationSeconds, int successful, int stepCount) {
        activeFlows.decrementAndGet();

        Attributes attrs = flowAttributes(flowName);
        if (successful == stepCount) {
            flowsCompleted.add(1, attrs);
        } else if (successful == 0) {
            flowsFailed.add(1, attrs);
        } else {
            flowsPartial.add(1, attrs);
        }
        flowDuration.record(durationSeconds, attrs);
    }

    public void recordStepStarted(String flowName, String stepName) {
        stepsTotal.add(1, stepAttributes(flowName, stepName));
    }

    public void recordStepCompleted(String flowName, String stepName, double durationSeconds) {
        Attributes attrs = stepAttributes(flowName, stepName);
        stepsCompleted.add(1, attrs);
        stepDuration.record(durationSeconds, attrs);
    }

    public void recordStepRecovered(String flowName, String stepName, double durationSeconds) {
        Attributes attrs = stepAttributes(flowName, stepName);
        stepsRecovered.add(1, attrs);
        stepDuration.record(durationSeconds, attrs);
    }

    public void recordStepFailed(String flowName, String stepName, String failureKind) {
        Attributes attrs = Attributes.builder()
                .put(FLOW_NAME_KEY, flowName)
                .put(STEP_NAME_KEY, stepName)
                .put(FAILURE_KIND_KEY, failureKind != null ? failureKind : "unknown")
                .build();

        stepsFailed.add(1, attrs);
    }

    public void recordStepSkipped(String flowName, String stepName, String skipReason) {
        Attributes attrs = Attributes.builder()
                .put(FLOW_NAME_KEY, flowName)
                .put(STEP_NAME_KEY, stepName)
                .put(SKIP_REASON_KEY, skipReason != null ? skipReason : "unknown")
                .build();

        stepsSkipped.add(1, attrs);
    }

    /**
     * Get the current number of running flows.
     */
    public long getActiveFlows() {
        return activeFlows.get();
    }

    private static Attributes flowAttributes(String flowName) {
        return Attributes.of(FLOW_NAME_KEY, flowName);
    }

    private static Attributes stepAttributes(String flowName, String stepName) {
        return Attributes.of(FLOW_NAME_KEY, flowName, STEP_NAME_KEY, stepName);
    }
}
