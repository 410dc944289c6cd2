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

import dev.mars.stepflow.config.FlowConfiguration;
import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.RecoveryHandler;
import dev.mars.stepflow.core.StepOutcome;
import dev.mars.stepflow.core.StepWork;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the instruments published by {@link FlowMetrics} when flows run.
 */
class FlowMetricsTest {

    private static final AttributeKey<String> STEP_NAME = AttributeKey.stringKey("step.name");
    private static final AttributeKey<String> SKIP_REASON = AttributeKey.stringKey("skip.reason");

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private FlowMetrics metrics;
    private FlowManager flow;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new FlowMetrics(meterProvider.get("stepflow-test"));
        flow = FlowManager.builder()
                .name("content")
                .configuration(FlowConfiguration.defaults())
                .metrics(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        flow.shutdown();
        meterProvider.close();
    }

    @Test
    void testSuccessfulFlowCounters() throws Exception {
        StepWork ok = (input, context) -> StepOutcome.success(Map.of());
        flow.addStep(FlowStep.of("research", ok))
            .addStep(FlowStep.of("write", ok, "research"));

        FlowResult result = flow.execute(Map.of());

        assertTrue(result.isSuccessful());
        Collection<MetricData> collected = reader.collectAllMetrics();
        assertEquals(1, sum(collected, "stepflow.flow.total"));
        assertEquals(1, sum(collected, "stepflow.flow.completed"));
        assertEquals(0, sum(collected, "stepflow.flow.failed"));
        assertEquals(2, sum(collected, "stepflow.step.total"));
        assertEquals(2, sum(collected, "stepflow.step.completed"));
        assertEquals(2, histogramCount(collected, "stepflow.step.duration.seconds"));
        assertEquals(1, histogramCount(collected, "stepflow.flow.duration.seconds"));
        assertEquals(0, metrics.getActiveFlows());
    }

    @Test
    void testFailureRecoveryAndSkipCounters() throws Exception {
        flow.addStep(FlowStep.of("research", (input, context) -> StepOutcome.failure("no sources")))
            .addStep(FlowStep.of("write", (input, context) -> StepOutcome.success(Map.of()), "research"))
            .addStep(FlowStep.builder("activities")
                    .work((input, context) -> StepOutcome.failure("search timed out"))
                    .onFailure(RecoveryHandler.substitute(Map.of("activities", "none")))
                    .build());

        flow.execute(Map.of());

        Collection<MetricData> collected = reader.collectAllMetrics();
        assertEquals(1, sum(collected, "stepflow.flow.partial"));
        assertEquals(1, sum(collected, "stepflow.step.failed"));
        assertEquals(1, sum(collected, "stepflow.step.recovered"));
        assertEquals(1, sum(collected, "stepflow.step.skipped"));

        LongPointData skipped = points(collected, "stepflow.step.skipped").orElseThrow()
                .getLongSumData().getPoints().iterator().next();
        assertEquals("write", skipped.getAttributes().get(STEP_NAME));
        assertEquals("DEPENDENCY_FAILED", skipped.getAttributes().get(SKIP_REASON));
    }

    @Test
    void testActiveFlowGauge() {
        metrics.recordFlowStarted("content");
        metrics.recordFlowStarted("content");
        metrics.recordFlowFinished("content", 0.5, 0, 1);

        MetricData active = points(reader.collectAllMetrics(), "stepflow.flow.active").orElseThrow();

        assertEquals(1, metrics.getActiveFlows());
        assertEquals(1, active.getLongGaugeData().getPoints().iterator().next().getValue());
    }

    @Test
    void testMetricsObserverDisabledByConfiguration() throws Exception {
        FlowManager quiet = FlowManager.builder()
                .configuration(new FlowConfiguration(props(FlowConfiguration.METRICS_ENABLED_KEY, "false")))
                .metrics(metrics)
                .build();
        try {
            quiet.addStep(FlowStep.of("research", (input, context) -> StepOutcome.success(Map.of())));
            quiet.execute(Map.of());
        } finally {
            quiet.shutdown();
        }

        assertEquals(0, sum(reader.collectAllMetrics(), "stepflow.flow.total"));
    }

    private static Properties props(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }

    private static Optional<MetricData> points(Collection<MetricData> collected, String name) {
        return collected.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    }

    private static long sum(Collection<MetricData> collected, String name) {
        return points(collected, name)
                .map(metric -> metric.getLongSumData().getPoints().stream().mapToLong(LongPointData::getValue).sum())
                .orElse(0L);
    }

    private static long histogramCount(Collection<MetricData> collected, String name) {
        return points(collected, name)
                .map(metric -> metric.getHistogramData().getPoints().stream().mapToLong(p -> p.getCount()).sum())
                .orElse(0L);
    }
}
