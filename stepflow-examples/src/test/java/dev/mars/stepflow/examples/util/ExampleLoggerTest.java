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

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepOutcome;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.StepExecution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ExampleLoggerTest {

    private ByteArrayOutputStream buffer;
    private ExampleLogger log;
    private FlowManager flow;

    @BeforeEach
    void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        log = new ExampleLogger(ExampleLoggerTest.class, out, out);

        flow = FlowManager.builder().name("report").build();
        flow.addStep(FlowStep.builder("research")
                .work((input, context) -> StepOutcome.success(Map.of("facts", 3)))
                .build());
        flow.addStep(FlowStep.builder("write")
                .requires("research")
                .work((input, context) -> StepOutcome.failure("model unavailable"))
                .build());
        flow.addStep(FlowStep.builder("publish")
                .requires("write")
                .work((input, context) -> StepOutcome.success(Map.of()))
                .build());
    }

    @AfterEach
    void tearDown() {
        flow.shutdown();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testExecutionPlanPrintsOneLinePerLevel() throws Exception {
        log.executionPlan(flow.getExecutionPlan());

        String printed = output();
        assertTrue(printed.contains("Level 0: [research]"));
        assertTrue(printed.contains("Level 1: [write]"));
        assertTrue(printed.contains("Level 2: [publish]"));
    }

    @Test
    void testDependenciesMarkRootSteps() {
        log.dependencies(flow.listSteps());

        String printed = output();
        assertTrue(printed.contains("(start) → research"));
        assertTrue(printed.contains("research → write"));
        assertTrue(printed.contains("write → publish"));
    }

    @Test
    void testFlowResultPrintsStatusTableAndFailures() throws Exception {
        FlowResult result = flow.execute(Map.of());

        log.flowResult(result);

        String printed = output();
        assertTrue(printed.contains("--- Results ---"));
        assertTrue(printed.contains("Outcome: " + result.getOutcome()));
        assertTrue(printed.contains("✗ write: model unavailable"));
        List<String> lines = printed.lines().map(String::strip).collect(Collectors.toList());
        assertTrue(lines.stream().anyMatch(line -> line.startsWith("research") && line.contains("COMPLETED")));
        assertTrue(lines.contains("publish      SKIPPED    DEPENDENCY_FAILED after write"));
    }

    @Test
    void testStatusLineForStepThatRan() {
        Instant start = Instant.parse("2025-03-01T10:00:00Z");
        StepExecution execution = new StepExecution("edit", StepStatus.COMPLETED, start,
                start.plusMillis(250), null, List.of(), null);

        assertEquals("edit         COMPLETED  250 ms", ExampleLogger.statusLine(execution));
    }

    @Test
    void testStatusLineForTimedOutStep() {
        StepExecution execution = new StepExecution("itinerary", StepStatus.SKIPPED, null, null,
                SkipReason.TIMEOUT, List.of(), "not started before the flow deadline of 30000 ms");

        assertEquals("itinerary    SKIPPED    TIMEOUT", ExampleLogger.statusLine(execution));
    }
}
