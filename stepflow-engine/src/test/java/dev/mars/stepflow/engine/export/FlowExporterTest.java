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

package dev.mars.stepflow.engine.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.stepflow.config.FlowConfiguration;
import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.RecoveryHandler;
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepOutcome;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.StepDescriptor;
import dev.mars.stepflow.engine.StepExecution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlowExporter.
 */
class FlowExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FlowExporter exporter;
    private FlowManager flow;

    @BeforeEach
    void setUp() throws Exception {
        exporter = new FlowExporter();

        Properties props = new Properties();
        props.setProperty(FlowConfiguration.METRICS_ENABLED_KEY, "false");
        flow = FlowManager.builder()
                .name("content")
                .configuration(new FlowConfiguration(props))
                .build();

        flow.addStep(FlowStep.of("research", (input, context) -> StepOutcome.success(Map.of("findings", "AI trends"))))
            .addStep(FlowStep.builder("write")
                    .description("Draft the article")
                    .requires("research")
                    .work((input, context) -> StepOutcome.failure("model unavailable"))
                    .build())
            .addStep(FlowStep.of("edit", (input, context) -> StepOutcome.success(Map.of()), "write"));
    }

    @AfterEach
    void tearDown() {
        flow.shutdown();
    }

    @Test
    void testDefinitionAsJson() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(flow));

        assertEquals("content", root.get("flow").asText());
        JsonNode steps = root.get("steps");
        assertEquals(3, steps.size());
        assertEquals("research", steps.get(0).get("name").asText());
        assertEquals(0, steps.get(0).get("requires").size());
        assertFalse(steps.get(0).has("description"));
        assertEquals("research", steps.get(1).get("requires").get(0).asText());
        assertEquals("Draft the article", steps.get(1).get("description").asText());
        assertFalse(steps.get(1).get("recoverable").asBoolean());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDefinitionAsYaml() throws Exception {
        List<StepDescriptor> steps = List.of(
                new StepDescriptor("research", List.of(), null, false),
                new StepDescriptor("write", List.of("research"), "Draft the article", true));

        String yaml = exporter.toYaml("content", steps);

        assertThat(yaml).contains("flow: content").contains("- name: research").doesNotContain("{name");
        Map<String, Object> loaded = new Yaml().load(yaml);
        List<Map<String, Object>> loadedSteps = (List<Map<String, Object>>) loaded.get("steps");
        assertEquals(2, loadedSteps.size());
        assertEquals(List.of("research"), loadedSteps.get(1).get("requires"));
        assertEquals(Boolean.TRUE, loadedSteps.get(1).get("recoverable"));
    }

    @Test
    void testMermaidEdgesFollowDependencies() {
        String mermaid = exporter.toMermaid(flow.listSteps());

        assertThat(mermaid.split("\n")).containsExactly(
                "flowchart TD",
                "    n0[\"research\"]",
                "    n1[\"write\"]",
                "    n2[\"edit\"]",
                "    n0 --> n1",
                "    n1 --> n2");
    }

    @Test
    void testMermaidColorsStepsByStatus() throws Exception {
        FlowResult result = flow.execute(Map.of());

        String mermaid = exporter.toMermaid(flow.listSteps(), result);

        assertThat(mermaid)
                .contains("    class n0 completed\n")
                .contains("    class n1 failed\n")
                .contains("    class n2 skipped\n")
                .contains("    classDef completed ")
                .contains("    classDef skipped ")
                .doesNotContain("classDef recovered");
    }

    @Test
    void testMermaidEscapesQuotes() {
        String mermaid = exporter.toMermaid(List.of(new StepDescriptor("say \"hi\"", List.of(), null, false)));

        assertThat(mermaid).contains("n0[\"say #quot;hi#quot;\"]");
    }

    @Test
    void testResultAsJson() throws Exception {
        FlowResult result = flow.execute(Map.of("topic", "AI"));

        JsonNode root = mapper.readTree(exporter.resultToJson(result));

        assertEquals(result.getExecutionId(), root.get("executionId").asText());
        assertEquals("PARTIAL_SUCCESS", root.get("outcome").asText());
        assertEquals(result.getStartTime(), Instant.parse(root.get("startTime").asText()));

        JsonNode steps = root.get("steps");
        assertEquals("COMPLETED", steps.get(0).get("status").asText());
        assertEquals("model unavailable", steps.get(1).get("error").asText());
        assertEquals(SkipReason.DEPENDENCY_FAILED.name(), steps.get(2).get("skipReason").asText());
        assertEquals("write", steps.get(2).get("skippedBecauseOf").get(0).asText());
        assertFalse(steps.get(2).has("startTime"));

        JsonNode failures = root.get("failures");
        assertEquals(1, failures.size());
        assertEquals("STEP_EXECUTION", failures.get(0).get("kind").asText());
        assertFalse(failures.get(0).get("recovered").asBoolean());

        assertEquals("AI trends", root.get("context").get("research").get("findings").asText());
        assertFalse(root.get("context").has("write"));
    }

    @Test
    void testRecoveredStepAppearsInResultJson() throws Exception {
        FlowManager recovering = FlowManager.builder()
                .configuration(FlowConfiguration.defaults())
                .build();
        try {
            recovering.addStep(FlowStep.builder("activities")
                    .work((input, context) -> StepOutcome.failure("search timed out"))
                    .onFailure(RecoveryHandler.substitute(Map.of("activities", List.of())))
                    .build());

            JsonNode root = mapper.readTree(exporter.resultToJson(recovering.execute(Map.of())));

            assertEquals(StepStatus.RECOVERED.name(), root.get("steps").get(0).get("status").asText());
            assertTrue(root.get("failures").get(0).get("recovered").asBoolean());
            assertEquals(0, root.get("context").get("activities").get("activities").size());
        } finally {
            recovering.shutdown();
        }
    }

    @Test
    void testUnserializableResultRaisesExportException() {
        Instant now = Instant.now();
        FlowResult result = new FlowResult("exec-1", "content", now, now,
                Map.of("research", Map.of("handle", new Object())),
                List.of(new StepExecution("research", StepStatus.COMPLETED, now, now, null, null, null)),
                List.of());

        FlowExportException e = assertThrows(FlowExportException.class, () -> exporter.resultToJson(result));

        assertThat(e.getMessage()).contains("exec-1");
        assertNotNull(e.getCause());
    }
}
