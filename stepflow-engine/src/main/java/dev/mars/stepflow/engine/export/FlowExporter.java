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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.StepDescriptor;
import dev.mars.stepflow.engine.StepExecution;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders flow definitions and results for inspection: JSON and YAML definitions,
 * Mermaid flowcharts and a JSON view of a finished execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowExporter {

    private static final Map<StepStatus, String> STATUS_STYLES = Map.of(
            StepStatus.COMPLETED, "fill:#d4edda,stroke:#28a745",
            StepStatus.RECOVERED, "fill:#fff3cd,stroke:#ffc107",
            StepStatus.FAILED, "fill:#f8d7da,stroke:#dc3545",
            StepStatus.SKIPPED, "fill:#e2e3e5,stroke:#6c757d,stroke-dasharray: 5 5"
    );

    private final ObjectMapper objectMapper;
    private final Yaml yaml;

    public FlowExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);
        this.yaml = new Yaml(dumperOptions);
    }

    public String toJson(FlowManager flow) throws FlowExportException {
        return toJson(flow.getName(), flow.listSteps());
    }

    public String toJson(String flowName, List<StepDescriptor> steps) throws FlowExportException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(definitionModel(flowName, steps));
        } catch (JsonProcessingException e) {
            throw new FlowExportException("Failed to render flow '" + flowName + "' as JSON", e);
        }
    }

    public String toYaml(FlowManager flow) throws FlowExportException {
        return toYaml(flow.getName(), flow.listSteps());
    }

    public String toYaml(String flowName, List<StepDescriptor> steps) throws FlowExportException {
        try {
            return yaml.dump(definitionModel(flowName, steps));
        } catch (YAMLException e) {
            throw new FlowExportException("Failed to render flow '" + flowName + "' as YAML", e);
        }
    }

    public String toMermaid(List<StepDescriptor> steps) {
        return toMermaid(steps, null);
    }

    /**
     * Renders the dependency graph as a Mermaid flowchart, edges pointing from a
     * dependency to its dependent.
     *
     * @param result optional result used to color steps by final status
     */
    public String toMermaid(List<StepDescriptor> steps, FlowResult result) {
        Objects.requireNonNull(steps, "Steps cannot be null");
        Map<String, String> ids = new HashMap<>();
        StringBuilder sb = new StringBuilder("flowchart TD\n");

        for (StepDescriptor step : steps) {
            String id = "n" + ids.size();
            ids.put(step.getName(), id);
            sb.append("    ").append(id).append("[\"").append(escapeLabel(step.getName())).append("\"]\n");
        }
        for (StepDescriptor step : steps) {
            for (String dependency : step.getRequires()) {
                String from = ids.get(dependency);
                if (from != null) {
                    sb.append("    ").append(from).append(" --> ").append(ids.get(step.getName())).append('\n');
                }
            }
        }

        if (result != null) {
            Set<StepStatus> used = EnumSet.noneOf(StepStatus.class);
            for (StepDescriptor step : steps) {
                result.getStepExecution(step.getName()).ifPresent(execution -> {
                    StepStatus status = execution.getStatus();
                    if (STATUS_STYLES.containsKey(status)) {
                        used.add(status);
                        sb.append("    class ").append(ids.get(step.getName())).append(' ')
                          .append(styleClass(status)).append('\n');
                    }
                });
            }
            for (StepStatus status : used) {
                sb.append("    classDef ").append(styleClass(status)).append(' ')
                  .append(STATUS_STYLES.get(status)).append('\n');
            }
        }

        return sb.toString();
    }

    /**
     * Renders a finished execution, including every step result, as JSON.
     *
     * @throws FlowExportException if a step result holds a value Jackson cannot serialize
     */
    public String resultToJson(FlowResult result) throws FlowExportException {
        Objects.requireNonNull(result, "Result cannot be null");

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("executionId", result.getExecutionId());
        model.put("flow", result.getFlowName());
        model.put("outcome", result.getOutcome().name());
        model.put("startTime", result.getStartTime());
        model.put("endTime", result.getEndTime());
        model.put("durationMs", result.getDuration().toMillis());

        List<Map<String, Object>> steps = new ArrayList<>();
        for (StepExecution execution : result.getStepExecutions()) {
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("name", execution.getStepName());
            step.put("status", execution.getStatus().name());
            execution.getStartTime().ifPresent(start -> step.put("startTime", start));
            execution.getEndTime().ifPresent(end -> step.put("endTime", end));
            execution.getSkipReason().ifPresent(reason -> step.put("skipReason", reason.name()));
            if (!execution.getSkippedBecauseOf().isEmpty()) {
                step.put("skippedBecauseOf", execution.getSkippedBecauseOf());
            }
            execution.getErrorMessage().ifPresent(error -> step.put("error", error));
            steps.add(step);
        }
        model.put("steps", steps);

        List<Map<String, Object>> failures = new ArrayList<>();
        for (StepFailure failure : result.getFailures()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step", failure.getStepName());
            entry.put("kind", failure.getKind().name());
            entry.put("error", failure.getErrorMessage());
            entry.put("recovered", failure.isRecovered());
            entry.put("occurredAt", failure.getOccurredAt());
            failures.add(entry);
        }
        model.put("failures", failures);
        model.put("context", result.getContext());

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new FlowExportException("Failed to render result of execution " + result.getExecutionId(), e);
        }
    }

    private Map<String, Object> definitionModel(String flowName, List<StepDescriptor> steps) {
        Objects.requireNonNull(flowName, "Flow name cannot be null");
        Objects.requireNonNull(steps, "Steps cannot be null");

        List<Map<String, Object>> stepModels = new ArrayList<>();
        for (StepDescriptor step : steps) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("name", step.getName());
            model.put("requires", new ArrayList<>(step.getRequires()));
            step.getDescription().ifPresent(description -> model.put("description", description));
            model.put("recoverable", step.isRecoverable());
            stepModels.add(model);
        }

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("flow", flowName);
        definition.put("steps", stepModels);
        return definition;
    }

    private static String styleClass(StepStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private static String escapeLabel(String label) {
        return label.replace("\"", "#quot;");
    }
}
