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

package dev.mars.stepflow.examples;

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.StepOutcome;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.core.exceptions.FlowValidationException;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.export.FlowExporter;
import dev.mars.stepflow.examples.agents.StubAgent;
import dev.mars.stepflow.examples.util.ExampleLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fan-out trip planner. Destination research feeds activity planning and logistics,
 * which run in parallel; the itinerary step joins both. Activity planning carries a
 * recovery handler, so an outage of its agent degrades the itinerary instead of
 * skipping it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class TripPlannerFlowExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(TripPlannerFlowExample.class);

    public static final String SIMULATE_OUTAGE = "simulateOutage";

    private final StubAgent researcher;
    private final StubAgent activityPlanner;
    private final StubAgent logisticsPlanner;

    public TripPlannerFlowExample() {
        this(100);
    }

    public TripPlannerFlowExample(long agentLatencyMillis) {
        this.researcher = new StubAgent("destination_researcher", "Researches destinations", agentLatencyMillis,
                (prompt, hints) -> "Highlights of " + hints.get("destination") + ": old town, harbour, museums");
        this.activityPlanner = new StubAgent("activity_planner", "Plans daily activities", agentLatencyMillis,
                (prompt, hints) -> {
                    if (Boolean.TRUE.equals(hints.get(SIMULATE_OUTAGE))) {
                        throw new IllegalStateException("activity search timed out");
                    }
                    return "Day 1: old town walk; Day 2: harbour cruise; Day 3: museums";
                });
        this.logisticsPlanner = new StubAgent("logistics_planner", "Plans transport and lodging", agentLatencyMillis,
                (prompt, hints) -> "Rail pass for " + hints.get("travellers") + " travellers, central hotel");
    }

    public static void main(String[] args) {
        try {
            TripPlannerFlowExample example = new TripPlannerFlowExample();
            example.runExample(Map.of("destination", "Lisbon", "days", 3, "travellers", 2));
            example.runExample(Map.of("destination", "Lisbon", "days", 3, "travellers", 2, SIMULATE_OUTAGE, true));
            log.exampleComplete("Trip Planner Flow");
        } catch (Exception e) {
            log.unexpectedError("Trip Planner Flow", e);
            System.exit(1);
        }
    }

    public FlowManager createFlow() throws FlowValidationException {
        FlowManager flow = FlowManager.builder()
                .name("trip-planner")
                .maxConcurrency(2)
                .deadline(Duration.ofSeconds(30))
                .build();

        flow.addStep(FlowStep.builder("research")
                .description("Research the destination")
                .agent(researcher)
                .work((input, context) -> StepOutcome.success(Map.of(
                        "content", researcher.process("Research " + input.get("destination"),
                                Map.of("destination", input.get("destination"))))))
                .build());

        flow.addStep(FlowStep.builder("activities")
                .description("Plan daily activities")
                .agent(activityPlanner)
                .requires("research")
                .work((input, context) -> {
                    Object research = context.require("research").get("content");
                    String plan = activityPlanner.process("Plan activities based on: " + research,
                            Map.of(SIMULATE_OUTAGE, input.getOrDefault(SIMULATE_OUTAGE, false)));
                    return StepOutcome.success(Map.of("content", plan, "degraded", false));
                })
                .onFailure((failure, context) -> {
                    log.warning("Activity planning failed, using a generic plan: " + failure.getReason());
                    return StepOutcome.success(Map.of(
                            "content", "Free time to explore the destination",
                            "degraded", true,
                            "reason", failure.getReason()));
                })
                .build());

        flow.addStep(FlowStep.builder("logistics")
                .description("Plan transport and accommodation")
                .agent(logisticsPlanner)
                .requires("research")
                .work((input, context) -> StepOutcome.success(Map.of(
                        "content", logisticsPlanner.process("Plan logistics",
                                Map.of("travellers", input.getOrDefault("travellers", 1))))))
                .build());

        flow.addStep(FlowStep.builder("itinerary")
                .description("Combine activities and logistics into an itinerary")
                .requires("activities", "logistics")
                .work((input, context) -> {
                    Map<String, Object> activities = context.require("activities");
                    Map<String, Object> logistics = context.require("logistics");
                    List<String> sections = new ArrayList<>();
                    sections.add("Trip to " + input.get("destination") + " (" + input.getOrDefault("days", 1) + " days)");
                    sections.add("Activities: " + activities.get("content"));
                    sections.add("Logistics: " + logistics.get("content"));
                    return StepOutcome.success(Map.of(
                            "itinerary", String.join("\n", sections),
                            "degraded", activities.get("degraded")));
                })
                .build());

        return flow;
    }

    public FlowResult runExample(Map<String, ?> input) throws Exception {
        boolean outage = Boolean.TRUE.equals(input.get(SIMULATE_OUTAGE));
        log.exampleStart("Trip Planner Flow", outage
                ? "activity planner outage, recovered with a degraded plan"
                : "research fans out to activities and logistics");

        FlowManager flow = createFlow();
        try {
            log.step(1, "Execution plan");
            log.executionPlan(flow.getExecutionPlan());

            log.step(2, "Executing flow...");
            FlowResult result = flow.execute(input);

            log.flowResult(result);
            for (String recovered : result.getStepsWithStatus(StepStatus.RECOVERED)) {
                log.warning(recovered + " recovered: " + result.getResult(recovered).orElseThrow().get("reason"));
            }
            result.getResult("itinerary").ifPresent(itinerary -> {
                log.success("Itinerary ready");
                for (String line : String.valueOf(itinerary.get("itinerary")).split("\n")) {
                    log.subDetail(line);
                }
            });

            log.step(3, "Result as JSON");
            log.info(new FlowExporter().resultToJson(result));
            return result;
        } finally {
            flow.shutdown();
        }
    }
}
