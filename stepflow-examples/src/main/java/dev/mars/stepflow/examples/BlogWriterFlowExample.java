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
import dev.mars.stepflow.core.exceptions.FlowValidationException;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowResult;
import dev.mars.stepflow.engine.export.FlowExporter;
import dev.mars.stepflow.examples.agents.StubAgent;
import dev.mars.stepflow.examples.util.ExampleLogger;

import java.util.List;
import java.util.Map;

/**
 * Linear content pipeline: a researcher gathers findings, a writer drafts a post from
 * them and an editor refines the draft. Each step only starts once its predecessor
 * has produced a result.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class BlogWriterFlowExample {

    private static final ExampleLogger log = ExampleLogger.getLogger(BlogWriterFlowExample.class);

    public static final String DEFAULT_TOPIC = "The Impact of AI on Software Development";

    private final StubAgent researcher;
    private final StubAgent writer;
    private final StubAgent editor;

    public BlogWriterFlowExample() {
        this(50);
    }

    public BlogWriterFlowExample(long agentLatencyMillis) {
        this.researcher = new StubAgent("researcher", "Gathers key facts on a topic", agentLatencyMillis,
                (prompt, hints) -> "Key findings on " + hints.get("topic") +
                                   ": assistants speed up routine coding; review practices are changing.");
        this.writer = new StubAgent("writer", "Drafts blog posts", agentLatencyMillis,
                (prompt, hints) -> "Draft (" + hints.get("style") + "): " + prompt);
        this.editor = new StubAgent("editor", "Refines drafts for clarity", agentLatencyMillis,
                (prompt, hints) -> prompt.replace("Draft", "Final"));
    }

    public static void main(String[] args) {
        try {
            BlogWriterFlowExample example = new BlogWriterFlowExample();
            example.runExample(Map.of("topic", DEFAULT_TOPIC, "style", "informative and engaging"));
            log.exampleComplete("Blog Writer Flow");
        } catch (Exception e) {
            log.unexpectedError("Blog Writer Flow", e);
            System.exit(1);
        }
    }

    /**
     * Builds the research, write and edit pipeline.
     */
    public FlowManager createFlow() throws FlowValidationException {
        FlowManager flow = FlowManager.builder()
                .name("blog-writer")
                .build();

        flow.addStep(FlowStep.builder("research")
                .description("Research the topic")
                .agent(researcher)
                .work((input, context) -> {
                    String topic = String.valueOf(input.getOrDefault("topic", DEFAULT_TOPIC));
                    String findings = researcher.process("Research this topic thoroughly: " + topic,
                            Map.of("topic", topic));
                    return StepOutcome.success(Map.of(
                            "research", findings,
                            "sources", List.of("industry-survey-2025", "developer-interviews")));
                })
                .build());

        flow.addStep(FlowStep.builder("write")
                .description("Write a first draft from the research")
                .agent(writer)
                .requires("research")
                .work((input, context) -> {
                    Object findings = context.require("research").get("research");
                    String draft = writer.process(String.valueOf(findings),
                            Map.of("style", input.getOrDefault("style", "informative")));
                    return StepOutcome.success(Map.of("draft", draft));
                })
                .build());

        flow.addStep(FlowStep.builder("edit")
                .description("Edit the draft into the final post")
                .agent(editor)
                .requires("write")
                .work((input, context) -> {
                    String draft = String.valueOf(context.require("write").get("draft"));
                    String finalPost = editor.process(draft, Map.of("focus", "clarity"));
                    return StepOutcome.success(Map.of(
                            "final_post", finalPost,
                            "word_count", finalPost.split("\\s+").length));
                })
                .build());

        return flow;
    }

    public FlowResult runExample(Map<String, ?> input) throws Exception {
        log.exampleStart("Blog Writer Flow", "research -> write -> edit with stub agents");

        log.step(1, "Registering steps...");
        FlowManager flow = createFlow();
        try {
            log.dependencies(flow.listSteps());

            log.step(2, "Execution plan");
            log.executionPlan(flow.getExecutionPlan());

            log.step(3, "Executing flow...");
            FlowResult result = flow.execute(input);
            displayResults(result);

            log.step(4, "Flowchart");
            log.info(new FlowExporter().toMermaid(flow.listSteps(), result));
            return result;
        } finally {
            flow.shutdown();
        }
    }

    private void displayResults(FlowResult result) {
        log.flowResult(result);
        result.getResult("edit").ifPresentOrElse(
                edit -> log.success("Final post: " + edit.get("final_post")),
                () -> log.failure("No final post produced"));
    }
}
