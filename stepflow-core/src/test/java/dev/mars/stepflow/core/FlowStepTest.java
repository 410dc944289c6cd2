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

package dev.mars.stepflow.core;

import dev.mars.stepflow.core.exceptions.StepExecutionException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FlowStepTest {

    private static final StepWork NOOP = (input, context) -> StepOutcome.success(Map.of());

    @Test
    void testBuilderCarriesAllAttributes() throws Exception {
        Object agent = new Object();
        RecoveryHandler handler = RecoveryHandler.substitute(Map.of("status", "degraded"));

        FlowStep step = FlowStep.builder("summarize")
                .description("Summarize the research")
                .agent(agent)
                .work(NOOP)
                .requires("research", "outline")
                .onFailure(handler)
                .build();

        assertEquals("summarize", step.getName());
        assertEquals("Summarize the research", step.getDescription().orElseThrow());
        assertSame(agent, step.getAgent().orElseThrow());
        assertSame(NOOP, step.getWork());
        assertThat(step.getRequires()).containsExactly("research", "outline");
        assertTrue(step.hasRecoveryHandler());

        StepOutcome recovered = step.getRecoveryHandler().orElseThrow()
                .recover(new StepExecutionException("summarize", "boom"), FlowContext.empty());
        assertEquals("degraded", recovered.getResult().get("status"));
    }

    @Test
    void testOfFactory() {
        FlowStep step = FlowStep.of("write", NOOP, "research");

        assertThat(step.getRequires()).containsExactly("research");
        assertTrue(step.getAgent().isEmpty());
        assertTrue(step.getDescription().isEmpty());
        assertFalse(step.hasRecoveryHandler());
    }

    @Test
    void testRepeatedDependencyCollapses() {
        FlowStep step = new FlowStep("edit", null, null, NOOP, List.of("write", "write"), null);

        assertThat(step.getRequires()).containsExactly("write");
        assertThrows(UnsupportedOperationException.class, () -> step.getRequires().add("other"));
    }

    @Test
    void testInvalidDefinitionsRejected() {
        assertThrows(NullPointerException.class, () -> FlowStep.of(null, NOOP));
        assertThrows(IllegalArgumentException.class, () -> FlowStep.of("  ", NOOP));
        assertThrows(NullPointerException.class, () -> FlowStep.builder("x").build());
        assertThrows(NullPointerException.class,
                () -> new FlowStep("x", null, null, NOOP, Arrays.asList("a", null), null));
    }

    @Test
    void testToString() {
        String text = FlowStep.of("write", NOOP, "research").toString();

        assertTrue(text.contains("write"));
        assertTrue(text.contains("research"));
    }
}
