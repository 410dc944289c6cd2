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

import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.engine.FlowManager;
import dev.mars.stepflow.engine.FlowOutcome;
import dev.mars.stepflow.engine.FlowResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TripPlannerFlowExampleTest {

    private static final Map<String, Object> INPUT = Map.of("destination", "Lisbon", "days", 3, "travellers", 2);

    @Test
    void testActivitiesAndLogisticsShareALevel() throws Exception {
        FlowManager flow = new TripPlannerFlowExample(0).createFlow();
        try {
            assertEquals(List.of(
                    List.of("research"),
                    List.of("activities", "logistics"),
                    List.of("itinerary")), flow.getExecutionPlan());
            assertEquals(2, flow.getOptions().getMaxConcurrency());
        } finally {
            flow.shutdown();
        }
    }

    @Test
    void testFullPlan() throws Exception {
        FlowResult result = new TripPlannerFlowExample(0).runExample(INPUT);

        assertEquals(FlowOutcome.SUCCESS, result.getOutcome());
        Map<String, Object> itinerary = result.getResult("itinerary").orElseThrow();
        assertEquals(Boolean.FALSE, itinerary.get("degraded"));
        assertTrue(String.valueOf(itinerary.get("itinerary")).contains("harbour cruise"));
        assertTrue(String.valueOf(itinerary.get("itinerary")).contains("Rail pass for 2 travellers"));
    }

    @Test
    void testActivityOutageDegradesItinerary() throws Exception {
        Map<String, Object> input = new HashMap<>(INPUT);
        input.put(TripPlannerFlowExample.SIMULATE_OUTAGE, true);

        FlowResult result = new TripPlannerFlowExample(0).runExample(input);

        assertEquals(FlowOutcome.SUCCESS, result.getOutcome());
        assertEquals(StepStatus.RECOVERED, result.getStatus("activities"));
        assertEquals(StepStatus.COMPLETED, result.getStatus("itinerary"));
        assertEquals(Boolean.TRUE, result.getResult("itinerary").orElseThrow().get("degraded"));

        assertEquals(1, result.getFailures().size());
        StepFailure failure = result.getFailures().get(0);
        assertEquals("activities", failure.getStepName());
        assertTrue(failure.isRecovered());
        assertTrue(failure.getErrorMessage().contains("activity search timed out"));
    }
}
