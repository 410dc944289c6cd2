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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FlowContextTest {

    @Test
    void testLookups() {
        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        results.put("research", Map.of("findings", "AI trends"));
        FlowContext context = new FlowContext(results, new CancellationSignal());

        assertTrue(context.contains("research"));
        assertEquals(1, context.size());
        assertEquals("AI trends", context.require("research").get("findings"));
        assertEquals("AI trends", context.getValue("research", "findings").orElseThrow());
        assertTrue(context.get("missing").isEmpty());
        assertTrue(context.getValue("missing", "findings").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> context.require("missing"));
    }

    @Test
    void testSnapshotIsDetachedFromSource() {
        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        results.put("research", Map.of());
        FlowContext context = new FlowContext(results, new CancellationSignal());

        results.put("write", Map.of());

        assertFalse(context.contains("write"));
        assertThrows(UnsupportedOperationException.class, () -> context.asMap().put("x", Map.of()));
    }

    @Test
    void testCancellationIsVisible() {
        CancellationSignal signal = new CancellationSignal();
        FlowContext context = new FlowContext(Map.of(), signal);

        assertFalse(context.isCancellationRequested());
        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertTrue(context.isCancellationRequested());
        assertTrue(context.awaitCancellation(Duration.ofSeconds(5)));
    }

    @Test
    void testAwaitCancellationTimesOut() {
        FlowContext context = new FlowContext(Map.of(), new CancellationSignal());

        assertFalse(context.awaitCancellation(Duration.ofMillis(20)));
    }

    @Test
    void testAwaitCancellationWakesOnCancel() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(
                () -> signal.awaitCancellation(Duration.ofSeconds(10)));

        Thread.sleep(50);
        signal.cancel();

        assertTrue(waiter.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testEmptyContext() {
        assertEquals(0, FlowContext.empty().size());
        assertFalse(FlowContext.empty().isCancellationRequested());
    }
}
