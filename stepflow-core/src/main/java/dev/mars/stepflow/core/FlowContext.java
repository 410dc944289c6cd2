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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only snapshot of step results handed to a unit of work or recovery handler.
 *
 * <p>The snapshot is taken when the step is dispatched and never changes afterwards.
 * It always holds the result of every declared dependency; whether it also holds
 * results of unrelated, already-finished steps depends on the configured
 * {@link ContextView}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public final class FlowContext {

    private static final FlowContext EMPTY = new FlowContext(Map.of(), new CancellationSignal());

    private final Map<String, Map<String, Object>> results;
    private final CancellationSignal cancellationSignal;

    public FlowContext(Map<String, Map<String, Object>> results, CancellationSignal cancellationSignal) {
        Objects.requireNonNull(results, "Results cannot be null");
        this.cancellationSignal = Objects.requireNonNull(cancellationSignal, "Cancellation signal cannot be null");
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static FlowContext empty() {
        return EMPTY;
    }

    public Optional<Map<String, Object>> get(String stepName) {
        return Optional.ofNullable(results.get(stepName));
    }

    /**
     * Returns the result of a step that must be present, typically a declared dependency.
     *
     * @throws IllegalArgumentException if the step has no entry in this snapshot
     */
    public Map<String, Object> require(String stepName) {
        Map<String, Object> result = results.get(stepName);
        if (result == null) {
            throw new IllegalArgumentException("No result for step '" + stepName + "' in context " + results.keySet());
        }
        return result;
    }

    /**
     * Convenience lookup of one value inside a step's result.
     */
    public Optional<Object> getValue(String stepName, String key) {
        return get(stepName).map(result -> result.get(key));
    }

    public boolean contains(String stepName) {
        return results.containsKey(stepName);
    }

    public Set<String> stepNames() {
        return results.keySet();
    }

    public Map<String, Map<String, Object>> asMap() {
        return results;
    }

    public int size() {
        return results.size();
    }

    public boolean isCancellationRequested() {
        return cancellationSignal.isCancelled();
    }

    /**
     * Cancellable sleep for units of work.
     *
     * @return true if the flow was cancelled while waiting
     */
    public boolean awaitCancellation(Duration maxWait) {
        return cancellationSignal.awaitCancellation(maxWait);
    }

    @Override
    public String toString() {
        return "FlowContext{" +
               "steps=" + results.keySet() +
               ", cancelled=" + cancellationSignal.isCancelled() +
               '}';
    }
}
