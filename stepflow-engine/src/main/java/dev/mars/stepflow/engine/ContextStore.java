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

package dev.mars.stepflow.engine;

import dev.mars.stepflow.core.ResultMaps;
import dev.mars.stepflow.core.exceptions.ContextWriteException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write-once store of step results for one flow execution.
 *
 * <p>Each key is written at most once. Values are frozen on write so readers on
 * other threads only ever see complete, immutable results.</p>
 */
public class ContextStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Object>> results = new LinkedHashMap<>();

    /**
     * Records the result of a step.
     *
     * @throws ContextWriteException if the step already has an entry
     */
    public void set(String stepName, Map<String, ?> result) {
        Objects.requireNonNull(stepName, "Step name cannot be null");
        Objects.requireNonNull(result, "Result cannot be null");
        Map<String, Object> frozen = ResultMaps.freeze(result);

        lock.lock();
        try {
            if (results.containsKey(stepName)) {
                throw new ContextWriteException(stepName);
            }
            results.put(stepName, frozen);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Map<String, Object>> get(String stepName) {
        lock.lock();
        try {
            return Optional.ofNullable(results.get(stepName));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String stepName) {
        lock.lock();
        try {
            return results.containsKey(stepName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable copy of every entry, in write order
     */
    public Map<String, Map<String, Object>> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(results));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable copy of the entries of the given steps that have been written
     */
    public Map<String, Map<String, Object>> snapshot(Collection<String> stepNames) {
        lock.lock();
        try {
            Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Object>> entry : results.entrySet()) {
                if (stepNames.contains(entry.getKey())) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }
}
