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

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.ValidationResult;
import dev.mars.stepflow.core.ValidationResult.ValidationIssue;
import dev.mars.stepflow.core.exceptions.FlowValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of the steps of one flow. Registration order is kept and used
 * as the display order and the scheduling tie-break.
 */
public class StepRegistry {

    private final Map<String, FlowStep> steps = new LinkedHashMap<>();

    /**
     * Adds a step.
     *
     * @param step the step to add
     * @throws FlowValidationException if a step with the same name is already registered
     */
    public synchronized void register(FlowStep step) throws FlowValidationException {
        Objects.requireNonNull(step, "Step cannot be null");

        String name = step.getName();
        if (steps.containsKey(name)) {
            ValidationResult result = new ValidationResult();
            result.addError(ValidationIssue.Code.DUPLICATE_STEP, name, "Duplicate step name '" + name + "'");
            throw new FlowValidationException(result);
        }
        steps.put(name, step);
    }

    public synchronized List<FlowStep> getSteps() {
        return List.copyOf(new ArrayList<>(steps.values()));
    }

    public synchronized Optional<FlowStep> find(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    public synchronized boolean contains(String name) {
        return steps.containsKey(name);
    }

    public synchronized int size() {
        return steps.size();
    }

    @Override
    public synchronized String toString() {
        return "StepRegistry{steps=" + steps.keySet() + '}';
    }
}
