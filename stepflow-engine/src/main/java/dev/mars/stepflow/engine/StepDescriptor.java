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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only description of a registered step.
 */
public class StepDescriptor {

    private final String name;
    private final List<String> requires;
    private final String description;
    private final boolean recoverable;

    public StepDescriptor(String name, List<String> requires, String description, boolean recoverable) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.requires = requires != null ? List.copyOf(requires) : List.of();
        this.description = description;
        this.recoverable = recoverable;
    }

    public static StepDescriptor of(FlowStep step) {
        return new StepDescriptor(step.getName(), List.copyOf(step.getRequires()),
                step.getDescription().orElse(null), step.hasRecoveryHandler());
    }

    public String getName() {
        return name;
    }

    public List<String> getRequires() {
        return requires;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDescriptor that = (StepDescriptor) o;
        return recoverable == that.recoverable &&
               Objects.equals(name, that.name) &&
               Objects.equals(requires, that.requires) &&
               Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, requires, description, recoverable);
    }

    @Override
    public String toString() {
        return "StepDescriptor{" +
               "name='" + name + '\'' +
               ", requires=" + requires +
               (description != null ? ", description='" + description + '\'' : "") +
               '}';
    }
}
