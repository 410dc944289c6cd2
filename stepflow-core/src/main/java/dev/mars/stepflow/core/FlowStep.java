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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Definition of one named step of a flow.
 *
 * <p>The agent handle is an opaque capability reference owned by the caller.
 * The engine only stores and forwards it; it never inspects or invokes it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowStep {

    private final String name;
    private final String description;
    private final Object agent;
    private final StepWork work;
    private final Set<String> requires;
    private final RecoveryHandler recoveryHandler;

    public FlowStep(String name, String description, Object agent, StepWork work,
                    Collection<String> requires, RecoveryHandler recoveryHandler) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
        this.description = description;
        this.agent = agent;
        this.work = Objects.requireNonNull(work, "Work cannot be null");
        Set<String> deps = new LinkedHashSet<>();
        if (requires != null) {
            for (String dependency : requires) {
                deps.add(Objects.requireNonNull(dependency, "Dependency name cannot be null"));
            }
        }
        this.requires = Collections.unmodifiableSet(deps);
        this.recoveryHandler = recoveryHandler;
    }

    public static FlowStep of(String name, StepWork work, String... requires) {
        return new FlowStep(name, null, null, work, Arrays.asList(requires), null);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<Object> getAgent() {
        return Optional.ofNullable(agent);
    }

    public StepWork getWork() {
        return work;
    }

    /**
     * @return declared dependency names, in declaration order
     */
    public Set<String> getRequires() {
        return requires;
    }

    public Optional<RecoveryHandler> getRecoveryHandler() {
        return Optional.ofNullable(recoveryHandler);
    }

    public boolean hasRecoveryHandler() {
        return recoveryHandler != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowStep that = (FlowStep) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(requires, that.requires);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, requires);
    }

    @Override
    public String toString() {
        return "FlowStep{" +
               "name='" + name + '\'' +
               ", requires=" + requires +
               ", recoverable=" + hasRecoveryHandler() +
               '}';
    }

    /**
     * Builder for FlowStep.
     */
    public static class Builder {
        private final String name;
        private String description;
        private Object agent;
        private StepWork work;
        private final Set<String> requires = new LinkedHashSet<>();
        private RecoveryHandler recoveryHandler;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder agent(Object agent) {
            this.agent = agent;
            return this;
        }

        public Builder work(StepWork work) {
            this.work = work;
            return this;
        }

        public Builder requires(String... stepNames) {
            this.requires.addAll(Arrays.asList(stepNames));
            return this;
        }

        public Builder requires(Collection<String> stepNames) {
            this.requires.addAll(stepNames);
            return this;
        }

        public Builder onFailure(RecoveryHandler recoveryHandler) {
            this.recoveryHandler = recoveryHandler;
            return this;
        }

        public FlowStep build() {
            return new FlowStep(name, description, agent, work, requires, recoveryHandler);
        }
    }
}
