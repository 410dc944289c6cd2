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

import dev.mars.stepflow.config.FlowConfiguration;
import dev.mars.stepflow.core.ContextView;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-execution scheduling options.
 */
public class SchedulerOptions {

    /** Concurrency bound meaning "no limit". */
    public static final int UNBOUNDED = 0;

    private static final SchedulerOptions DEFAULTS = builder().build();

    private final String flowName;
    private final int maxConcurrency;
    private final Duration deadline;
    private final ContextView contextView;

    private SchedulerOptions(Builder builder) {
        this.flowName = builder.flowName;
        this.maxConcurrency = builder.maxConcurrency;
        this.deadline = builder.deadline;
        this.contextView = builder.contextView;
    }

    public static SchedulerOptions defaults() {
        return DEFAULTS;
    }

    public static SchedulerOptions fromConfiguration(FlowConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return builder()
                .maxConcurrency(configuration.getMaxConcurrentSteps())
                .deadline(configuration.getDeadline())
                .contextView(configuration.getContextView())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .flowName(flowName)
                .maxConcurrency(maxConcurrency)
                .deadline(deadline)
                .contextView(contextView);
    }

    public String getFlowName() {
        return flowName;
    }

    /**
     * @return maximum number of steps running at the same time, {@link #UNBOUNDED} for no limit
     */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public boolean isBounded() {
        return maxConcurrency > UNBOUNDED;
    }

    public Optional<Duration> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public ContextView getContextView() {
        return contextView;
    }

    @Override
    public String toString() {
        return "SchedulerOptions{" +
               "flowName='" + flowName + '\'' +
               ", maxConcurrency=" + (isBounded() ? String.valueOf(maxConcurrency) : "unbounded") +
               ", deadline=" + deadline +
               ", contextView=" + contextView +
               '}';
    }

    public static class Builder {
        private String flowName = "flow";
        private int maxConcurrency = UNBOUNDED;
        private Duration deadline;
        private ContextView contextView = ContextView.FULL;

        public Builder flowName(String flowName) {
            this.flowName = Objects.requireNonNull(flowName, "Flow name cannot be null");
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 0) {
                throw new IllegalArgumentException("Max concurrency cannot be negative: " + maxConcurrency);
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * @param deadline flow deadline, {@code null} for none
         */
        public Builder deadline(Duration deadline) {
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("Deadline must be positive: " + deadline);
            }
            this.deadline = deadline;
            return this;
        }

        public Builder contextView(ContextView contextView) {
            this.contextView = Objects.requireNonNull(contextView, "Context view cannot be null");
            return this;
        }

        public SchedulerOptions build() {
            return new SchedulerOptions(this);
        }
    }
}
