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
import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.ValidationResult;
import dev.mars.stepflow.core.exceptions.FlowValidationException;
import dev.mars.stepflow.engine.observability.FlowMetrics;
import dev.mars.stepflow.engine.observability.MetricsFlowObserver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Entry point for defining and running a flow.
 *
 * <p>Steps are registered in order with {@link #addStep(FlowStep)}; each call to
 * {@link #execute(Map)} validates the definition, then runs every step once.
 * Independent steps run in parallel, a step only starts after all of its
 * dependencies completed or were recovered.</p>
 *
 * <pre>{@code
 * FlowManager flow = FlowManager.builder().name("content").build();
 * flow.addStep(FlowStep.of("research", researchWork))
 *     .addStep(FlowStep.of("write", writeWork, "research"));
 * FlowResult result = flow.execute(Map.of("topic", "AI trends"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowManager {

    private static final Logger logger = Logger.getLogger(FlowManager.class.getName());

    private final StepRegistry registry = new StepRegistry();
    private final FlowScheduler scheduler;
    private final SchedulerOptions options;
    private final ExecutorService asyncExecutor;
    private volatile boolean shutdown = false;

    public FlowManager() {
        this(builder());
    }

    private FlowManager(Builder builder) {
        FlowConfiguration configuration = builder.configuration;

        SchedulerOptions.Builder optionsBuilder = SchedulerOptions.fromConfiguration(configuration).toBuilder()
                .flowName(builder.name);
        if (builder.maxConcurrency != null) {
            optionsBuilder.maxConcurrency(builder.maxConcurrency);
        }
        if (builder.deadline != null) {
            optionsBuilder.deadline(builder.deadline);
        }
        if (builder.contextView != null) {
            optionsBuilder.contextView(builder.contextView);
        }
        this.options = optionsBuilder.build();

        List<FlowObserver> observers = new ArrayList<>();
        observers.add(new LoggingFlowObserver());
        if (configuration.isMetricsEnabled()) {
            observers.add(new MetricsFlowObserver(builder.metrics != null ? builder.metrics : FlowMetrics.getInstance()));
        }
        observers.addAll(builder.observers);
        FlowObserver observer = new CompositeFlowObserver(observers);

        this.scheduler = builder.executorService != null
                ? new FlowScheduler(builder.executorService, observer)
                : new FlowScheduler(observer, configuration.getThreadNamePrefix());

        AtomicInteger counter = new AtomicInteger();
        this.asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stepflow-flow-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("FlowManager created: " + options);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a step.
     *
     * @param step the step to add
     * @return this manager, for chaining
     * @throws FlowValidationException if a step with the same name already exists
     */
    public FlowManager addStep(FlowStep step) throws FlowValidationException {
        registry.register(step);
        logger.fine("Registered step: " + step.getName() + " requires " + step.getRequires());
        return this;
    }

    /**
     * Runs the flow to completion on the calling thread.
     *
     * @param input flow input, handed unchanged to every step
     * @return the result, also when steps failed
     * @throws FlowValidationException if the definition is invalid; no step runs in that case
     */
    public FlowResult execute(Map<String, ?> input) throws FlowValidationException {
        if (shutdown) {
            throw new IllegalStateException("Flow manager is shutdown");
        }
        DependencyGraph graph = DependencyGraph.build(registry.getSteps());
        return scheduler.execute(graph, input, options);
    }

    /**
     * Runs the flow on a background thread. An invalid definition completes the future
     * exceptionally with a {@link FlowValidationException}.
     */
    public CompletableFuture<FlowResult> executeAsync(Map<String, ?> input) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Flow manager is shutdown"));
        }
        DependencyGraph graph;
        try {
            graph = DependencyGraph.build(registry.getSteps());
        } catch (FlowValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> scheduler.execute(graph, input, options), asyncExecutor);
    }

    /**
     * Checks the definition without running anything and reports every problem found.
     */
    public ValidationResult validate() {
        return DependencyGraph.inspect(registry.getSteps());
    }

    /**
     * @return steps in insertion order
     */
    public List<StepDescriptor> listSteps() {
        return registry.getSteps().stream()
                .map(StepDescriptor::of)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Groups step names into levels that could run in parallel.
     *
     * @throws FlowValidationException if the definition is invalid
     */
    public List<List<String>> getExecutionPlan() throws FlowValidationException {
        return DependencyGraph.build(registry.getSteps()).getExecutionLevels().stream()
                .map(level -> level.stream().map(FlowStep::getName).collect(Collectors.toList()))
                .collect(Collectors.toList());
    }

    /**
     * @return the validated graph of the current definition
     * @throws FlowValidationException if the definition is invalid
     */
    public DependencyGraph getDependencyGraph() throws FlowValidationException {
        return DependencyGraph.build(registry.getSteps());
    }

    public String getName() {
        return options.getFlowName();
    }

    public SchedulerOptions getOptions() {
        return options;
    }

    public int getStepCount() {
        return registry.size();
    }

    public void shutdown() {
        shutdown = true;
        scheduler.shutdown();
        asyncExecutor.shutdown();
        logger.info("FlowManager shutdown initiated: " + options.getFlowName());
    }

    public static class Builder {
        private String name = "flow";
        private FlowConfiguration configuration = FlowConfiguration.defaults();
        private Integer maxConcurrency;
        private Duration deadline;
        private ContextView contextView;
        private final List<FlowObserver> observers = new ArrayList<>();
        private ExecutorService executorService;
        private FlowMetrics metrics;

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Name cannot be null");
            return this;
        }

        public Builder configuration(FlowConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
            return this;
        }

        /**
         * Overrides the configured concurrency bound; 0 means unbounded.
         */
        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder contextView(ContextView contextView) {
            this.contextView = contextView;
            return this;
        }

        public Builder observer(FlowObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "Observer cannot be null"));
            return this;
        }

        /**
         * Runs steps on the given executor instead of an owned thread pool.
         */
        public Builder executor(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder metrics(FlowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public FlowManager build() {
            return new FlowManager(this);
        }
    }
}
