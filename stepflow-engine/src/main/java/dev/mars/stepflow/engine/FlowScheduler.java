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

import dev.mars.stepflow.core.CancellationSignal;
import dev.mars.stepflow.core.ContextView;
import dev.mars.stepflow.core.FlowContext;
import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.RecoveryHandler;
import dev.mars.stepflow.core.ResultMaps;
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepFailure;
import dev.mars.stepflow.core.StepOutcome;
import dev.mars.stepflow.core.StepStatus;
import dev.mars.stepflow.core.exceptions.HandlerExecutionException;
import dev.mars.stepflow.core.exceptions.InvalidTransitionException;
import dev.mars.stepflow.core.exceptions.StepExecutionException;
import dev.mars.stepflow.core.exceptions.StepTimeoutException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a validated {@link DependencyGraph}.
 *
 * <p>Each step runs as its own task on the executor. A task reports exactly one
 * completion event through a queue that is consumed on the calling thread, which is
 * the only place where step statuses change and results are written. Independent
 * steps therefore run in parallel while all bookkeeping stays single-threaded.</p>
 *
 * <p>Failures never escape {@link #execute}: exceptions and {@code null} outcomes of a
 * unit of work become step failures, the dependents of an unrecovered failure are
 * skipped and unrelated branches keep running.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowScheduler {

    private static final Logger logger = Logger.getLogger(FlowScheduler.class.getName());

    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final FlowObserver observer;
    private volatile boolean shutdown = false;

    public FlowScheduler(FlowObserver observer) {
        this(observer, "stepflow-step");
    }

    public FlowScheduler(FlowObserver observer, String threadNamePrefix) {
        this.executorService = Executors.newCachedThreadPool(daemonThreadFactory(threadNamePrefix));
        this.ownsExecutor = true;
        this.observer = isolate(observer);
    }

    /**
     * Uses a caller supplied executor. The executor is not shut down by {@link #shutdown()}.
     */
    public FlowScheduler(ExecutorService executorService, FlowObserver observer) {
        this.executorService = Objects.requireNonNull(executorService, "Executor service cannot be null");
        this.ownsExecutor = false;
        this.observer = isolate(observer);
    }

    /**
     * Runs every step of the graph and waits until each one has reached a terminal status.
     *
     * @param graph   the validated graph
     * @param input   flow input handed unchanged to every step; copied before use
     * @param options scheduling options
     * @return the result of the execution, also when steps failed
     * @throws IllegalStateException if the scheduler has been shut down
     */
    public FlowResult execute(DependencyGraph graph, Map<String, ?> input, SchedulerOptions options) {
        Objects.requireNonNull(graph, "Dependency graph cannot be null");
        Objects.requireNonNull(options, "Scheduler options cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Flow scheduler is shutdown");
        }
        return new Run(graph, ResultMaps.freeze(input), options).run();
    }

    public void shutdown() {
        shutdown = true;
        if (ownsExecutor) {
            executorService.shutdown();
        }
        logger.info("FlowScheduler shutdown initiated");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private static FlowObserver isolate(FlowObserver observer) {
        return new CompositeFlowObserver(List.of(observer != null ? observer : FlowObserver.NO_OP));
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        Objects.requireNonNull(prefix, "Thread name prefix cannot be null");
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Mutable tracking state of one step, touched only by the driving thread.
     */
    private static final class StepRun {
        private final FlowStep step;
        private StepStatus status = StepStatus.PENDING;
        private int unmetDependencies;
        private Instant startTime;
        private Instant endTime;
        private long startNanos;
        private SkipReason skipReason;
        private final Set<String> skipCauses = new LinkedHashSet<>();
        private String errorMessage;

        private StepRun(FlowStep step) {
            this.step = step;
            this.unmetDependencies = step.getRequires().size();
        }

        private String name() {
            return step.getName();
        }

        private StepExecution toExecution() {
            return new StepExecution(step.getName(), status, startTime, endTime, skipReason,
                    new ArrayList<>(skipCauses), errorMessage);
        }
    }

    /**
     * The single message a step task sends back to the driving thread.
     */
    private static final class CompletionEvent {

        enum Type { COMPLETED, RECOVERED, FAILED, HANDLER_FAILED }

        private final Type type;
        private final String stepName;
        private final Map<String, Object> result;
        private final StepExecutionException failure;
        private final StepExecutionException handlerFailure;

        private CompletionEvent(Type type, String stepName, Map<String, Object> result,
                                StepExecutionException failure, StepExecutionException handlerFailure) {
            this.type = type;
            this.stepName = stepName;
            this.result = result;
            this.failure = failure;
            this.handlerFailure = handlerFailure;
        }

        static CompletionEvent completed(String stepName, Map<String, Object> result) {
            return new CompletionEvent(Type.COMPLETED, stepName, result, null, null);
        }

        static CompletionEvent recovered(String stepName, Map<String, Object> result, StepExecutionException failure) {
            return new CompletionEvent(Type.RECOVERED, stepName, result, failure, null);
        }

        static CompletionEvent failed(String stepName, StepExecutionException failure) {
            return new CompletionEvent(Type.FAILED, stepName, null, failure, null);
        }

        static CompletionEvent handlerFailed(String stepName, StepExecutionException failure,
                                             StepExecutionException handlerFailure) {
            return new CompletionEvent(Type.HANDLER_FAILED, stepName, null, failure, handlerFailure);
        }
    }

    /**
     * State of a single call to {@link #execute}.
     */
    private final class Run {
        private final String executionId = UUID.randomUUID().toString();
        private final DependencyGraph graph;
        private final Map<String, Object> input;
        private final SchedulerOptions options;
        private final ContextStore store = new ContextStore();
        private final CancellationSignal cancellationSignal = new CancellationSignal();
        private final Map<String, StepRun> steps = new LinkedHashMap<>();
        private final Deque<String> readyQueue = new ArrayDeque<>();
        private final BlockingQueue<CompletionEvent> events = new LinkedBlockingQueue<>();
        private final List<StepFailure> failures = new ArrayList<>();
        private final long deadlineNanos;
        private int running = 0;
        private boolean dispatchStopped = false;
        private boolean interrupted = false;

        private Run(DependencyGraph graph, Map<String, Object> input, SchedulerOptions options) {
            this.graph = graph;
            this.input = input;
            this.options = options;
            this.deadlineNanos = options.getDeadline()
                    .map(deadline -> System.nanoTime() + deadline.toNanos())
                    .orElse(0L);
        }

        private FlowResult run() {
            Instant startTime = Instant.now();
            observer.onFlowStarted(executionId, options.getFlowName(), graph.size());

            for (FlowStep step : graph.getSteps()) {
                StepRun stepRun = new StepRun(step);
                steps.put(step.getName(), stepRun);
                if (stepRun.unmetDependencies == 0) {
                    transition(stepRun, StepStatus.READY);
                    readyQueue.addLast(step.getName());
                }
            }

            while (true) {
                dispatchReady();
                if (running == 0) {
                    break;
                }
                CompletionEvent event = awaitEvent();
                if (event != null) {
                    handle(event);
                }
            }

            List<StepExecution> executions = new ArrayList<>();
            for (StepRun stepRun : steps.values()) {
                executions.add(stepRun.toExecution());
            }
            FlowResult result = new FlowResult(executionId, options.getFlowName(), startTime, Instant.now(),
                    store.snapshot(), executions, failures);
            observer.onFlowCompleted(result);

            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return result;
        }

        private void dispatchReady() {
            while (!dispatchStopped && !readyQueue.isEmpty()
                    && (!options.isBounded() || running < options.getMaxConcurrency())) {
                dispatch(steps.get(readyQueue.pollFirst()));
            }
        }

        private void dispatch(StepRun stepRun) {
            transition(stepRun, StepStatus.RUNNING);
            stepRun.startTime = Instant.now();
            stepRun.startNanos = System.nanoTime();
            running++;

            FlowStep step = stepRun.step;
            FlowContext context = contextFor(step);
            observer.onStepStarted(executionId, step);

            try {
                CompletableFuture.supplyAsync(() -> invoke(step, context), executorService)
                        .whenComplete((event, error) -> {
                            if (error != null) {
                                events.offer(crashed(step.getName(), error));
                            } else {
                                events.offer(event);
                            }
                        });
            } catch (RejectedExecutionException e) {
                events.offer(CompletionEvent.failed(step.getName(),
                        new StepExecutionException(step.getName(), "Step could not be scheduled: " + e.getMessage(), e)));
            }
        }

        private FlowContext contextFor(FlowStep step) {
            Map<String, Map<String, Object>> visible = options.getContextView() == ContextView.DECLARED_DEPENDENCIES
                    ? store.snapshot(step.getRequires())
                    : store.snapshot();
            return new FlowContext(visible, cancellationSignal);
        }

        /**
         * Runs on the worker thread. Never throws for failures of the step or its handler;
         * only a {@link VirtualMachineError} is left to {@link #crashed}.
         */
        private CompletionEvent invoke(FlowStep step, FlowContext context) {
            String name = step.getName();
            StepOutcome outcome;
            try {
                outcome = step.getWork().execute(input, context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = StepOutcome.failure(e);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                // assertion and linkage errors from step code are step failures too
                outcome = StepOutcome.failure(e);
            }
            if (outcome == null) {
                outcome = StepOutcome.failure("Step returned no outcome");
            }
            if (outcome.isSuccess()) {
                return CompletionEvent.completed(name, outcome.getResult());
            }

            StepExecutionException failure = toException(name, outcome);
            Optional<RecoveryHandler> handler = step.getRecoveryHandler();
            if (handler.isEmpty()) {
                return CompletionEvent.failed(name, failure);
            }

            StepExecutionException handlerFailure;
            try {
                StepOutcome recovered = handler.get().recover(failure, contextFor(step));
                if (recovered == null) {
                    handlerFailure = new HandlerExecutionException(name, "Recovery handler returned no outcome", failure);
                } else if (recovered.isFailure()) {
                    handlerFailure = new HandlerExecutionException(name, recovered.getErrorMessage().orElse("failed"),
                            failure, recovered.getCause().orElse(null));
                } else {
                    return CompletionEvent.recovered(name, recovered.getResult(), failure);
                }
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                handlerFailure = new HandlerExecutionException(name, message, failure, e);
            }
            return CompletionEvent.handlerFailed(name, failure, handlerFailure);
        }

        private StepExecutionException toException(String stepName, StepOutcome outcome) {
            String message = outcome.getErrorMessage().orElse("failed");
            Throwable cause = outcome.getCause().orElse(null);
            if (cause instanceof StepExecutionException) {
                return (StepExecutionException) cause;
            }
            return cause != null
                    ? new StepExecutionException(stepName, message, cause)
                    : new StepExecutionException(stepName, message);
        }

        private CompletionEvent crashed(String stepName, Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            return CompletionEvent.failed(stepName,
                    new StepExecutionException(stepName, "Step crashed: " + cause, cause));
        }

        /**
         * Waits for the next completion event. Returns {@code null} when the wait ended
         * because of the deadline or an interrupt instead.
         */
        private CompletionEvent awaitEvent() {
            try {
                if (deadlineNanos == 0 || dispatchStopped) {
                    return events.take();
                }
                long remaining = deadlineNanos - System.nanoTime();
                CompletionEvent event = remaining > 0 ? events.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (event == null) {
                    logger.warning("Flow deadline of " + options.getDeadline().map(Duration::toMillis).orElse(0L) +
                            " ms reached for execution " + executionId + ", " + running + " step(s) still running");
                    stopDispatching(SkipReason.TIMEOUT);
                }
                return event;
            } catch (InterruptedException e) {
                interrupted = true;
                logger.warning("Flow execution " + executionId + " interrupted, waiting for " + running +
                        " running step(s)");
                stopDispatching(SkipReason.CANCELLED);
                return null;
            }
        }

        private void stopDispatching(SkipReason reason) {
            if (dispatchStopped) {
                return;
            }
            dispatchStopped = true;
            cancellationSignal.cancel();
            readyQueue.clear();

            Instant now = Instant.now();
            for (StepRun stepRun : steps.values()) {
                if (stepRun.status != StepStatus.PENDING && stepRun.status != StepStatus.READY) {
                    continue;
                }
                transition(stepRun, StepStatus.SKIPPED);
                stepRun.skipReason = reason;

                StepFailure failure = reason == SkipReason.TIMEOUT
                        ? new StepFailure(stepRun.name(), StepFailure.Kind.TIMEOUT,
                                new StepTimeoutException(stepRun.name(), options.getDeadline().orElse(Duration.ZERO)),
                                false, now)
                        : new StepFailure(stepRun.name(), StepFailure.Kind.CANCELLED,
                                new StepExecutionException(stepRun.name(), "not started before the flow was interrupted"),
                                false, now);
                stepRun.errorMessage = failure.getErrorMessage();
                failures.add(failure);
                observer.onStepSkipped(executionId, stepRun.name(), reason, List.of());
            }
        }

        private void handle(CompletionEvent event) {
            StepRun stepRun = steps.get(event.stepName);
            running--;
            stepRun.endTime = Instant.now();
            Duration duration = Duration.ofNanos(System.nanoTime() - stepRun.startNanos);

            switch (event.type) {
                case COMPLETED:
                    transition(stepRun, StepStatus.COMPLETED);
                    store.set(stepRun.name(), event.result);
                    observer.onStepCompleted(executionId, stepRun.name(), duration);
                    release(stepRun.name());
                    break;

                case RECOVERED:
                    StepFailure recovered = recordFailure(stepRun, StepFailure.Kind.STEP_EXECUTION, event.failure, true);
                    transition(stepRun, StepStatus.RECOVERED);
                    store.set(stepRun.name(), event.result);
                    observer.onStepRecovered(executionId, recovered, duration);
                    release(stepRun.name());
                    break;

                case FAILED:
                    StepFailure failed = recordFailure(stepRun, StepFailure.Kind.STEP_EXECUTION, event.failure, false);
                    transition(stepRun, StepStatus.FAILED);
                    observer.onStepFailed(executionId, failed);
                    cascadeSkip(stepRun.name());
                    break;

                case HANDLER_FAILED:
                    StepFailure original = recordFailure(stepRun, StepFailure.Kind.STEP_EXECUTION, event.failure, false);
                    StepFailure handlerFailed = recordFailure(stepRun, StepFailure.Kind.HANDLER_EXECUTION,
                            event.handlerFailure, false);
                    transition(stepRun, StepStatus.FAILED);
                    observer.onStepFailed(executionId, original);
                    observer.onStepFailed(executionId, handlerFailed);
                    cascadeSkip(stepRun.name());
                    break;

                default:
                    throw new IllegalStateException("Unknown completion event type: " + event.type);
            }
        }

        private StepFailure recordFailure(StepRun stepRun, StepFailure.Kind kind, StepExecutionException error,
                                          boolean recovered) {
            StepFailure failure = new StepFailure(stepRun.name(), kind, error, recovered, Instant.now());
            failures.add(failure);
            stepRun.errorMessage = error.getReason();
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Recorded " + kind + " failure for step " + stepRun.name(), error);
            }
            return failure;
        }

        /**
         * Decrements the unmet count of each dependent; those reaching zero become ready
         * in insertion order.
         */
        private void release(String completedStep) {
            for (String dependent : graph.getDependents(completedStep)) {
                StepRun dependentRun = steps.get(dependent);
                dependentRun.unmetDependencies--;
                if (dependentRun.unmetDependencies == 0 && dependentRun.status == StepStatus.PENDING) {
                    transition(dependentRun, StepStatus.READY);
                    readyQueue.addLast(dependent);
                }
            }
        }

        private void cascadeSkip(String failedStep) {
            for (String dependent : graph.transitiveDependents(failedStep)) {
                StepRun dependentRun = steps.get(dependent);
                if (dependentRun.status == StepStatus.PENDING) {
                    transition(dependentRun, StepStatus.SKIPPED);
                    dependentRun.skipReason = SkipReason.DEPENDENCY_FAILED;
                    dependentRun.skipCauses.add(failedStep);
                    observer.onStepSkipped(executionId, dependent, SkipReason.DEPENDENCY_FAILED,
                            List.copyOf(dependentRun.skipCauses));
                } else if (dependentRun.skipReason == SkipReason.DEPENDENCY_FAILED) {
                    dependentRun.skipCauses.add(failedStep);
                }
            }
        }

        private void transition(StepRun stepRun, StepStatus target) {
            if (!stepRun.status.canTransitionTo(target)) {
                throw new InvalidTransitionException(stepRun.name(), stepRun.status, target);
            }
            stepRun.status = target;
        }
    }
}
