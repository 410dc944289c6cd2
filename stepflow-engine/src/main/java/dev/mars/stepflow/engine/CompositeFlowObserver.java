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
import dev.mars.stepflow.core.SkipReason;
import dev.mars.stepflow.core.StepFailure;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans notifications out to several observers. A failing observer does not stop
 * delivery to the others and never reaches the scheduler.
 */
public class CompositeFlowObserver implements FlowObserver {

    private static final Logger logger = Logger.getLogger(CompositeFlowObserver.class.getName());

    private final List<FlowObserver> observers;

    public CompositeFlowObserver(List<FlowObserver> observers) {
        this.observers = List.copyOf(Objects.requireNonNull(observers, "Observers cannot be null"));
    }

    public List<FlowObserver> getObservers() {
        return observers;
    }

    @Override
    public void onFlowStarted(String executionId, String flowName, int stepCount) {
        notifyAll("onFlowStarted", observer -> observer.onFlowStarted(executionId, flowName, stepCount));
    }

    @Override
    public void onStepStarted(String executionId, FlowStep step) {
        notifyAll("onStepStarted", observer -> observer.onStepStarted(executionId, step));
    }

    @Override
    public void onStepCompleted(String executionId, String stepName, Duration duration) {
        notifyAll("onStepCompleted", observer -> observer.onStepCompleted(executionId, stepName, duration));
    }

    @Override
    public void onStepRecovered(String executionId, StepFailure failure, Duration duration) {
        notifyAll("onStepRecovered", observer -> observer.onStepRecovered(executionId, failure, duration));
    }

    @Override
    public void onStepFailed(String executionId, StepFailure failure) {
        notifyAll("onStepFailed", observer -> observer.onStepFailed(executionId, failure));
    }

    @Override
    public void onStepSkipped(String executionId, String stepName, SkipReason reason, List<String> causes) {
        notifyAll("onStepSkipped", observer -> observer.onStepSkipped(executionId, stepName, reason, causes));
    }

    @Override
    public void onFlowCompleted(FlowResult result) {
        notifyAll("onFlowCompleted", observer -> observer.onFlowCompleted(result));
    }

    private void notifyAll(String callback, Consumer<FlowObserver> notification) {
        for (FlowObserver observer : observers) {
            try {
                notification.accept(observer);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Observer " + observer.getClass().getSimpleName() +
                        " failed in " + callback + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Observer exception details", e);
                }
            }
        }
    }
}
