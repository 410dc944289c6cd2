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

package dev.mars.stepflow.core.exceptions;

import dev.mars.stepflow.core.StepStatus;

/**
 * Thrown when the scheduler attempts a step status transition that
 * {@link StepStatus#canTransitionTo(StepStatus)} rejects.
 *
 * <p>Only the scheduler changes step statuses, so this is an engine defect and is
 * unchecked. The message carries the step, both states and the legal targets.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class InvalidTransitionException extends IllegalStateException {

    private final String stepName;
    private final StepStatus currentState;
    private final StepStatus requestedState;

    public InvalidTransitionException(String stepName, StepStatus currentState, StepStatus requestedState) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                stepName, currentState, requestedState, formatTransitions(currentState.getValidTransitions())));
        this.stepName = stepName;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getStepName() {
        return stepName;
    }

    public StepStatus getCurrentState() {
        return currentState;
    }

    public StepStatus getRequestedState() {
        return requestedState;
    }

    public StepStatus[] getValidTransitions() {
        return currentState.getValidTransitions();
    }

    private static String formatTransitions(StepStatus[] transitions) {
        if (transitions.length == 0) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < transitions.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(transitions[i].name());
        }
        sb.append("]");
        return sb.toString();
    }
}
