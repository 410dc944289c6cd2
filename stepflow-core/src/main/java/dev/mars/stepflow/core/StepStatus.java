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

/**
 * Lifecycle of a single step within one flow execution.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → READY → RUNNING → {COMPLETED | FAILED | RECOVERED}
 *    ↓        ↓
 * SKIPPED  SKIPPED
 * </pre>
 *
 * <p>A step leaves {@code PENDING} once every declared dependency is COMPLETED or
 * RECOVERED. It is SKIPPED straight from {@code PENDING} when a dependency fails
 * without recovery, and from {@code PENDING} or {@code READY} when the flow deadline
 * fires before it was dispatched. COMPLETED, FAILED, RECOVERED and SKIPPED are
 * terminal.</p>
 *
 * <p>Only the scheduler moves a step between states.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public enum StepStatus {

    /**
     * Registered for this execution, waiting on at least one dependency.
     */
    PENDING,

    /**
     * All dependencies satisfied; queued for a free concurrency slot.
     */
    READY,

    /**
     * Unit of work dispatched and not yet reported back.
     */
    RUNNING,

    /**
     * Unit of work returned a result; the result is in the flow context.
     */
    COMPLETED,

    /**
     * Unit of work failed and no recovery handler produced a substitute result.
     */
    FAILED,

    /**
     * Unit of work failed but the recovery handler returned a substitute result,
     * which is in the flow context in place of the original.
     */
    RECOVERED,

    /**
     * Never executed, either because an upstream step failed or because the
     * flow deadline fired first.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == RECOVERED || this == SKIPPED;
    }

    /**
     * Whether the step produced a context entry that dependents may consume.
     */
    public boolean isSuccessful() {
        return this == COMPLETED || this == RECOVERED;
    }

    public boolean isActive() {
        return this == READY || this == RUNNING;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(StepStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case PENDING:
                return target == READY || target == SKIPPED;

            case READY:
                return target == RUNNING || target == SKIPPED;

            case RUNNING:
                return target == COMPLETED || target == FAILED || target == RECOVERED;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public StepStatus[] getValidTransitions() {
        switch (this) {
            case PENDING:
                return new StepStatus[]{READY, SKIPPED};
            case READY:
                return new StepStatus[]{RUNNING, SKIPPED};
            case RUNNING:
                return new StepStatus[]{COMPLETED, FAILED, RECOVERED};
            default:
                return new StepStatus[0];
        }
    }
}
