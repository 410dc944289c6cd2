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

import dev.mars.stepflow.core.exceptions.StepExecutionException;

import java.util.Map;

/**
 * Optional per-step error policy that turns a failure into a substitute result.
 *
 * <p>A success outcome marks the step RECOVERED and its result is published to
 * dependents exactly like a normal result. A failure outcome, a {@code null}
 * outcome or a thrown exception is a handler failure: the step is FAILED and its
 * dependents are skipped.</p>
 */
@FunctionalInterface
public interface RecoveryHandler {

    StepOutcome recover(StepExecutionException failure, FlowContext context) throws Exception;

    /**
     * Handler that always substitutes the given result.
     */
    static RecoveryHandler substitute(Map<String, ?> fallbackResult) {
        StepOutcome outcome = StepOutcome.success(fallbackResult);
        return (failure, context) -> outcome;
    }
}
