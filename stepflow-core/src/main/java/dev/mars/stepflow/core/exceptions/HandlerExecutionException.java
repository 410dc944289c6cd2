package dev.mars.stepflow.core.exceptions;

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

/**
 * Raised when a step's recovery handler fails, returns a failure or returns nothing.
 * The step is then treated exactly like a failure without a handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class HandlerExecutionException extends StepExecutionException {

    private final StepExecutionException originalFailure;

    public HandlerExecutionException(String stepName, String message, StepExecutionException originalFailure) {
        super(stepName, message);
        this.originalFailure = originalFailure;
    }

    public HandlerExecutionException(String stepName, String message, StepExecutionException originalFailure,
                                     Throwable cause) {
        super(stepName, message, cause);
        this.originalFailure = originalFailure;
    }

    /**
     * The step failure the handler was asked to recover from.
     */
    public StepExecutionException getOriginalFailure() {
        return originalFailure;
    }

    @Override
    public String getMessage() {
        return String.format("Recovery handler of step %s failed: %s", getStepName(), getReason());
    }
}
