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
 * Raised for a step whose unit of work failed.
 *
 * <p>Never thrown out of flow execution: the scheduler records it in the flow
 * result and hands it to the step's recovery handler, if any.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class StepExecutionException extends FlowException {

    private final String stepName;

    public StepExecutionException(String stepName, String message) {
        super(message);
        this.stepName = stepName;
    }

    public StepExecutionException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }

    /**
     * The failure description as reported by the step, without the step prefix.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Step %s failed: %s", stepName, super.getMessage());
    }
}
