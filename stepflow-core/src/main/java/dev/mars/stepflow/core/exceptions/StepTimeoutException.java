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

import java.time.Duration;

/**
 * Recorded for a step that was not dispatched before the flow deadline fired.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class StepTimeoutException extends StepExecutionException {

    private final Duration deadline;

    public StepTimeoutException(String stepName, Duration deadline) {
        super(stepName, "not started before the flow deadline of " + deadline.toMillis() + " ms");
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
