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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Explicit result of a unit of work or recovery handler: either a result mapping
 * or a failure description.
 *
 * <p>The scheduler branches on this value; a thrown exception is still contained
 * but is converted into a failure outcome first.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public final class StepOutcome {

    private final Map<String, Object> result;
    private final String errorMessage;
    private final Throwable cause;

    private StepOutcome(Map<String, Object> result, String errorMessage, Throwable cause) {
        this.result = result;
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    public static StepOutcome success(Map<String, ?> result) {
        Objects.requireNonNull(result, "Result cannot be null");
        return new StepOutcome(ResultMaps.freeze(result), null, null);
    }

    public static StepOutcome failure(String errorMessage) {
        Objects.requireNonNull(errorMessage, "Error message cannot be null");
        return new StepOutcome(null, errorMessage, null);
    }

    public static StepOutcome failure(String errorMessage, Throwable cause) {
        Objects.requireNonNull(cause, "Cause cannot be null");
        String message = errorMessage != null ? errorMessage : cause.getClass().getSimpleName();
        return new StepOutcome(null, message, cause);
    }

    public static StepOutcome failure(Throwable cause) {
        Objects.requireNonNull(cause, "Cause cannot be null");
        return failure(cause.getMessage(), cause);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public boolean isFailure() {
        return result == null;
    }

    /**
     * @return the immutable result mapping
     * @throws IllegalStateException if this outcome is a failure
     */
    public Map<String, Object> getResult() {
        if (result == null) {
            throw new IllegalStateException("Failure outcome has no result: " + errorMessage);
        }
        return result;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "StepOutcome{success, keys=" + result.keySet() + '}'
                : "StepOutcome{failure, error='" + errorMessage + "'}";
    }
}
