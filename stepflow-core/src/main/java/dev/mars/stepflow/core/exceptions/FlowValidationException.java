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

import dev.mars.stepflow.core.ValidationResult;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown when a flow definition is invalid: a duplicate step name, a dependency on
 * an unknown step, or a dependency cycle.
 *
 * <p>Always raised before any step runs. The flow definition has to be fixed;
 * retrying the same definition fails the same way.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowValidationException extends FlowException {

    private final ValidationResult validationResult;

    public FlowValidationException(ValidationResult validationResult) {
        super(describe(validationResult));
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String describe(ValidationResult validationResult) {
        Objects.requireNonNull(validationResult, "Validation result cannot be null");
        return "Flow validation failed: " + validationResult.getErrors().stream()
                .map(ValidationResult.ValidationIssue::getMessage)
                .collect(Collectors.joining("; "));
    }
}
