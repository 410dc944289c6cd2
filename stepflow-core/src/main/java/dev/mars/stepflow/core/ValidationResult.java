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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collected problems of a flow definition. A result with no errors is valid.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;

    public ValidationResult() {
        this.errors = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
    }

    public void addError(ValidationIssue.Code code, String stepName, String message) {
        errors.add(new ValidationIssue(code, stepName, message, List.of(stepName)));
    }

    public void addError(ValidationIssue.Code code, String stepName, String message, List<String> involvedSteps) {
        errors.add(new ValidationIssue(code, stepName, message, involvedSteps));
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getErrors(ValidationIssue.Code code) {
        return errors.stream()
                .filter(issue -> issue.getCode() == code)
                .collect(Collectors.toList());
    }

    public boolean hasError(ValidationIssue.Code code) {
        return errors.stream().anyMatch(issue -> issue.getCode() == code);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * A single validation error, attributed to the step where it was found.
     */
    public static class ValidationIssue {

        public enum Code {
            DUPLICATE_STEP,
            UNKNOWN_DEPENDENCY,
            CYCLE
        }

        private final Code code;
        private final String stepName;
        private final String message;
        private final List<String> involvedSteps;

        public ValidationIssue(Code code, String stepName, String message, List<String> involvedSteps) {
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.stepName = Objects.requireNonNull(stepName, "Step name cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
            this.involvedSteps = involvedSteps != null ? List.copyOf(involvedSteps) : List.of();
        }

        public Code getCode() {
            return code;
        }

        public String getStepName() {
            return stepName;
        }

        public String getMessage() {
            return message;
        }

        /**
         * For {@link Code#CYCLE}, the steps on the cycle in the order they were detected.
         */
        public List<String> getInvolvedSteps() {
            return involvedSteps;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return code == that.code &&
                   Objects.equals(stepName, that.stepName) &&
                   Objects.equals(message, that.message) &&
                   Objects.equals(involvedSteps, that.involvedSteps);
        }

        @Override
        public int hashCode() {
            return Objects.hash(code, stepName, message, involvedSteps);
        }

        @Override
        public String toString() {
            return code.name() + " [" + stepName + "]: " + message;
        }
    }
}
