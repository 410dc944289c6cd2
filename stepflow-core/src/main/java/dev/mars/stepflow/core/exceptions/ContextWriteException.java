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
 * Thrown when a result is written twice for the same step.
 *
 * <p>Each context entry has exactly one writer and is written once, so this always
 * signals an engine defect rather than bad input. It is unchecked and never
 * recovered from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class ContextWriteException extends IllegalStateException {

    private final String stepName;

    public ContextWriteException(String stepName) {
        super("Context entry for step '" + stepName + "' is already written");
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
