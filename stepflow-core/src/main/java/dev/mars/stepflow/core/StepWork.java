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

/**
 * The business logic of a step. The engine treats it as opaque.
 *
 * <p>Implementations may block (model calls, web search, file I/O); each step runs
 * on its own task so other ready steps keep running meanwhile.</p>
 */
@FunctionalInterface
public interface StepWork {

    /**
     * Runs the step.
     *
     * @param flowInput the immutable input supplied to the flow, identical for every step
     * @param context   immutable snapshot of results available to this step
     * @return success with a result mapping, or failure
     * @throws Exception any exception is contained and treated as a failure outcome
     */
    StepOutcome execute(Map<String, Object> flowInput, FlowContext context) throws Exception;
}
