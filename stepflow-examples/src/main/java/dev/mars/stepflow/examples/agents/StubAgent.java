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

package dev.mars.stepflow.examples.agents;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * Stand-in for a model-backed agent. Answers prompts with a canned response after a
 * short simulated latency, so the examples run offline and deterministically.
 */
public class StubAgent {

    private static final Logger logger = Logger.getLogger(StubAgent.class.getName());

    private final String name;
    private final String role;
    private final long latencyMillis;
    private final BiFunction<String, Map<String, ?>, String> responder;
    private final AtomicInteger calls = new AtomicInteger();

    public StubAgent(String name, String role, long latencyMillis,
                     BiFunction<String, Map<String, ?>, String> responder) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.role = Objects.requireNonNull(role, "Role cannot be null");
        this.latencyMillis = latencyMillis;
        this.responder = Objects.requireNonNull(responder, "Responder cannot be null");
    }

    /**
     * Answers a prompt.
     *
     * @throws InterruptedException if interrupted during the simulated latency
     * @throws AgentUnavailableException if the responder fails
     */
    public String process(String prompt, Map<String, ?> hints) throws InterruptedException {
        int call = calls.incrementAndGet();
        logger.fine(name + " processing call " + call + ": " + prompt);
        if (latencyMillis > 0) {
            TimeUnit.MILLISECONDS.sleep(latencyMillis);
        }
        try {
            return responder.apply(prompt, hints != null ? hints : Map.of());
        } catch (RuntimeException e) {
            throw new AgentUnavailableException(name, e.getMessage(), e);
        }
    }

    public String getName() {
        return name;
    }

    public String getRole() {
        return role;
    }

    public int getCallCount() {
        return calls.get();
    }

    @Override
    public String toString() {
        return "StubAgent{" +
               "name='" + name + '\'' +
               ", role='" + role + '\'' +
               '}';
    }

    /**
     * Raised when an agent cannot answer.
     */
    public static class AgentUnavailableException extends RuntimeException {

        private final String agentName;

        public AgentUnavailableException(String agentName, String message, Throwable cause) {
            super("Agent " + agentName + " unavailable: " + message, cause);
            this.agentName = agentName;
        }

        public String getAgentName() {
            return agentName;
        }
    }
}
