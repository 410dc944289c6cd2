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

package dev.mars.stepflow.engine;

import dev.mars.stepflow.core.FlowStep;
import dev.mars.stepflow.core.ValidationResult;
import dev.mars.stepflow.core.ValidationResult.ValidationIssue;
import dev.mars.stepflow.core.exceptions.FlowValidationException;

import java.util.*;

/**
 * Validated dependency graph of the steps of a flow.
 * Provides reverse adjacency for scheduling, topological sorting and execution levels.
 *
 * <p>Instances only exist for valid definitions: unique names, resolvable
 * dependencies and no cycles. Use {@link #inspect(List)} to collect the problems of
 * a definition without building a graph.</p>
 */
public class DependencyGraph {

    private enum VisitState { UNVISITED, IN_PROGRESS, DONE }

    private final Map<String, FlowStep> steps;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;

    private DependencyGraph(List<FlowStep> stepList) {
        this.steps = new LinkedHashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();

        for (FlowStep step : stepList) {
            steps.put(step.getName(), step);
            dependencies.put(step.getName(), step.getRequires());
            dependents.put(step.getName(), new LinkedHashSet<>());
        }
        // Iterating in insertion order keeps each dependents set in insertion order too
        for (FlowStep step : stepList) {
            for (String dependency : step.getRequires()) {
                dependents.get(dependency).add(step.getName());
            }
        }
    }

    /**
     * Builds the graph for the given steps.
     *
     * @param steps the steps in insertion order
     * @return the validated graph
     * @throws FlowValidationException if the definition has duplicate names, unknown
     *         dependencies or cycles; the exception carries every problem found
     */
    public static DependencyGraph build(List<FlowStep> steps) throws FlowValidationException {
        ValidationResult result = inspect(steps);
        if (!result.isValid()) {
            throw new FlowValidationException(result);
        }
        return new DependencyGraph(steps);
    }

    /**
     * Validates a flow definition and reports all problems without throwing.
     *
     * @param steps the steps in insertion order
     * @return validation result
     */
    public static ValidationResult inspect(List<FlowStep> steps) {
        Objects.requireNonNull(steps, "Steps cannot be null");
        ValidationResult result = new ValidationResult();

        Map<String, FlowStep> byName = new LinkedHashMap<>();
        for (FlowStep step : steps) {
            Objects.requireNonNull(step, "Step cannot be null");
            if (byName.putIfAbsent(step.getName(), step) != null) {
                result.addError(ValidationIssue.Code.DUPLICATE_STEP, step.getName(),
                        "Duplicate step name '" + step.getName() + "'");
            }
        }

        // Check for missing dependencies
        for (FlowStep step : byName.values()) {
            for (String dependency : step.getRequires()) {
                if (!byName.containsKey(dependency)) {
                    result.addError(ValidationIssue.Code.UNKNOWN_DEPENDENCY, step.getName(),
                            "Step '" + step.getName() + "' requires unknown step '" + dependency + "'");
                }
            }
        }

        // Check for circular dependencies
        Map<String, VisitState> states = new HashMap<>();
        for (String name : byName.keySet()) {
            states.put(name, VisitState.UNVISITED);
        }
        Deque<String> path = new ArrayDeque<>();
        for (String name : byName.keySet()) {
            if (states.get(name) == VisitState.UNVISITED) {
                detectCycles(name, byName, states, path, result);
            }
        }

        return result;
    }

    private static void detectCycles(String current, Map<String, FlowStep> byName, Map<String, VisitState> states,
                                     Deque<String> path, ValidationResult result) {
        states.put(current, VisitState.IN_PROGRESS);
        path.addLast(current);

        for (String dependency : byName.get(current).getRequires()) {
            VisitState state = states.get(dependency);
            if (state == null) {
                continue; // unknown dependency, reported separately
            }
            if (state == VisitState.IN_PROGRESS) {
                List<String> cycle = cycleFrom(dependency, path);
                List<String> display = new ArrayList<>(cycle);
                display.add(dependency);
                result.addError(ValidationIssue.Code.CYCLE, dependency,
                        "Dependency cycle detected: " + String.join(" -> ", display), cycle);
            } else if (state == VisitState.UNVISITED) {
                detectCycles(dependency, byName, states, path, result);
            }
        }

        path.removeLast();
        states.put(current, VisitState.DONE);
    }

    private static List<String> cycleFrom(String reentered, Deque<String> path) {
        List<String> cycle = new ArrayList<>();
        boolean onCycle = false;
        for (String name : path) {
            if (name.equals(reentered)) {
                onCycle = true;
            }
            if (onCycle) {
                cycle.add(name);
            }
        }
        return cycle;
    }

    /**
     * Gets all steps of the graph in insertion order.
     */
    public List<FlowStep> getSteps() {
        return List.copyOf(steps.values());
    }

    public FlowStep getStep(String name) {
        FlowStep step = steps.get(name);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step '" + name + "'");
        }
        return step;
    }

    public boolean contains(String name) {
        return steps.containsKey(name);
    }

    /**
     * Gets the dependencies declared by a step.
     *
     * @param name the name of the step
     * @return set of dependency step names
     */
    public Set<String> getDependencies(String name) {
        return dependencies.getOrDefault(name, Set.of());
    }

    /**
     * Gets the steps that directly require the given step, in insertion order.
     *
     * @param name the name of the step
     * @return set of dependent step names
     */
    public Set<String> getDependents(String name) {
        Set<String> result = dependents.get(name);
        return result != null ? Collections.unmodifiableSet(result) : Set.of();
    }

    public int getDependencyCount(String name) {
        return getDependencies(name).size();
    }

    /**
     * Gets the steps without dependencies, in insertion order.
     */
    public List<String> getRootSteps() {
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().isEmpty()) {
                roots.add(entry.getKey());
            }
        }
        return roots;
    }

    /**
     * Performs topological sort to determine a valid execution order.
     * Steps that become available together keep their insertion order.
     *
     * @return list of steps in execution order
     */
    public List<FlowStep> topologicalSort() {
        // Kahn's algorithm for topological sorting
        Map<String, Integer> inDegree = calculateInDegree();
        Queue<String> queue = new ArrayDeque<>(getRootSteps());
        List<FlowStep> result = new ArrayList<>();

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(steps.get(current));

            // Remove edges from current node
            for (String dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        return result;
    }

    /**
     * Groups the steps into levels: every step of a level only depends on steps of
     * earlier levels, so the steps of one level may run in parallel.
     *
     * @return list of execution levels
     */
    public List<List<FlowStep>> getExecutionLevels() {
        List<List<FlowStep>> levels = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        List<String> current = getRootSteps();

        while (!current.isEmpty()) {
            List<FlowStep> level = new ArrayList<>();
            Set<String> next = new LinkedHashSet<>();
            for (String name : current) {
                level.add(steps.get(name));
                for (String dependent : dependents.get(name)) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            levels.add(level);
            current = orderByInsertion(next);
        }

        return levels;
    }

    /**
     * Collects every step that directly or transitively requires the given step,
     * breadth-first over the reverse adjacency.
     *
     * @param name the name of the step
     * @return dependent step names in breadth-first order
     */
    public List<String> transitiveDependents(String name) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>(getDependents(name));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                result.add(current);
                queue.addAll(dependents.get(current));
            }
        }
        return result;
    }

    public int size() {
        return steps.size();
    }

    private List<String> orderByInsertion(Set<String> names) {
        List<String> ordered = new ArrayList<>();
        for (String name : steps.keySet()) {
            if (names.contains(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
        }
        return inDegree;
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "steps=" + steps.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
