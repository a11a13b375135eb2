/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.agentflow.workflow.registry;

import org.fireflyframework.agentflow.core.exception.StepGraphValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, named, ordered collection of steps. Definition order is significant: it
 * orders the sequential steps of a round.
 *
 * <p>Step names are validated for uniqueness here. Dependency references and
 * acyclicity are not; a graph that cannot make progress fails at run time with a
 * {@link org.fireflyframework.agentflow.core.exception.WorkflowDeadlockException}.
 */
public record StepGraph(String name, String description, List<StepSpec> steps) {

    public StepGraph {
        if (name == null || name.isBlank()) {
            throw new StepGraphValidationException("Step graph name cannot be blank");
        }
        steps = steps != null ? List.copyOf(steps) : List.of();
        Set<String> seen = new HashSet<>();
        for (StepSpec step : steps) {
            if (step.name() == null || step.name().isBlank()) {
                throw new StepGraphValidationException("Step graph '" + name + "' contains a step without a name");
            }
            if (!seen.add(step.name())) {
                throw new StepGraphValidationException("Duplicate step name '" + step.name() + "' in graph '" + name + "'");
            }
        }
        description = description != null ? description : "";
    }

    public StepGraph(String name, List<StepSpec> steps) {
        this(name, "", steps);
    }

    /**
     * Same steps registered under another name.
     */
    public StepGraph withName(String newName) {
        return newName.equals(name) ? this : new StepGraph(newName, description, steps);
    }

    public Optional<StepSpec> findStep(String stepName) {
        return steps.stream().filter(s -> s.name().equals(stepName)).findFirst();
    }

    public List<String> stepNames() {
        return steps.stream().map(StepSpec::name).toList();
    }

    public int size() {
        return steps.size();
    }
}
