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

package org.fireflyframework.agentflow.workflow.builder;

import org.fireflyframework.agentflow.core.exception.StepGraphValidationException;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent construction of a {@link StepGraph}:
 *
 * <pre>{@code
 * StepGraph graph = StepGraphBuilder.graph("place_order")
 *         .step("auth").executor("commerce").action("authenticateCustomer").parallel(true).add()
 *         .step("getAddress").executor("commerce").action("getAddress").dependsOn("auth").add()
 *         .build();
 * }</pre>
 *
 * Steps keep the order in which they are added.
 */
public class StepGraphBuilder {

    private final String name;
    private String description = "";
    private final List<StepSpec> steps = new ArrayList<>();

    public StepGraphBuilder(String name) {
        this.name = name;
    }

    public static StepGraphBuilder graph(String name) {
        return new StepGraphBuilder(name);
    }

    public StepGraphBuilder description(String description) {
        this.description = description != null ? description : "";
        return this;
    }

    public StepBuilder step(String stepName) {
        return new StepBuilder(this, stepName);
    }

    public StepGraphBuilder step(StepSpec step) {
        steps.add(step);
        return this;
    }

    public StepGraph build() {
        return new StepGraph(name, description, List.copyOf(steps));
    }

    public static class StepBuilder {

        private final StepGraphBuilder parent;
        private final String stepName;
        private String executorId;
        private String action;
        private final Map<String, Object> input = new LinkedHashMap<>();
        private List<String> dependsOn = List.of();
        private boolean parallel = false;

        StepBuilder(StepGraphBuilder parent, String stepName) {
            this.parent = parent;
            this.stepName = stepName;
        }

        public StepBuilder executor(String executorId) {
            this.executorId = executorId;
            return this;
        }

        public StepBuilder action(String action) {
            this.action = action;
            return this;
        }

        /**
         * Shorthand for {@code executor(executorId).action(action)}.
         */
        public StepBuilder call(String executorId, String action) {
            return executor(executorId).action(action);
        }

        public StepBuilder input(String key, Object value) {
            if (value != null) {
                this.input.put(key, value);
            }
            return this;
        }

        public StepBuilder input(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::input);
            }
            return this;
        }

        public StepBuilder dependsOn(String... deps) {
            this.dependsOn = Arrays.asList(deps);
            return this;
        }

        public StepBuilder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public StepGraphBuilder add() {
            if (executorId == null || executorId.isBlank()) {
                throw new StepGraphValidationException("Step '" + stepName + "' has no executor");
            }
            if (action == null || action.isBlank()) {
                throw new StepGraphValidationException("Step '" + stepName + "' has no action");
            }
            return parent.step(new StepSpec(stepName, executorId, action, input, dependsOn, parallel));
        }
    }
}
