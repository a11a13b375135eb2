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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * One step of a {@link StepGraph}: which executor performs which action, with what
 * input, after which other steps.
 *
 * @param inputTemplate payload handed to the executor; opaque to the engine
 * @param dependsOn     names of steps that must complete first
 * @param parallel      eligible for the concurrent batch of its round
 */
public record StepSpec(
        String name,
        String executorId,
        String action,
        Map<String, Object> inputTemplate,
        List<String> dependsOn,
        boolean parallel
) {
    public StepSpec {
        inputTemplate = inputTemplate != null ? Map.copyOf(inputTemplate) : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(new LinkedHashSet<>(dependsOn)) : List.of();
    }

    public static StepSpec of(String name, String executorId, String action, String... dependsOn) {
        return new StepSpec(name, executorId, action, Map.of(), List.of(dependsOn), false);
    }

    public static StepSpec parallel(String name, String executorId, String action, String... dependsOn) {
        return new StepSpec(name, executorId, action, Map.of(), List.of(dependsOn), true);
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public boolean isRootStep() {
        return !hasDependencies();
    }
}
