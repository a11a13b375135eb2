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

package org.fireflyframework.agentflow.strategy.engine;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A workflow whose steps are chosen at run time by the strategy engine.
 *
 * @param preludeSteps       dispatched one after another before evaluation; their
 *                           dependencies and parallel flags are ignored
 * @param situationResolver  builds the situation to evaluate from the instance once the
 *                           prelude has run
 */
public record DynamicWorkflowDefinition(
        String name,
        List<StepSpec> preludeSteps,
        Function<WorkflowInstance, StrategySituation> situationResolver
) {
    public DynamicWorkflowDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(situationResolver, "situationResolver");
        preludeSteps = preludeSteps != null ? List.copyOf(preludeSteps) : List.of();
    }
}
