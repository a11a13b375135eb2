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

package org.fireflyframework.agentflow.core.exception;

import java.util.List;
import java.util.Map;

/**
 * No step is ready while steps remain: the graph is cyclic or depends on a step it
 * does not contain.
 */
public final class WorkflowDeadlockException extends OrchestrationException {

    private final String graphName;
    private final List<String> remainingSteps;

    public WorkflowDeadlockException(String graphName, List<String> remainingSteps, String workflowId) {
        super("Workflow deadlock in '" + graphName + "': no ready step among " + remainingSteps,
                "AGENTFLOW_WORKFLOW_DEADLOCK", workflowId,
                Map.of("graphName", String.valueOf(graphName), "remainingSteps", List.copyOf(remainingSteps)),
                null);
        this.graphName = graphName;
        this.remainingSteps = List.copyOf(remainingSteps);
    }

    public String getGraphName() {
        return graphName;
    }

    public List<String> getRemainingSteps() {
        return remainingSteps;
    }
}
