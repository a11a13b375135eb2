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

package org.fireflyframework.agentflow.core.observability;

import org.fireflyframework.agentflow.core.model.WorkflowStatus;

import java.util.List;

public interface OrchestrationEvents {
    // Workflow lifecycle
    default void onStart(String name, String workflowId) {}
    default void onRoundPlanned(String name, String workflowId, int round, List<String> parallel, List<String> sequential) {}
    default void onCompleted(String name, String workflowId, WorkflowStatus status, long durationMs) {}
    default void onCancelled(String name, String workflowId) {}

    // Steps
    default void onStepStarted(String name, String workflowId, String stepName, String executorId, String action) {}
    default void onStepSuccess(String name, String workflowId, String stepName, long latencyMs) {}
    default void onStepFailed(String name, String workflowId, String stepName, Throwable error) {}
    default void onStepDiscarded(String name, String workflowId, String stepName) {}

    // Strategies
    default void onStrategySelected(String name, String workflowId, String strategyId, String strategyName, boolean fallback) {}
    default void onNoApplicableStrategy(String name, String workflowId) {}
    default void onInstructionDispatched(String name, String workflowId, int step, String originalExecutor, String targetExecutor, String action) {}
}
