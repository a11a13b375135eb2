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
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeOrchestrationEvents implements OrchestrationEvents {
    private final List<OrchestrationEvents> delegates;

    public CompositeOrchestrationEvents(List<OrchestrationEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<OrchestrationEvents> getDelegates() {
        return delegates;
    }

    private void safeForEach(Consumer<OrchestrationEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onStart(String name, String workflowId) { safeForEach(d -> d.onStart(name, workflowId)); }
    @Override public void onRoundPlanned(String name, String workflowId, int round, List<String> parallel, List<String> sequential) { safeForEach(d -> d.onRoundPlanned(name, workflowId, round, parallel, sequential)); }
    @Override public void onCompleted(String name, String workflowId, WorkflowStatus status, long durationMs) { safeForEach(d -> d.onCompleted(name, workflowId, status, durationMs)); }
    @Override public void onCancelled(String name, String workflowId) { safeForEach(d -> d.onCancelled(name, workflowId)); }
    @Override public void onStepStarted(String name, String workflowId, String stepName, String executorId, String action) { safeForEach(d -> d.onStepStarted(name, workflowId, stepName, executorId, action)); }
    @Override public void onStepSuccess(String name, String workflowId, String stepName, long latencyMs) { safeForEach(d -> d.onStepSuccess(name, workflowId, stepName, latencyMs)); }
    @Override public void onStepFailed(String name, String workflowId, String stepName, Throwable error) { safeForEach(d -> d.onStepFailed(name, workflowId, stepName, error)); }
    @Override public void onStepDiscarded(String name, String workflowId, String stepName) { safeForEach(d -> d.onStepDiscarded(name, workflowId, stepName)); }
    @Override public void onStrategySelected(String name, String workflowId, String strategyId, String strategyName, boolean fallback) { safeForEach(d -> d.onStrategySelected(name, workflowId, strategyId, strategyName, fallback)); }
    @Override public void onNoApplicableStrategy(String name, String workflowId) { safeForEach(d -> d.onNoApplicableStrategy(name, workflowId)); }
    @Override public void onInstructionDispatched(String name, String workflowId, int step, String originalExecutor, String targetExecutor, String action) { safeForEach(d -> d.onInstructionDispatched(name, workflowId, step, originalExecutor, targetExecutor, action)); }
}
