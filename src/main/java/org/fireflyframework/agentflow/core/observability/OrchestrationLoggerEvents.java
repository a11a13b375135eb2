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

@Slf4j
public class OrchestrationLoggerEvents implements OrchestrationEvents {
    @Override
    public void onStart(String name, String workflowId) {
        log.info("[agentflow] started name={} workflowId={}", name, workflowId);
    }
    @Override
    public void onRoundPlanned(String name, String workflowId, int round, List<String> parallel, List<String> sequential) {
        log.debug("[agentflow] round.planned name={} workflowId={} round={} parallel={} sequential={}", name, workflowId, round, parallel, sequential);
    }
    @Override
    public void onCompleted(String name, String workflowId, WorkflowStatus status, long durationMs) {
        if (status == WorkflowStatus.COMPLETED) {
            log.info("[agentflow] completed name={} workflowId={} status={} durationMs={}", name, workflowId, status, durationMs);
        } else {
            log.warn("[agentflow] completed name={} workflowId={} status={} durationMs={}", name, workflowId, status, durationMs);
        }
    }
    @Override
    public void onCancelled(String name, String workflowId) {
        log.info("[agentflow] cancelled name={} workflowId={}", name, workflowId);
    }
    @Override
    public void onStepStarted(String name, String workflowId, String stepName, String executorId, String action) {
        log.info("[agentflow] step.started name={} workflowId={} step={} executor={} action={}", name, workflowId, stepName, executorId, action);
    }
    @Override
    public void onStepSuccess(String name, String workflowId, String stepName, long latencyMs) {
        log.info("[agentflow] step.success name={} workflowId={} step={} latencyMs={}", name, workflowId, stepName, latencyMs);
    }
    @Override
    public void onStepFailed(String name, String workflowId, String stepName, Throwable error) {
        log.warn("[agentflow] step.failed name={} workflowId={} step={} error={}", name, workflowId, stepName, error.getMessage());
    }
    @Override
    public void onStepDiscarded(String name, String workflowId, String stepName) {
        log.info("[agentflow] step.discarded name={} workflowId={} step={}", name, workflowId, stepName);
    }
    @Override
    public void onStrategySelected(String name, String workflowId, String strategyId, String strategyName, boolean fallback) {
        log.info("[agentflow] strategy.selected name={} workflowId={} strategyId={} strategy={} fallback={}", name, workflowId, strategyId, strategyName, fallback);
    }
    @Override
    public void onNoApplicableStrategy(String name, String workflowId) {
        log.warn("[agentflow] strategy.none name={} workflowId={}", name, workflowId);
    }
    @Override
    public void onInstructionDispatched(String name, String workflowId, int step, String originalExecutor, String targetExecutor, String action) {
        log.info("[agentflow] instruction.dispatched name={} workflowId={} step={} executor={} target={} action={}", name, workflowId, step, originalExecutor, targetExecutor, action);
    }
}
