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

package org.fireflyframework.agentflow.core.step;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.exception.OrchestrationException;
import org.fireflyframework.agentflow.core.exception.StepFailureException;
import org.fireflyframework.agentflow.core.exception.UnknownExecutorException;
import org.fireflyframework.agentflow.core.exception.WorkflowCancelledException;
import org.fireflyframework.agentflow.core.executor.Executor;
import org.fireflyframework.agentflow.core.executor.ExecutorMessage;
import org.fireflyframework.agentflow.core.executor.ExecutorRegistry;
import org.fireflyframework.agentflow.core.model.WorkflowStatus;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Single-step dispatch primitive: resolves an executor by name, hands it a fresh
 * {@link ExecutorMessage} and normalizes the outcome.
 *
 * <p>Used by the step-graph loop and, directly, by strategy-driven execution.
 */
@Slf4j
public final class StepDispatcher {

    private final ExecutorRegistry executors;
    private final OrchestrationEvents events;
    private final Duration stepTimeout;

    public StepDispatcher(ExecutorRegistry executors, OrchestrationEvents events) {
        this(executors, events, null);
    }

    /**
     * @param stepTimeout upper bound for one executor call; {@code null} or non-positive
     *                    waits indefinitely
     */
    public StepDispatcher(ExecutorRegistry executors, OrchestrationEvents events, Duration stepTimeout) {
        this.executors = Objects.requireNonNull(executors, "executors");
        this.events = events != null ? events : new OrchestrationEvents() {};
        this.stepTimeout = stepTimeout != null && !stepTimeout.isZero() && !stepTimeout.isNegative()
                ? stepTimeout : null;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    /**
     * Dispatches {@code action} to {@code executorId} on behalf of {@code instance}.
     *
     * <p>Errors with {@link UnknownExecutorException} when no executor is registered under
     * that name, with {@link StepFailureException} when the call fails or times out, and
     * with {@link WorkflowCancelledException} when the instance was cancelled before the
     * call started or while it was in flight. A result arriving after cancellation is
     * discarded.
     */
    public Mono<Map<String, Object>> dispatch(String stepName, String executorId, String action,
                                              Map<String, Object> payload, WorkflowInstance instance) {
        return Mono.defer(() -> {
            String workflowName = instance.getWorkflowName();
            String workflowId = instance.getId();

            if (instance.getStatus() == WorkflowStatus.CANCELLED) {
                return Mono.error(new WorkflowCancelledException(workflowId, instance.getCurrentStep()));
            }

            Executor executor = executors.get(executorId).orElse(null);
            if (executor == null) {
                UnknownExecutorException error = new UnknownExecutorException(executorId, workflowId);
                events.onStepFailed(workflowName, workflowId, stepName, error);
                return Mono.error(error);
            }

            instance.setCurrentStep(stepName);
            events.onStepStarted(workflowName, workflowId, stepName, executorId, action);

            ExecutorMessage message = ExecutorMessage.dispatch(ExecutorMessage.ORCHESTRATOR, executorId,
                    workflowId, action, payload, contextSnapshot(instance));
            long startedAt = System.nanoTime();

            Mono<Map<String, Object>> call = Mono.defer(() -> executor.handle(message, instance))
                    .defaultIfEmpty(Map.of());
            if (stepTimeout != null) {
                call = call.timeout(stepTimeout)
                        .onErrorMap(TimeoutException.class,
                                e -> new StepFailureException(executorId, action, workflowId, true, e));
            }

            return call
                    .onErrorMap(e -> normalize(e, executorId, action, workflowId))
                    .flatMap(result -> {
                        if (instance.getStatus() == WorkflowStatus.CANCELLED) {
                            log.info("[agentflow] Discarding result of step '{}' for cancelled workflow {}",
                                    stepName, workflowId);
                            events.onStepDiscarded(workflowName, workflowId, stepName);
                            return Mono.<Map<String, Object>>error(
                                    new WorkflowCancelledException(workflowId, stepName));
                        }
                        long latencyMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
                        events.onStepSuccess(workflowName, workflowId, stepName, latencyMs);
                        return Mono.just(result);
                    })
                    .doOnError(e -> !(e instanceof WorkflowCancelledException),
                            e -> events.onStepFailed(workflowName, workflowId, stepName, e));
        });
    }

    private static Map<String, Object> contextSnapshot(WorkflowInstance instance) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(ExecutorMessage.ORIGIN_INPUT, instance.getOriginInput());
        snapshot.put("workflowName", instance.getWorkflowName());
        snapshot.put("completedSteps", instance.getCompletedSteps());
        snapshot.put("metadata", instance.getMetadata());
        return snapshot;
    }

    private static Throwable normalize(Throwable error, String executorId, String action, String workflowId) {
        if (error instanceof StepFailureException stepFailure) {
            return stepFailure.forWorkflow(workflowId);
        }
        if (error instanceof OrchestrationException) {
            return error;
        }
        return new StepFailureException(executorId, action, workflowId, false, error);
    }
}
