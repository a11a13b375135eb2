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

package org.fireflyframework.agentflow.workflow.engine;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.context.WorkflowStatusView;
import org.fireflyframework.agentflow.core.exception.UnknownWorkflowException;
import org.fireflyframework.agentflow.core.exception.WorkflowCancelledException;
import org.fireflyframework.agentflow.core.executor.Executor;
import org.fireflyframework.agentflow.core.executor.ExecutorRegistry;
import org.fireflyframework.agentflow.core.executor.ExecutorStatus;
import org.fireflyframework.agentflow.core.model.WorkflowStatus;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import org.fireflyframework.agentflow.core.step.StepDispatcher;
import org.fireflyframework.agentflow.core.topology.Round;
import org.fireflyframework.agentflow.core.topology.TopologyPlanner;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepGraphRegistry;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Caller-facing facade: registers executors and step graphs, starts and tracks workflow
 * instances, and reports status and counters.
 *
 * <p>Each {@link #startWorkflow} call drives its own instance; instances share nothing
 * but the executors. Failed and completed instances stay queryable; a cancelled one
 * is dropped from the table.
 */
@Slf4j
public class OrchestrationEngine {

    private final ExecutorRegistry executors;
    private final StepGraphRegistry graphs;
    private final StepDispatcher dispatcher;
    private final StepGraphExecutor graphExecutor;
    private final OrchestrationEvents events;

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final AtomicLong totalStarted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();

    public OrchestrationEngine(ExecutorRegistry executors, StepGraphRegistry graphs,
                               StepDispatcher dispatcher, StepGraphExecutor graphExecutor,
                               OrchestrationEvents events) {
        this.executors = Objects.requireNonNull(executors, "executors");
        this.graphs = Objects.requireNonNull(graphs, "graphs");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.graphExecutor = Objects.requireNonNull(graphExecutor, "graphExecutor");
        this.events = events != null ? events : new OrchestrationEvents() {};
    }

    /**
     * Engine with default wiring: no step timeout, unbounded parallel batches.
     */
    public static OrchestrationEngine create(OrchestrationEvents events) {
        ExecutorRegistry executors = new ExecutorRegistry();
        StepDispatcher dispatcher = new StepDispatcher(executors, events);
        return new OrchestrationEngine(executors, new StepGraphRegistry(), dispatcher,
                new StepGraphExecutor(dispatcher, events), events);
    }

    // Registration

    public void registerExecutor(Executor executor) {
        executors.register(executor);
    }

    public void registerStepGraph(StepGraph graph) {
        graphs.register(graph);
    }

    public void registerStepGraph(String name, StepGraph graph) {
        graphs.register(name, graph);
    }

    public ExecutorRegistry getExecutorRegistry() {
        return executors;
    }

    public StepGraphRegistry getStepGraphRegistry() {
        return graphs;
    }

    // Execution

    /**
     * Runs the named step graph to completion.
     *
     * @return the workflow id once every step completed; errors with
     *         {@link UnknownWorkflowException} before any state exists, or with the
     *         failure that aborted the run (the failed instance stays queryable under the
     *         id carried by the error)
     */
    public Mono<String> startWorkflow(String graphName, Map<String, Object> originInput,
                                      Map<String, Object> metadata) {
        return Mono.defer(() -> {
            StepGraph graph = graphs.get(graphName)
                    .orElseThrow(() -> new UnknownWorkflowException(graphName));
            return runInstance(graphName, originInput, metadata,
                    instance -> graphExecutor.execute(graph, instance));
        });
    }

    public Mono<String> startWorkflow(String graphName, Map<String, Object> originInput) {
        return startWorkflow(graphName, originInput, Map.of());
    }

    /**
     * Creates and tracks a new instance and applies the shared lifecycle (counters,
     * events, terminal status) around {@code body}. Strategy-driven workflows run
     * through here so they share the instance table and the counters.
     */
    public Mono<String> runInstance(String workflowName, Map<String, Object> originInput,
                                    Map<String, Object> metadata,
                                    Function<WorkflowInstance, Mono<Void>> body) {
        return Mono.defer(() -> {
            WorkflowInstance instance = WorkflowInstance.create(workflowName, originInput, metadata);
            String workflowId = instance.getId();
            instances.put(workflowId, instance);
            totalStarted.incrementAndGet();
            events.onStart(workflowName, workflowId);

            return Mono.defer(() -> body.apply(instance))
                    .then(Mono.defer(() -> {
                        if (!instance.markCompleted()) {
                            return Mono.<String>error(
                                    new WorkflowCancelledException(workflowId, instance.getCurrentStep()));
                        }
                        completed.incrementAndGet();
                        events.onCompleted(workflowName, workflowId, WorkflowStatus.COMPLETED,
                                durationMs(instance));
                        return Mono.just(workflowId);
                    }))
                    .onErrorResume(error -> {
                        if (error instanceof WorkflowCancelledException
                                || instance.getStatus() == WorkflowStatus.CANCELLED) {
                            return Mono.error(error);
                        }
                        if (instance.markFailed(error)) {
                            failed.incrementAndGet();
                            log.warn("[agentflow-engine] Workflow '{}' {} failed at step '{}': {}",
                                    workflowName, workflowId, instance.getCurrentStep(), error.getMessage());
                            events.onCompleted(workflowName, workflowId, WorkflowStatus.FAILED,
                                    durationMs(instance));
                        }
                        return Mono.error(error);
                    })
                    .doFinally(signal -> releaseExecutors(workflowId));
        });
    }

    /**
     * Dispatches one action outside any step graph, on behalf of {@code instance}.
     */
    public Mono<Map<String, Object>> dispatch(String stepName, String executorId, String action,
                                              Map<String, Object> payload, WorkflowInstance instance) {
        return dispatcher.dispatch(stepName, executorId, action, payload, instance);
    }

    // Control

    /**
     * Cancels a running instance. Returns {@code false} for unknown or already
     * terminal ids. Steps already in flight run to completion; their results are
     * discarded.
     */
    public boolean cancel(String workflowId) {
        if (workflowId == null) {
            return false;
        }
        WorkflowInstance instance = instances.get(workflowId);
        if (instance == null || !instance.markCancelled()) {
            return false;
        }
        instances.remove(workflowId, instance);
        cancelled.incrementAndGet();
        events.onCancelled(instance.getWorkflowName(), workflowId);
        return true;
    }

    // Queries

    public Optional<WorkflowStatusView> getStatus(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instances.get(workflowId)).map(WorkflowInstance::snapshot);
    }

    public Optional<ExecutorStatus> getExecutorStatus(String executorName) {
        return executors.statusOf(executorName);
    }

    public Map<String, ExecutorStatus> getExecutorStatuses() {
        return executors.statuses();
    }

    public EngineStats getEngineStats() {
        long done = completed.get();
        long failures = failed.get();
        long finished = done + failures;
        int active = (int) instances.values().stream()
                .filter(i -> i.getStatus() == WorkflowStatus.RUNNING)
                .count();
        return new EngineStats(totalStarted.get(), done, failures, cancelled.get(), active,
                instances.size(), finished > 0 ? (double) done / finished : 0.0,
                executors.names(), graphs.names());
    }

    /**
     * Dry-run round plan of the named graph, assuming every step succeeds.
     */
    public List<Round> describe(String graphName) {
        StepGraph graph = graphs.get(graphName)
                .orElseThrow(() -> new UnknownWorkflowException(graphName));
        return TopologyPlanner.planRounds(graph.name(), graph.steps(),
                StepSpec::name, StepSpec::dependsOn, StepSpec::parallel);
    }

    private void releaseExecutors(String workflowId) {
        for (Executor executor : executors.getAll()) {
            try {
                executor.onWorkflowFinished(workflowId);
            } catch (RuntimeException e) {
                log.warn("[agentflow-engine] Executor '{}' failed to release workflow {}: {}",
                        executor.name(), workflowId, e.getMessage());
            }
        }
    }

    private static long durationMs(WorkflowInstance instance) {
        Instant end = instance.getCompletedAt() != null ? instance.getCompletedAt() : Instant.now();
        return Duration.between(instance.getCreatedAt(), end).toMillis();
    }
}
