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
import org.fireflyframework.agentflow.core.exception.WorkflowCancelledException;
import org.fireflyframework.agentflow.core.exception.WorkflowDeadlockException;
import org.fireflyframework.agentflow.core.model.WorkflowStatus;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import org.fireflyframework.agentflow.core.step.StepDispatcher;
import org.fireflyframework.agentflow.core.topology.TopologyPlanner;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.concurrent.Queues;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Drives one {@link WorkflowInstance} through its {@link StepGraph}, round by round.
 *
 * <p>Each round computes the ready set, runs its parallel batch concurrently and waits
 * for all of it, then runs its sequential batch one step at a time. The first failure
 * aborts the run once its batch has joined; nothing is retried.
 */
@Slf4j
public class StepGraphExecutor {

    private final StepDispatcher dispatcher;
    private final OrchestrationEvents events;
    private final int parallelism;

    public StepGraphExecutor(StepDispatcher dispatcher, OrchestrationEvents events) {
        this(dispatcher, events, 0);
    }

    /**
     * @param parallelism maximum concurrent steps within one parallel batch; 0 = unbounded
     */
    public StepGraphExecutor(StepDispatcher dispatcher, OrchestrationEvents events, int parallelism) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.events = events != null ? events : new OrchestrationEvents() {};
        this.parallelism = Math.max(0, parallelism);
    }

    public Mono<Void> execute(StepGraph graph, WorkflowInstance instance) {
        return Mono.defer(() -> {
            instance.setPendingSteps(graph.stepNames());
            return executeRound(graph, instance, List.copyOf(graph.steps()), 1);
        });
    }

    private Mono<Void> executeRound(StepGraph graph, WorkflowInstance instance,
                                    List<StepSpec> remaining, int round) {
        return Mono.defer(() -> {
            if (remaining.isEmpty()) {
                return Mono.empty();
            }
            if (instance.getStatus() == WorkflowStatus.CANCELLED) {
                return Mono.error(new WorkflowCancelledException(instance.getId(), instance.getCurrentStep()));
            }

            Set<String> completed = new HashSet<>(instance.getCompletedSteps());
            List<StepSpec> ready = TopologyPlanner.readySet(remaining, completed, StepSpec::dependsOn);
            if (ready.isEmpty()) {
                List<String> stuck = remaining.stream().map(StepSpec::name).toList();
                log.warn("[agentflow] Deadlock in graph '{}': no ready step among {}", graph.name(), stuck);
                return Mono.error(new WorkflowDeadlockException(graph.name(), stuck, instance.getId()));
            }

            TopologyPlanner.Batch<StepSpec> batch = TopologyPlanner.partition(ready, StepSpec::parallel);
            events.onRoundPlanned(instance.getWorkflowName(), instance.getId(), round,
                    batch.parallel().stream().map(StepSpec::name).toList(),
                    batch.sequential().stream().map(StepSpec::name).toList());

            List<StepSpec> next = new ArrayList<>(remaining);
            next.removeAll(ready);

            return executeParallel(instance, batch.parallel())
                    .then(executeSequential(instance, batch.sequential()))
                    .then(executeRound(graph, instance, List.copyOf(next), round + 1));
        });
    }

    /**
     * Dispatches every member of the batch and waits for all of them, failed or not.
     * The first failure is reported once the whole batch has returned.
     */
    private Mono<Void> executeParallel(WorkflowInstance instance, List<StepSpec> steps) {
        if (steps.isEmpty()) {
            return Mono.empty();
        }
        if (steps.size() == 1) {
            return executeStep(instance, steps.get(0));
        }
        int concurrency = parallelism > 0 ? parallelism : steps.size();
        return Flux.fromIterable(steps)
                .flatMapDelayError(step -> executeStep(instance, step), concurrency, Queues.XS_BUFFER_SIZE)
                .then()
                .onErrorMap(Exceptions::isMultiple, e -> Exceptions.unwrapMultiple(e).get(0));
    }

    private Mono<Void> executeSequential(WorkflowInstance instance, List<StepSpec> steps) {
        return Flux.fromIterable(steps)
                .concatMap(step -> executeStep(instance, step))
                .then();
    }

    private Mono<Void> executeStep(WorkflowInstance instance, StepSpec step) {
        return dispatcher.dispatch(step.name(), step.executorId(), step.action(), step.inputTemplate(), instance)
                .doOnNext(result -> instance.markStepCompleted(step.name()))
                .then();
    }
}
