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
import org.fireflyframework.agentflow.core.exception.NoApplicableStrategyException;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import org.fireflyframework.agentflow.strategy.Strategy;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.compile.CompiledInstruction;
import org.fireflyframework.agentflow.workflow.engine.OrchestrationEngine;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Front door for both kinds of workflow. Names registered as dynamic run the strategy
 * path; every other name is handed to the {@link OrchestrationEngine}.
 *
 * <p>The strategy path runs the prelude, evaluates the situation, records the selected
 * strategy and its plan under {@value #STRATEGY_ENGINE}, then dispatches the compiled
 * instructions one after another. Each result is recorded under the executor name the
 * instruction was compiled with, even when it was retargeted to another executor.
 */
@Slf4j
public class StrategyOrchestrator {

    public static final String STRATEGY_ENGINE = "strategyEngine";

    private final OrchestrationEngine engine;
    private final StrategyEngine strategyEngine;
    private final ExecutorAliases aliases;
    private final OrchestrationEvents events;
    private final Map<String, DynamicWorkflowDefinition> dynamicWorkflows = new ConcurrentHashMap<>();

    public StrategyOrchestrator(OrchestrationEngine engine, StrategyEngine strategyEngine,
                                ExecutorAliases aliases, OrchestrationEvents events) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.strategyEngine = Objects.requireNonNull(strategyEngine, "strategyEngine");
        this.aliases = aliases != null ? aliases : ExecutorAliases.none();
        this.events = events != null ? events : new OrchestrationEvents() {};
    }

    public void registerDynamicWorkflow(DynamicWorkflowDefinition definition) {
        dynamicWorkflows.put(definition.name(), definition);
        log.info("[strategy] Registered dynamic workflow '{}' with {} prelude steps",
                definition.name(), definition.preludeSteps().size());
    }

    public boolean isDynamic(String workflowName) {
        return workflowName != null && dynamicWorkflows.containsKey(workflowName);
    }

    public Set<String> dynamicWorkflowNames() {
        return Collections.unmodifiableSet(new TreeSet<>(dynamicWorkflows.keySet()));
    }

    public Mono<String> startWorkflow(String workflowName, Map<String, Object> originInput,
                                      Map<String, Object> metadata) {
        DynamicWorkflowDefinition definition = workflowName != null ? dynamicWorkflows.get(workflowName) : null;
        if (definition == null) {
            return engine.startWorkflow(workflowName, originInput, metadata);
        }
        return engine.runInstance(workflowName, originInput, metadata,
                instance -> runDynamic(definition, instance));
    }

    private Mono<Void> runDynamic(DynamicWorkflowDefinition definition, WorkflowInstance instance) {
        return Flux.fromIterable(definition.preludeSteps())
                .concatMap(step -> runPrelude(step, instance))
                .then(Mono.defer(() -> {
                    StrategySituation situation = definition.situationResolver().apply(instance);
                    Optional<Strategy> selected = strategyEngine.evaluate(situation);
                    if (selected.isEmpty()) {
                        events.onNoApplicableStrategy(instance.getWorkflowName(), instance.getId());
                        return Mono.error(new NoApplicableStrategyException(situation.query(), instance.getId()));
                    }
                    Strategy strategy = selected.get();
                    ExecutionPlan plan = strategyEngine.plan(strategy, situation);
                    events.onStrategySelected(instance.getWorkflowName(), instance.getId(),
                            strategy.id(), strategy.name(), plan.fallback());
                    recordSelection(instance, strategy, plan);
                    return executePlan(plan, instance);
                }));
    }

    private Mono<Void> runPrelude(StepSpec step, WorkflowInstance instance) {
        return engine.dispatch(step.name(), step.executorId(), step.action(), step.inputTemplate(), instance)
                .doOnNext(result -> instance.markStepCompleted(step.name()))
                .then();
    }

    /**
     * Dispatches every instruction of {@code plan} in order on behalf of
     * {@code instance}. The first failure stops the plan.
     */
    public Mono<Void> executePlan(ExecutionPlan plan, WorkflowInstance instance) {
        instance.setPendingSteps(plan.instructions().stream().map(CompiledInstruction::resultKey).toList());
        return Flux.fromIterable(plan.instructions())
                .concatMap(instruction -> executeInstruction(instruction, instance))
                .then();
    }

    private Mono<Map<String, Object>> executeInstruction(CompiledInstruction instruction, WorkflowInstance instance) {
        ExecutorAliases.Target target = aliases.resolve(instruction.executorId(), instruction.action());
        log.info("[strategy] Step {}: {} ({}.{} -> {}.{})", instruction.step(), instruction.description(),
                instruction.executorId(), instruction.action(), target.executorId(), target.action());
        events.onInstructionDispatched(instance.getWorkflowName(), instance.getId(), instruction.step(),
                instruction.executorId(), target.executorId(), target.action());

        return engine.dispatch(instruction.resultKey(), target.executorId(), target.action(),
                        instruction.parameters(), instance)
                .doOnNext(result -> {
                    instance.putExecutorData(instruction.executorId(), instruction.resultKey(), result);
                    instance.markStepCompleted(instruction.resultKey());
                });
    }

    private static void recordSelection(WorkflowInstance instance, Strategy strategy, ExecutionPlan plan) {
        instance.putExecutorData(STRATEGY_ENGINE, "selected_strategy", strategy.id());
        instance.putExecutorData(STRATEGY_ENGINE, "strategy_name", strategy.name());
        instance.putExecutorData(STRATEGY_ENGINE, "strategy_description", strategy.description());
        instance.putExecutorData(STRATEGY_ENGINE, "fallback", plan.fallback());
        instance.putExecutorData(STRATEGY_ENGINE, "business_rationale", strategy.rationale());
        instance.putExecutorData(STRATEGY_ENGINE, "execution_plan", plan);
    }

    public StrategyEngine getStrategyEngine() {
        return strategyEngine;
    }
}
