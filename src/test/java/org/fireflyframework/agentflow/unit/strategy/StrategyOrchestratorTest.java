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

package org.fireflyframework.agentflow.unit.strategy;

import org.fireflyframework.agentflow.core.context.WorkflowStatusView;
import org.fireflyframework.agentflow.core.exception.NoApplicableStrategyException;
import org.fireflyframework.agentflow.core.exception.StepFailureException;
import org.fireflyframework.agentflow.core.model.WorkflowStatus;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import org.fireflyframework.agentflow.strategy.Strategy;
import org.fireflyframework.agentflow.strategy.StrategyCatalog;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.engine.DynamicWorkflowDefinition;
import org.fireflyframework.agentflow.strategy.engine.ExecutionPlan;
import org.fireflyframework.agentflow.strategy.engine.ExecutorAliases;
import org.fireflyframework.agentflow.strategy.engine.StrategyEngine;
import org.fireflyframework.agentflow.strategy.engine.StrategyOrchestrator;
import org.fireflyframework.agentflow.support.ScriptedExecutor;
import org.fireflyframework.agentflow.workflow.engine.OrchestrationEngine;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class StrategyOrchestratorTest {

    private static final Map<String, Object> NEW_ADDRESS =
            Map.of("street", "1 New St", "city", "Austin", "state", "TX", "zip", "78701");

    private static final Strategy DIRECT = new Strategy("direct", "Direct update", 1,
            List.of("Order status is PENDING or CONFIRMED", "New address is valid"),
            List.of("Validate new address", "Update order with new shipping address", "Send confirmation to customer"));

    private static final Strategy MANUAL = new Strategy("manual", "Manual review", 999,
            List.of(), List.of("Escalate to customer service"));

    private final AtomicReference<String> startedId = new AtomicReference<>();
    private final List<String> dispatched = new CopyOnWriteArrayList<>();
    private final List<String> selections = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> noStrategyFor = new AtomicReference<>();

    private OrchestrationEngine engine;
    private ScriptedExecutor commerce;
    private ScriptedExecutor rules;

    @BeforeEach
    void setUp() {
        OrchestrationEvents events = new OrchestrationEvents() {
            @Override
            public void onStart(String name, String workflowId) {
                startedId.set(workflowId);
            }

            @Override
            public void onStrategySelected(String name, String workflowId, String strategyId,
                                           String strategyName, boolean fallback) {
                selections.add(strategyId + (fallback ? " (fallback)" : ""));
            }

            @Override
            public void onNoApplicableStrategy(String name, String workflowId) {
                noStrategyFor.set(workflowId);
            }

            @Override
            public void onInstructionDispatched(String name, String workflowId, int step, String originalExecutor,
                                                String targetExecutor, String action) {
                dispatched.add(step + ":" + originalExecutor + "->" + targetExecutor + "." + action);
            }
        };
        engine = OrchestrationEngine.create(events);
        List<String> trace = new CopyOnWriteArrayList<>();
        commerce = new ScriptedExecutor("commerce", trace).succeed("lookupOrder");
        rules = new ScriptedExecutor("rulesExecutor", trace).succeed("executeCustomAction");
        engine.registerExecutor(commerce);
        engine.registerExecutor(rules);
    }

    private StrategyOrchestrator orchestrator(StrategyCatalog catalog, String status) {
        StrategyOrchestrator orchestrator = new StrategyOrchestrator(engine, new StrategyEngine(catalog),
                ExecutorAliases.consolidated("commerce"), null);
        orchestrator.registerDynamicWorkflow(new DynamicWorkflowDefinition("address_change",
                List.of(StepSpec.of("lookupOrder", "commerce", "lookupOrder")),
                instance -> new StrategySituation("move my order",
                        Map.of("order_id", "ORD-1", "status", status),
                        Map.of("customer_id", "cust-1"),
                        Map.of("order_age_hours", 1.0, "prelude_done", instance.isStepCompleted("lookupOrder")),
                        Map.of("new_address", NEW_ADDRESS))));
        return orchestrator;
    }

    private String run(StrategyOrchestrator orchestrator) {
        AtomicReference<String> id = new AtomicReference<>();
        StepVerifier.create(orchestrator.startWorkflow("address_change", Map.of("order_id", "ORD-1"), Map.of()))
                .consumeNextWith(id::set)
                .verifyComplete();
        return id.get();
    }

    @Test
    void selectedPlan_runsInOrder_resultsUnderCompiledExecutorNames() {
        commerce.succeed("validateAddress", "updateOrder", "sendNotification");
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT), "confirmed");

        String id = run(orchestrator);

        assertThat(commerce.trace())
                .containsExactly("lookupOrder", "validateAddress", "updateOrder", "sendNotification");
        assertThat(dispatched).containsExactly(
                "1:shippingExecutor->commerce.validateAddress",
                "2:orderExecutor->commerce.updateOrder",
                "3:customerExecutor->commerce.sendNotification");
        assertThat(selections).containsExactly("direct");

        WorkflowStatusView status = engine.getStatus(id).orElseThrow();
        assertThat(status.status()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(status.completedSteps()).containsExactly("lookupOrder", "step_1", "step_2", "step_3");
        assertThat(status.executorData().get("shippingExecutor")).containsKey("step_1");
        assertThat(status.executorData().get("orderExecutor")).containsKey("step_2");
        assertThat(status.executorData().get("customerExecutor")).containsKey("step_3");
        assertThat(status.executorData().get("commerce")).containsKeys("validateAddress", "updateOrder");

        Map<String, Object> selection = status.executorData().get(StrategyOrchestrator.STRATEGY_ENGINE);
        assertThat(selection).containsEntry("selected_strategy", "direct")
                .containsEntry("strategy_name", "Direct update")
                .containsEntry("fallback", false);
        assertThat(((ExecutionPlan) selection.get("execution_plan")).size()).isEqualTo(3);
    }

    @Test
    void noStrategyApplies_fallbackRunsAsCustomAction() {
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT).withFallback(MANUAL), "shipped");

        String id = run(orchestrator);

        assertThat(selections).containsExactly("manual (fallback)");
        assertThat(rules.trace()).endsWith("executeCustomAction");
        WorkflowStatusView status = engine.getStatus(id).orElseThrow();
        assertThat(status.executorData().get("rulesExecutor")).containsKey("step_1");
        assertThat(status.executorData().get(StrategyOrchestrator.STRATEGY_ENGINE))
                .containsEntry("fallback", true);
    }

    @Test
    void noStrategyAndNoFallback_failsTheWorkflow() {
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT), "delivered");

        StepVerifier.create(orchestrator.startWorkflow("address_change", Map.of(), Map.of()))
                .expectError(NoApplicableStrategyException.class)
                .verify();

        String id = startedId.get();
        assertThat(noStrategyFor.get()).isEqualTo(id);
        assertThat(engine.getStatus(id).orElseThrow().status()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(commerce.trace()).containsExactly("lookupOrder");
        assertThat(engine.getEngineStats().failed()).isEqualTo(1);
    }

    @Test
    void failingInstruction_stopsThePlan() {
        commerce.succeed("validateAddress", "sendNotification").fail("updateOrder", "order locked");
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT), "pending");

        StepVerifier.create(orchestrator.startWorkflow("address_change", Map.of(), Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StepFailureException.class);
                    assertThat(error.getCause()).hasMessage("order locked");
                })
                .verify();

        assertThat(commerce.trace()).containsExactly("lookupOrder", "validateAddress");
        WorkflowStatusView status = engine.getStatus(startedId.get()).orElseThrow();
        assertThat(status.status()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(status.completedSteps()).containsExactly("lookupOrder", "step_1");
    }

    @Test
    void preludeFailure_skipsEvaluation() {
        commerce.fail("lookupOrder", "order service down");
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT), "pending");

        StepVerifier.create(orchestrator.startWorkflow("address_change", Map.of(), Map.of()))
                .expectError(StepFailureException.class)
                .verify();

        assertThat(selections).isEmpty();
        assertThat(noStrategyFor.get()).isNull();
    }

    @Test
    void nonDynamicName_isDelegatedToTheEngine() {
        commerce.succeed("search");
        engine.registerStepGraph(new StepGraph("product_inquiry", List.of(StepSpec.of("search", "commerce", "search"))));
        StrategyOrchestrator orchestrator = orchestrator(StrategyCatalog.of(DIRECT), "pending");

        assertThat(orchestrator.isDynamic("product_inquiry")).isFalse();
        assertThat(orchestrator.dynamicWorkflowNames()).containsExactly("address_change");

        StepVerifier.create(orchestrator.startWorkflow("product_inquiry", Map.of(), Map.of()))
                .assertNext(id -> assertThat(engine.getStatus(id).orElseThrow().completedSteps())
                        .containsExactly("search"))
                .verifyComplete();
        assertThat(selections).isEmpty();
    }

    @Test
    void executePlan_dispatchesAgainstAnExistingInstance() {
        commerce.succeed("validateAddress", "updateOrder", "sendNotification");
        StrategyEngine strategyEngine = new StrategyEngine(StrategyCatalog.of(DIRECT));
        StrategyOrchestrator orchestrator = new StrategyOrchestrator(engine, strategyEngine,
                ExecutorAliases.consolidated("commerce"), null);
        StrategySituation situation = new StrategySituation("", Map.of("order_id", "ORD-9", "status", "pending"),
                Map.of(), Map.of(), Map.of("new_address", NEW_ADDRESS));
        ExecutionPlan plan = strategyEngine.plan(DIRECT, situation);

        StepVerifier.create(engine.runInstance("manual_plan", Map.of(), Map.of(),
                        instance -> orchestrator.executePlan(plan, instance)))
                .assertNext(id -> assertThat(engine.getStatus(id).orElseThrow().executorData().get("orderExecutor"))
                        .containsKey("step_2"))
                .verifyComplete();
    }
}
