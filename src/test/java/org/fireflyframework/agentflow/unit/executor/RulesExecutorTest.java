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

package org.fireflyframework.agentflow.unit.executor;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.exception.NoApplicableStrategyException;
import org.fireflyframework.agentflow.core.exception.StepFailureException;
import org.fireflyframework.agentflow.core.executor.ExecutorMessage;
import org.fireflyframework.agentflow.executor.commerce.CommerceExecutor;
import org.fireflyframework.agentflow.executor.rules.RulesExecutor;
import org.fireflyframework.agentflow.executor.rules.ValidationRules;
import org.fireflyframework.agentflow.strategy.Strategy;
import org.fireflyframework.agentflow.strategy.StrategyCatalog;
import org.fireflyframework.agentflow.strategy.StrategyCatalogLoader;
import org.fireflyframework.agentflow.strategy.engine.ExecutionPlan;
import org.fireflyframework.agentflow.strategy.engine.StrategyEngine;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RulesExecutorTest {

    private static final Map<String, Object> NEW_ADDRESS =
            Map.of("street", "1 New St", "city", "Austin", "state", "TX", "zip", "78701");

    private final WorkflowInstance instance = WorkflowInstance.create("place_order", Map.of(), null);

    private Mono<Map<String, Object>> run(RulesExecutor executor, String action, Map<String, Object> payload) {
        ExecutorMessage message = ExecutorMessage.dispatch(ExecutorMessage.ORCHESTRATOR, executor.name(),
                instance.getId(), action, payload, Map.of(ExecutorMessage.ORIGIN_INPUT, instance.getOriginInput()));
        return executor.handle(message, instance);
    }

    private void searched(double price, boolean inStock) {
        instance.putExecutorData(CommerceExecutor.NAME, "search_results",
                List.of(Map.of("id", "prod-1", "name", "iPhone 15 Pro", "price", price)));
        instance.putExecutorData(CommerceExecutor.NAME, "inventory_status",
                List.of(Map.of("product_id", "prod-1", "in_stock", inStock)));
    }

    private void orderPlacedHoursAgo(String status, long hours) {
        instance.putExecutorData(CommerceExecutor.NAME, "order_details", Map.of(
                "order_id", "ORD-1",
                "status", status,
                "created_at", Instant.now().minus(hours, ChronoUnit.HOURS).toString()));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> recorded(String key) {
        return (Map<String, Object>) instance.getExecutorValue(RulesExecutor.NAME, key);
    }

    @Test
    void validateOrder_withinLimits_passes() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        searched(999.99, true);

        StepVerifier.create(run(executor, "validateOrder", Map.of("quantity", 2)))
                .assertNext(report -> {
                    assertThat(report).containsEntry("validation_passed", true);
                    assertThat((List<?>) report.get("rules_checked")).hasSize(4);
                    assertThat((List<?>) report.get("violations")).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void validateOrder_overLimits_failsAndRecordsReport() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        searched(999.99, true);

        StepVerifier.create(run(executor, "validateOrder", Map.of("quantity", 11)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StepFailureException.class);
                    assertThat(error.getCause()).isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("Order validation failed");
                })
                .verify();

        Map<String, Object> report = recorded("rules_validation");
        assertThat(report).containsEntry("validation_passed", false);
        assertThat((List<Map<String, Object>>) report.get("violations"))
                .extracting(v -> v.get("rule"))
                .containsExactly("max_order_value", "max_quantity_per_item");
    }

    @Test
    void validateOrder_outOfStock_fails() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        searched(20.0, false);

        StepVerifier.create(run(executor, "validateOrder", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause()).hasMessageContaining("out of stock"))
                .verify();
    }

    @Test
    void validateOrder_customLimits() {
        var executor = new RulesExecutor(new ValidationRules(50, 100, 1, 24, 48), null);
        searched(20.0, true);

        StepVerifier.create(run(executor, "validateOrder", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause()).hasMessageContaining("minimum 50.00"))
                .verify();
    }

    @Test
    void checkChangePolicy_recentConfirmedOrder_allowsChange() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        orderPlacedHoursAgo("CONFIRMED", 2);

        StepVerifier.create(run(executor, "checkChangePolicy", Map.of("enforce", true)))
                .assertNext(policy -> {
                    assertThat(policy).containsEntry("change_allowed", true)
                            .containsEntry("cancellation_allowed", true);
                    assertThat((List<?>) policy.get("restrictions")).isEmpty();
                })
                .verifyComplete();
        assertThat(recorded("change_policy")).containsEntry("change_allowed", true);
    }

    @Test
    void checkChangePolicy_outsideWindow_reportsRestriction() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        orderPlacedHoursAgo("PENDING", 30);

        StepVerifier.create(run(executor, "checkChangePolicy", Map.of()))
                .assertNext(policy -> {
                    assertThat(policy).containsEntry("change_allowed", false)
                            .containsEntry("cancellation_allowed", true);
                    assertThat((List<String>) policy.get("restrictions"))
                            .singleElement().asString().contains("24");
                })
                .verifyComplete();
    }

    @Test
    void checkChangePolicy_shippedOrder_enforced_fails() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);
        orderPlacedHoursAgo("SHIPPED", 1);

        StepVerifier.create(run(executor, "checkChangePolicy", Map.of("enforce", true)))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .hasMessageContaining("Cannot change shipped orders"))
                .verify();
        assertThat(recorded("change_policy")).containsEntry("change_allowed", false);
    }

    @Test
    void checkChangePolicy_withoutOrder_fails() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);

        StepVerifier.create(run(executor, "checkChangePolicy", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .hasMessageContaining("Order details required"))
                .verify();
    }

    @Test
    void evaluateStrategy_withoutEngine_fails() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);

        StepVerifier.create(run(executor, "evaluateStrategy", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .hasMessage("No strategy engine configured"))
                .verify();
    }

    @Test
    void evaluateStrategy_selectsAndRecordsPlan() {
        StrategyCatalog catalog = new StrategyCatalogLoader()
                .load(new ClassPathResource("agentflow/business-strategies.json"));
        var executor = new RulesExecutor(ValidationRules.defaults(), new StrategyEngine(catalog));

        Map<String, Object> payload = Map.of(
                "query", "please ship to my new place",
                "order_data", Map.of("order_id", "ORD-1", "status", "CONFIRMED", "total_amount", 120.0),
                "customer_data", Map.of("customer_id", "cust-1"),
                "current_situation", Map.of("order_age_hours", 2.0),
                "requested_changes", Map.of("new_address", NEW_ADDRESS));

        StepVerifier.create(run(executor, "evaluateStrategy", payload))
                .assertNext(evaluation -> {
                    assertThat(evaluation).containsEntry("strategy_id", "direct_address_update")
                            .containsEntry("fallback", false);
                    assertThat(((ExecutionPlan) evaluation.get("execution_plan")).size()).isEqualTo(3);
                })
                .verifyComplete();
        assertThat(recorded("strategy_evaluation")).containsKey("business_rationale");
    }

    @Test
    void evaluateStrategy_nothingApplies_failsWithNoApplicableStrategy() {
        var shippedOnly = new Strategy("shipped_only", "Shipped only", 1,
                List.of("Order status is SHIPPED"), List.of("Notify customer"));
        var executor = new RulesExecutor(ValidationRules.defaults(), new StrategyEngine(StrategyCatalog.of(shippedOnly)));

        StepVerifier.create(run(executor, "evaluateStrategy", Map.of("order_data", Map.of("status", "PENDING"))))
                .expectError(NoApplicableStrategyException.class)
                .verify();
    }

    @Test
    void executeCustomAction_queuesManualFollowUp() {
        var executor = new RulesExecutor(ValidationRules.defaults(), null);

        StepVerifier.create(run(executor, "executeCustomAction",
                        Map.of("description", "Arrange return pickup for delivered order")))
                .assertNext(followUp -> assertThat(followUp)
                        .containsEntry("status", "pending_manual_review")
                        .containsEntry("description", "Arrange return pickup for delivered order"))
                .verifyComplete();
    }
}
