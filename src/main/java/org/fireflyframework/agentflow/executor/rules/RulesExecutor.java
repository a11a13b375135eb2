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

package org.fireflyframework.agentflow.executor.rules;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.exception.NoApplicableStrategyException;
import org.fireflyframework.agentflow.core.executor.AbstractExecutor;
import org.fireflyframework.agentflow.core.executor.ActionHandler;
import org.fireflyframework.agentflow.core.executor.ExecutorMessage;
import org.fireflyframework.agentflow.core.model.Capability;
import org.fireflyframework.agentflow.executor.commerce.CommerceExecutor;
import org.fireflyframework.agentflow.strategy.Strategy;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.engine.ExecutionPlan;
import org.fireflyframework.agentflow.strategy.engine.StrategyEngine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.*;

/**
 * Business rules and policy checks: order validation, change-policy checks, strategy
 * evaluation and the catch-all for strategy actions no other executor understands.
 *
 * <p>Order data produced earlier in the run is read from the business executor's slot
 * ({@value CommerceExecutor#NAME} unless configured otherwise).
 */
@Slf4j
public class RulesExecutor extends AbstractExecutor {

    public static final String NAME = "rulesExecutor";

    private static final Set<String> LOCKED_STATUSES = Set.of("shipped", "delivered", "cancelled");

    private final ValidationRules rules;
    private final StrategyEngine strategyEngine;
    private final String businessExecutor;

    public RulesExecutor(ValidationRules rules, StrategyEngine strategyEngine) {
        this(NAME, rules, strategyEngine, CommerceExecutor.NAME);
    }

    /**
     * @param strategyEngine may be {@code null}; {@code evaluateStrategy} then fails
     */
    public RulesExecutor(String name, ValidationRules rules, StrategyEngine strategyEngine, String businessExecutor) {
        super(name, EnumSet.of(Capability.RULES_VALIDATE));
        this.rules = rules != null ? rules : ValidationRules.defaults();
        this.strategyEngine = strategyEngine;
        this.businessExecutor = Objects.requireNonNull(businessExecutor, "businessExecutor");
        for (RulesAction action : RulesAction.values()) {
            registerAction(action.actionName(), handlerFor(action));
        }
    }

    private ActionHandler handlerFor(RulesAction action) {
        return switch (action) {
            case VALIDATE_ORDER -> this::validateOrder;
            case CHECK_CHANGE_POLICY -> this::checkChangePolicy;
            case EVALUATE_STRATEGY -> this::evaluateStrategy;
            case EXECUTE_CUSTOM_ACTION -> this::executeCustomAction;
        };
    }

    public ValidationRules getRules() {
        return rules;
    }

    /**
     * Checks the order about to be placed: value limits, quantity limit and stock of
     * every searched product. Any violation fails the step; the full report is
     * recorded either way.
     */
    private Mono<Map<String, Object>> validateOrder(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromCallable(() -> {
            List<Map<String, Object>> checks = new ArrayList<>();
            List<Map<String, Object>> products = listOf(instance.getExecutorValue(businessExecutor, "search_results"));
            int quantity = message.argument("quantity") instanceof Number n ? n.intValue() : 1;

            if (!products.isEmpty()) {
                double value = number(products.get(0).get("price")) * quantity;
                checks.add(check("min_order_value", value >= rules.minOrderValue(),
                        String.format(Locale.ROOT, "Order value %.2f against minimum %.2f", value, rules.minOrderValue())));
                checks.add(check("max_order_value", value <= rules.maxOrderValue(),
                        String.format(Locale.ROOT, "Order value %.2f against maximum %.2f", value, rules.maxOrderValue())));
            }
            checks.add(check("max_quantity_per_item", quantity <= rules.maxQuantityPerItem(),
                    "Quantity " + quantity + " against limit " + rules.maxQuantityPerItem()));
            for (Map<String, Object> status : listOf(instance.getExecutorValue(businessExecutor, "inventory_status"))) {
                boolean inStock = Boolean.TRUE.equals(status.get("in_stock"));
                checks.add(check("inventory_availability", inStock,
                        "Product " + status.get("product_id") + (inStock ? " available" : " out of stock")));
            }

            List<Map<String, Object>> violations = checks.stream()
                    .filter(c -> !Boolean.TRUE.equals(c.get("valid")))
                    .toList();
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("validation_passed", violations.isEmpty());
            report.put("rules_checked", checks);
            report.put("violations", violations);
            recordResult(instance, "rules_validation", report);

            if (!violations.isEmpty()) {
                List<Object> messages = violations.stream().map(v -> v.get("message")).toList();
                log.warn("[rules] Order validation failed for workflow {}: {}", instance.getId(), messages);
                throw new IllegalStateException("Order validation failed: " + messages);
            }
            return report;
        });
    }

    /**
     * Decides whether an existing order may still be changed: inside the change window
     * and not yet shipped, delivered or cancelled. With {@code enforce} set, a refused
     * change fails the step.
     */
    @SuppressWarnings("unchecked")
    private Mono<Map<String, Object>> checkChangePolicy(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromCallable(() -> {
            Object source = message.argument("order");
            if (!(source instanceof Map<?, ?>)) {
                source = instance.getExecutorValue(businessExecutor, "order_details");
            }
            if (!(source instanceof Map<?, ?> found)) {
                throw new IllegalStateException("Order details required for policy check");
            }
            Map<String, Object> order = (Map<String, Object>) found;
            double hours = message.argument("order_age_hours") instanceof Number n
                    ? n.doubleValue() : StrategySituation.hoursSince(order.get("created_at"));
            String status = String.valueOf(order.getOrDefault("status", "pending")).toLowerCase(Locale.ROOT);

            List<String> restrictions = new ArrayList<>();
            boolean allowed = hours <= rules.addressChangeWindowHours();
            if (!allowed) {
                restrictions.add("Change window of " + rules.addressChangeWindowHours() + "h has passed");
            }
            if (LOCKED_STATUSES.contains(status)) {
                allowed = false;
                restrictions.add("Cannot change " + status + " orders");
            }
            Map<String, Object> policy = new LinkedHashMap<>();
            policy.put("change_allowed", allowed);
            policy.put("cancellation_allowed", hours <= rules.cancellationWindowHours() && !LOCKED_STATUSES.contains(status));
            policy.put("hours_since_order", Math.round(hours * 100) / 100.0);
            policy.put("time_limit_hours", rules.addressChangeWindowHours());
            policy.put("restrictions", restrictions);
            recordResult(instance, "change_policy", policy);
            if (!allowed && Boolean.TRUE.equals(message.argument("enforce"))) {
                throw new IllegalStateException("Order change not allowed: " + restrictions);
            }
            return policy;
        });
    }

    private Mono<Map<String, Object>> evaluateStrategy(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromCallable(() -> {
            if (strategyEngine == null) {
                throw new IllegalStateException("No strategy engine configured");
            }
            StrategySituation situation = new StrategySituation(
                    message.argumentString("query"),
                    mapOf(message.argument("order_data")),
                    mapOf(message.argument("customer_data")),
                    mapOf(message.argument("current_situation")),
                    mapOf(message.argument("requested_changes")));
            Strategy strategy = strategyEngine.evaluate(situation)
                    .orElseThrow(() -> new NoApplicableStrategyException(situation.query(), instance.getId()));
            ExecutionPlan plan = strategyEngine.plan(strategy, situation);

            Map<String, Object> evaluation = new LinkedHashMap<>();
            evaluation.put("strategy_selected", strategy.name());
            evaluation.put("strategy_id", strategy.id());
            evaluation.put("strategy_description", strategy.description());
            if (strategy.rationale() != null) {
                evaluation.put("business_rationale", strategy.rationale());
            }
            evaluation.put("fallback", plan.fallback());
            evaluation.put("execution_plan", plan);
            recordResult(instance, "strategy_evaluation", evaluation);
            return evaluation;
        });
    }

    /**
     * Records an action nothing else could perform, for manual follow-up.
     */
    private Mono<Map<String, Object>> executeCustomAction(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromSupplier(() -> {
            String description = Objects.requireNonNullElse(message.argumentString("description"), message.action());
            log.info("[rules] Custom action queued for manual follow-up in workflow {}: {}", instance.getId(), description);
            Map<String, Object> followUp = new LinkedHashMap<>();
            followUp.put("description", description);
            followUp.put("status", "pending_manual_review");
            followUp.put("recorded_at", Instant.now().toString());
            recordResult(instance, "custom_action", followUp);
            return followUp;
        });
    }

    private static Map<String, Object> check(String rule, boolean valid, String message) {
        Map<String, Object> check = new LinkedHashMap<>();
        check.put("rule", rule);
        check.put("valid", valid);
        check.put("message", message);
        return check;
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOf(Object value) {
        return value instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOf(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
