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

package org.fireflyframework.agentflow.strategy.compile;

import org.fireflyframework.agentflow.strategy.StrategySituation;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

import static org.fireflyframework.agentflow.strategy.compile.ActionRule.containsAll;
import static org.fireflyframework.agentflow.strategy.compile.ActionRule.containsAny;

/**
 * Compiles declarative strategy actions into {@link CompiledInstruction}s. The first
 * rule whose matcher accepts the lower-cased description wins; a description no rule
 * accepts compiles to {@code rulesExecutor.executeCustomAction}.
 */
@Slf4j
public class ActionCompiler {

    public static final String ORDER_EXECUTOR = "orderExecutor";
    public static final String PAYMENT_EXECUTOR = "paymentExecutor";
    public static final String SHIPPING_EXECUTOR = "shippingExecutor";
    public static final String CUSTOMER_EXECUTOR = "customerExecutor";
    public static final String RULES_EXECUTOR = "rulesExecutor";
    public static final String CUSTOM_ACTION = "executeCustomAction";

    private final List<ActionRule> rules;

    public ActionCompiler(List<ActionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ActionCompiler withDefaults() {
        return new ActionCompiler(defaultRules());
    }

    public List<ActionRule> getRules() {
        return rules;
    }

    public List<CompiledInstruction> compile(List<String> actions, StrategySituation situation) {
        List<CompiledInstruction> instructions = new ArrayList<>(actions.size());
        for (int i = 0; i < actions.size(); i++) {
            instructions.add(compile(actions.get(i), situation, i + 1));
        }
        return List.copyOf(instructions);
    }

    public CompiledInstruction compile(String description, StrategySituation situation, int step) {
        String normalized = description != null ? description.toLowerCase(Locale.ROOT) : "";
        for (ActionRule rule : rules) {
            if (rule.matches(normalized)) {
                CompiledInstruction instruction = rule.compile(step, description, situation);
                log.debug("[strategy] '{}' -> {}.{} (rule {})", description,
                        instruction.executorId(), instruction.action(), rule.name());
                return instruction;
            }
        }
        return customAction(step, description, situation);
    }

    private static CompiledInstruction customAction(int step, String description, StrategySituation situation) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("description", description);
        parameters.put("query", situation.query());
        return new CompiledInstruction(step, RULES_EXECUTOR, CUSTOM_ACTION, description, parameters);
    }

    /**
     * The order-change vocabulary, in matching order.
     */
    public static List<ActionRule> defaultRules() {
        return List.of(
                new ActionRule("cancel-order", containsAll("cancel", "order"), ORDER_EXECUTOR, "cancelOrder",
                        (d, s) -> params("order_id", s.orderId(), "reason", "Address change requested")),
                new ActionRule("issue-gift-card", containsAll("gift card", "issue"), PAYMENT_EXECUTOR, "issueGiftCard",
                        (d, s) -> params("amount", s.order().get("total_amount"),
                                "customer_id", s.customerId(),
                                "reason", "Order cancellation for address change")),
                new ActionRule("create-order", containsAll("create new order"), ORDER_EXECUTOR, "createOrder",
                        (d, s) -> params("customer_id", s.customerId(),
                                "items", s.order().getOrDefault("items", List.of()),
                                "shipping_address", s.newAddress().orElse(null),
                                "payment_method", Map.of("type", "gift_card"))),
                new ActionRule("validate-address", containsAll("validate", "address"), SHIPPING_EXECUTOR, "validateAddress",
                        (d, s) -> params("address", s.newAddress().orElse(null))),
                new ActionRule("update-order", containsAll("update order"), ORDER_EXECUTOR, "updateOrder",
                        (d, s) -> params("order_id", s.orderId(), "updates", s.requestedChanges())),
                new ActionRule("notify-customer", containsAny("send confirmation", "notify customer"),
                        CUSTOMER_EXECUTOR, "sendNotification",
                        (d, s) -> params("customer_id", s.customerId(),
                                "message_type", "address_change_confirmation",
                                "details", s.requestedChanges())));
    }

    /**
     * Key/value pairs with {@code null} values dropped.
     */
    static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                parameters.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return parameters;
    }
}
