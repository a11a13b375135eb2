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

package org.fireflyframework.agentflow.workflow.standard;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.executor.commerce.CommerceExecutor;
import org.fireflyframework.agentflow.executor.rules.RulesExecutor;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.engine.DynamicWorkflowDefinition;
import org.fireflyframework.agentflow.strategy.engine.StrategyOrchestrator;
import org.fireflyframework.agentflow.workflow.builder.StepGraphBuilder;
import org.fireflyframework.agentflow.workflow.engine.OrchestrationEngine;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The order-handling workflows, wired against the consolidated business executor and
 * the rules executor.
 */
public final class StandardWorkflows {

    public static final String PLACE_ORDER = "place_order";
    public static final String CHANGE_ADDRESS = "change_address";
    public static final String PRODUCT_INQUIRY = "product_inquiry";
    public static final String DYNAMIC_ADDRESS_CHANGE = "dynamic_address_change";

    private static final String COMMERCE = CommerceExecutor.NAME;
    private static final String RULES = RulesExecutor.NAME;

    private StandardWorkflows() {}

    public static void registerAll(OrchestrationEngine engine, StrategyOrchestrator orchestrator) {
        engine.registerStepGraph(placeOrder());
        engine.registerStepGraph(changeAddress());
        engine.registerStepGraph(productInquiry());
        if (orchestrator != null) {
            orchestrator.registerDynamicWorkflow(dynamicAddressChange());
        }
    }

    /**
     * Search and authentication start together; delivery quote and order validation
     * both wait for stock and address.
     */
    public static StepGraph placeOrder() {
        return StepGraphBuilder.graph(PLACE_ORDER)
                .description("Find a product, check it and place the order")
                .step("searchProduct").call(COMMERCE, "searchProduct").add()
                .step("authenticateCustomer").call(COMMERCE, "authenticateCustomer").parallel(true).add()
                .step("checkInventory").call(COMMERCE, "checkInventory").dependsOn("searchProduct").add()
                .step("getAddress").call(COMMERCE, "getAddress").dependsOn("authenticateCustomer").add()
                .step("calculateDelivery").call(COMMERCE, "calculateDelivery")
                .dependsOn("checkInventory", "getAddress").add()
                .step("validateOrder").call(RULES, "validateOrder")
                .dependsOn("checkInventory", "getAddress").add()
                .step("createOrder").call(COMMERCE, "createOrder")
                .dependsOn("validateOrder", "calculateDelivery").add()
                .step("sendConfirmation").call(COMMERCE, "sendConfirmation").dependsOn("createOrder").add()
                .build();
    }

    public static StepGraph changeAddress() {
        return StepGraphBuilder.graph(CHANGE_ADDRESS)
                .description("Move an existing order to a new delivery address")
                .step("authenticateCustomer").call(COMMERCE, "authenticateCustomer").add()
                .step("getOrderDetails").call(COMMERCE, "getOrderDetails").dependsOn("authenticateCustomer").add()
                .step("checkChangePolicy").call(RULES, "checkChangePolicy").input("enforce", true)
                .dependsOn("getOrderDetails").add()
                .step("getAddress").call(COMMERCE, "getAddress").dependsOn("checkChangePolicy").add()
                .step("validateAddress").call(COMMERCE, "validateAddress").dependsOn("getAddress").add()
                .step("calculateDelivery").call(COMMERCE, "calculateDelivery").dependsOn("validateAddress").add()
                .step("updateOrder").call(COMMERCE, "updateOrder").dependsOn("calculateDelivery").add()
                .step("sendNotification").call(COMMERCE, "sendNotification")
                .input("message_type", "address_change_confirmation").dependsOn("updateOrder").add()
                .build();
    }

    public static StepGraph productInquiry() {
        return StepGraphBuilder.graph(PRODUCT_INQUIRY)
                .description("Answer a product and availability question")
                .step("searchProduct").call(COMMERCE, "searchProduct").add()
                .step("checkAvailability").call(COMMERCE, "checkAvailability").dependsOn("searchProduct").add()
                .build();
    }

    /**
     * Address change decided by the strategy catalog: authenticate, load the order and
     * the requested address, then run whichever strategy fits.
     */
    public static DynamicWorkflowDefinition dynamicAddressChange() {
        return new DynamicWorkflowDefinition(DYNAMIC_ADDRESS_CHANGE,
                List.of(StepSpec.of("authenticateCustomer", COMMERCE, "authenticateCustomer"),
                        StepSpec.of("getOrderDetails", COMMERCE, "getOrderDetails"),
                        StepSpec.of("getAddress", COMMERCE, "getAddress")),
                StandardWorkflows::addressChangeSituation);
    }

    @SuppressWarnings("unchecked")
    static StrategySituation addressChangeSituation(WorkflowInstance instance) {
        Map<String, Object> order = instance.getExecutorValue(COMMERCE, "order_details", Map.class);
        Object customerId = instance.getExecutorValue(COMMERCE, "customer_id");
        Object newAddress = instance.getExecutorValue(COMMERCE, "delivery_address");

        Map<String, Object> customer = new LinkedHashMap<>();
        if (customerId != null) {
            customer.put(StrategySituation.CUSTOMER_ID, customerId);
        }
        Map<String, Object> requestedChanges = new LinkedHashMap<>();
        if (newAddress != null) {
            requestedChanges.put(StrategySituation.NEW_ADDRESS, newAddress);
        }
        Map<String, Object> situation = new LinkedHashMap<>();
        situation.put(StrategySituation.HAS_EXISTING_ORDER, order != null);
        if (order != null) {
            situation.put(StrategySituation.ORDER_STATUS, order.getOrDefault("status", "UNKNOWN"));
            situation.put(StrategySituation.ORDER_AGE_HOURS, StrategySituation.hoursSince(order.get("created_at")));
        }
        Object query = instance.getOriginInput().get("query");
        return new StrategySituation(query != null ? query.toString() : "",
                order, customer, situation, requestedChanges);
    }
}
