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

import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.compile.ActionCompiler;
import org.fireflyframework.agentflow.strategy.compile.ActionRule;
import org.fireflyframework.agentflow.strategy.compile.CompiledInstruction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ActionCompilerTest {

    private final ActionCompiler compiler = ActionCompiler.withDefaults();

    private final Map<String, Object> newAddress =
            Map.of("street", "1 New St", "city", "Austin", "state", "TX", "zip", "78701");

    private final StrategySituation situation = new StrategySituation("please ship to my new place",
            Map.of("order_id", "ORD-7", "total_amount", 59.5,
                    "items", List.of(Map.of("product_id", "prod-1", "quantity", 1))),
            Map.of("customer_id", "cust-9"),
            Map.of(),
            Map.of(StrategySituation.NEW_ADDRESS, newAddress));

    private CompiledInstruction compile(String description) {
        return compiler.compile(description, situation, 1);
    }

    @Test
    void cancelOrder() {
        CompiledInstruction instruction = compile("Cancel the existing order");

        assertThat(instruction.executorId()).isEqualTo(ActionCompiler.ORDER_EXECUTOR);
        assertThat(instruction.action()).isEqualTo("cancelOrder");
        assertThat(instruction.parameters())
                .containsEntry("order_id", "ORD-7")
                .containsEntry("reason", "Address change requested");
    }

    @Test
    void issueGiftCard() {
        CompiledInstruction instruction = compile("Issue a gift card for the full amount");

        assertThat(instruction.executorId()).isEqualTo(ActionCompiler.PAYMENT_EXECUTOR);
        assertThat(instruction.action()).isEqualTo("issueGiftCard");
        assertThat(instruction.parameters()).containsEntry("amount", 59.5).containsEntry("customer_id", "cust-9");
    }

    @Test
    void createNewOrder_carriesItemsAndNewAddress() {
        CompiledInstruction instruction = compile("Create new order with the new address");

        assertThat(instruction.action()).isEqualTo("createOrder");
        assertThat(instruction.parameters())
                .containsEntry("customer_id", "cust-9")
                .containsEntry("shipping_address", newAddress)
                .containsKey("items");
    }

    @Test
    void validateAddress() {
        CompiledInstruction instruction = compile("Validate new address");

        assertThat(instruction.executorId()).isEqualTo(ActionCompiler.SHIPPING_EXECUTOR);
        assertThat(instruction.action()).isEqualTo("validateAddress");
        assertThat(instruction.parameters()).containsEntry("address", newAddress);
    }

    @Test
    void updateOrder_passesRequestedChanges() {
        CompiledInstruction instruction = compile("Update order with new shipping address");

        assertThat(instruction.action()).isEqualTo("updateOrder");
        assertThat(instruction.parameters()).containsEntry("order_id", "ORD-7")
                .containsEntry("updates", Map.of(StrategySituation.NEW_ADDRESS, newAddress));
    }

    @Test
    void confirmationAndNotification_mapToSendNotification() {
        assertThat(compile("Send confirmation to customer").action()).isEqualTo("sendNotification");
        assertThat(compile("Notify customer of the delay").executorId()).isEqualTo(ActionCompiler.CUSTOMER_EXECUTOR);
    }

    @Test
    void firstMatchingRuleWins() {
        // mentions both cancel+order and notify customer
        CompiledInstruction instruction = compile("Notify customer and cancel order");

        assertThat(instruction.action()).isEqualTo("cancelOrder");
    }

    @Test
    void unmatchedDescription_becomesCustomAction() {
        CompiledInstruction instruction = compile("Escalate to a human agent");

        assertThat(instruction.executorId()).isEqualTo(ActionCompiler.RULES_EXECUTOR);
        assertThat(instruction.action()).isEqualTo(ActionCompiler.CUSTOM_ACTION);
        assertThat(instruction.parameters())
                .containsEntry("description", "Escalate to a human agent")
                .containsEntry("query", "please ship to my new place");
    }

    @Test
    void missingSituationValues_areDroppedFromParameters() {
        var bare = new StrategySituation(null, null, null, null, null);

        CompiledInstruction instruction = compiler.compile("Cancel the existing order", bare, 3);

        assertThat(instruction.step()).isEqualTo(3);
        assertThat(instruction.parameters()).containsOnlyKeys("reason");
    }

    @Test
    void compile_numbersStepsFromOne() {
        List<CompiledInstruction> instructions = compiler.compile(
                List.of("Validate new address", "Update order", "Send confirmation"), situation);

        assertThat(instructions).extracting(CompiledInstruction::step).containsExactly(1, 2, 3);
        assertThat(instructions).extracting(CompiledInstruction::resultKey)
                .containsExactly("step_1", "step_2", "step_3");
    }

    @Test
    void customRuleTable() {
        List<ActionRule> rules = new ArrayList<>();
        rules.add(new ActionRule("refund", d -> d.contains("refund"), "paymentExecutor", "refund",
                (d, s) -> Map.of("order_id", s.orderId())));
        rules.addAll(ActionCompiler.defaultRules());
        var custom = new ActionCompiler(rules);

        CompiledInstruction instruction = custom.compile("Refund the order", situation, 1);

        assertThat(instruction.action()).isEqualTo("refund");
        assertThat(instruction.parameters()).containsEntry("order_id", "ORD-7");
    }
}
