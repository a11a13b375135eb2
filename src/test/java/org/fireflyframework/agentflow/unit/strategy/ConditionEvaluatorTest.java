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
import org.fireflyframework.agentflow.strategy.condition.ConditionEvaluator;
import org.fireflyframework.agentflow.strategy.condition.ConditionRule;
import org.fireflyframework.agentflow.strategy.condition.ConditionRules;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = ConditionEvaluator.withDefaults();

    private static StrategySituation situation(String status, double ageHours, Map<String, Object> newAddress) {
        Map<String, Object> changes = new HashMap<>();
        if (newAddress != null) {
            changes.put(StrategySituation.NEW_ADDRESS, newAddress);
        }
        return new StrategySituation("", Map.of("order_id", "ORD-1", "status", status), Map.of(),
                Map.of(StrategySituation.ORDER_AGE_HOURS, ageHours), changes);
    }

    private static Map<String, Object> fullAddress() {
        return Map.of("street", "1 Main St", "city", "Austin", "state", "TX", "zip", "78701");
    }

    @Test
    void orderStatus_namedStatusesAreAlternatives() {
        assertThat(evaluator.holds("Order status is PENDING or CONFIRMED", situation("pending", 1, null))).isTrue();
        assertThat(evaluator.holds("Order status is PENDING or CONFIRMED", situation("CONFIRMED", 1, null))).isTrue();
        assertThat(evaluator.holds("Order status is PENDING or CONFIRMED", situation("shipped", 1, null))).isFalse();
        assertThat(evaluator.holds("Order status is SHIPPED", situation("shipped", 1, null))).isTrue();
    }

    @Test
    void changeWindow_boundaryIsInclusive() {
        assertThat(evaluator.holds("Within 24 hours of order placement", situation("pending", 24, null))).isTrue();
        assertThat(evaluator.holds("Within 24 hours of order placement", situation("pending", 24.5, null))).isFalse();
        assertThat(evaluator.holds("Outside change window", situation("pending", 30, null))).isTrue();
        assertThat(evaluator.holds("Outside change window", situation("pending", 3, null))).isFalse();
    }

    @Test
    void changeWindow_isConfigurable() {
        ConditionEvaluator wide = ConditionEvaluator.withDefaults(48);

        assertThat(wide.holds("Within change window", situation("pending", 30, null))).isTrue();
    }

    @Test
    void newAddressValid_requiresAllFields() {
        Map<String, Object> partial = new HashMap<>(fullAddress());
        partial.put("zip", " ");

        assertThat(evaluator.holds("New address is valid", situation("pending", 1, fullAddress()))).isTrue();
        assertThat(evaluator.holds("New address is valid", situation("pending", 1, partial))).isFalse();
        assertThat(evaluator.holds("New address is valid", situation("pending", 1, null))).isFalse();
        assertThat(ConditionRules.isCompleteAddress(fullAddress())).isTrue();
    }

    @Test
    void directChangeNotPossible_invertsDirectEligibility() {
        String condition = "Direct address change not possible";

        assertThat(evaluator.holds(condition, situation("pending", 2, null))).isFalse();
        assertThat(evaluator.holds(condition, situation("pending", 48, null))).isTrue();
        assertThat(evaluator.holds(condition, situation("shipped", 2, null))).isTrue();
    }

    @Test
    void existingOrder_followsSituationFlag() {
        var withOrder = situation("pending", 1, null);
        var withoutOrder = new StrategySituation("", Map.of(), Map.of(),
                Map.of(StrategySituation.HAS_EXISTING_ORDER, false), Map.of());

        assertThat(evaluator.holds("Customer has an existing order", withOrder)).isTrue();
        assertThat(evaluator.holds("Customer has an existing order", withoutOrder)).isFalse();
        assertThat(evaluator.holds("Customer has no existing order", withoutOrder)).isTrue();
    }

    @Test
    void unrecognizedCondition_holds() {
        assertThat(evaluator.holds("Moon is in the seventh house", situation("pending", 1, null))).isTrue();
        assertThat(evaluator.holds("", situation("pending", 1, null))).isTrue();
    }

    @Test
    void throwingRule_countsAsNotHolding() {
        ConditionRule broken = ConditionRule.of("broken", c -> c.contains("vip"), (c, s) -> {
            throw new IllegalStateException("no loyalty data");
        });
        ConditionEvaluator extended = evaluator.withRule(broken);

        assertThat(extended.holds("Customer is VIP", situation("pending", 1, null))).isFalse();
        assertThat(extended.getRules()).hasSize(evaluator.getRules().size() + 1);
    }

    @Test
    void allHold_requiresEveryCondition() {
        var s = situation("pending", 1, fullAddress());

        assertThat(evaluator.allHold(List.of("Order status is PENDING", "New address is valid"), s)).isTrue();
        assertThat(evaluator.allHold(List.of("Order status is PENDING", "Outside change window"), s)).isFalse();
        assertThat(evaluator.allHold(List.of(), s)).isTrue();
    }

    @Test
    void ruleCombinators() {
        ConditionRule pending = ConditionRule.of("pending", c -> c.contains("eligible"),
                (c, s) -> s.orderStatus().equals("pending"));
        ConditionRule young = ConditionRule.of("young", c -> c.contains("eligible"),
                (c, s) -> s.orderAgeHours() < 5);

        var fresh = situation("pending", 1, null);
        var stale = situation("pending", 10, null);

        assertThat(pending.and(young).test("eligible", fresh)).isTrue();
        assertThat(pending.and(young).test("eligible", stale)).isFalse();
        assertThat(young.or(pending).test("eligible", stale)).isTrue();
        assertThat(young.negate().test("eligible", stale)).isTrue();
        assertThat(pending.and(young).name()).isEqualTo("pending&young");
    }
}
