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

package org.fireflyframework.agentflow.strategy.condition;

import org.fireflyframework.agentflow.strategy.StrategySituation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The built-in condition vocabulary of the order-change domain.
 */
public final class ConditionRules {

    public static final double DEFAULT_CHANGE_WINDOW_HOURS = 24;

    private static final List<String> ORDER_STATUSES = List.of("pending", "confirmed", "shipped", "delivered");
    private static final Set<String> DIRECTLY_CHANGEABLE = Set.of("pending", "confirmed");
    private static final List<String> ADDRESS_FIELDS = List.of("street", "city", "state", "zip");

    private ConditionRules() {}

    public static List<ConditionRule> defaults() {
        return defaults(DEFAULT_CHANGE_WINDOW_HOURS);
    }

    public static List<ConditionRule> defaults(double changeWindowHours) {
        return List.of(
                orderStatus(),
                withinChangeWindow(changeWindowHours),
                outsideChangeWindow(changeWindowHours),
                newAddressValid(),
                directChangeNotPossible(changeWindowHours),
                existingOrder());
    }

    /**
     * "Order status is PENDING or CONFIRMED": the statuses named in one condition are
     * alternatives.
     */
    public static ConditionRule orderStatus() {
        return ConditionRule.of("order-status",
                condition -> ORDER_STATUSES.stream().anyMatch(condition::contains),
                (condition, situation) -> {
                    String status = situation.orderStatus();
                    return ORDER_STATUSES.stream()
                            .filter(condition::contains)
                            .anyMatch(status::contains);
                });
    }

    public static ConditionRule withinChangeWindow(double windowHours) {
        return ConditionRule.of("within-change-window",
                condition -> condition.contains("within 24 hours") || condition.contains("within change window"),
                (condition, situation) -> situation.orderAgeHours() <= windowHours);
    }

    public static ConditionRule outsideChangeWindow(double windowHours) {
        return ConditionRule.of("outside-change-window",
                condition -> condition.contains("outside change window"),
                (condition, situation) -> situation.orderAgeHours() > windowHours);
    }

    public static ConditionRule newAddressValid() {
        return ConditionRule.of("new-address-valid",
                condition -> condition.contains("new address is valid"),
                (condition, situation) -> situation.newAddress()
                        .map(ConditionRules::isCompleteAddress)
                        .orElse(false));
    }

    /**
     * Holds unless the order is still pending or confirmed and inside the change window.
     */
    public static ConditionRule directChangeNotPossible(double windowHours) {
        return ConditionRule.of("direct-change-not-possible",
                condition -> condition.contains("direct address change not possible")
                        || condition.contains("direct change not possible"),
                (condition, situation) -> !(DIRECTLY_CHANGEABLE.contains(situation.orderStatus())
                        && situation.orderAgeHours() <= windowHours));
    }

    public static ConditionRule existingOrder() {
        return ConditionRule.of("existing-order",
                condition -> condition.contains("existing order"),
                (condition, situation) -> condition.contains("no existing order")
                        ? !situation.hasExistingOrder()
                        : situation.hasExistingOrder());
    }

    public static boolean isCompleteAddress(Map<String, Object> address) {
        for (String field : ADDRESS_FIELDS) {
            Object value = address.get(field);
            if (value == null || value.toString().isBlank()) {
                return false;
            }
        }
        return true;
    }
}
