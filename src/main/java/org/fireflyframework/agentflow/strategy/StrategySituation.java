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

package org.fireflyframework.agentflow.strategy;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Snapshot a strategy is evaluated and compiled against. Built fresh for every
 * evaluation.
 *
 * @param query            the triggering request text
 * @param order            order-like data ({@code order_id}, {@code status}, {@code total_amount}, {@code items})
 * @param customer         customer-like data ({@code customer_id}, ...)
 * @param currentSituation derived facts ({@code order_age_hours}, {@code has_existing_order}, ...)
 * @param requestedChanges what the caller asks for ({@code new_address}, ...)
 */
public record StrategySituation(
        String query,
        Map<String, Object> order,
        Map<String, Object> customer,
        Map<String, Object> currentSituation,
        Map<String, Object> requestedChanges
) {
    public static final String ORDER_ID = "order_id";
    public static final String ORDER_STATUS = "order_status";
    public static final String ORDER_AGE_HOURS = "order_age_hours";
    public static final String HAS_EXISTING_ORDER = "has_existing_order";
    public static final String NEW_ADDRESS = "new_address";
    public static final String CUSTOMER_ID = "customer_id";

    public StrategySituation {
        query = query != null ? query : "";
        order = readOnly(order);
        customer = readOnly(customer);
        currentSituation = readOnly(currentSituation);
        requestedChanges = readOnly(requestedChanges);
    }

    /**
     * Lower-case order status, from the order itself or the derived situation; empty
     * when unknown.
     */
    public String orderStatus() {
        Object status = order.get("status");
        if (status == null) {
            status = currentSituation.get(ORDER_STATUS);
        }
        return status != null ? status.toString().toLowerCase(Locale.ROOT) : "";
    }

    public double orderAgeHours() {
        Object age = currentSituation.get(ORDER_AGE_HOURS);
        if (age == null) {
            age = order.get("created_hours_ago");
        }
        if (age instanceof Number number) {
            return number.doubleValue();
        }
        if (age != null) {
            try {
                return Double.parseDouble(age.toString());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> newAddress() {
        Object address = requestedChanges.get(NEW_ADDRESS);
        return address instanceof Map<?, ?> map ? Optional.of((Map<String, Object>) map) : Optional.empty();
    }

    public boolean hasExistingOrder() {
        Object flag = currentSituation.get(HAS_EXISTING_ORDER);
        if (flag instanceof Boolean b) {
            return b;
        }
        return !order.isEmpty();
    }

    public Object orderId() {
        return order.get(ORDER_ID);
    }

    public Object customerId() {
        return customer.get(CUSTOMER_ID);
    }

    /**
     * Hours elapsed since an ISO-8601 instant; 0 when the timestamp is missing or
     * unparseable, so an undated order counts as new.
     */
    public static double hoursSince(Object timestamp) {
        if (timestamp == null) {
            return 0;
        }
        try {
            return Duration.between(Instant.parse(timestamp.toString()), Instant.now()).toMinutes() / 60.0;
        } catch (DateTimeParseException e) {
            return 0;
        }
    }

    private static Map<String, Object> readOnly(Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }
}
