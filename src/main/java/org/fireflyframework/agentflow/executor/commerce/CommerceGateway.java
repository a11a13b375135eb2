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

package org.fireflyframework.agentflow.executor.commerce;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Remote commerce back end used by {@link CommerceExecutor}. Lookups of missing
 * entities complete empty; transport failures error.
 */
public interface CommerceGateway {

    /**
     * Customer by id or e-mail.
     */
    Mono<Map<String, Object>> findCustomer(String identifier);

    Mono<List<Map<String, Object>>> searchProducts(String query);

    Mono<Integer> stockLevel(String productId);

    Mono<List<Map<String, Object>>> shippingOptions(Map<String, Object> address, List<Map<String, Object>> items);

    /**
     * @return {@code valid}, {@code missing_fields} and the {@code normalized} address
     */
    Mono<Map<String, Object>> validateAddress(Map<String, Object> address);

    Mono<Map<String, Object>> createOrder(String customerId, String productId, int quantity,
                                          Map<String, Object> shippingAddress);

    Mono<Map<String, Object>> findOrder(String orderId);

    Mono<Map<String, Object>> updateOrder(String orderId, Map<String, Object> updates);

    Mono<Map<String, Object>> cancelOrder(String orderId, String reason);
}
