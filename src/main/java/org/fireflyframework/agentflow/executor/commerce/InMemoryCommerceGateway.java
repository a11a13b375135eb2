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

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CommerceGateway} backed by in-process maps, for tests and local runs.
 */
public class InMemoryCommerceGateway implements CommerceGateway {

    private static final List<String> ADDRESS_FIELDS = List.of("street", "city", "state", "zip");

    private final Map<String, Map<String, Object>> customers = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> products = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> orders = new ConcurrentHashMap<>();
    private final AtomicLong orderIds = new AtomicLong(10000);

    /**
     * Gateway seeded with a small demo catalog: two customers, three products and one
     * confirmed order ({@code ORD-12345}).
     */
    public static InMemoryCommerceGateway withSampleData() {
        InMemoryCommerceGateway gateway = new InMemoryCommerceGateway();
        gateway.addCustomer("cust-1", "Jane Doe", "jane@example.com",
                address("123 Main St", "Springfield", "IL", "62701"));
        gateway.addCustomer("cust-2", "John Roe", "john@example.com",
                address("9 Elm Ave", "Portland", "OR", "97201"));
        gateway.addProduct("prod-1", "iPhone 15 Pro", "Apple", 999.99, 25);
        gateway.addProduct("prod-2", "MacBook Air", "Apple", 1199.00, 5);
        gateway.addProduct("prod-3", "Noise Cancelling Headphones", "Sony", 349.50, 0);
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("order_id", "ORD-12345");
        order.put("customer_id", "cust-1");
        order.put("status", "CONFIRMED");
        order.put("total_amount", 999.99);
        order.put("items", List.of(Map.of("product_id", "prod-1", "product", "iPhone 15 Pro",
                "quantity", 1, "price", 999.99)));
        order.put("created_at", Instant.now().minusSeconds(7200).toString());
        gateway.addOrder(order);
        return gateway;
    }

    public static Map<String, Object> address(String street, String city, String state, String zip) {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("street", street);
        address.put("city", city);
        address.put("state", state);
        address.put("zip", zip);
        return address;
    }

    public void addCustomer(String id, String name, String email, Map<String, Object> defaultAddress) {
        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("customer_id", id);
        customer.put("name", name);
        customer.put("email", email);
        if (defaultAddress != null) {
            customer.put("address", Map.copyOf(defaultAddress));
        }
        customers.put(id, Collections.unmodifiableMap(customer));
    }

    public void addProduct(String id, String name, String brand, double price, int stock) {
        Map<String, Object> product = new LinkedHashMap<>();
        product.put("id", id);
        product.put("name", name);
        product.put("brand", brand);
        product.put("price", price);
        product.put("stockQuantity", stock);
        products.put(id, Collections.unmodifiableMap(product));
    }

    public void addOrder(Map<String, Object> order) {
        orders.put(String.valueOf(order.get("order_id")), Map.copyOf(order));
    }

    @Override
    public Mono<Map<String, Object>> findCustomer(String identifier) {
        return Mono.fromCallable(() -> {
            if (identifier == null) {
                return null;
            }
            Map<String, Object> byId = customers.get(identifier);
            if (byId != null) {
                return byId;
            }
            return customers.values().stream()
                    .filter(c -> identifier.equalsIgnoreCase(String.valueOf(c.get("email"))))
                    .findFirst()
                    .orElse(null);
        });
    }

    @Override
    public Mono<List<Map<String, Object>>> searchProducts(String query) {
        return Mono.fromSupplier(() -> {
            String q = query != null ? query.toLowerCase(Locale.ROOT).trim() : "";
            if (q.isEmpty()) {
                return List.of();
            }
            return products.values().stream()
                    .filter(p -> {
                        String name = String.valueOf(p.get("name")).toLowerCase(Locale.ROOT);
                        return q.contains(name) || name.contains(q);
                    })
                    .sorted(Comparator.comparing(p -> String.valueOf(p.get("id"))))
                    .toList();
        });
    }

    @Override
    public Mono<Integer> stockLevel(String productId) {
        return Mono.fromSupplier(() -> {
            Map<String, Object> product = products.get(productId);
            return product != null ? ((Number) product.get("stockQuantity")).intValue() : 0;
        });
    }

    @Override
    public Mono<List<Map<String, Object>>> shippingOptions(Map<String, Object> address,
                                                          List<Map<String, Object>> items) {
        return Mono.fromSupplier(() -> {
            double subtotal = items.stream()
                    .mapToDouble(i -> ((Number) i.getOrDefault("price", 0)).doubleValue()
                            * ((Number) i.getOrDefault("quantity", 1)).intValue())
                    .sum();
            return List.of(
                    option("standard", subtotal >= 50 ? 0.0 : 5.99, "5-7 business days"),
                    option("express", 14.99, "2-3 business days"),
                    option("overnight", 29.99, "1 business day"));
        });
    }

    @Override
    public Mono<Map<String, Object>> validateAddress(Map<String, Object> address) {
        return Mono.fromSupplier(() -> {
            List<String> missing = ADDRESS_FIELDS.stream()
                    .filter(f -> address.get(f) == null || address.get(f).toString().isBlank())
                    .toList();
            Map<String, Object> normalized = new LinkedHashMap<>();
            ADDRESS_FIELDS.forEach(f -> {
                Object value = address.get(f);
                if (value != null) {
                    normalized.put(f, value.toString().trim());
                }
            });
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("valid", missing.isEmpty());
            result.put("missing_fields", missing);
            result.put("normalized", normalized);
            return result;
        });
    }

    @Override
    public Mono<Map<String, Object>> createOrder(String customerId, String productId, int quantity,
                                                 Map<String, Object> shippingAddress) {
        return Mono.fromCallable(() -> {
            Map<String, Object> product = products.get(productId);
            if (product == null) {
                throw new IllegalArgumentException("Unknown product " + productId);
            }
            double price = ((Number) product.get("price")).doubleValue();
            Map<String, Object> order = new LinkedHashMap<>();
            order.put("order_id", "ORD-" + orderIds.incrementAndGet());
            order.put("customer_id", customerId);
            order.put("status", "CONFIRMED");
            order.put("total_amount", price * quantity);
            order.put("items", List.of(Map.of("product_id", productId, "product", product.get("name"),
                    "quantity", quantity, "price", price)));
            if (shippingAddress != null) {
                order.put("shipping_address", Map.copyOf(shippingAddress));
            }
            order.put("created_at", Instant.now().toString());
            addOrder(order);
            return orders.get(String.valueOf(order.get("order_id")));
        });
    }

    @Override
    public Mono<Map<String, Object>> findOrder(String orderId) {
        return Mono.fromCallable(() -> orderId != null ? orders.get(orderId) : null);
    }

    @Override
    public Mono<Map<String, Object>> updateOrder(String orderId, Map<String, Object> updates) {
        return Mono.fromCallable(() -> orders.computeIfPresent(orderId, (id, existing) -> {
            Map<String, Object> updated = new LinkedHashMap<>(existing);
            updates.forEach((k, v) -> {
                if (v != null) {
                    updated.put(k, v);
                }
            });
            updated.put("updated_at", Instant.now().toString());
            return Map.copyOf(updated);
        }));
    }

    @Override
    public Mono<Map<String, Object>> cancelOrder(String orderId, String reason) {
        return Mono.fromCallable(() -> orders.computeIfPresent(orderId, (id, existing) -> {
            Map<String, Object> cancelled = new LinkedHashMap<>(existing);
            cancelled.put("status", "CANCELLED");
            cancelled.put("cancellation_reason", reason);
            cancelled.put("cancelled_at", Instant.now().toString());
            return Map.copyOf(cancelled);
        }));
    }

    private static Map<String, Object> option(String method, double cost, String eta) {
        Map<String, Object> option = new LinkedHashMap<>();
        option.put("method", method);
        option.put("cost", cost);
        option.put("estimated_delivery", eta);
        return option;
    }
}
