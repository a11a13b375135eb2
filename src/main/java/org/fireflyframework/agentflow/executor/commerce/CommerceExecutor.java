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

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.executor.AbstractExecutor;
import org.fireflyframework.agentflow.core.executor.ActionHandler;
import org.fireflyframework.agentflow.core.executor.ExecutorMessage;
import org.fireflyframework.agentflow.core.model.Capability;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consolidated business executor: customers, products, inventory, shipping, orders,
 * gift cards and notifications behind one name.
 *
 * <p>Results are recorded under this executor's slot of the instance and read back by
 * later actions of the same run, e.g. {@code createOrder} uses the
 * {@code search_results} and {@code delivery_address} recorded earlier.
 *
 * <p>Shared across workflows: the authenticated-customer session cache (guarded by a
 * lock, one entry per running workflow, evicted when the run ends), the reservation
 * table (guarded by its own monitor) and the gift card sequence.
 */
@Slf4j
public class CommerceExecutor extends AbstractExecutor {

    public static final String NAME = "commerce";

    private final CommerceGateway gateway;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private final Map<String, Map<String, Object>> sessions = new HashMap<>();
    private final Map<String, Integer> reservations = new HashMap<>();
    private final AtomicLong giftCardSequence = new AtomicLong(1000);

    public CommerceExecutor(CommerceGateway gateway) {
        this(NAME, gateway);
    }

    public CommerceExecutor(String name, CommerceGateway gateway) {
        super(name, capabilitiesOf(CommerceAction.values()));
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        for (CommerceAction action : CommerceAction.values()) {
            registerAction(action.actionName(), handlerFor(action));
        }
    }

    private ActionHandler handlerFor(CommerceAction action) {
        return switch (action) {
            case AUTHENTICATE_CUSTOMER -> this::authenticateCustomer;
            case GET_ADDRESS -> this::getAddress;
            case SEARCH_PRODUCT -> this::searchProduct;
            case CHECK_INVENTORY -> this::checkInventory;
            case CHECK_AVAILABILITY -> this::checkAvailability;
            case RESERVE_INVENTORY -> this::reserveInventory;
            case CALCULATE_DELIVERY -> this::calculateDelivery;
            case VALIDATE_ADDRESS -> this::validateAddress;
            case CREATE_ORDER -> this::createOrder;
            case GET_ORDER_DETAILS -> this::getOrderDetails;
            case UPDATE_ORDER -> this::updateOrder;
            case CANCEL_ORDER -> this::cancelOrder;
            case CREATE_GIFT_CARD -> this::createGiftCard;
            case SEND_CONFIRMATION -> this::sendConfirmation;
            case SEND_NOTIFICATION -> this::sendNotification;
        };
    }

    // Customers

    private Mono<Map<String, Object>> authenticateCustomer(ExecutorMessage message, WorkflowInstance instance) {
        String identifier = firstNonNull(message.argumentString("customer_email"),
                message.argumentString("email"), message.argumentString("customer_id"));
        if (identifier == null) {
            return Mono.error(new IllegalArgumentException("Customer e-mail or id required"));
        }
        return gateway.findCustomer(identifier)
                .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Customer " + identifier + " not found")))
                .map(customer -> {
                    cacheSession(instance.getId(), customer);
                    Map<String, Object> profile = new LinkedHashMap<>(customer);
                    profile.put("authenticated", true);
                    recordResult(instance, "customer_profile", profile);
                    recordResult(instance, "customer_id", customer.get("customer_id"));
                    return result("customer_id", customer.get("customer_id"), "authenticated", true);
                });
    }

    @SuppressWarnings("unchecked")
    private Mono<Map<String, Object>> getAddress(ExecutorMessage message, WorkflowInstance instance) {
        Map<String, Object> profile = session(instance.getId())
                .orElseGet(() -> recordedMap(instance, "customer_profile"));
        if (profile == null) {
            return Mono.error(new IllegalStateException("Customer must be authenticated before fetching an address"));
        }
        Object requested = message.argument("delivery_address");
        if (requested == null) {
            requested = instance.getMetadata("delivery_address");
        }
        Map<String, Object> address;
        String source;
        if (requested instanceof Map<?, ?> map) {
            address = new LinkedHashMap<>((Map<String, Object>) map);
            source = "request";
        } else if (profile.get("address") instanceof Map<?, ?> stored) {
            address = new LinkedHashMap<>((Map<String, Object>) stored);
            source = "stored_profile";
        } else {
            return Mono.error(new NoSuchElementException("No address found for customer " + profile.get("customer_id")));
        }
        return gateway.validateAddress(address).map(validation -> {
            List<String> missing = (List<String>) validation.getOrDefault("missing_fields", List.of());
            recordResult(instance, "delivery_address", address);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("address", address);
            result.put("address_source", source);
            result.put("needs_completion", !missing.isEmpty());
            result.put("missing_fields", missing);
            return result;
        });
    }

    // Products and inventory

    private Mono<Map<String, Object>> searchProduct(ExecutorMessage message, WorkflowInstance instance) {
        String query = firstNonNull(message.argumentString("product_query"), message.argumentString("query"));
        if (query == null) {
            return Mono.error(new IllegalArgumentException("Product query required"));
        }
        return gateway.searchProducts(query).map(products -> {
            recordResult(instance, "search_results", products);
            recordResult(instance, "search_query", query);
            return Map.of("count", products.size(), "query", query);
        });
    }

    private Mono<Map<String, Object>> checkInventory(ExecutorMessage message, WorkflowInstance instance) {
        List<Map<String, Object>> products = searchResults(instance);
        if (products.isEmpty()) {
            return Mono.error(new IllegalStateException("No products to check inventory for"));
        }
        return Flux.fromIterable(products)
                .concatMap(product -> {
                    String productId = String.valueOf(product.get("id"));
                    return gateway.stockLevel(productId).map(stock -> {
                        int available = Math.max(0, stock - reserved(productId));
                        Map<String, Object> status = new LinkedHashMap<>();
                        status.put("product_id", productId);
                        status.put("in_stock", available > 0);
                        status.put("quantity_available", available);
                        return status;
                    });
                })
                .collectList()
                .map(statuses -> {
                    boolean allInStock = statuses.stream().allMatch(s -> Boolean.TRUE.equals(s.get("in_stock")));
                    recordResult(instance, "inventory_status", statuses);
                    return Map.of("all_in_stock", allInStock, "checked", statuses.size());
                });
    }

    private Mono<Map<String, Object>> checkAvailability(ExecutorMessage message, WorkflowInstance instance) {
        List<Map<String, Object>> products = searchResults(instance);
        if (products.isEmpty()) {
            return Mono.error(new IllegalStateException("No products to check availability for"));
        }
        return Flux.fromIterable(products)
                .concatMap(product -> gateway.stockLevel(String.valueOf(product.get("id"))).map(stock -> {
                    int available = Math.max(0, stock - reserved(String.valueOf(product.get("id"))));
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("product", product);
                    info.put("in_stock", available > 0);
                    info.put("quantity_available", available);
                    return info;
                }))
                .collectList()
                .map(infos -> {
                    boolean allAvailable = infos.stream().allMatch(i -> Boolean.TRUE.equals(i.get("in_stock")));
                    recordResult(instance, "availability_info", infos);
                    return Map.of("all_available", allAvailable);
                });
    }

    private Mono<Map<String, Object>> reserveInventory(ExecutorMessage message, WorkflowInstance instance) {
        String productId = message.argumentString("product_id");
        if (productId == null) {
            List<Map<String, Object>> products = searchResults(instance);
            if (products.isEmpty()) {
                return Mono.error(new IllegalStateException("No product to reserve"));
            }
            productId = String.valueOf(products.get(0).get("id"));
        }
        int quantity = intArgument(message, "quantity", 1);
        String target = productId;
        return gateway.stockLevel(target).map(stock -> {
            synchronized (reservations) {
                int alreadyReserved = reservations.getOrDefault(target, 0);
                if (stock - alreadyReserved < quantity) {
                    throw new IllegalStateException("Insufficient stock for " + target + ": requested "
                            + quantity + ", available " + (stock - alreadyReserved));
                }
                reservations.put(target, alreadyReserved + quantity);
            }
            Map<String, Object> reservation = Map.of("product_id", target, "quantity", quantity);
            recordResult(instance, "reservation", reservation);
            return reservation;
        });
    }

    /**
     * Units of {@code productId} currently held by reservations.
     */
    public int reserved(String productId) {
        synchronized (reservations) {
            return reservations.getOrDefault(productId, 0);
        }
    }

    // Shipping

    private Mono<Map<String, Object>> calculateDelivery(ExecutorMessage message, WorkflowInstance instance) {
        Map<String, Object> address = recordedMap(instance, "delivery_address");
        if (address == null) {
            return Mono.error(new IllegalStateException("Delivery address required"));
        }
        List<Map<String, Object>> items = searchResults(instance).stream()
                .map(p -> Map.<String, Object>of("price", p.getOrDefault("price", 0), "quantity", 1))
                .toList();
        Object preference = instance.getMetadata("delivery_preference");
        String method = preference != null ? preference.toString() : "standard";
        return gateway.shippingOptions(address, items).map(options -> {
            Map<String, Object> selected = options.stream()
                    .filter(o -> method.equals(o.get("method")))
                    .findFirst()
                    .orElse(options.isEmpty() ? Map.of() : options.get(0));
            Map<String, Object> calculation = Map.of("options", options, "selected", selected);
            recordResult(instance, "shipping_calculation", calculation);
            return calculation;
        });
    }

    @SuppressWarnings("unchecked")
    private Mono<Map<String, Object>> validateAddress(ExecutorMessage message, WorkflowInstance instance) {
        Object candidate = message.argument("address");
        if (candidate == null) {
            candidate = message.argument("new_address");
        }
        if (candidate == null) {
            candidate = instance.getExecutorValue(name(), "delivery_address");
        }
        if (!(candidate instanceof Map<?, ?> address)) {
            return Mono.error(new IllegalArgumentException("Address required for validation"));
        }
        return gateway.validateAddress((Map<String, Object>) address).map(validation -> {
            recordResult(instance, "address_validation", validation);
            return validation;
        });
    }

    // Orders

    @SuppressWarnings("unchecked")
    private Mono<Map<String, Object>> createOrder(ExecutorMessage message, WorkflowInstance instance) {
        Object customerId = message.argument("customer_id");
        if (customerId == null) {
            customerId = instance.getExecutorValue(name(), "customer_id");
        }
        if (customerId == null) {
            return Mono.error(new IllegalArgumentException("Customer id required"));
        }
        String productId;
        int quantity;
        if (message.argument("items") instanceof List<?> items && !items.isEmpty()
                && items.get(0) instanceof Map<?, ?> item && item.get("product_id") != null) {
            productId = String.valueOf(item.get("product_id"));
            quantity = item.get("quantity") instanceof Number n ? n.intValue() : 1;
        } else {
            List<Map<String, Object>> products = searchResults(instance);
            if (products.isEmpty()) {
                return Mono.error(new IllegalStateException("No products found for order"));
            }
            productId = String.valueOf(products.get(0).get("id"));
            quantity = intArgument(message, "quantity", 1);
        }
        Object shipping = message.argument("shipping_address");
        Map<String, Object> address = shipping instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : recordedMap(instance, "delivery_address");
        String customer = customerId.toString();
        return gateway.createOrder(customer, productId, quantity, address).map(order -> {
            recordResult(instance, "created_order", order);
            return result("order_id", order.get("order_id"), "status", order.get("status"));
        });
    }

    private Mono<Map<String, Object>> getOrderDetails(ExecutorMessage message, WorkflowInstance instance) {
        String orderId = message.argumentString("order_id");
        if (orderId == null) {
            return Mono.error(new IllegalArgumentException("Order id required"));
        }
        return gateway.findOrder(orderId)
                .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Order " + orderId + " not found")))
                .map(order -> {
                    recordResult(instance, "order_details", order);
                    return order;
                });
    }

    @SuppressWarnings("unchecked")
    private Mono<Map<String, Object>> updateOrder(ExecutorMessage message, WorkflowInstance instance) {
        String orderId = message.argumentString("order_id");
        if (orderId == null) {
            return Mono.error(new IllegalArgumentException("Order id required for update"));
        }
        Map<String, Object> updates;
        if (message.argument("updates") instanceof Map<?, ?> map) {
            updates = (Map<String, Object>) map;
        } else {
            Map<String, Object> address = recordedMap(instance, "delivery_address");
            updates = address != null ? Map.of("shipping_address", address) : Map.of();
        }
        return gateway.updateOrder(orderId, updates)
                .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Order " + orderId + " not found")))
                .map(order -> {
                    recordResult(instance, "updated_order", order);
                    return Map.of("order_id", orderId, "updates_applied", updates.keySet());
                });
    }

    private Mono<Map<String, Object>> cancelOrder(ExecutorMessage message, WorkflowInstance instance) {
        String orderId = message.argumentString("order_id");
        if (orderId == null) {
            return Mono.error(new IllegalArgumentException("Order id required for cancellation"));
        }
        String reason = Objects.requireNonNullElse(message.argumentString("reason"), "Customer request");
        return gateway.cancelOrder(orderId, reason)
                .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Order " + orderId + " not found")))
                .map(order -> {
                    recordResult(instance, "cancelled_order", order);
                    return Map.of("order_id", orderId, "order_cancelled", true);
                });
    }

    // Payments and notifications

    private Mono<Map<String, Object>> createGiftCard(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromSupplier(() -> {
            Object amount = message.argument("amount");
            Object customerId = message.argument("customer_id");
            if (customerId == null) {
                customerId = instance.getExecutorValue(name(), "customer_id");
            }
            Map<String, Object> giftCard = new LinkedHashMap<>();
            giftCard.put("gift_card_id", "GC-" + giftCardSequence.incrementAndGet());
            giftCard.put("amount", amount instanceof Number n ? n.doubleValue() : 0.0);
            if (customerId != null) {
                giftCard.put("customer_id", customerId);
            }
            giftCard.put("reason", Objects.requireNonNullElse(message.argumentString("reason"), "Order cancellation"));
            giftCard.put("status", "active");
            giftCard.put("created_at", Instant.now().toString());
            recordResult(instance, "gift_card", giftCard);
            return giftCard;
        });
    }

    private Mono<Map<String, Object>> sendConfirmation(ExecutorMessage message, WorkflowInstance instance) {
        Map<String, Object> order = recordedMap(instance, "created_order");
        if (order == null) {
            return Mono.error(new IllegalStateException("No order to confirm"));
        }
        Map<String, Object> profile = recordedMap(instance, "customer_profile");
        return Mono.fromSupplier(() -> {
            Map<String, Object> confirmation = new LinkedHashMap<>();
            if (profile != null && profile.get("email") != null) {
                confirmation.put("recipient", profile.get("email"));
            }
            confirmation.put("order_id", order.get("order_id"));
            confirmation.put("message", "Order " + order.get("order_id") + " confirmed!");
            confirmation.put("sent_at", Instant.now().toString());
            recordResult(instance, "confirmation", confirmation);
            return result("confirmation_sent", true, "order_id", order.get("order_id"));
        });
    }

    private Mono<Map<String, Object>> sendNotification(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.fromSupplier(() -> {
            Object customerId = message.argument("customer_id");
            if (customerId == null) {
                customerId = instance.getExecutorValue(name(), "customer_id");
            }
            Map<String, Object> notification = new LinkedHashMap<>();
            if (customerId != null) {
                notification.put("customer_id", customerId);
            }
            notification.put("message_type",
                    Objects.requireNonNullElse(message.argumentString("message_type"), "general"));
            Object details = message.argument("details");
            notification.put("details", details != null ? details : Map.of());
            notification.put("sent_at", Instant.now().toString());
            recordResult(instance, "notification", notification);
            return Map.of("notification_sent", true);
        });
    }

    // Helpers

    private void cacheSession(String sessionId, Map<String, Object> customer) {
        sessionLock.lock();
        try {
            sessions.put(sessionId, customer);
        } finally {
            sessionLock.unlock();
        }
    }

    private Optional<Map<String, Object>> session(String sessionId) {
        sessionLock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            sessionLock.unlock();
        }
    }

    @Override
    public void onWorkflowFinished(String workflowId) {
        endSession(workflowId);
    }

    /**
     * Drops the cached customer of {@code sessionId}.
     */
    public void endSession(String sessionId) {
        sessionLock.lock();
        try {
            sessions.remove(sessionId);
        } finally {
            sessionLock.unlock();
        }
    }

    public int activeSessions() {
        sessionLock.lock();
        try {
            return sessions.size();
        } finally {
            sessionLock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> recordedMap(WorkflowInstance instance, String key) {
        Object value = instance.getExecutorValue(name(), key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> searchResults(WorkflowInstance instance) {
        List<Map<String, Object>> results = instance.getExecutorValue(name(), "search_results", List.class);
        return results != null ? results : List.of();
    }

    /**
     * Key/value pairs with {@code null} values dropped; gateways may omit fields.
     */
    private static Map<String, Object> result(Object... keyValues) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                result.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return result;
    }

    private static int intArgument(ExecutorMessage message, String key, int defaultValue) {
        Object value = message.argument(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Set<Capability> capabilitiesOf(CommerceAction[] actions) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (CommerceAction action : actions) {
            capabilities.add(action.capability());
        }
        return capabilities;
    }
}
