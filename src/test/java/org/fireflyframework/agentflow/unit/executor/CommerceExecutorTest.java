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

package org.fireflyframework.agentflow.unit.executor;

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.exception.StepFailureException;
import org.fireflyframework.agentflow.core.executor.ExecutorMessage;
import org.fireflyframework.agentflow.core.model.Capability;
import org.fireflyframework.agentflow.executor.commerce.CommerceExecutor;
import org.fireflyframework.agentflow.executor.commerce.InMemoryCommerceGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class CommerceExecutorTest {

    private InMemoryCommerceGateway gateway;
    private CommerceExecutor executor;
    private WorkflowInstance instance;

    @BeforeEach
    void setUp() {
        gateway = InMemoryCommerceGateway.withSampleData();
        executor = new CommerceExecutor(gateway);
        instance = WorkflowInstance.create("place_order",
                Map.of("customer_email", "jane@example.com", "product_query", "iPhone 15 Pro"), null);
    }

    private Mono<Map<String, Object>> run(String action, Map<String, Object> payload) {
        ExecutorMessage message = ExecutorMessage.dispatch(ExecutorMessage.ORCHESTRATOR, executor.name(),
                instance.getId(), action, payload, Map.of(ExecutorMessage.ORIGIN_INPUT, instance.getOriginInput()));
        return executor.handle(message, instance);
    }

    private Map<String, Object> runAndGet(String action, Map<String, Object> payload) {
        return run(action, payload).block();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> recorded(String key) {
        return (Map<String, Object>) instance.getExecutorValue(CommerceExecutor.NAME, key);
    }

    @Test
    void capabilities_coverEveryCommerceConcern() {
        assertThat(executor.capabilities()).contains(Capability.CUSTOMER_AUTH, Capability.PRODUCT_SEARCH,
                Capability.INVENTORY_CHECK, Capability.SHIPPING_CALC, Capability.ORDER_CREATE,
                Capability.ORDER_UPDATE, Capability.PAYMENT_PROCESS, Capability.NOTIFICATION_SEND);
        assertThat(executor.actions()).contains("authenticateCustomer", "createOrder", "createGiftCard");
    }

    @Test
    void authenticateCustomer_fromOriginInput_cachesSession() {
        StepVerifier.create(run("authenticateCustomer", Map.of()))
                .assertNext(result -> assertThat(result)
                        .containsEntry("customer_id", "cust-1")
                        .containsEntry("authenticated", true))
                .verifyComplete();

        assertThat(instance.getExecutorValue(CommerceExecutor.NAME, "customer_id")).isEqualTo("cust-1");
        assertThat(recorded("customer_profile")).containsEntry("email", "jane@example.com");
        assertThat(executor.activeSessions()).isEqualTo(1);

        executor.endSession(instance.getId());
        assertThat(executor.activeSessions()).isZero();
    }

    @Test
    void authenticateCustomer_unknownCustomer_fails() {
        StepVerifier.create(run("authenticateCustomer", Map.of("customer_email", "nobody@example.com")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StepFailureException.class);
                    assertThat(error.getCause()).isInstanceOf(NoSuchElementException.class)
                            .hasMessageContaining("nobody@example.com");
                })
                .verify();
    }

    @Test
    void getAddress_beforeAuthentication_fails() {
        StepVerifier.create(run("getAddress", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("authenticated"))
                .verify();
    }

    @Test
    void getAddress_fallsBackToStoredProfile() {
        runAndGet("authenticateCustomer", Map.of());

        StepVerifier.create(run("getAddress", Map.of()))
                .assertNext(result -> {
                    assertThat(result).containsEntry("address_source", "stored_profile")
                            .containsEntry("needs_completion", false);
                })
                .verifyComplete();

        assertThat(recorded("delivery_address")).containsEntry("city", "Springfield");
    }

    @Test
    void getAddress_prefersRequestedAddressAndReportsMissingFields() {
        instance.putMetadata("delivery_address", Map.of("street", "1 New Rd", "city", "Austin", "state", "TX"));
        runAndGet("authenticateCustomer", Map.of());

        StepVerifier.create(run("getAddress", Map.of()))
                .assertNext(result -> {
                    assertThat(result).containsEntry("address_source", "request")
                            .containsEntry("needs_completion", true);
                    assertThat(result.get("missing_fields")).isEqualTo(List.of("zip"));
                })
                .verifyComplete();

        assertThat(recorded("delivery_address")).containsEntry("city", "Austin");
    }

    @Test
    void searchThenCheckInventory_reportsStock() {
        StepVerifier.create(run("searchProduct", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("count", 1))
                .verifyComplete();

        StepVerifier.create(run("checkInventory", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("all_in_stock", true))
                .verifyComplete();
    }

    @Test
    void checkInventory_outOfStockProduct() {
        runAndGet("searchProduct", Map.of("product_query", "Headphones"));

        StepVerifier.create(run("checkInventory", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("all_in_stock", false))
                .verifyComplete();
    }

    @Test
    void checkInventory_withoutSearch_fails() {
        StepVerifier.create(run("checkInventory", Map.of()))
                .expectError(StepFailureException.class)
                .verify();
    }

    @Test
    void reserveInventory_holdsStockAcrossWorkflows() {
        StepVerifier.create(run("reserveInventory", Map.of("product_id", "prod-2", "quantity", 4)))
                .assertNext(result -> assertThat(result).containsEntry("quantity", 4))
                .verifyComplete();
        assertThat(executor.reserved("prod-2")).isEqualTo(4);

        StepVerifier.create(run("reserveInventory", Map.of("product_id", "prod-2", "quantity", 2)))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .hasMessageContaining("Insufficient stock"))
                .verify();
        assertThat(executor.reserved("prod-2")).isEqualTo(4);
    }

    @Test
    void createOrder_usesRecordedSearchAndAddress_thenConfirms() {
        runAndGet("authenticateCustomer", Map.of());
        runAndGet("searchProduct", Map.of());
        runAndGet("getAddress", Map.of());

        Map<String, Object> created = runAndGet("createOrder", Map.of("quantity", 2));
        assertThat(created).containsEntry("status", "CONFIRMED");
        String orderId = created.get("order_id").toString();
        assertThat(orderId).startsWith("ORD-");

        Map<String, Object> stored = gateway.findOrder(orderId).block();
        assertThat(stored).containsEntry("customer_id", "cust-1");
        assertThat((Double) stored.get("total_amount")).isCloseTo(1999.98, within(0.001));
        assertThat(stored.get("shipping_address")).isEqualTo(recorded("delivery_address"));

        StepVerifier.create(run("sendConfirmation", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("confirmation_sent", true))
                .verifyComplete();
        assertThat(recorded("confirmation")).containsEntry("recipient", "jane@example.com")
                .containsEntry("order_id", orderId);
    }

    @Test
    void createOrder_gatewayOmittingFields_reportsWhatItHas() {
        InMemoryCommerceGateway sparse = new InMemoryCommerceGateway() {
            @Override
            public Mono<Map<String, Object>> createOrder(String customerId, String productId, int quantity,
                                                         Map<String, Object> shippingAddress) {
                return Mono.just(Map.of("order_id", "ORD-77"));
            }
        };
        sparse.addCustomer("cust-9", "Sam Poe", "sam@example.com", null);
        sparse.addProduct("prod-9", "iPhone 15 Pro", "Apple", 999.99, 3);
        executor = new CommerceExecutor(sparse);
        runAndGet("authenticateCustomer", Map.of("customer_email", "sam@example.com"));
        runAndGet("searchProduct", Map.of());

        StepVerifier.create(run("createOrder", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("order_id", "ORD-77")
                        .doesNotContainKey("status"))
                .verifyComplete();
        StepVerifier.create(run("sendConfirmation", Map.of()))
                .assertNext(result -> assertThat(result).containsEntry("order_id", "ORD-77"))
                .verifyComplete();
    }

    @Test
    void sendConfirmation_withoutOrder_fails() {
        StepVerifier.create(run("sendConfirmation", Map.of()))
                .expectErrorSatisfies(error -> assertThat(error.getCause()).hasMessage("No order to confirm"))
                .verify();
    }

    @Test
    void getOrderDetails_andUpdateOrderWithRecordedAddress() {
        instance.putMetadata("delivery_address", InMemoryCommerceGateway.address("7 Oak St", "Denver", "CO", "80202"));
        runAndGet("authenticateCustomer", Map.of());
        runAndGet("getAddress", Map.of());

        StepVerifier.create(run("getOrderDetails", Map.of("order_id", "ORD-12345")))
                .assertNext(order -> assertThat(order).containsEntry("status", "CONFIRMED"))
                .verifyComplete();

        StepVerifier.create(run("updateOrder", Map.of("order_id", "ORD-12345")))
                .assertNext(result -> assertThat(result).containsEntry("order_id", "ORD-12345"))
                .verifyComplete();

        Map<String, Object> updated = gateway.findOrder("ORD-12345").block();
        assertThat(updated.get("shipping_address")).isEqualTo(recorded("delivery_address"));
        assertThat(updated).containsKey("updated_at");
    }

    @Test
    void getOrderDetails_unknownOrder_fails() {
        StepVerifier.create(run("getOrderDetails", Map.of("order_id", "ORD-0")))
                .expectErrorSatisfies(error -> assertThat(error.getCause())
                        .isInstanceOf(NoSuchElementException.class))
                .verify();
    }

    @Test
    void validateAddress_readsNewAddressArgument() {
        StepVerifier.create(run("validateAddress", Map.of("new_address", Map.of("street", "1 Main", "city", "X"))))
                .assertNext(result -> {
                    assertThat(result).containsEntry("valid", false);
                    assertThat(result.get("missing_fields")).isEqualTo(List.of("state", "zip"));
                })
                .verifyComplete();
    }

    @Test
    void cancelOrder_marksOrderCancelled() {
        StepVerifier.create(run("cancelOrder", Map.of("order_id", "ORD-12345", "reason", "Address change")))
                .assertNext(result -> assertThat(result).containsEntry("order_cancelled", true))
                .verifyComplete();

        assertThat(gateway.findOrder("ORD-12345").block())
                .containsEntry("status", "CANCELLED")
                .containsEntry("cancellation_reason", "Address change");
    }

    @Test
    void createGiftCard_issuesSequentialCards() {
        runAndGet("authenticateCustomer", Map.of());

        Map<String, Object> first = runAndGet("createGiftCard", Map.of("amount", 999.99));
        Map<String, Object> second = runAndGet("createGiftCard", Map.of("amount", 10));

        assertThat(first).containsEntry("customer_id", "cust-1")
                .containsEntry("amount", 999.99)
                .containsEntry("status", "active");
        assertThat(first.get("gift_card_id")).isNotEqualTo(second.get("gift_card_id"));
        assertThat(second).containsEntry("amount", 10.0);
    }

    @Test
    void sendNotification_recordsMessageType() {
        StepVerifier.create(run("sendNotification", Map.of("message_type", "address_change_confirmation",
                        "customer_id", "cust-1")))
                .assertNext(result -> assertThat(result).containsEntry("notification_sent", true))
                .verifyComplete();

        assertThat(recorded("notification"))
                .containsEntry("message_type", "address_change_confirmation")
                .containsEntry("customer_id", "cust-1");
    }
}
