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

import org.fireflyframework.agentflow.core.model.Capability;

import java.util.Arrays;
import java.util.Optional;

/**
 * Actions of the consolidated business executor.
 */
public enum CommerceAction {
    AUTHENTICATE_CUSTOMER("authenticateCustomer", Capability.CUSTOMER_AUTH),
    GET_ADDRESS("getAddress", Capability.CUSTOMER_AUTH),
    SEARCH_PRODUCT("searchProduct", Capability.PRODUCT_SEARCH),
    CHECK_INVENTORY("checkInventory", Capability.INVENTORY_CHECK),
    CHECK_AVAILABILITY("checkAvailability", Capability.INVENTORY_CHECK),
    RESERVE_INVENTORY("reserveInventory", Capability.INVENTORY_CHECK),
    CALCULATE_DELIVERY("calculateDelivery", Capability.SHIPPING_CALC),
    VALIDATE_ADDRESS("validateAddress", Capability.ADDRESS_VALIDATE),
    CREATE_ORDER("createOrder", Capability.ORDER_CREATE),
    GET_ORDER_DETAILS("getOrderDetails", Capability.ORDER_UPDATE),
    UPDATE_ORDER("updateOrder", Capability.ORDER_UPDATE),
    CANCEL_ORDER("cancelOrder", Capability.ORDER_UPDATE),
    CREATE_GIFT_CARD("createGiftCard", Capability.PAYMENT_PROCESS),
    SEND_CONFIRMATION("sendConfirmation", Capability.NOTIFICATION_SEND),
    SEND_NOTIFICATION("sendNotification", Capability.NOTIFICATION_SEND);

    private final String actionName;
    private final Capability capability;

    CommerceAction(String actionName, Capability capability) {
        this.actionName = actionName;
        this.capability = capability;
    }

    public String actionName() {
        return actionName;
    }

    public Capability capability() {
        return capability;
    }

    public static Optional<CommerceAction> fromActionName(String actionName) {
        return Arrays.stream(values()).filter(a -> a.actionName.equals(actionName)).findFirst();
    }
}
