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

package org.fireflyframework.agentflow.core.executor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One dispatch of an action to an executor. Created fresh for every step and never
 * reused.
 *
 * @param priority 1 = high, 2 = medium, 3 = low
 */
public record ExecutorMessage(
        String id,
        String from,
        String to,
        String workflowId,
        String action,
        Map<String, Object> payload,
        Map<String, Object> contextSnapshot,
        int priority,
        boolean requiresResponse,
        Instant timestamp
) {
    public static final String ORCHESTRATOR = "orchestrator";
    public static final int HIGH_PRIORITY = 1;
    public static final String ORIGIN_INPUT = "originInput";

    public ExecutorMessage {
        payload = readOnlyCopy(payload);
        contextSnapshot = readOnlyCopy(contextSnapshot);
    }

    public static ExecutorMessage dispatch(String from, String to, String workflowId, String action,
                                           Map<String, Object> payload, Map<String, Object> contextSnapshot) {
        return new ExecutorMessage(UUID.randomUUID().toString(), from, to, workflowId, action,
                payload, contextSnapshot, HIGH_PRIORITY, true, Instant.now());
    }

    @SuppressWarnings("unchecked")
    public <T> T payloadValue(String key, Class<T> type) {
        Object value = payload.get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Looks {@code key} up in the payload first, then in the workflow's origin input.
     */
    public Object argument(String key) {
        Object value = payload.get(key);
        if (value == null && contextSnapshot.get(ORIGIN_INPUT) instanceof Map<?, ?> origin) {
            value = origin.get(key);
        }
        return value;
    }

    public String argumentString(String key) {
        Object value = argument(key);
        return value != null ? value.toString() : null;
    }

    private static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }
}
