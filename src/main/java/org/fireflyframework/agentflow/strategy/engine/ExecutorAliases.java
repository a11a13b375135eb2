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

package org.fireflyframework.agentflow.strategy.engine;

import org.fireflyframework.agentflow.strategy.compile.ActionCompiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retargets instructions compiled against legacy executor names onto the executors
 * actually registered, optionally renaming the action as well.
 */
public final class ExecutorAliases {

    private final Map<String, String> executors;
    private final Map<String, String> actions;

    public record Target(String executorId, String action) {}

    private ExecutorAliases(Map<String, String> executors, Map<String, String> actions) {
        this.executors = Collections.unmodifiableMap(new LinkedHashMap<>(executors));
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public static ExecutorAliases none() {
        return new ExecutorAliases(Map.of(), Map.of());
    }

    public static ExecutorAliases of(Map<String, String> executorAliases) {
        return new ExecutorAliases(executorAliases != null ? executorAliases : Map.of(), Map.of());
    }

    /**
     * Maps every legacy business executor onto {@code businessExecutor}; the rules
     * executor keeps its name. Gift-card issuance becomes {@code createGiftCard}.
     */
    public static ExecutorAliases consolidated(String businessExecutor) {
        Map<String, String> executors = new LinkedHashMap<>();
        executors.put("customerExecutor", businessExecutor);
        executors.put("productExecutor", businessExecutor);
        executors.put(ActionCompiler.ORDER_EXECUTOR, businessExecutor);
        executors.put(ActionCompiler.SHIPPING_EXECUTOR, businessExecutor);
        executors.put(ActionCompiler.PAYMENT_EXECUTOR, businessExecutor);
        return new ExecutorAliases(executors, Map.of())
                .withAction(ActionCompiler.PAYMENT_EXECUTOR, "issueGiftCard", "createGiftCard");
    }

    public ExecutorAliases withExecutor(String legacyName, String targetName) {
        Map<String, String> updated = new LinkedHashMap<>(executors);
        updated.put(legacyName, targetName);
        return new ExecutorAliases(updated, actions);
    }

    public ExecutorAliases withAction(String legacyExecutor, String legacyAction, String targetAction) {
        Map<String, String> updated = new LinkedHashMap<>(actions);
        updated.put(legacyExecutor + "." + legacyAction, targetAction);
        return new ExecutorAliases(executors, updated);
    }

    public Target resolve(String executorId, String action) {
        String targetAction = actions.getOrDefault(executorId + "." + action, action);
        return new Target(executors.getOrDefault(executorId, executorId), targetAction);
    }

    public Map<String, String> getExecutorAliases() {
        return executors;
    }
}
