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

import org.fireflyframework.agentflow.core.exception.StrategyCatalogException;

import java.util.*;

/**
 * Immutable, ordered set of strategies plus an optional fallback. Load order is kept:
 * it breaks ties between strategies of equal priority.
 */
public final class StrategyCatalog {

    private final List<Strategy> strategies;
    private final Strategy fallbackStrategy;

    public StrategyCatalog(List<Strategy> strategies, Strategy fallbackStrategy) {
        List<Strategy> ordered = strategies != null ? List.copyOf(strategies) : List.of();
        Set<String> ids = new HashSet<>();
        for (Strategy strategy : ordered) {
            if (strategy.id() == null || strategy.id().isBlank()) {
                throw new StrategyCatalogException("Strategy without an id: " + strategy.name());
            }
            if (!ids.add(strategy.id())) {
                throw new StrategyCatalogException("Duplicate strategy id '" + strategy.id() + "'");
            }
        }
        this.strategies = ordered;
        this.fallbackStrategy = fallbackStrategy;
    }

    public static StrategyCatalog empty() {
        return new StrategyCatalog(List.of(), null);
    }

    public static StrategyCatalog of(Strategy... strategies) {
        return new StrategyCatalog(Arrays.asList(strategies), null);
    }

    public StrategyCatalog withFallback(Strategy fallback) {
        return new StrategyCatalog(strategies, fallback);
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }

    public Optional<Strategy> getFallbackStrategy() {
        return Optional.ofNullable(fallbackStrategy);
    }

    public boolean isFallback(Strategy strategy) {
        return strategy != null && strategy == fallbackStrategy;
    }

    public Optional<Strategy> findById(String id) {
        return strategies.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public int size() {
        return strategies.size();
    }
}
