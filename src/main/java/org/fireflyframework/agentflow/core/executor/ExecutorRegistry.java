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

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-indexed executors. Registering a name twice replaces the earlier binding, which
 * lets a consolidated executor take over a legacy name without touching step graphs.
 */
@Slf4j
public class ExecutorRegistry {

    private final ConcurrentHashMap<String, Executor> executors = new ConcurrentHashMap<>();

    public Optional<Executor> register(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        Executor previous = executors.put(executor.name(), executor);
        if (previous != null && previous != executor) {
            log.info("[executor-registry] Replaced executor '{}' ({} -> {})", executor.name(),
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        } else {
            log.info("[executor-registry] Registered executor '{}'", executor.name());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<Executor> get(String name) {
        return name != null ? Optional.ofNullable(executors.get(name)) : Optional.empty();
    }

    public boolean contains(String name) {
        return name != null && executors.containsKey(name);
    }

    public boolean unregister(String name) {
        return executors.remove(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(executors.keySet()));
    }

    public Collection<Executor> getAll() {
        return Collections.unmodifiableCollection(executors.values());
    }

    public Optional<ExecutorStatus> statusOf(String name) {
        return get(name).map(Executor::status);
    }

    public Map<String, ExecutorStatus> statuses() {
        Map<String, ExecutorStatus> statuses = new TreeMap<>();
        executors.forEach((name, executor) -> statuses.put(name, executor.status()));
        return Collections.unmodifiableMap(statuses);
    }
}
