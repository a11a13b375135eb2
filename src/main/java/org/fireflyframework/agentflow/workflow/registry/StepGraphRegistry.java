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

package org.fireflyframework.agentflow.workflow.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named step graphs. Graphs are immutable, so they are shared read-only by every
 * concurrently running instance; registering a name again replaces the graph for
 * runs started afterwards.
 */
@Slf4j
public class StepGraphRegistry {

    private final ConcurrentHashMap<String, StepGraph> graphs = new ConcurrentHashMap<>();

    public void register(StepGraph graph) {
        register(graph.name(), graph);
    }

    public void register(String name, StepGraph graph) {
        Objects.requireNonNull(graph, "graph");
        StepGraph previous = graphs.put(name, graph.withName(name));
        if (previous != null) {
            log.info("[step-graph-registry] Replaced step graph '{}'", name);
        } else {
            log.info("[step-graph-registry] Registered step graph '{}' with {} steps", name, graph.size());
        }
    }

    public Optional<StepGraph> get(String name) {
        return name != null ? Optional.ofNullable(graphs.get(name)) : Optional.empty();
    }

    public boolean contains(String name) {
        return name != null && graphs.containsKey(name);
    }

    public Collection<StepGraph> getAll() {
        return Collections.unmodifiableCollection(graphs.values());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(graphs.keySet()));
    }

    public void unregister(String name) {
        graphs.remove(name);
    }
}
