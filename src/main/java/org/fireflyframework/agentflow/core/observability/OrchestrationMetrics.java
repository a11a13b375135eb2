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

package org.fireflyframework.agentflow.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.agentflow.core.model.WorkflowStatus;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class OrchestrationMetrics implements OrchestrationEvents {
    private static final String PREFIX = "firefly.agentflow";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStart(String name, String workflowId) {
        counter("workflows.started", "name", name).increment();
    }

    @Override
    public void onCompleted(String name, String workflowId, WorkflowStatus status, long durationMs) {
        counter("workflows.completed", "name", name, "status", status.value()).increment();
        timer("workflows.duration", "name", name).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onStepSuccess(String name, String workflowId, String stepName, long latencyMs) {
        counter("steps.completed", "name", name, "step", stepName, "success", "true").increment();
        timer("steps.duration", "name", name, "step", stepName).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onStepFailed(String name, String workflowId, String stepName, Throwable error) {
        counter("steps.completed", "name", name, "step", stepName, "success", "false").increment();
    }

    @Override
    public void onStrategySelected(String name, String workflowId, String strategyId, String strategyName, boolean fallback) {
        counter("strategies.selected", "strategy", strategyId, "fallback", String.valueOf(fallback)).increment();
    }

    @Override
    public void onNoApplicableStrategy(String name, String workflowId) {
        counter("strategies.unmatched", "name", name).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
