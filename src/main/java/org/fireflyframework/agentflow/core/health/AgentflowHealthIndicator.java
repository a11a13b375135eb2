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

package org.fireflyframework.agentflow.core.health;

import org.fireflyframework.agentflow.core.executor.ExecutorStatus;
import org.fireflyframework.agentflow.core.model.ExecutorState;
import org.fireflyframework.agentflow.workflow.engine.EngineStats;
import org.fireflyframework.agentflow.workflow.engine.OrchestrationEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;

/**
 * Reports engine counters. Executors stuck in the error state are listed but do not
 * take the engine down.
 */
public class AgentflowHealthIndicator implements HealthIndicator {

    private final OrchestrationEngine engine;

    public AgentflowHealthIndicator(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        try {
            EngineStats stats = engine.getEngineStats();
            Map<String, ExecutorStatus> statuses = engine.getExecutorStatuses();
            List<String> erroring = statuses.entrySet().stream()
                    .filter(e -> e.getValue().state() == ExecutorState.ERROR)
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
            return Health.up()
                    .withDetail("totalStarted", stats.totalStarted())
                    .withDetail("completed", stats.completed())
                    .withDetail("failed", stats.failed())
                    .withDetail("cancelled", stats.cancelled())
                    .withDetail("active", stats.activeCount())
                    .withDetail("successRate", stats.successRate())
                    .withDetail("executors", stats.registeredExecutorNames().size())
                    .withDetail("workflows", stats.registeredGraphNames().size())
                    .withDetail("erroringExecutors", erroring)
                    .build();
        } catch (RuntimeException e) {
            return Health.down().withException(e).build();
        }
    }
}
