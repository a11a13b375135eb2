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

import org.fireflyframework.agentflow.core.model.Capability;
import org.fireflyframework.agentflow.core.model.ExecutorState;

import java.time.Instant;
import java.util.Set;

public record ExecutorStatus(
        String name,
        ExecutorState state,
        Set<Capability> capabilities,
        Set<String> actions,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double averageResponseTimeMs,
        int inFlight,
        Instant lastActivity
) {
    public static ExecutorStatus unmetered(String name, Set<Capability> capabilities) {
        return new ExecutorStatus(name, ExecutorState.IDLE, Set.copyOf(capabilities), Set.of(),
                0, 0, 0, 0.0, 0, null);
    }

    public double successRate() {
        return (double) successfulRequests / Math.max(1, totalRequests);
    }
}
