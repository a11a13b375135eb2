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

package org.fireflyframework.agentflow.workflow.engine;

import java.util.Set;

/**
 * Point-in-time engine counters.
 *
 * @param activeCount  tracked instances still running
 * @param trackedCount instances held for status queries, running or terminal
 * @param successRate  completed / (completed + failed); 0 when nothing has finished
 */
public record EngineStats(
        long totalStarted,
        long completed,
        long failed,
        long cancelled,
        int activeCount,
        int trackedCount,
        double successRate,
        Set<String> registeredExecutorNames,
        Set<String> registeredGraphNames
) {
    public EngineStats {
        registeredExecutorNames = Set.copyOf(registeredExecutorNames);
        registeredGraphNames = Set.copyOf(registeredGraphNames);
    }
}
