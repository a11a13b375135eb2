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

import org.fireflyframework.agentflow.strategy.compile.CompiledInstruction;

import java.util.List;

/**
 * A selected strategy compiled against one situation.
 */
public record ExecutionPlan(
        String strategyId,
        String strategyName,
        String strategyDescription,
        boolean fallback,
        List<CompiledInstruction> instructions
) {
    public ExecutionPlan {
        instructions = instructions != null ? List.copyOf(instructions) : List.of();
    }

    public int size() {
        return instructions.size();
    }
}
