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

package org.fireflyframework.agentflow.strategy.compile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One executor call produced from a declarative strategy action.
 *
 * @param step       1-based position in the compiled plan
 * @param executorId executor name as the rule table knows it, before any aliasing
 */
public record CompiledInstruction(
        int step,
        String executorId,
        String action,
        String description,
        Map<String, Object> parameters
) {
    public CompiledInstruction {
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    /**
     * Key under which the result of this instruction is recorded.
     */
    public String resultKey() {
        return "step_" + step;
    }
}
