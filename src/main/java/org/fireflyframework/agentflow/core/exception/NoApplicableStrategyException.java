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

package org.fireflyframework.agentflow.core.exception;

import java.util.Map;

/**
 * Neither a catalog strategy nor a fallback applies to the situation. Callers should
 * surface this as "cannot determine how to proceed" rather than retry unchanged.
 */
public final class NoApplicableStrategyException extends OrchestrationException {

    public NoApplicableStrategyException(String query) {
        this(query, null);
    }

    public NoApplicableStrategyException(String query, String workflowId) {
        super("No applicable strategy found for the current situation", "AGENTFLOW_NO_APPLICABLE_STRATEGY",
                workflowId, Map.of("query", String.valueOf(query)), null);
    }
}
