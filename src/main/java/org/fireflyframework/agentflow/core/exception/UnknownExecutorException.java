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

public final class UnknownExecutorException extends OrchestrationException {

    private final String executorId;

    public UnknownExecutorException(String executorId, String workflowId) {
        super("Executor '" + executorId + "' not registered", "AGENTFLOW_UNKNOWN_EXECUTOR",
                workflowId, Map.of("executorId", String.valueOf(executorId)), null);
        this.executorId = executorId;
    }

    public String getExecutorId() {
        return executorId;
    }
}
