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
 * An executor call failed. Fatal to the whole workflow run: the engine never retries.
 */
public final class StepFailureException extends OrchestrationException {

    private final String executorId;
    private final String action;
    private final boolean timeout;

    public StepFailureException(String executorId, String action, Throwable cause) {
        this(executorId, action, null, false, cause);
    }

    public StepFailureException(String executorId, String action, String workflowId,
                                boolean timeout, Throwable cause) {
        super(buildMessage(executorId, action, timeout, cause), "AGENTFLOW_STEP_FAILURE", workflowId,
                Map.of("executorId", String.valueOf(executorId),
                        "action", String.valueOf(action),
                        "timeout", timeout),
                cause);
        this.executorId = executorId;
        this.action = action;
        this.timeout = timeout;
    }

    public String getExecutorId() {
        return executorId;
    }

    public String getAction() {
        return action;
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * Same failure, attributed to {@code workflowId}.
     */
    public StepFailureException forWorkflow(String workflowId) {
        if (workflowId == null || workflowId.equals(getWorkflowId())) {
            return this;
        }
        return new StepFailureException(executorId, action, workflowId, timeout, getCause());
    }

    private static String buildMessage(String executorId, String action, boolean timeout, Throwable cause) {
        String base = "Executor '" + executorId + "' failed on action '" + action + "'";
        if (timeout) {
            return base + ": timed out";
        }
        return cause != null && cause.getMessage() != null ? base + ": " + cause.getMessage() : base;
    }
}
