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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the engine's error taxonomy. Every failure that aborts a workflow run is
 * reported to the caller as a subclass of this type.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final String errorCode;
    private final String workflowId;
    private final Map<String, Object> context;

    protected OrchestrationException(String message, String errorCode) {
        this(message, errorCode, null, Map.of(), null);
    }

    protected OrchestrationException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, null, Map.of(), cause);
    }

    protected OrchestrationException(String message, String errorCode, String workflowId,
                                     Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.workflowId = workflowId;
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Id of the workflow instance the failure belongs to, or {@code null} when the
     * failure happened before any instance was created.
     */
    public String getWorkflowId() {
        return workflowId;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
