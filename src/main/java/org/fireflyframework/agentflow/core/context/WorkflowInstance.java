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

package org.fireflyframework.agentflow.core.context;

import org.fireflyframework.agentflow.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable run-time record of one execution of a step graph or compiled strategy.
 *
 * <p>Only the execution loop that owns an instance mutates it. Members of a parallel
 * batch may write their results at the same time, so the per-executor result maps are
 * concurrent. Once terminal the instance no longer accepts writes to its step history.
 */
public class WorkflowInstance {

    private final String id;
    private final String workflowName;
    private final Map<String, Object> originInput;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    private final List<String> completedSteps;
    private final List<String> pendingSteps;
    private final Map<String, Map<String, Object>> executorData;

    private volatile String currentStep = "";
    private volatile Instant updatedAt;
    private volatile Instant completedAt;
    private volatile WorkflowStatus status = WorkflowStatus.RUNNING;
    private volatile Throwable failure;

    private WorkflowInstance(String id, String workflowName, Map<String, Object> originInput,
                             Map<String, Object> metadata) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.workflowName = workflowName;
        this.originInput = originInput != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(originInput))
                : Map.of();
        this.metadata = new ConcurrentHashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) {
                    this.metadata.put(k, v);
                }
            });
        }
        this.completedSteps = new CopyOnWriteArrayList<>();
        this.pendingSteps = new CopyOnWriteArrayList<>();
        this.executorData = new ConcurrentHashMap<>();
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public static WorkflowInstance create(String workflowName, Map<String, Object> originInput,
                                          Map<String, Object> metadata) {
        return new WorkflowInstance(null, workflowName, originInput, metadata);
    }

    public static WorkflowInstance create(String id, String workflowName, Map<String, Object> originInput,
                                          Map<String, Object> metadata) {
        return new WorkflowInstance(id, workflowName, originInput, metadata);
    }

    // Identity
    public String getId() { return id; }
    public String getWorkflowName() { return workflowName; }
    public Map<String, Object> getOriginInput() { return originInput; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getCompletedAt() { return completedAt; }

    // Metadata
    public Map<String, Object> getMetadata() { return Collections.unmodifiableMap(metadata); }
    public Object getMetadata(String key) { return metadata.get(key); }
    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
        touch();
    }

    // Step progress
    public String getCurrentStep() { return currentStep; }
    public void setCurrentStep(String stepName) {
        this.currentStep = stepName != null ? stepName : "";
        touch();
    }

    public List<String> getCompletedSteps() { return List.copyOf(completedSteps); }
    public boolean isStepCompleted(String stepName) { return completedSteps.contains(stepName); }

    public void markStepCompleted(String stepName) {
        if (status.isTerminal()) {
            return;
        }
        completedSteps.add(stepName);
        pendingSteps.remove(stepName);
        touch();
    }

    public List<String> getPendingSteps() { return List.copyOf(pendingSteps); }
    public void setPendingSteps(Collection<String> stepNames) {
        pendingSteps.clear();
        pendingSteps.addAll(stepNames);
        touch();
    }

    // Executor results
    public void putExecutorData(String executorId, String key, Object value) {
        // results arriving after cancellation are discarded
        if (value == null || status == WorkflowStatus.CANCELLED) {
            return;
        }
        executorData.computeIfAbsent(executorId, k -> new ConcurrentHashMap<>()).put(key, value);
        touch();
    }

    public void putAllExecutorData(String executorId, Map<String, Object> values) {
        if (values != null) {
            values.forEach((k, v) -> putExecutorData(executorId, k, v));
        }
    }

    public Map<String, Object> getExecutorData(String executorId) {
        Map<String, Object> data = executorData.get(executorId);
        return data != null ? Collections.unmodifiableMap(data) : Map.of();
    }

    public Object getExecutorValue(String executorId, String key) {
        Map<String, Object> data = executorData.get(executorId);
        return data != null ? data.get(key) : null;
    }

    @SuppressWarnings("unchecked")
    public <T> T getExecutorValue(String executorId, String key, Class<T> type) {
        Object value = getExecutorValue(executorId, key);
        return type.isInstance(value) ? (T) value : null;
    }

    /**
     * Deep, immutable copy of every executor's results.
     */
    public Map<String, Map<String, Object>> getExecutorData() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        executorData.forEach((k, v) -> copy.put(k, Map.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    // Lifecycle
    public WorkflowStatus getStatus() { return status; }
    public Throwable getFailure() { return failure; }
    public boolean isTerminal() { return status.isTerminal(); }

    public synchronized boolean markCompleted() {
        return transition(WorkflowStatus.COMPLETED, null);
    }

    public synchronized boolean markFailed(Throwable error) {
        return transition(WorkflowStatus.FAILED, error);
    }

    public synchronized boolean markCancelled() {
        return transition(WorkflowStatus.CANCELLED, null);
    }

    private boolean transition(WorkflowStatus target, Throwable error) {
        if (status.isTerminal()) {
            return false;
        }
        this.status = target;
        this.failure = error;
        this.completedAt = Instant.now();
        this.updatedAt = completedAt;
        return true;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public WorkflowStatusView snapshot() {
        Throwable error = failure;
        return new WorkflowStatusView(id, workflowName, status, currentStep,
                getCompletedSteps(), getPendingSteps(), getExecutorData(), Map.copyOf(metadata),
                error != null ? error.getMessage() : null, createdAt, updatedAt, completedAt);
    }

    @Override
    public String toString() {
        return "WorkflowInstance{id=" + id + ", workflow=" + workflowName + ", status=" + status
                + ", completedSteps=" + completedSteps + "}";
    }
}
