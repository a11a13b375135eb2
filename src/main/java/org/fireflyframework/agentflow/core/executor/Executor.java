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

import org.fireflyframework.agentflow.core.context.WorkflowInstance;
import org.fireflyframework.agentflow.core.model.Capability;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * A named unit of work that performs one action per {@link ExecutorMessage}.
 *
 * <p>{@link #handle} may be invoked concurrently on behalf of different workflow
 * instances; the engine gives no serialization guarantee across workflows. Any
 * mutable resource an executor owns must be guarded by the executor itself.
 *
 * <p>On success the executor records its results under
 * {@code instance.executorData[name()]} before the returned {@code Mono} completes.
 * On failure the {@code Mono} errors with a
 * {@link org.fireflyframework.agentflow.core.exception.StepFailureException}.
 * Remote calls made by an executor must have finished, one way or the other, by the
 * time the {@code Mono} terminates.
 */
public interface Executor {

    String name();

    Set<Capability> capabilities();

    default boolean canHandle(Capability capability) {
        return capabilities().contains(capability);
    }

    Mono<Map<String, Object>> handle(ExecutorMessage message, WorkflowInstance instance);

    /**
     * Called once per workflow run that ends, whatever the outcome. Executors holding
     * per-workflow state release it here.
     */
    default void onWorkflowFinished(String workflowId) {}

    default ExecutorStatus status() {
        return ExecutorStatus.unmetered(name(), capabilities());
    }
}
