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
import org.fireflyframework.agentflow.core.exception.OrchestrationException;
import org.fireflyframework.agentflow.core.exception.StepFailureException;
import org.fireflyframework.agentflow.core.model.Capability;
import org.fireflyframework.agentflow.core.model.ExecutorState;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base executor: dispatches each message through an explicit {@code action -> handler}
 * table, keeps request metrics and normalizes every failure that is not already an
 * {@link OrchestrationException} into a {@link StepFailureException}.
 */
@Slf4j
public abstract class AbstractExecutor implements Executor {

    private final String name;
    private final Set<Capability> capabilities;
    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object responseTimeLock = new Object();
    private double averageResponseTimeMs;
    private volatile Instant lastActivity;
    private volatile boolean lastRequestFailed;

    protected AbstractExecutor(String name, Set<Capability> capabilities) {
        this.name = Objects.requireNonNull(name, "name");
        this.capabilities = capabilities.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        log.info("[executor] Initialized '{}' with capabilities {}", name, this.capabilities);
    }

    protected final void registerAction(String action, ActionHandler handler) {
        handlers.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(handler, "handler"));
    }

    public Set<String> actions() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    public boolean supportsAction(String action) {
        return handlers.containsKey(action);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public Mono<Map<String, Object>> handle(ExecutorMessage message, WorkflowInstance instance) {
        return Mono.defer(() -> {
            String action = message.action();
            ActionHandler handler = handlers.get(action);
            if (handler == null) {
                totalRequests.incrementAndGet();
                recordFailure();
                return Mono.error(new StepFailureException(name, action, instance.getId(), false,
                        new UnsupportedOperationException("Unknown action: " + action)));
            }

            long startedAt = System.nanoTime();
            totalRequests.incrementAndGet();
            inFlight.incrementAndGet();
            log.info("[executor] {} processing {} for workflow {}", name, action, instance.getId());

            return Mono.defer(() -> handler.handle(message, instance))
                    .defaultIfEmpty(Map.of())
                    .doOnNext(result -> {
                        long elapsedMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
                        recordSuccess(elapsedMs);
                        log.info("[executor] {} completed {} in {}ms", name, action, elapsedMs);
                    })
                    .onErrorMap(e -> !(e instanceof OrchestrationException),
                            e -> new StepFailureException(name, action, instance.getId(), false, e))
                    .doOnError(e -> {
                        recordFailure();
                        log.error("[executor] {} failed to process {}: {}", name, action, e.getMessage());
                    })
                    .doFinally(signal -> {
                        inFlight.decrementAndGet();
                        lastActivity = Instant.now();
                    });
        });
    }

    /**
     * Records {@code value} under this executor's slot of the instance's results.
     */
    protected void recordResult(WorkflowInstance instance, String key, Object value) {
        instance.putExecutorData(name, key, value);
    }

    protected void recordResults(WorkflowInstance instance, Map<String, Object> values) {
        instance.putAllExecutorData(name, values);
    }

    private void recordSuccess(long elapsedMs) {
        long successes = successfulRequests.incrementAndGet();
        synchronized (responseTimeLock) {
            averageResponseTimeMs = (averageResponseTimeMs * (successes - 1) + elapsedMs) / successes;
        }
        lastRequestFailed = false;
    }

    private void recordFailure() {
        failedRequests.incrementAndGet();
        lastRequestFailed = true;
        lastActivity = Instant.now();
    }

    @Override
    public ExecutorStatus status() {
        int running = inFlight.get();
        ExecutorState state = running > 0 ? ExecutorState.BUSY
                : lastRequestFailed ? ExecutorState.ERROR : ExecutorState.IDLE;
        double average;
        synchronized (responseTimeLock) {
            average = averageResponseTimeMs;
        }
        return new ExecutorStatus(name, state, capabilities, actions(), totalRequests.get(),
                successfulRequests.get(), failedRequests.get(), average, running, lastActivity);
    }
}
