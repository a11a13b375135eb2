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

package org.fireflyframework.agentflow.core.topology;

import org.fireflyframework.agentflow.core.exception.WorkflowDeadlockException;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Round-based scheduling primitives shared by the execution loop and the dry-run
 * planner.
 *
 * <p>A round takes every remaining step whose dependencies are all complete (the
 * ready set) and splits it into a parallel batch and a sequential batch, each in
 * definition order. The parallel batch runs and joins first, then the sequential
 * batch runs one step at a time.
 */
public final class TopologyPlanner {

    private TopologyPlanner() {}

    /**
     * Partition of one round's ready set.
     */
    public record Batch<T>(List<T> parallel, List<T> sequential) {
        public Batch {
            parallel = List.copyOf(parallel);
            sequential = List.copyOf(sequential);
        }

        public boolean isEmpty() {
            return parallel.isEmpty() && sequential.isEmpty();
        }
    }

    /**
     * Steps of {@code remaining} whose dependencies are all in {@code completed},
     * in the iteration order of {@code remaining}.
     */
    public static <T> List<T> readySet(Collection<T> remaining, Set<String> completed,
                                       Function<T, List<String>> dependsOnExtractor) {
        List<T> ready = new ArrayList<>();
        for (T step : remaining) {
            List<String> deps = dependsOnExtractor.apply(step);
            if (deps == null || completed.containsAll(deps)) {
                ready.add(step);
            }
        }
        return ready;
    }

    public static <T> Batch<T> partition(List<T> ready, Predicate<T> parallelExtractor) {
        List<T> parallel = new ArrayList<>();
        List<T> sequential = new ArrayList<>();
        for (T step : ready) {
            if (parallelExtractor.test(step)) {
                parallel.add(step);
            } else {
                sequential.add(step);
            }
        }
        return new Batch<>(parallel, sequential);
    }

    /**
     * Dry-runs the scheduler over {@code steps}, assuming every step succeeds.
     *
     * @return one {@link Round} per loop iteration, in execution order
     * @throws WorkflowDeadlockException if some steps can never become ready
     */
    public static <T> List<Round> planRounds(String graphName, List<T> steps,
                                             Function<T, String> idExtractor,
                                             Function<T, List<String>> dependsOnExtractor,
                                             Predicate<T> parallelExtractor) {
        List<T> remaining = new ArrayList<>(steps);
        Set<String> completed = new LinkedHashSet<>();
        List<Round> rounds = new ArrayList<>();

        while (!remaining.isEmpty()) {
            List<T> ready = readySet(remaining, completed, dependsOnExtractor);
            if (ready.isEmpty()) {
                throw new WorkflowDeadlockException(graphName,
                        remaining.stream().map(idExtractor).toList(), null);
            }
            Batch<T> batch = partition(ready, parallelExtractor);
            List<String> parallelIds = batch.parallel().stream().map(idExtractor).toList();
            List<String> sequentialIds = batch.sequential().stream().map(idExtractor).toList();
            rounds.add(new Round(rounds.size() + 1, parallelIds, sequentialIds));

            completed.addAll(parallelIds);
            completed.addAll(sequentialIds);
            remaining.removeAll(ready);
        }
        return rounds;
    }
}
