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

import java.util.ArrayList;
import java.util.List;

/**
 * One iteration of the scheduler: the parallel batch (joined first) and the
 * sequential batch (run afterwards, in order).
 *
 * @param index 1-based round number
 */
public record Round(int index, List<String> parallel, List<String> sequential) {

    public Round {
        parallel = List.copyOf(parallel);
        sequential = List.copyOf(sequential);
    }

    /**
     * Completion order of the round when every step succeeds.
     */
    public List<String> completionOrder() {
        List<String> all = new ArrayList<>(parallel);
        all.addAll(sequential);
        return List.copyOf(all);
    }
}
