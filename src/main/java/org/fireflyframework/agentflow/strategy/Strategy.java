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

package org.fireflyframework.agentflow.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A condition-gated plan of declarative business actions.
 *
 * @param priority   lower is preferred; {@value #DEFAULT_PRIORITY} when absent
 * @param conditions every one must hold for the strategy to apply
 * @param actions    compiled one by one into executor instructions, in order
 * @param rationale  free-text business justification, reported alongside the selection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Strategy(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("conditions") List<String> conditions,
        @JsonProperty("actions") List<String> actions,
        @JsonProperty("business_rationale") String rationale
) {
    public static final int DEFAULT_PRIORITY = 999;

    @JsonCreator
    public Strategy {
        name = name != null ? name : id;
        description = description != null ? description : "";
        priority = priority != null ? priority : DEFAULT_PRIORITY;
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public Strategy(String id, String name, int priority, List<String> conditions, List<String> actions) {
        this(id, name, "", priority, conditions, actions, null);
    }
}
