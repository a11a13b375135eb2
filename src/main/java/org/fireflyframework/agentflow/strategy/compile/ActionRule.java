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

package org.fireflyframework.agentflow.strategy.compile;

import org.fireflyframework.agentflow.strategy.StrategySituation;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * One row of the action table: a phrase matcher and the instruction it compiles to.
 *
 * @param matcher    receives the action description lower-cased
 * @param parameters builds the call parameters from the original description and the
 *                   situation
 */
public record ActionRule(
        String name,
        Predicate<String> matcher,
        String executorId,
        String action,
        BiFunction<String, StrategySituation, Map<String, Object>> parameters
) {
    public boolean matches(String normalizedDescription) {
        return matcher.test(normalizedDescription);
    }

    public CompiledInstruction compile(int step, String description, StrategySituation situation) {
        return new CompiledInstruction(step, executorId, action, description,
                parameters.apply(description, situation));
    }

    static Predicate<String> containsAll(String... phrases) {
        return text -> {
            for (String phrase : phrases) {
                if (!text.contains(phrase)) {
                    return false;
                }
            }
            return true;
        };
    }

    static Predicate<String> containsAny(String... phrases) {
        return text -> {
            for (String phrase : phrases) {
                if (text.contains(phrase)) {
                    return true;
                }
            }
            return false;
        };
    }
}
