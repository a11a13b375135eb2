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

package org.fireflyframework.agentflow.strategy.condition;

import org.fireflyframework.agentflow.strategy.StrategySituation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates condition phrases against a {@link StrategySituation} with an ordered table
 * of {@link ConditionRule}s.
 *
 * <p>A condition holds when every rule that recognizes it holds. A condition no rule
 * recognizes holds, so an unknown phrase never blocks a strategy. A rule that throws
 * counts as not holding.
 */
@Slf4j
public class ConditionEvaluator {

    private final List<ConditionRule> rules;

    public ConditionEvaluator(List<ConditionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ConditionEvaluator withDefaults() {
        return new ConditionEvaluator(ConditionRules.defaults());
    }

    public static ConditionEvaluator withDefaults(double changeWindowHours) {
        return new ConditionEvaluator(ConditionRules.defaults(changeWindowHours));
    }

    /**
     * Copy of this evaluator with {@code rule} appended to the table.
     */
    public ConditionEvaluator withRule(ConditionRule rule) {
        List<ConditionRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new ConditionEvaluator(extended);
    }

    public List<ConditionRule> getRules() {
        return rules;
    }

    public boolean holds(String condition, StrategySituation situation) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        String normalized = condition.toLowerCase(Locale.ROOT);
        boolean recognized = false;
        for (ConditionRule rule : rules) {
            if (!rule.appliesTo(normalized)) {
                continue;
            }
            recognized = true;
            try {
                if (!rule.test(normalized, situation)) {
                    return false;
                }
            } catch (RuntimeException e) {
                log.warn("[strategy] Condition rule '{}' failed on '{}': {}", rule.name(), condition, e.getMessage());
                return false;
            }
        }
        if (!recognized) {
            log.debug("[strategy] Unrecognized condition '{}' treated as holding", condition);
        }
        return true;
    }

    public boolean allHold(List<String> conditions, StrategySituation situation) {
        for (String condition : conditions) {
            if (!holds(condition, situation)) {
                return false;
            }
        }
        return true;
    }
}
