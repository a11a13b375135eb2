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

import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * One matcher of the condition table: recognizes a family of condition phrases and
 * decides whether a recognized phrase holds for a situation.
 *
 * <p>Both methods receive the condition already lower-cased.
 */
public interface ConditionRule {

    String name();

    boolean appliesTo(String condition);

    boolean test(String condition, StrategySituation situation);

    static ConditionRule of(String name, Predicate<String> appliesTo,
                            BiPredicate<String, StrategySituation> test) {
        return new ConditionRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean appliesTo(String condition) {
                return appliesTo.test(condition);
            }

            @Override
            public boolean test(String condition, StrategySituation situation) {
                return test.test(condition, situation);
            }

            @Override
            public String toString() {
                return "ConditionRule[" + name + "]";
            }
        };
    }

    /**
     * Applies where this rule applies; holds when both this and {@code other} hold.
     */
    default ConditionRule and(ConditionRule other) {
        return of(name() + "&" + other.name(), this::appliesTo,
                (c, s) -> test(c, s) && other.test(c, s));
    }

    /**
     * Applies where this rule applies; holds when either this or {@code other} holds.
     */
    default ConditionRule or(ConditionRule other) {
        return of(name() + "|" + other.name(), this::appliesTo,
                (c, s) -> test(c, s) || other.test(c, s));
    }

    default ConditionRule negate() {
        return of("!" + name(), this::appliesTo, (c, s) -> !test(c, s));
    }
}
