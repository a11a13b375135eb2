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

package org.fireflyframework.agentflow.strategy.engine;

import org.fireflyframework.agentflow.core.exception.NoApplicableStrategyException;
import org.fireflyframework.agentflow.strategy.Strategy;
import org.fireflyframework.agentflow.strategy.StrategyCatalog;
import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.fireflyframework.agentflow.strategy.compile.ActionCompiler;
import org.fireflyframework.agentflow.strategy.compile.CompiledInstruction;
import org.fireflyframework.agentflow.strategy.condition.ConditionEvaluator;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the strategy that fits a situation and compiles it into executor
 * instructions.
 *
 * <p>A strategy applies when all of its conditions hold. Among applicable strategies
 * the lowest priority number wins; equal priorities resolve to the one loaded first.
 * With no applicable strategy the catalog's fallback is used, if it has one.
 */
@Slf4j
public class StrategyEngine {

    private final StrategyCatalog catalog;
    private final ConditionEvaluator conditions;
    private final ActionCompiler compiler;

    public StrategyEngine(StrategyCatalog catalog, ConditionEvaluator conditions, ActionCompiler compiler) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public StrategyEngine(StrategyCatalog catalog) {
        this(catalog, ConditionEvaluator.withDefaults(), ActionCompiler.withDefaults());
    }

    public Optional<Strategy> evaluate(StrategySituation situation) {
        // Stream.sorted is stable on an ordered stream: ties keep catalog order
        Optional<Strategy> best = catalog.getStrategies().stream()
                .filter(strategy -> conditions.allHold(strategy.conditions(), situation))
                .sorted(Comparator.comparing(Strategy::priority))
                .findFirst();
        if (best.isPresent()) {
            log.info("[strategy] Selected strategy '{}' (priority={})", best.get().name(), best.get().priority());
            return best;
        }
        Optional<Strategy> fallback = catalog.getFallbackStrategy();
        if (fallback.isPresent()) {
            log.warn("[strategy] No strategy matched, using fallback '{}'", fallback.get().name());
        } else {
            log.warn("[strategy] No strategy matched and no fallback configured");
        }
        return fallback;
    }

    /**
     * Like {@link #evaluate} but fails with {@link NoApplicableStrategyException} when
     * there is nothing to run.
     */
    public Strategy select(StrategySituation situation) {
        return evaluate(situation).orElseThrow(() -> new NoApplicableStrategyException(situation.query()));
    }

    public List<CompiledInstruction> compile(Strategy strategy, StrategySituation situation) {
        return compiler.compile(strategy.actions(), situation);
    }

    public ExecutionPlan plan(Strategy strategy, StrategySituation situation) {
        return new ExecutionPlan(strategy.id(), strategy.name(), strategy.description(),
                catalog.isFallback(strategy), compile(strategy, situation));
    }

    public boolean isFallback(Strategy strategy) {
        return catalog.isFallback(strategy);
    }

    public StrategyCatalog getCatalog() {
        return catalog;
    }
}
