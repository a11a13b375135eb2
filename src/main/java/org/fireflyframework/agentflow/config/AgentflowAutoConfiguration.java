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

package org.fireflyframework.agentflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.agentflow.core.executor.Executor;
import org.fireflyframework.agentflow.core.executor.ExecutorRegistry;
import org.fireflyframework.agentflow.core.health.AgentflowHealthIndicator;
import org.fireflyframework.agentflow.core.observability.CompositeOrchestrationEvents;
import org.fireflyframework.agentflow.core.observability.OrchestrationEvents;
import org.fireflyframework.agentflow.core.observability.OrchestrationLoggerEvents;
import org.fireflyframework.agentflow.core.observability.OrchestrationMetrics;
import org.fireflyframework.agentflow.core.step.StepDispatcher;
import org.fireflyframework.agentflow.executor.commerce.CommerceExecutor;
import org.fireflyframework.agentflow.executor.commerce.CommerceGateway;
import org.fireflyframework.agentflow.executor.rules.RulesExecutor;
import org.fireflyframework.agentflow.strategy.StrategyCatalog;
import org.fireflyframework.agentflow.strategy.StrategyCatalogLoader;
import org.fireflyframework.agentflow.strategy.compile.ActionCompiler;
import org.fireflyframework.agentflow.strategy.condition.ConditionEvaluator;
import org.fireflyframework.agentflow.strategy.engine.ExecutorAliases;
import org.fireflyframework.agentflow.strategy.engine.StrategyEngine;
import org.fireflyframework.agentflow.strategy.engine.StrategyOrchestrator;
import org.fireflyframework.agentflow.workflow.engine.OrchestrationEngine;
import org.fireflyframework.agentflow.workflow.engine.StepGraphExecutor;
import org.fireflyframework.agentflow.workflow.registry.StepGraph;
import org.fireflyframework.agentflow.workflow.registry.StepGraphRegistry;
import org.fireflyframework.agentflow.workflow.standard.StandardWorkflows;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the agentflow engine.
 *
 * <p>Wires the registries, the dispatcher and graph executor, lifecycle listeners, the
 * strategy layer and the reference executors. Every {@link Executor} and
 * {@link StepGraph} bean in the context is registered with the engine.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AgentflowProperties.class)
public class AgentflowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationLoggerEvents orchestrationLoggerEvents() {
        return new OrchestrationLoggerEvents();
    }

    /**
     * The listener the engine publishes to: the logger plus Micrometer metrics when a
     * {@link MeterRegistry} is present.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "orchestrationEvents")
    public OrchestrationEvents orchestrationEvents(ObjectProvider<OrchestrationLoggerEvents> loggerEvents,
                                                   ObjectProvider<MeterRegistry> meterRegistry,
                                                   AgentflowProperties properties) {
        List<OrchestrationEvents> delegates = new ArrayList<>();
        OrchestrationLoggerEvents logger = loggerEvents.getIfAvailable();
        if (logger != null) {
            delegates.add(logger);
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            delegates.add(new OrchestrationMetrics(registry));
            log.info("[agentflow] Micrometer metrics enabled");
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeOrchestrationEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorRegistry executorRegistry() {
        return new ExecutorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepGraphRegistry stepGraphRegistry() {
        return new StepGraphRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepDispatcher stepDispatcher(ExecutorRegistry executorRegistry, OrchestrationEvents events,
                                         AgentflowProperties properties) {
        return new StepDispatcher(executorRegistry, events, properties.getEngine().getStepTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public StepGraphExecutor stepGraphExecutor(StepDispatcher dispatcher, OrchestrationEvents events,
                                               AgentflowProperties properties) {
        return new StepGraphExecutor(dispatcher, events, properties.getEngine().getParallelism());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrchestrationEngine orchestrationEngine(ExecutorRegistry executorRegistry,
                                                   StepGraphRegistry stepGraphRegistry,
                                                   StepDispatcher dispatcher,
                                                   StepGraphExecutor stepGraphExecutor,
                                                   OrchestrationEvents events,
                                                   ObjectProvider<Executor> executors,
                                                   ObjectProvider<StepGraph> graphs,
                                                   AgentflowProperties properties) {
        OrchestrationEngine engine = new OrchestrationEngine(executorRegistry, stepGraphRegistry,
                dispatcher, stepGraphExecutor, events);
        if (properties.getStandardWorkflows().isEnabled()) {
            engine.registerStepGraph(StandardWorkflows.placeOrder());
            engine.registerStepGraph(StandardWorkflows.changeAddress());
            engine.registerStepGraph(StandardWorkflows.productInquiry());
        }
        executors.orderedStream().forEach(engine::registerExecutor);
        graphs.orderedStream().forEach(engine::registerStepGraph);
        log.info("[agentflow] Orchestration engine initialized: executors={}, workflows={}",
                executorRegistry.names(), stepGraphRegistry.names());
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CommerceGateway.class)
    public CommerceExecutor commerceExecutor(CommerceGateway gateway) {
        return new CommerceExecutor(gateway);
    }

    @Bean
    @ConditionalOnMissingBean
    public RulesExecutor rulesExecutor(ObjectProvider<StrategyEngine> strategyEngine, AgentflowProperties properties) {
        return new RulesExecutor(RulesExecutor.NAME, properties.getValidation().toRules(),
                strategyEngine.getIfAvailable(), properties.getStrategy().getBusinessExecutor());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "firefly.agentflow.strategy.enabled", havingValue = "true", matchIfMissing = true)
    static class StrategyConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public StrategyCatalog strategyCatalog(ResourceLoader resourceLoader,
                                               ObjectProvider<ObjectMapper> objectMapper,
                                               AgentflowProperties properties) {
            StrategyCatalogLoader loader = new StrategyCatalogLoader(objectMapper.getIfAvailable(ObjectMapper::new));
            return loader.load(resourceLoader.getResource(properties.getStrategy().getCatalogLocation()));
        }

        @Bean
        @ConditionalOnMissingBean
        public StrategyEngine strategyEngine(StrategyCatalog catalog, AgentflowProperties properties) {
            return new StrategyEngine(catalog,
                    ConditionEvaluator.withDefaults(properties.getValidation().getChangeWindowHours()),
                    ActionCompiler.withDefaults());
        }

        @Bean
        @ConditionalOnMissingBean
        public ExecutorAliases executorAliases(AgentflowProperties properties) {
            AgentflowProperties.StrategyProperties strategy = properties.getStrategy();
            ExecutorAliases aliases = strategy.isConsolidatedAliases()
                    ? ExecutorAliases.consolidated(strategy.getBusinessExecutor())
                    : ExecutorAliases.none();
            for (var entry : strategy.getAliases().entrySet()) {
                aliases = aliases.withExecutor(entry.getKey(), entry.getValue());
            }
            return aliases;
        }

        @Bean
        @ConditionalOnMissingBean
        public StrategyOrchestrator strategyOrchestrator(OrchestrationEngine engine, StrategyEngine strategyEngine,
                                                         ExecutorAliases aliases, OrchestrationEvents events,
                                                         AgentflowProperties properties) {
            StrategyOrchestrator orchestrator = new StrategyOrchestrator(engine, strategyEngine, aliases, events);
            if (properties.getStandardWorkflows().isEnabled()) {
                orchestrator.registerDynamicWorkflow(StandardWorkflows.dynamicAddressChange());
            }
            log.info("[agentflow] Strategy orchestrator initialized with {} strategies",
                    strategyEngine.getCatalog().size());
            return orchestrator;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(name = "firefly.agentflow.health.enabled", havingValue = "true", matchIfMissing = true)
        public AgentflowHealthIndicator agentflowHealthIndicator(OrchestrationEngine engine) {
            log.info("[agentflow] Health indicator initialized");
            return new AgentflowHealthIndicator(engine);
        }
    }
}
