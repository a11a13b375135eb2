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

import org.fireflyframework.agentflow.executor.rules.ValidationRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the agentflow engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   agentflow:
 *     engine:
 *       step-timeout: 30s
 *       parallelism: 8
 *     strategy:
 *       enabled: true
 *       catalog-location: classpath:agentflow/business-strategies.json
 *       business-executor: commerce
 *       aliases:
 *         orderExecutor: commerce
 *     standard-workflows:
 *       enabled: true
 *     validation:
 *       max-order-value: 10000
 *       change-window-hours: 24
 *     metrics:
 *       enabled: true
 *     health:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.agentflow")
public class AgentflowProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private StrategyProperties strategy = new StrategyProperties();

    @NestedConfigurationProperty
    private StandardWorkflowsProperties standardWorkflows = new StandardWorkflowsProperties();

    @NestedConfigurationProperty
    private ValidationProperties validation = new ValidationProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public StrategyProperties getStrategy() { return strategy; }
    public void setStrategy(StrategyProperties strategy) { this.strategy = strategy; }

    public StandardWorkflowsProperties getStandardWorkflows() { return standardWorkflows; }
    public void setStandardWorkflows(StandardWorkflowsProperties standardWorkflows) { this.standardWorkflows = standardWorkflows; }

    public ValidationProperties getValidation() { return validation; }
    public void setValidation(ValidationProperties validation) { this.validation = validation; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    // --- Nested property classes ---

    public static class EngineProperties {
        /** Unset means a step may run indefinitely. */
        private Duration stepTimeout;
        /** Upper bound on concurrently running members of a parallel batch; 0 is unbounded. */
        private int parallelism = 0;

        public Duration getStepTimeout() { return stepTimeout; }
        public void setStepTimeout(Duration stepTimeout) { this.stepTimeout = stepTimeout; }

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public static class StrategyProperties {
        private boolean enabled = true;
        private String catalogLocation = "classpath:agentflow/business-strategies.json";
        private String businessExecutor = "commerce";
        private boolean consolidatedAliases = true;
        private Map<String, String> aliases = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCatalogLocation() { return catalogLocation; }
        public void setCatalogLocation(String catalogLocation) { this.catalogLocation = catalogLocation; }

        public String getBusinessExecutor() { return businessExecutor; }
        public void setBusinessExecutor(String businessExecutor) { this.businessExecutor = businessExecutor; }

        public boolean isConsolidatedAliases() { return consolidatedAliases; }
        public void setConsolidatedAliases(boolean consolidatedAliases) { this.consolidatedAliases = consolidatedAliases; }

        public Map<String, String> getAliases() { return aliases; }
        public void setAliases(Map<String, String> aliases) { this.aliases = aliases; }
    }

    public static class StandardWorkflowsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ValidationProperties {
        private double minOrderValue = 0.01;
        private double maxOrderValue = 10000.0;
        private int maxQuantityPerItem = 10;
        private int changeWindowHours = 24;
        private int cancellationWindowHours = 48;

        public double getMinOrderValue() { return minOrderValue; }
        public void setMinOrderValue(double minOrderValue) { this.minOrderValue = minOrderValue; }

        public double getMaxOrderValue() { return maxOrderValue; }
        public void setMaxOrderValue(double maxOrderValue) { this.maxOrderValue = maxOrderValue; }

        public int getMaxQuantityPerItem() { return maxQuantityPerItem; }
        public void setMaxQuantityPerItem(int maxQuantityPerItem) { this.maxQuantityPerItem = maxQuantityPerItem; }

        public int getChangeWindowHours() { return changeWindowHours; }
        public void setChangeWindowHours(int changeWindowHours) { this.changeWindowHours = changeWindowHours; }

        public int getCancellationWindowHours() { return cancellationWindowHours; }
        public void setCancellationWindowHours(int cancellationWindowHours) { this.cancellationWindowHours = cancellationWindowHours; }

        public ValidationRules toRules() {
            return new ValidationRules(minOrderValue, maxOrderValue, maxQuantityPerItem,
                    changeWindowHours, cancellationWindowHours);
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
