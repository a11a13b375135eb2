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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.agentflow.core.exception.StrategyCatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads a strategy catalog from JSON:
 *
 * <pre>{@code
 * {
 *   "strategies": [ {"id": "...", "name": "...", "priority": 1, "conditions": [...], "actions": [...]} ],
 *   "fallback_strategy": { ... }
 * }
 * }</pre>
 */
@Slf4j
public class StrategyCatalogLoader {

    private final ObjectMapper objectMapper;

    public StrategyCatalogLoader() {
        this(new ObjectMapper());
    }

    public StrategyCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StrategyCatalog load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new StrategyCatalogException("Strategy catalog not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            StrategyCatalog catalog = load(in);
            log.info("[strategy] Loaded {} strategies from {} (fallback: {})", catalog.size(),
                    resource.getDescription(), catalog.getFallbackStrategy().isPresent());
            return catalog;
        } catch (IOException e) {
            throw new StrategyCatalogException("Failed to read strategy catalog " + resource.getDescription(), e);
        }
    }

    public StrategyCatalog load(InputStream in) {
        try {
            CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
            return new StrategyCatalog(document.strategies(), document.fallbackStrategy());
        } catch (IOException e) {
            throw new StrategyCatalogException("Malformed strategy catalog: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
            @JsonProperty("strategies") List<Strategy> strategies,
            @JsonProperty("fallback_strategy") Strategy fallbackStrategy
    ) {}
}
