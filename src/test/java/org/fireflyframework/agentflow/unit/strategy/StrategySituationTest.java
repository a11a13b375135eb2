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


package org.fireflyframework.agentflow.unit.strategy;

import org.fireflyframework.agentflow.strategy.StrategySituation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StrategySituationTest {

    @Test
    void hoursSince_measuresIsoTimestamps() {
        String thirtyHoursAgo = Instant.now().minus(30, ChronoUnit.HOURS).toString();

        assertThat(StrategySituation.hoursSince(thirtyHoursAgo)).isCloseTo(30.0, within(0.05));
        assertThat(StrategySituation.hoursSince(null)).isZero();
        assertThat(StrategySituation.hoursSince("yesterday")).isZero();
    }

    @Test
    void orderAge_prefersDerivedFactOverOrderField() {
        StrategySituation situation = new StrategySituation(null,
                Map.of("status", "SHIPPED", "created_hours_ago", 5),
                null,
                Map.of(StrategySituation.ORDER_AGE_HOURS, "12.5"),
                null);

        assertThat(situation.orderAgeHours()).isEqualTo(12.5);
        assertThat(situation.orderStatus()).isEqualTo("shipped");
        assertThat(situation.query()).isEmpty();
        assertThat(situation.newAddress()).isEmpty();
    }
}
