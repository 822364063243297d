/*
 *
 *  Copyright 2025: the agentguard authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */
package io.github.agentguard.circuitbreaker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Health of every CircuitBreaker of a {@link MultiCircuitBreaker}, bucketed by state:
 * CLOSED is healthy, HALF_OPEN degraded and OPEN unhealthy. Each list is sorted by name.
 */
public final class HealthStatus {

    private final List<String> healthy;
    private final List<String> degraded;
    private final List<String> unhealthy;

    HealthStatus(List<String> healthy, List<String> degraded, List<String> unhealthy) {
        this.healthy = sortedCopy(healthy);
        this.degraded = sortedCopy(degraded);
        this.unhealthy = sortedCopy(unhealthy);
    }

    private static List<String> sortedCopy(List<String> names) {
        List<String> copy = new ArrayList<>(names);
        Collections.sort(copy);
        return Collections.unmodifiableList(copy);
    }

    public List<String> getHealthy() {
        return healthy;
    }

    public List<String> getDegraded() {
        return degraded;
    }

    public List<String> getUnhealthy() {
        return unhealthy;
    }

    /**
     * @return true if no CircuitBreaker is OPEN or HALF_OPEN
     */
    public boolean isAllHealthy() {
        return degraded.isEmpty() && unhealthy.isEmpty();
    }

    @Override
    public String toString() {
        return "HealthStatus{" +
            "healthy=" + healthy +
            ", degraded=" + degraded +
            ", unhealthy=" + unhealthy +
            '}';
    }
}
