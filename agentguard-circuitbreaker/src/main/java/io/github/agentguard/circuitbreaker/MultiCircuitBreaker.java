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

import io.github.agentguard.core.CallContext;
import io.vavr.CheckedRunnable;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of CircuitBreakers keyed by name, typically one per protected dependency.
 * <p>CircuitBreakers are created on first access. Concurrent first accesses to the same name
 * yield the same instance. The registry is an ordinary object owned by its caller; share it by
 * passing it around.
 */
public class MultiCircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(MultiCircuitBreaker.class);

    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    /**
     * 按名称覆盖的配置
     */
    private final Map<String, CircuitBreakerConfig> instanceConfigs;

    /**
     * @param defaultConfig the configuration of every CircuitBreaker without its own
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public MultiCircuitBreaker(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Collections.emptyMap());
    }

    /**
     * @param defaultConfig   the configuration of every CircuitBreaker without its own
     * @param instanceConfigs configurations of specific CircuitBreakers, by name
     * @throws IllegalArgumentException if one of the configurations is invalid
     */
    public MultiCircuitBreaker(CircuitBreakerConfig defaultConfig, Map<String, CircuitBreakerConfig> instanceConfigs) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "Default config must not be null").validate();
        Map<String, CircuitBreakerConfig> validated = new HashMap<>();
        instanceConfigs.forEach((name, config) -> validated.put(name, config.validate()));
        this.instanceConfigs = Collections.unmodifiableMap(validated);
    }

    public static MultiCircuitBreaker ofDefaults() {
        return new MultiCircuitBreaker(CircuitBreakerConfig.ofDefaults());
    }

    /**
     * Returns the CircuitBreaker with the given name, creating it with the configuration
     * registered for that name, or the default one, if it does not exist yet.
     *
     * @param name the name of the CircuitBreaker
     * @return the CircuitBreaker
     */
    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, instanceConfigs.getOrDefault(name, defaultConfig));
    }

    /**
     * Returns the CircuitBreaker with the given name, creating it with {@code config} if it does
     * not exist yet. An existing CircuitBreaker keeps its configuration.
     *
     * @param name   the name of the CircuitBreaker
     * @param config the configuration used if the CircuitBreaker is created
     * @return the CircuitBreaker
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "Name must not be null");
        Objects.requireNonNull(config, "Config must not be null");
        return circuitBreakers.computeIfAbsent(name, key -> {
            LOG.debug("Creating CircuitBreaker '{}' with {}", key, config);
            return CircuitBreaker.of(key, config);
        });
    }

    public Option<CircuitBreaker> find(String name) {
        return Option.of(circuitBreakers.get(name));
    }

    /**
     * Executes the call with the CircuitBreaker of the given name.
     *
     * @param context the call context
     * @param name    the name of the CircuitBreaker
     * @param call    the protected call
     * @throws Exception see {@link CircuitBreaker#execute(CallContext, CheckedRunnable)}
     */
    public void execute(CallContext context, String name, CheckedRunnable call) throws Exception {
        getOrCreate(name).execute(context, call);
    }

    /**
     * @return a copy of the registered CircuitBreakers, by name
     */
    public Map<String, CircuitBreaker> getAll() {
        return Collections.unmodifiableMap(new HashMap<>(circuitBreakers));
    }

    public void resetAll() {
        LOG.info("Resetting {} CircuitBreakers", circuitBreakers.size());
        circuitBreakers.values().forEach(CircuitBreaker::reset);
    }

    public HealthStatus getHealthStatus() {
        List<String> healthy = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        List<String> unhealthy = new ArrayList<>();

        circuitBreakers.forEach((name, circuitBreaker) -> {
            switch (circuitBreaker.getState()) {
                case CLOSED:
                    healthy.add(name);
                    break;
                case HALF_OPEN:
                    degraded.add(name);
                    break;
                case OPEN:
                    unhealthy.add(name);
                    break;
                default:
                    throw new IllegalStateException("Unknown CircuitBreaker state " + circuitBreaker.getState());
            }
        });

        return new HealthStatus(healthy, degraded, unhealthy);
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig;
    }
}
