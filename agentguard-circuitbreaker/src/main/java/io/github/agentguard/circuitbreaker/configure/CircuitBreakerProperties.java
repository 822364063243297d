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
package io.github.agentguard.circuitbreaker.configure;

import io.github.agentguard.circuitbreaker.CircuitBreakerConfig;
import io.github.agentguard.circuitbreaker.MultiCircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Reads CircuitBreaker configurations from {@link Properties}.
 * <pre>
 * agentguard.circuitbreaker.default.failure-threshold=5
 * agentguard.circuitbreaker.default.success-threshold=2
 * agentguard.circuitbreaker.default.timeout=30s
 * agentguard.circuitbreaker.default.max-concurrent-requests=1
 * agentguard.circuitbreaker.instances.backendA.timeout=10s
 * </pre>
 * Values missing for an instance are taken from the {@code default} section, values missing there
 * from {@link CircuitBreakerConfig#ofDefaults()}. Keys outside the {@code agentguard.circuitbreaker}
 * prefix are ignored.
 */
public class CircuitBreakerProperties {

    public static final String PREFIX = "agentguard.circuitbreaker.";

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerProperties.class);

    private static final String DEFAULT_SECTION = "default.";
    private static final String INSTANCES_SECTION = "instances.";

    private static final String FAILURE_THRESHOLD = "failure-threshold";
    private static final String SUCCESS_THRESHOLD = "success-threshold";
    private static final String TIMEOUT = "timeout";
    private static final String MAX_CONCURRENT_REQUESTS = "max-concurrent-requests";

    private final CircuitBreakerConfig defaultConfig;
    private final Map<String, CircuitBreakerConfig> instanceConfigs;

    /**
     * @param properties the source
     * @throws IllegalArgumentException on an unknown key, a malformed value or an invalid configuration
     */
    public CircuitBreakerProperties(Properties properties) {
        Map<String, String> defaults = new LinkedHashMap<>();
        Map<String, Map<String, String>> instances = new TreeMap<>();

        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String value = properties.getProperty(key).trim();
            String path = key.substring(PREFIX.length());
            if (path.startsWith(DEFAULT_SECTION)) {
                defaults.put(path.substring(DEFAULT_SECTION.length()), value);
            } else if (path.startsWith(INSTANCES_SECTION)) {
                String instancePath = path.substring(INSTANCES_SECTION.length());
                int separator = instancePath.lastIndexOf('.');
                if (separator <= 0) {
                    throw new IllegalArgumentException("Unknown property " + key);
                }
                instances.computeIfAbsent(instancePath.substring(0, separator), name -> new LinkedHashMap<>())
                    .put(instancePath.substring(separator + 1), value);
            } else {
                throw new IllegalArgumentException("Unknown property " + key);
            }
        }

        this.defaultConfig = apply(CircuitBreakerConfig.custom(), defaults, PREFIX + DEFAULT_SECTION).build().validate();
        Map<String, CircuitBreakerConfig> configs = new HashMap<>();
        instances.forEach((name, values) -> configs.put(name,
            apply(CircuitBreakerConfig.from(defaultConfig), values, PREFIX + INSTANCES_SECTION + name + ".")
                .build().validate()));
        this.instanceConfigs = Collections.unmodifiableMap(configs);
        LOG.debug("Loaded CircuitBreaker properties: default {}, instances {}", defaultConfig, instanceConfigs.keySet());
    }

    /**
     * Loads the properties from a classpath resource.
     *
     * @param resource the resource name, for example {@code agentguard.properties}
     * @return the parsed properties
     * @throws IllegalArgumentException if the resource does not exist or holds an invalid configuration
     */
    public static CircuitBreakerProperties fromResource(String resource) {
        ClassLoader classLoader = CircuitBreakerProperties.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return new CircuitBreakerProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
    }

    private static CircuitBreakerConfig.Builder apply(CircuitBreakerConfig.Builder builder,
                                                      Map<String, String> values, String keyPrefix) {
        values.forEach((property, value) -> {
            String key = keyPrefix + property;
            switch (property) {
                case FAILURE_THRESHOLD:
                    builder.failureThreshold(parseInt(key, value));
                    break;
                case SUCCESS_THRESHOLD:
                    builder.successThreshold(parseInt(key, value));
                    break;
                case TIMEOUT:
                    builder.timeout(parseDuration(key, value));
                    break;
                case MAX_CONCURRENT_REQUESTS:
                    builder.maxConcurrentRequests(parseInt(key, value));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown property " + key);
            }
        });
        return builder;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    /**
     * Parses {@code 250ms}, {@code 30s}, {@code 5m}, {@code 1h} or an ISO-8601 duration such as
     * {@code PT30S}.
     *
     * @param key   the property key, for error messages
     * @param value the value to parse
     * @return the duration
     */
    static Duration parseDuration(String key, String value) {
        String text = value.toLowerCase(Locale.ROOT);
        try {
            if (text.startsWith("p")) {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            }
            long amount = Long.parseLong(text.substring(0, text.length() - 1).trim());
            switch (text.charAt(text.length() - 1)) {
                case 's':
                    return Duration.ofSeconds(amount);
                case 'm':
                    return Duration.ofMinutes(amount);
                case 'h':
                    return Duration.ofHours(amount);
                default:
                    throw new IllegalArgumentException("Property " + key + " has no duration unit: " + value);
            }
        } catch (NumberFormatException | DateTimeParseException | StringIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Property " + key + " is not a duration: " + value, e);
        }
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * @return the configurations of the {@code instances} section, by name
     */
    public Map<String, CircuitBreakerConfig> getInstanceConfigs() {
        return instanceConfigs;
    }

    /**
     * @return a new registry using these configurations
     */
    public MultiCircuitBreaker createRegistry() {
        return new MultiCircuitBreaker(defaultConfig, instanceConfigs);
    }
}
