package dev.mars.stepflow.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


import dev.mars.stepflow.core.ContextView;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the flow engine.
 *
 * <p>Values are layered: built-in defaults, then the first readable
 * {@code stepflow.properties} (working directory, {@code config/}, user home,
 * classpath), then {@code stepflow.*} system properties. Malformed values fall back
 * to the default with a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class FlowConfiguration {
    private static final Logger logger = Logger.getLogger(FlowConfiguration.class.getName());

    public static final String MAX_CONCURRENT_KEY = "stepflow.scheduler.max.concurrent";
    public static final String DEADLINE_MS_KEY = "stepflow.scheduler.deadline.ms";
    public static final String THREAD_PREFIX_KEY = "stepflow.scheduler.thread.prefix";
    public static final String CONTEXT_VIEW_KEY = "stepflow.context.view";
    public static final String METRICS_ENABLED_KEY = "stepflow.monitoring.metrics.enabled";

    // 0 means unbounded
    private static final int DEFAULT_MAX_CONCURRENT_STEPS = 0;
    private static final long DEFAULT_DEADLINE_MS = 0;
    private static final String DEFAULT_THREAD_PREFIX = "stepflow-step";
    private static final ContextView DEFAULT_CONTEXT_VIEW = ContextView.FULL;

    private final Properties properties;

    public FlowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Defaults only, no file or system property lookup.
     */
    public static FlowConfiguration defaults() {
        return new FlowConfiguration(null);
    }

    // Scheduler Configuration
    public int getMaxConcurrentSteps() {
        int value = getIntProperty(MAX_CONCURRENT_KEY, DEFAULT_MAX_CONCURRENT_STEPS);
        if (value < 0) {
            logger.warning("Negative value for property " + MAX_CONCURRENT_KEY + ": " + value +
                         ". Using default: " + DEFAULT_MAX_CONCURRENT_STEPS);
            return DEFAULT_MAX_CONCURRENT_STEPS;
        }
        return value;
    }

    /**
     * @return the flow deadline, or {@code null} when none is configured
     */
    public Duration getDeadline() {
        long millis = getLongProperty(DEADLINE_MS_KEY, DEFAULT_DEADLINE_MS);
        return millis > 0 ? Duration.ofMillis(millis) : null;
    }

    public String getThreadNamePrefix() {
        return getStringProperty(THREAD_PREFIX_KEY, DEFAULT_THREAD_PREFIX);
    }

    // Context Configuration
    public ContextView getContextView() {
        String value = properties.getProperty(CONTEXT_VIEW_KEY);
        if (value != null) {
            try {
                return ContextView.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid context view for property " + CONTEXT_VIEW_KEY + ": " + value +
                             ". Using default: " + DEFAULT_CONTEXT_VIEW);
            }
        }
        return DEFAULT_CONTEXT_VIEW;
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENT_KEY, String.valueOf(DEFAULT_MAX_CONCURRENT_STEPS));
        properties.setProperty(DEADLINE_MS_KEY, String.valueOf(DEFAULT_DEADLINE_MS));
        properties.setProperty(THREAD_PREFIX_KEY, DEFAULT_THREAD_PREFIX);
        properties.setProperty(CONTEXT_VIEW_KEY, DEFAULT_CONTEXT_VIEW.name());
        properties.setProperty(METRICS_ENABLED_KEY, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "stepflow.properties",
                "config/stepflow.properties",
                System.getProperty("user.home") + "/.stepflow/stepflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("stepflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("stepflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowConfiguration{" +
                "maxConcurrentSteps=" + getMaxConcurrentSteps() +
                ", deadline=" + getDeadline() +
                ", contextView=" + getContextView() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
