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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FlowConfiguration.
 * Validates property layering, type conversion and fallback to defaults.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
class FlowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowConfiguration.MAX_CONCURRENT_KEY);
        System.clearProperty(FlowConfiguration.CONTEXT_VIEW_KEY);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        FlowConfiguration config = FlowConfiguration.defaults();

        assertEquals(0, config.getMaxConcurrentSteps());
        assertNull(config.getDeadline());
        assertEquals("stepflow-step", config.getThreadNamePrefix());
        assertEquals(ContextView.FULL, config.getContextView());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Properties Constructor Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(FlowConfiguration.MAX_CONCURRENT_KEY, "4");
        props.setProperty(FlowConfiguration.DEADLINE_MS_KEY, "1500");
        props.setProperty(FlowConfiguration.CONTEXT_VIEW_KEY, "declared_dependencies");
        props.setProperty(FlowConfiguration.METRICS_ENABLED_KEY, "false");
        props.setProperty(FlowConfiguration.THREAD_PREFIX_KEY, "agents");

        FlowConfiguration config = new FlowConfiguration(props);

        assertEquals(4, config.getMaxConcurrentSteps());
        assertEquals(Duration.ofMillis(1500), config.getDeadline());
        assertEquals(ContextView.DECLARED_DEPENDENCIES, config.getContextView());
        assertFalse(config.isMetricsEnabled());
        assertEquals("agents", config.getThreadNamePrefix());
    }

    // ========== Invalid Value Tests ==========

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(FlowConfiguration.MAX_CONCURRENT_KEY, "many");
        props.setProperty(FlowConfiguration.DEADLINE_MS_KEY, "soon");
        props.setProperty(FlowConfiguration.CONTEXT_VIEW_KEY, "everything");

        FlowConfiguration config = new FlowConfiguration(props);

        assertEquals(0, config.getMaxConcurrentSteps());
        assertNull(config.getDeadline());
        assertEquals(ContextView.FULL, config.getContextView());
    }

    @Test
    void testNegativeConcurrencyFallsBackToUnbounded() {
        FlowConfiguration config = FlowConfiguration.defaults();
        config.setProperty(FlowConfiguration.MAX_CONCURRENT_KEY, "-3");

        assertEquals(0, config.getMaxConcurrentSteps());
    }

    @Test
    void testZeroDeadlineMeansNone() {
        FlowConfiguration config = FlowConfiguration.defaults();
        config.setProperty(FlowConfiguration.DEADLINE_MS_KEY, "0");

        assertNull(config.getDeadline());
    }

    // ========== System Property Tests ==========

    @Test
    void testSystemPropertiesOverride() {
        System.setProperty(FlowConfiguration.MAX_CONCURRENT_KEY, "7");
        System.setProperty(FlowConfiguration.CONTEXT_VIEW_KEY, "DECLARED_DEPENDENCIES");

        FlowConfiguration config = new FlowConfiguration();

        assertEquals(7, config.getMaxConcurrentSteps());
        assertEquals(ContextView.DECLARED_DEPENDENCIES, config.getContextView());
    }

    // ========== Generic Access Tests ==========

    @Test
    void testGenericPropertyAccess() {
        FlowConfiguration config = FlowConfiguration.defaults();
        config.setProperty("stepflow.custom", "value");

        assertEquals("value", config.getProperty("stepflow.custom"));
        assertEquals("fallback", config.getProperty("stepflow.absent", "fallback"));
        assertNull(config.getProperty("stepflow.absent"));
    }

    @Test
    void testToString() {
        String text = FlowConfiguration.defaults().toString();

        assertTrue(text.contains("maxConcurrentSteps=0"));
        assertTrue(text.contains("contextView=FULL"));
    }
}
