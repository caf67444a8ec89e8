package com.dbc.contracts.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ContractsConfiguration}.
 */
class ContractsConfigurationTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ContractsConfiguration.ENABLED_PROPERTY);
        System.clearProperty(ContractsConfiguration.SOURCE_ROOTS_PROPERTY);
    }

    @Test
    void testDefaults() {
        ContractsConfiguration configuration = ContractsConfiguration.defaults();
        assertTrue(configuration.isEnabled());
        assertEquals(List.of(Paths.get("src/main/java"), Paths.get("src/test/java")),
                configuration.getSourceRoots());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ContractsConfiguration.ENABLED_PROPERTY, " false ");
        properties.setProperty(ContractsConfiguration.SOURCE_ROOTS_PROPERTY, "lib/src, app/src");

        ContractsConfiguration configuration = ContractsConfiguration.fromProperties(properties);
        assertFalse(configuration.isEnabled());
        assertEquals(List.of(Paths.get("lib/src"), Paths.get("app/src")), configuration.getSourceRoots());
    }

    @Test
    void testEmptyPropertiesKeepDefaults() {
        ContractsConfiguration configuration = ContractsConfiguration.fromProperties(new Properties());
        assertTrue(configuration.isEnabled());
        assertEquals(ContractsConfiguration.defaults().getSourceRoots(), configuration.getSourceRoots());
    }

    @Test
    void testLoadWithoutResourceUsesDefaults() {
        ContractsConfiguration configuration = ContractsConfiguration.load();
        assertTrue(configuration.isEnabled());
    }

    @Test
    void testSystemPropertiesOverride() {
        System.setProperty(ContractsConfiguration.ENABLED_PROPERTY, "false");
        System.setProperty(ContractsConfiguration.SOURCE_ROOTS_PROPERTY, "only/here");

        ContractsConfiguration configuration = ContractsConfiguration.load();
        assertFalse(configuration.isEnabled());
        assertEquals(List.of(Paths.get("only/here")), configuration.getSourceRoots());
    }

    @Test
    void testBuilder() {
        ContractsConfiguration configuration = ContractsConfiguration.builder()
                .enabled(false)
                .sourceRoots(List.of())
                .build();
        assertFalse(configuration.isEnabled());
        assertTrue(configuration.getSourceRoots().isEmpty());
        assertThrows(NullPointerException.class, () -> ContractsConfiguration.builder().sourceRoots(null));
    }
}
