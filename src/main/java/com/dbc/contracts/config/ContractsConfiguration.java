package com.dbc.contracts.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Boundary configuration of the contract engine, fixed at process initialization.
 *
 * When contracts are disabled every combinator is replaced by a no-op at attachment time,
 * so contracted code pays nothing per call.
 */
public final class ContractsConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ContractsConfiguration.class);

    public static final String ENABLED_PROPERTY = "dbc.contracts.enabled";
    public static final String SOURCE_ROOTS_PROPERTY = "dbc.contracts.sourceRoots";
    public static final String RESOURCE_NAME = "dbc-contracts.properties";

    private static final List<Path> DEFAULT_SOURCE_ROOTS = List.of(
            Paths.get("src/main/java"),
            Paths.get("src/test/java"));

    private final boolean enabled;
    private final List<Path> sourceRoots;

    private ContractsConfiguration(boolean enabled, List<Path> sourceRoots) {
        this.enabled = enabled;
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public static ContractsConfiguration defaults() {
        return new ContractsConfiguration(true, DEFAULT_SOURCE_ROOTS);
    }

    /**
     * Loads the configuration: system properties first, then the {@value #RESOURCE_NAME}
     * classpath resource, then defaults.
     */
    public static ContractsConfiguration load() {
        Properties properties = new Properties();
        try (InputStream in = ContractsConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
                logger.debug("Loaded {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults", RESOURCE_NAME, e);
        }
        for (String key : List.of(ENABLED_PROPERTY, SOURCE_ROOTS_PROPERTY)) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        ContractsConfiguration configuration = fromProperties(properties);
        if (!configuration.isEnabled()) {
            logger.info("Contracts are disabled; combinators attach nothing");
        }
        return configuration;
    }

    public static ContractsConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String enabled = properties.getProperty(ENABLED_PROPERTY);
        if (enabled != null) {
            builder.enabled(Boolean.parseBoolean(enabled.trim()));
        }
        String roots = properties.getProperty(SOURCE_ROOTS_PROPERTY);
        if (roots != null) {
            List<Path> paths = new ArrayList<>();
            for (String root : roots.split("[,;" + java.io.File.pathSeparator + "]")) {
                if (!root.isBlank()) {
                    paths.add(Paths.get(root.trim()));
                }
            }
            builder.sourceRoots(paths);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<Path> getSourceRoots() {
        return sourceRoots;
    }

    @Override
    public String toString() {
        return "ContractsConfiguration{enabled=" + enabled + ", sourceRoots=" + sourceRoots + "}";
    }

    public static final class Builder {

        private boolean enabled = true;
        private List<Path> sourceRoots = DEFAULT_SOURCE_ROOTS;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder sourceRoots(List<Path> sourceRoots) {
            this.sourceRoots = Objects.requireNonNull(sourceRoots, "sourceRoots");
            return this;
        }

        public ContractsConfiguration build() {
            return new ContractsConfiguration(enabled, sourceRoots);
        }
    }
}
