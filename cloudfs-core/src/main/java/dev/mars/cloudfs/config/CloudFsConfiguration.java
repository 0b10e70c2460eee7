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

package dev.mars.cloudfs.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for CloudFS.
 * Handles loading and providing access to client configuration parameters.
 *
 * <p>Values are layered: built-in defaults, then the first {@code cloudfs.properties}
 * found on disk or on the classpath, then {@code cloudfs.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class CloudFsConfiguration {
    private static final Logger logger = Logger.getLogger(CloudFsConfiguration.class.getName());

    public static final String API_URL = "cloudfs.api.url";
    public static final String CONNECTION_TIMEOUT_MS = "cloudfs.network.connection.timeout.ms";
    public static final String REQUEST_TIMEOUT_MS = "cloudfs.network.request.timeout.ms";
    public static final String REFRESH_GRACE_SECONDS = "cloudfs.auth.refresh.grace.seconds";
    public static final String UPLOAD_CHUNK_SIZE = "cloudfs.upload.chunk.size";
    public static final String SCRATCH_DIR = "cloudfs.file.scratch.dir";
    public static final String CACHE_DIR = "cloudfs.cache.dir";
    public static final String USER_AGENT = "cloudfs.http.user.agent";

    // Default configuration values
    private static final String DEFAULT_API_URL = "http://localhost:8080";
    private static final int DEFAULT_CONNECTION_TIMEOUT_MS = 10000;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 120000;
    private static final long DEFAULT_REFRESH_GRACE_SECONDS = 300; // 5 minutes
    private static final long DEFAULT_UPLOAD_CHUNK_SIZE = 15L * 1024 * 1024; // 15 MiB
    private static final String DEFAULT_SCRATCH_DIR = System.getProperty("java.io.tmpdir");
    private static final String DEFAULT_USER_AGENT = "CloudFS/1.0";

    private final Properties properties;

    public CloudFsConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public CloudFsConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Backend
    public String getApiUrl() {
        return getStringProperty(API_URL, DEFAULT_API_URL);
    }

    public String getUserAgent() {
        return getStringProperty(USER_AGENT, DEFAULT_USER_AGENT);
    }

    // Network Configuration
    public Duration getConnectionTimeout() {
        return Duration.ofMillis(getIntProperty(CONNECTION_TIMEOUT_MS, DEFAULT_CONNECTION_TIMEOUT_MS));
    }

    public Duration getRequestTimeout() {
        return Duration.ofMillis(getIntProperty(REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS));
    }

    // Authentication
    public Duration getRefreshGracePeriod() {
        return Duration.ofSeconds(getLongProperty(REFRESH_GRACE_SECONDS, DEFAULT_REFRESH_GRACE_SECONDS));
    }

    // Upload
    public long getUploadChunkSize() {
        long value = getLongProperty(UPLOAD_CHUNK_SIZE, DEFAULT_UPLOAD_CHUNK_SIZE);
        if (value <= 0 || value > DEFAULT_UPLOAD_CHUNK_SIZE) {
            logger.warning("Upload chunk size must be between 1 and " + DEFAULT_UPLOAD_CHUNK_SIZE
                    + " bytes, got " + value + ". Using default.");
            return DEFAULT_UPLOAD_CHUNK_SIZE;
        }
        return value;
    }

    // Local storage
    public Path getScratchDirectory() {
        return Paths.get(getStringProperty(SCRATCH_DIR, DEFAULT_SCRATCH_DIR));
    }

    /**
     * Directory backing the read-through cache. Empty when random-access reads are disabled.
     */
    public Optional<Path> getCacheDirectory() {
        String value = properties.getProperty(CACHE_DIR);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.trim()));
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

    private void loadDefaultConfiguration() {
        properties.setProperty(API_URL, DEFAULT_API_URL);
        properties.setProperty(CONNECTION_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECTION_TIMEOUT_MS));
        properties.setProperty(REQUEST_TIMEOUT_MS, String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS));
        properties.setProperty(REFRESH_GRACE_SECONDS, String.valueOf(DEFAULT_REFRESH_GRACE_SECONDS));
        properties.setProperty(UPLOAD_CHUNK_SIZE, String.valueOf(DEFAULT_UPLOAD_CHUNK_SIZE));
        properties.setProperty(SCRATCH_DIR, DEFAULT_SCRATCH_DIR);
        properties.setProperty(USER_AGENT, DEFAULT_USER_AGENT);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "cloudfs.properties",
                "config/cloudfs.properties",
                System.getProperty("user.home") + "/.cloudfs/cloudfs.properties",
                "/etc/cloudfs/cloudfs.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("cloudfs.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("cloudfs."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "CloudFsConfiguration{" +
                "apiUrl='" + getApiUrl() + '\'' +
                ", requestTimeout=" + getRequestTimeout() +
                ", uploadChunkSize=" + getUploadChunkSize() +
                ", cacheDirectory=" + getCacheDirectory().map(Path::toString).orElse("<disabled>") +
                '}';
    }
}
