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

package dev.mars.flowgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration management for Flowgate.
 * Defaults are overlaid by the first readable {@code flowgate.properties} file (or classpath
 * resource) and finally by {@code flowgate.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class FlowgateConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowgateConfiguration.class);

    public static final String DATA_DIR = "flowgate.data.dir";
    public static final String EVENT_LOG_FORMAT = "flowgate.eventlog.format";
    public static final String EVENT_LOG_FSYNC = "flowgate.eventlog.fsync";
    public static final String BUS_MAX_PUBLISH_DEPTH = "flowgate.bus.max.publish.depth";
    public static final String APPROVAL_POLL_INTERVAL_MS = "flowgate.approval.poll.interval.ms";
    public static final String APPROVAL_TIMEOUT_SECONDS = "flowgate.approval.timeout.seconds";
    public static final String NOTIFICATION_CHANNEL = "flowgate.notification.channel";
    public static final String ESCALATION_CHANNEL = "flowgate.escalation.channel";
    public static final String METRICS_FLUSH_MODE = "flowgate.metrics.flush.mode";
    public static final String METRICS_FLUSH_INTERVAL_MS = "flowgate.metrics.flush.interval.ms";
    public static final String BUSINESS_HOURS_START = "flowgate.business.hours.start";
    public static final String BUSINESS_HOURS_END = "flowgate.business.hours.end";
    public static final String TEMPLATES_FILE = "flowgate.templates.file";

    // Default configuration values
    private static final String DEFAULT_DATA_DIR = "data";
    private static final String DEFAULT_EVENT_LOG_FORMAT = "document";
    private static final int DEFAULT_MAX_PUBLISH_DEPTH = 16;
    private static final long DEFAULT_APPROVAL_POLL_INTERVAL_MS = 5000;
    private static final long DEFAULT_APPROVAL_TIMEOUT_SECONDS = 3600;
    private static final String DEFAULT_NOTIFICATION_CHANNEL = "#devops-alerts";
    private static final String DEFAULT_ESCALATION_CHANNEL = "#escalations";
    private static final String DEFAULT_METRICS_FLUSH_MODE = "immediate";
    private static final long DEFAULT_METRICS_FLUSH_INTERVAL_MS = 10000;
    private static final int DEFAULT_BUSINESS_HOURS_START = 9;
    private static final int DEFAULT_BUSINESS_HOURS_END = 17;

    private final Properties properties;

    public FlowgateConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowgateConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Loads defaults, then the given file, then system property overrides.
     *
     * @param configFile properties file supplied on the command line
     * @return the layered configuration
     * @throws IOException if the file cannot be read
     */
    public static FlowgateConfiguration fromFile(Path configFile) throws IOException {
        Properties loaded = new Properties();
        try (InputStream input = Files.newInputStream(configFile)) {
            loaded.load(input);
        }
        FlowgateConfiguration configuration = new FlowgateConfiguration(loaded);
        configuration.loadConfigurationFromSystemProperties();
        logger.info("Loaded configuration from: {}", configFile);
        return configuration;
    }

    // Storage
    public Path getDataDirectory() {
        return Paths.get(getStringProperty(DATA_DIR, DEFAULT_DATA_DIR));
    }

    public String getEventLogFormat() {
        return getStringProperty(EVENT_LOG_FORMAT, DEFAULT_EVENT_LOG_FORMAT);
    }

    public boolean isEventLogFsync() {
        return getBooleanProperty(EVENT_LOG_FSYNC, true);
    }

    // Event bus
    public int getMaxPublishDepth() {
        return getIntProperty(BUS_MAX_PUBLISH_DEPTH, DEFAULT_MAX_PUBLISH_DEPTH);
    }

    // Approvals
    public Duration getApprovalPollInterval() {
        return Duration.ofMillis(getLongProperty(APPROVAL_POLL_INTERVAL_MS, DEFAULT_APPROVAL_POLL_INTERVAL_MS));
    }

    public Duration getApprovalTimeout() {
        return Duration.ofSeconds(getLongProperty(APPROVAL_TIMEOUT_SECONDS, DEFAULT_APPROVAL_TIMEOUT_SECONDS));
    }

    // Notification
    public String getNotificationChannel() {
        return getStringProperty(NOTIFICATION_CHANNEL, DEFAULT_NOTIFICATION_CHANNEL);
    }

    public String getEscalationChannel() {
        return getStringProperty(ESCALATION_CHANNEL, DEFAULT_ESCALATION_CHANNEL);
    }

    // Metrics
    public boolean isPeriodicMetricsFlush() {
        return "periodic".equalsIgnoreCase(getStringProperty(METRICS_FLUSH_MODE, DEFAULT_METRICS_FLUSH_MODE));
    }

    public long getMetricsFlushIntervalMs() {
        return getLongProperty(METRICS_FLUSH_INTERVAL_MS, DEFAULT_METRICS_FLUSH_INTERVAL_MS);
    }

    // Conditional execution
    public int getBusinessHoursStart() {
        return getIntProperty(BUSINESS_HOURS_START, DEFAULT_BUSINESS_HOURS_START);
    }

    public int getBusinessHoursEnd() {
        return getIntProperty(BUSINESS_HOURS_END, DEFAULT_BUSINESS_HOURS_END);
    }

    public Path getTemplatesFile() {
        String value = properties.getProperty(TEMPLATES_FILE);
        return value == null || value.isBlank() ? null : Paths.get(value.trim());
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

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(DATA_DIR, DEFAULT_DATA_DIR);
        properties.setProperty(EVENT_LOG_FORMAT, DEFAULT_EVENT_LOG_FORMAT);
        properties.setProperty(EVENT_LOG_FSYNC, "true");
        properties.setProperty(BUS_MAX_PUBLISH_DEPTH, String.valueOf(DEFAULT_MAX_PUBLISH_DEPTH));
        properties.setProperty(APPROVAL_POLL_INTERVAL_MS, String.valueOf(DEFAULT_APPROVAL_POLL_INTERVAL_MS));
        properties.setProperty(APPROVAL_TIMEOUT_SECONDS, String.valueOf(DEFAULT_APPROVAL_TIMEOUT_SECONDS));
        properties.setProperty(NOTIFICATION_CHANNEL, DEFAULT_NOTIFICATION_CHANNEL);
        properties.setProperty(ESCALATION_CHANNEL, DEFAULT_ESCALATION_CHANNEL);
        properties.setProperty(METRICS_FLUSH_MODE, DEFAULT_METRICS_FLUSH_MODE);
        properties.setProperty(METRICS_FLUSH_INTERVAL_MS, String.valueOf(DEFAULT_METRICS_FLUSH_INTERVAL_MS));
        properties.setProperty(BUSINESS_HOURS_START, String.valueOf(DEFAULT_BUSINESS_HOURS_START));
        properties.setProperty(BUSINESS_HOURS_END, String.valueOf(DEFAULT_BUSINESS_HOURS_END));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowgate.properties",
                "config/flowgate.properties",
                System.getProperty("user.home") + "/.flowgate/flowgate.properties",
                "/etc/flowgate/flowgate.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("flowgate.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("flowgate."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowgateConfiguration{" +
                "dataDir=" + getDataDirectory() +
                ", eventLogFormat='" + getEventLogFormat() + '\'' +
                ", approvalPollInterval=" + getApprovalPollInterval() +
                ", approvalTimeout=" + getApprovalTimeout() +
                ", periodicMetricsFlush=" + isPeriodicMetricsFlush() +
                '}';
    }
}
