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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FlowgateConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class FlowgateConfigurationTest {

    @Test
    @DisplayName("Defaults apply when no overrides are given")
    void testDefaults() {
        FlowgateConfiguration config = new FlowgateConfiguration(new Properties());

        assertEquals(Paths.get("data"), config.getDataDirectory());
        assertEquals("document", config.getEventLogFormat());
        assertTrue(config.isEventLogFsync());
        assertEquals(16, config.getMaxPublishDepth());
        assertEquals(Duration.ofSeconds(5), config.getApprovalPollInterval());
        assertEquals(Duration.ofHours(1), config.getApprovalTimeout());
        assertEquals("#devops-alerts", config.getNotificationChannel());
        assertEquals("#escalations", config.getEscalationChannel());
        assertFalse(config.isPeriodicMetricsFlush());
        assertEquals(9, config.getBusinessHoursStart());
        assertEquals(17, config.getBusinessHoursEnd());
        assertNull(config.getTemplatesFile());
    }

    @Test
    @DisplayName("Supplied properties override defaults")
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty(FlowgateConfiguration.APPROVAL_POLL_INTERVAL_MS, "50");
        props.setProperty(FlowgateConfiguration.EVENT_LOG_FORMAT, "jsonl");
        props.setProperty(FlowgateConfiguration.METRICS_FLUSH_MODE, "periodic");

        FlowgateConfiguration config = new FlowgateConfiguration(props);

        assertEquals(Duration.ofMillis(50), config.getApprovalPollInterval());
        assertEquals("jsonl", config.getEventLogFormat());
        assertTrue(config.isPeriodicMetricsFlush());
    }

    @Test
    @DisplayName("Invalid numbers fall back to the default")
    void testInvalidNumberFallsBack() {
        Properties props = new Properties();
        props.setProperty(FlowgateConfiguration.BUS_MAX_PUBLISH_DEPTH, "lots");

        FlowgateConfiguration config = new FlowgateConfiguration(props);

        assertEquals(16, config.getMaxPublishDepth());
    }

    @Test
    @DisplayName("fromFile layers the file over the defaults")
    void testFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "flowgate.data.dir=" + tempDir.resolve("store").toString().replace("\\", "/") + "\n"
                + "flowgate.escalation.channel=#oncall\n");

        FlowgateConfiguration config = FlowgateConfiguration.fromFile(file);

        assertEquals(tempDir.resolve("store"), config.getDataDirectory());
        assertEquals("#oncall", config.getEscalationChannel());
        assertEquals("#devops-alerts", config.getNotificationChannel());
    }
}
