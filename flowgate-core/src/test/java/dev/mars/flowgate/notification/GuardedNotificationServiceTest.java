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

package dev.mars.flowgate.notification;

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.InMemoryEventLog;
import dev.mars.flowgate.event.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

class GuardedNotificationServiceTest {

    @Mock
    private NotificationService failing;

    @Mock
    private NotificationService healthy;

    private GuardedNotificationService guarded;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        guarded = new GuardedNotificationService(failing, healthy);
    }

    @Test
    @DisplayName("Collaborator failures are never raised and later delegates still run")
    void failuresAreSwallowedAndLogged() {
        doThrow(new RuntimeException("chat API down")).when(failing).notify(anyString(), anyString());
        doThrow(new RuntimeException("chat API down")).when(failing)
                .notifyApprovalNeeded(anyString(), anyString(), anyString());

        assertDoesNotThrow(() -> guarded.notify("hello", "#c"));
        assertDoesNotThrow(() -> guarded.notifyApprovalNeeded("deploy?", "#c", "a-1"));

        verify(healthy).notify("hello", "#c");
        verify(healthy).notifyApprovalNeeded("deploy?", "#c", "a-1");
    }

    @Test
    @DisplayName("Event bus notifications are recorded as events")
    void eventBusNotifications() throws Exception {
        EventBus bus = new EventBus(new InMemoryEventLog());
        NotificationService service = new EventBusNotificationService(bus);

        service.notify("Workflow started", "#devops-alerts");
        service.notifyApprovalNeeded("Approve deployment", "#devops-alerts", "deploy-1");

        List<Event> events = bus.getEvents().collect(Collectors.toList());
        assertEquals(List.of("notification", "approval_requested"),
                events.stream().map(Event::getType).collect(Collectors.toList()));
        assertEquals("deploy-1", events.get(1).getString("alertId"));
    }
}
