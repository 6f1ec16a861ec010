/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.objectstore.event;

import dev.mars.objectstore.storage.ChangeOrigin;
import dev.mars.objectstore.storage.CommitSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreEventBusTest {

    private final StoreEventBus bus = new StoreEventBus();

    @Test
    void testDeliversMatchingEvents() {
        List<CommitEvent> received = new ArrayList<>();
        bus.subscribe(CommitEvent.class, received::add);

        CommitEvent event = new CommitEvent(CommitSummary.empty(ChangeOrigin.LOCAL));
        bus.publish(event);
        bus.publish("not a commit");

        assertEquals(List.of(event), received);
    }

    @Test
    void testSupertypeListenerSeesEverything() {
        List<Object> received = new ArrayList<>();
        bus.subscribe(Object.class, received::add);

        bus.publish("a");
        bus.publish(42);

        assertEquals(2, received.size());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        List<String> received = new ArrayList<>();
        bus.subscribe(String.class, s -> {
            throw new IllegalStateException("listener failure");
        });
        bus.subscribe(String.class, received::add);

        assertDoesNotThrow(() -> bus.publish("event"));
        assertEquals(List.of("event"), received);
    }

    @Test
    void testUnsubscribe() {
        List<String> received = new ArrayList<>();
        StoreEventBus.Subscription subscription = bus.subscribe(String.class, received::add);
        assertEquals(1, bus.listenerCount());

        subscription.close();
        bus.publish("ignored");

        assertTrue(received.isEmpty());
        assertEquals(0, bus.listenerCount());
    }
}
