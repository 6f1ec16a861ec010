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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process publish/subscribe for store notifications.
 * <p>
 * Events are delivered on the publishing thread, in subscription order, to
 * every listener whose event type is assignable from the event. A listener
 * that throws is logged and skipped; the remaining listeners still run.
 * Listeners run on the engine's commit thread and must not block on engine
 * futures.
 */
public final class StoreEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(StoreEventBus.class);

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener.
     *
     * @return a handle that removes the listener when closed
     */
    public <E> Subscription subscribe(Class<E> eventType, Consumer<? super E> listener) {
        Listener<E> entry = new Listener<>(eventType, listener);
        listeners.add(entry);
        LOG.debug("Subscribed listener for {}", eventType.getSimpleName());
        return () -> listeners.remove(entry);
    }

    public void publish(Object event) {
        for (Listener<?> listener : listeners) {
            listener.deliver(event);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle returned by {@link #subscribe}.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Listener<E> {
        private final Class<E> type;
        private final Consumer<? super E> consumer;

        Listener(Class<E> type, Consumer<? super E> consumer) {
            this.type = type;
            this.consumer = consumer;
        }

        void deliver(Object event) {
            if (!type.isInstance(event)) {
                return;
            }
            try {
                consumer.accept(type.cast(event));
            } catch (RuntimeException e) {
                LOG.error("Listener for {} failed on {}: {}",
                        type.getSimpleName(), event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
