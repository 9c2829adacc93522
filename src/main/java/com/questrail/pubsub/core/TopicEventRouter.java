package com.questrail.pubsub.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.pubsub.api.ListenerRegistration;
import com.questrail.pubsub.api.TopicListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TopicEventRouter
 * -----------------------------------------------------------------------------
 * Maps topic names to ordered lists of {@link TopicListener}s.
 *
 * <h2>Dispatch rules</h2>
 * <ul>
 *   <li>Topic names are compared for exact equality; there is no wildcard
 *       matching.</li>
 *   <li>Listeners are invoked synchronously, in registration order.</li>
 *   <li>A listener that throws is logged and skipped; later listeners still
 *       receive the message.</li>
 * </ul>
 *
 * <h2>Mutation during dispatch</h2>
 * Registrations are copy-on-write. A dispatch iterates the snapshot that was
 * current when it started, so listeners may register or remove listeners
 * (including themselves) from inside a callback.
 *
 * <p>The router knows nothing about connections; registrations survive any
 * number of reconnects.</p>
 */
public final class TopicEventRouter
{
    private static final Logger log = LoggerFactory.getLogger(TopicEventRouter.class);

    private final ConcurrentMap<String, List<Entry>> listeners = new ConcurrentHashMap<>();

    /**
     * Registers {@code listener} for {@code topic}. The same listener may be
     * registered more than once; each registration is removed independently.
     */
    public ListenerRegistration register(String topic, TopicListener listener)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(listener, "listener");

        Entry entry = new Entry(listener);
        listeners.compute(topic, (t, list) -> {
            List<Entry> target = (list != null) ? list : new CopyOnWriteArrayList<>();
            target.add(entry);
            return target;
        });

        return () -> listeners.computeIfPresent(topic, (t, list) -> {
            list.remove(entry);
            return list.isEmpty() ? null : list;
        });
    }

    /**
     * Delivers {@code message} to every listener registered for {@code topic}.
     *
     * @return the number of listeners that were invoked
     */
    public int dispatch(String topic, JsonNode message)
    {
        Objects.requireNonNull(topic, "topic");

        List<Entry> targets = listeners.get(topic);
        if (targets == null) {
            log.debug("No listener for topic '{}'", topic);
            return 0;
        }

        int invoked = 0;
        for (Entry entry : targets) {
            invoked++;
            try {
                entry.listener.onMessage(topic, message);
            } catch (RuntimeException e) {
                log.error("Listener for topic '{}' failed", topic, e);
            }
        }
        return invoked;
    }

    public int listenerCount(String topic)
    {
        List<Entry> targets = listeners.get(topic);
        return targets == null ? 0 : targets.size();
    }

    // Identity wrapper so duplicate registrations of one listener stay distinct.
    private static final class Entry
    {
        private final TopicListener listener;

        private Entry(TopicListener listener) {
            this.listener = listener;
        }
    }
}
