package com.questrail.pubsub.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.pubsub.api.ClientIdentity;
import com.questrail.pubsub.api.ConnectionSignalListener;
import com.questrail.pubsub.api.ConnectionStatus;
import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.api.ListenerRegistration;
import com.questrail.pubsub.api.TopicClient;
import com.questrail.pubsub.api.TopicListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * AbstractTopicClient
 * -----------------------------------------------------------------------------
 * Protocol-neutral base implementation of {@link TopicClient} that owns the
 * application-facing registries.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Holds topic listeners in a {@link TopicEventRouter}</li>
 *   <li>Holds {@link ConnectionSignalListener}s and fans signals out to them</li>
 *   <li>Exposes the coarse {@link ConnectionStatus}</li>
 *   <li>Holds the stable {@link ClientIdentity}</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * It does not open sockets, run timers, or decide when to reconnect. Those
 * responsibilities live in concrete subclasses and the layers below them.
 *
 * <h2>Threading model</h2>
 * Registries are concurrent and may be mutated from any thread. The
 * {@code fire*} and {@link #dispatch} hooks are expected to be called from
 * the subclass's single event-loop thread.
 */
public abstract class AbstractTopicClient implements TopicClient
{
    private static final Logger log = LoggerFactory.getLogger(AbstractTopicClient.class);

    private final ClientIdentity identity;
    private final TopicEventRouter router;
    private final List<ConnectionSignalListener> signalListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    protected AbstractTopicClient(ClientIdentity identity, TopicEventRouter router)
    {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public final ListenerRegistration subscribe(String topic, TopicListener listener)
    {
        return router.register(topic, listener);
    }

    @Override
    public final ListenerRegistration addSignalListener(ConnectionSignalListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        signalListeners.add(listener);
        return () -> signalListeners.remove(listener);
    }

    @Override
    public final ConnectionStatus getStatus()
    {
        return status;
    }

    @Override
    public final ClientIdentity identity()
    {
        return identity;
    }

    @Override
    public void disconnect()
    {
        close();
    }

    /**
     * Updates the coarse status. Intended for subclasses to call when the
     * lifecycle state machine changes phase.
     */
    protected final void setStatus(ConnectionStatus status)
    {
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Routes a decoded inbound message to the listeners of its topic.
     */
    protected final int dispatch(String topic, JsonNode message)
    {
        return router.dispatch(topic, message);
    }

    protected final void fireConnect()
    {
        fire("connect", ConnectionSignalListener::onConnect);
    }

    protected final void fireReconnect()
    {
        fire("reconnect", ConnectionSignalListener::onReconnect);
    }

    protected final void fireDisconnect()
    {
        fire("disconnect", l -> l.onDisconnect(identity));
    }

    protected final void fireFatal(FatalConnectionException cause)
    {
        Objects.requireNonNull(cause, "cause");
        fire("fatal", l -> l.onFatal(cause));
    }

    private void fire(String signal, Consumer<ConnectionSignalListener> action)
    {
        for (ConnectionSignalListener listener : signalListeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.error("Signal listener failed on '{}' for client {}", signal, identity.clientId(), e);
            }
        }
    }
}
