package com.questrail.pubsub.api;

/**
 * TopicClient
 * -----------------------------------------------------------------------------
 * {@code TopicClient} is the application-facing façade of a long-lived
 * publish/subscribe connection to a broker.
 *
 * <h2>Core responsibilities</h2>
 * <ul>
 *   <li>Establishing the first session with a broker ({@link #connect})</li>
 *   <li>Publishing messages by topic name ({@link #send})</li>
 *   <li>Routing inbound messages to per-topic listeners ({@link #subscribe})</li>
 *   <li>Reporting lifecycle signals (connect, reconnect, disconnect, fatal)</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Delivery guarantees, ordering, or persistence of messages</li>
 *   <li>Broker-side subscription management</li>
 * </ul>
 *
 * <h2>Recovery contract</h2>
 * After the first successful connection the client owns every further
 * reconnection. Transient failures are never thrown to the caller; they are
 * observable only through {@link ConnectionSignalListener}. A failure before
 * the first successful connection is fatal and reported once through
 * {@link ConnectionSignalListener#onFatal(FatalConnectionException)} and the
 * pending {@link ConnectCallback}.
 *
 * <h2>Listener lifetime</h2>
 * Topic and signal listeners are independent of connection state and survive
 * reconnects.
 *
 * <h2>Threading</h2>
 * Every method may be called from any thread. Callbacks and listeners are
 * invoked on the client's event-loop thread, one at a time.
 */
public interface TopicClient extends AutoCloseable
{
    /**
     * Connects to the given broker and remembers the endpoint for every later
     * reconnect. The outcome is reported asynchronously to {@code callback},
     * which only succeeds for the client's first session; once a session has
     * been established the callback is not retained.
     *
     * @return {@code true} if a connection attempt was submitted; {@code false}
     *         if the client is already connected or closed (the callback has
     *         then already been failed)
     */
    boolean connect(String host, int port, ConnectCallback callback);

    /**
     * Connects without a completion callback.
     */
    default boolean connect(String host, int port)
    {
        return connect(host, port, ConnectCallback.NONE);
    }

    /**
     * Connects to the previously remembered endpoint.
     *
     * @throws IllegalArgumentException if no endpoint was ever supplied
     */
    boolean connect(ConnectCallback callback);

    /**
     * Publishes {@code message} to {@code topic}. Fire-and-forget: when no
     * session is connected the message is dropped.
     */
    void send(String topic, Object message);

    /**
     * Registers a listener for messages published on exactly {@code topic}.
     */
    ListenerRegistration subscribe(String topic, TopicListener listener);

    /**
     * Registers a listener for connection lifecycle signals.
     */
    ListenerRegistration addSignalListener(ConnectionSignalListener listener);

    /**
     * Disconnects from the broker and suppresses any further reconnection.
     * Equivalent to {@link #close()}.
     */
    void disconnect();

    /**
     * Terminal shutdown. Idempotent.
     */
    @Override
    void close();

    /**
     * Returns the coarse connection status.
     */
    ConnectionStatus getStatus();

    /**
     * Returns the identity presented to the broker; stable for the lifetime
     * of the client.
     */
    ClientIdentity identity();
}
