package com.questrail.pubsub.api;

/**
 * Completion callback for {@link TopicClient#connect}.
 *
 * <p>{@link #onConnected()} is reserved for the client's very first
 * session. Callbacks passed before that session is established complete
 * once, with {@link #onConnected()} or {@link #onFailure(Throwable)}. A
 * callback passed after it is never invoked unless the request is rejected
 * outright; later sessions are reported through
 * {@link ConnectionSignalListener#onReconnect()}.</p>
 */
@FunctionalInterface
public interface ConnectCallback
{
    ConnectCallback NONE = () -> {};

    void onConnected();

    /**
     * The connect request was rejected (already connected, closed) or the
     * first connection failed fatally.
     */
    default void onFailure(Throwable cause) {}
}
