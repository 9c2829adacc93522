package com.questrail.pubsub.api;

import java.util.Objects;

/**
 * Identity of a client.
 *
 * @param localId  application-supplied identifier of this client instance
 * @param clientId session identifier presented to the broker in the handshake
 */
public record ClientIdentity(String localId, String clientId)
{
    public ClientIdentity {
        Objects.requireNonNull(localId, "localId");
        Objects.requireNonNull(clientId, "clientId");
        if (clientId.isEmpty()) {
            throw new IllegalArgumentException("clientId must not be empty");
        }
    }
}
