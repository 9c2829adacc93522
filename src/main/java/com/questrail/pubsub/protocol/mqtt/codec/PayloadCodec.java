package com.questrail.pubsub.protocol.mqtt.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * PayloadCodec
 * -----------------------------------------------------------------------------
 * Serialization boundary for application message bodies.
 *
 * <p>The connection core treats payloads as opaque bytes. Only the client
 * façade crosses this boundary: outbound objects are encoded before a publish
 * request is submitted, inbound bytes are decoded before topic dispatch.</p>
 */
public interface PayloadCodec
{
    /**
     * @throws PayloadCodecException if {@code message} cannot be serialized
     */
    byte[] encode(Object message);

    /**
     * @throws PayloadCodecException if {@code payload} is not well-formed
     */
    JsonNode decode(byte[] payload);
}
