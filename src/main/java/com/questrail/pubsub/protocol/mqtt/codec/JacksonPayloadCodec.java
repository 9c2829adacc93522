package com.questrail.pubsub.protocol.mqtt.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON {@link PayloadCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>An empty payload decodes to {@code null} JSON (a {@code NullNode}).</p>
 */
public final class JacksonPayloadCodec implements PayloadCodec
{
    private final ObjectMapper mapper;

    public JacksonPayloadCodec() {
        this(new ObjectMapper());
    }

    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Object message)
    {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Cannot encode message of type "
                    + (message == null ? "null" : message.getClass().getName()), e);
        }
    }

    @Override
    public JsonNode decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            return mapper.nullNode();
        }
        try {
            return mapper.readTree(payload);
        } catch (IOException e) {
            throw new PayloadCodecException("Malformed JSON payload (" + payload.length + " bytes)", e);
        }
    }
}
