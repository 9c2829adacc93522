package com.questrail.pubsub.protocol.mqtt.transport.netty;

import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSession;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSessionListener;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyMqttSession
 * =============================================================================
 * One TCP connection plus MQTT codec, exposed through the {@link MqttSession}
 * port.
 *
 * <p>Commands issued while the TCP connect is still in flight are written once
 * it succeeds and dropped if it fails. Inbound packets are translated into
 * {@link MqttSessionListener} callbacks on the channel's event loop;
 * {@link MqttSessionListener#onClosed()} is delivered exactly once, from the
 * channel's close future, whether the connect failed or an established
 * stream went away.</p>
 */
final class NettyMqttSession implements MqttSession
{
    private static final Logger log = LoggerFactory.getLogger(NettyMqttSession.class);

    private final MqttEndpoint endpoint;
    private final MqttSessionListener listener;
    private final AtomicBoolean closedNotified = new AtomicBoolean(false);

    private volatile ChannelFuture connectFuture;
    private volatile boolean released;

    NettyMqttSession(MqttEndpoint endpoint, MqttSessionListener listener)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    InboundHandler inboundHandler()
    {
        return new InboundHandler();
    }

    void attach(ChannelFuture future)
    {
        this.connectFuture = future;

        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess() && !released) {
                log.debug("MQTT transport to {} failed: {}", endpoint, f.cause() == null ? "cancelled" : f.cause().toString());
                listener.onError(f.cause());
            }
        });
        future.channel().closeFuture().addListener(f -> {
            if (closedNotified.compareAndSet(false, true)) {
                listener.onClosed();
            }
        });
    }

    @Override
    public void connect(String clientId, Duration keepAlive)
    {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(keepAlive, "keepAlive");

        MqttMessage connect = MqttMessageBuilders.connect()
                .protocolVersion(MqttVersion.MQTT_3_1_1)
                .clientId(clientId)
                .cleanSession(true)
                .keepAlive((int) Math.min(0xFFFF, keepAlive.toSeconds()))
                .build();
        write(connect, false);
    }

    @Override
    public void publish(String topic, byte[] payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        MqttPublishMessage publish = MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_MOST_ONCE)
                .retained(false)
                .messageId(0)
                .payload(Unpooled.wrappedBuffer(payload))
                .build();
        write(publish, false);
    }

    @Override
    public void pingRequest()
    {
        write(controlPacket(MqttMessageType.PINGREQ), false);
    }

    @Override
    public void disconnect()
    {
        write(controlPacket(MqttMessageType.DISCONNECT), true);
    }

    @Override
    public void release()
    {
        released = true;
        ChannelFuture f = connectFuture;
        if (f != null) {
            f.channel().close();
        }
    }

    private void write(MqttMessage message, boolean closeAfterWrite)
    {
        ChannelFuture f = connectFuture;
        if (f == null || released) {
            ReferenceCountUtil.release(message);
            return;
        }

        if (f.isDone()) {
            writeNow(f, message, closeAfterWrite);
        }
        else {
            f.addListener((ChannelFutureListener) done -> writeNow(done, message, closeAfterWrite));
        }
    }

    private static void writeNow(ChannelFuture connected, MqttMessage message, boolean closeAfterWrite)
    {
        if (!connected.isSuccess()) {
            ReferenceCountUtil.release(message);
            return;
        }
        Channel ch = connected.channel();
        ChannelFuture written = ch.writeAndFlush(message);
        if (closeAfterWrite) {
            written.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private static MqttMessage controlPacket(MqttMessageType type)
    {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives decoded {@link MqttMessage}s and forwards them as typed
     * callbacks. Payloads are copied out of the reference-counted buffer,
     * which is released by {@link SimpleChannelInboundHandler}.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<MqttMessage>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg)
        {
            if (msg.decoderResult().isFailure()) {
                listener.onError(msg.decoderResult().cause());
                ctx.close();
                return;
            }

            switch (msg.fixedHeader().messageType()) {
                case CONNACK -> {
                    MqttConnectReturnCode code = ((MqttConnAckMessage) msg).variableHeader().connectReturnCode();
                    listener.onConnAck(code == MqttConnectReturnCode.CONNECTION_ACCEPTED, code.name());
                }
                case PUBLISH -> {
                    MqttPublishMessage publish = (MqttPublishMessage) msg;
                    byte[] payload = ByteBufUtil.getBytes(publish.payload());
                    if (publish.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
                        ctx.writeAndFlush(new MqttPubAckMessage(
                                new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 0),
                                MqttMessageIdVariableHeader.from(publish.variableHeader().packetId())));
                    }
                    listener.onPublish(publish.variableHeader().topicName(), payload);
                }
                case PINGRESP -> listener.onPingResponse();
                case DISCONNECT -> listener.onDisconnect();
                default -> log.debug("Ignoring {} from {}", msg.fixedHeader().messageType(), endpoint);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            listener.onError(cause);
            ctx.close();
        }
    }
}
