package com.questrail.pubsub.protocol.mqtt.transport.netty;

import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSession;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSessionListener;
import com.questrail.pubsub.protocol.mqtt.transport.MqttTransportFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyMqttTransportFactory
 * =============================================================================
 * Netty-backed implementation of the {@link MqttTransportFactory} port.
 *
 * <h2>Architectural role</h2>
 * This class is a <strong>pure transport adapter</strong>. It opens TCP
 * connections and installs the MQTT packet codec; it never decides on
 * timeouts, heartbeats or reconnection.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g. {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * The factory owns one single-threaded {@link NioEventLoopGroup}, shared by
 * every session it opens. {@link #close()} shuts the group down; sessions
 * still open at that point are closed with it.
 */
public final class NettyMqttTransportFactory implements MqttTransportFactory, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyMqttTransportFactory.class);

    private final EventLoopGroup group;
    private final Duration connectTimeout;
    private final int maxMessageBytes;

    /**
     * @param connectTimeout  TCP connect timeout; the handshake timer still
     *                        bounds the whole attempt
     * @param maxMessageBytes largest inbound MQTT packet accepted by the decoder
     */
    public NettyMqttTransportFactory(Duration connectTimeout, int maxMessageBytes)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be > 0");
        }
        this.maxMessageBytes = maxMessageBytes;
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public MqttSession open(MqttEndpoint endpoint, MqttSessionListener listener)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(listener, "listener");

        NettyMqttSession session = new NettyMqttSession(endpoint, listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("mqttDecoder", new MqttDecoder(maxMessageBytes));
                        p.addLast("mqttEncoder", MqttEncoder.INSTANCE);
                        p.addLast("session", session.inboundHandler());
                    }
                });

        log.debug("Opening MQTT transport to {}", endpoint);
        ChannelFuture connectFuture = bootstrap.connect(endpoint.host(), endpoint.port());
        session.attach(connectFuture);
        return session;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
