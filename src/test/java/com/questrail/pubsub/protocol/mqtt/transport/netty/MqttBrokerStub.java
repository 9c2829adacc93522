package com.questrail.pubsub.protocol.mqtt.transport.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * MqttBrokerStub
 * -----------------------------------------------------------------------------
 * Minimal in-process MQTT 3.1.1 broker for integration tests.
 *
 * <ul>
 *   <li>CONNECT is answered with CONNACK (accepted unless {@link #refuseConnections()})</li>
 *   <li>PINGREQ is answered with PINGRESP</li>
 *   <li>PUBLISH is echoed back to the sender on the same topic</li>
 * </ul>
 *
 * Every received packet type and client id is recorded for assertions.
 */
final class MqttBrokerStub implements AutoCloseable {

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private final List<MqttMessageType> received = new CopyOnWriteArrayList<>();
    private final List<String> clientIds = new CopyOnWriteArrayList<>();

    private volatile boolean refuse;
    private Channel server;

    int start() throws InterruptedException {
        server = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clients.add(ch);
                        ch.pipeline().addLast(new MqttDecoder(), MqttEncoder.INSTANCE, new BrokerHandler());
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();
        return ((InetSocketAddress) server.localAddress()).getPort();
    }

    void refuseConnections() {
        refuse = true;
    }

    List<MqttMessageType> received() {
        return received;
    }

    List<String> clientIds() {
        return clientIds;
    }

    long count(MqttMessageType type) {
        return received.stream().filter(t -> t == type).count();
    }

    void publishToAll(String topic, byte[] payload, MqttQoS qos) {
        for (Channel ch : clients) {
            ch.writeAndFlush(MqttMessageBuilders.publish()
                    .topicName(topic)
                    .qos(qos)
                    .retained(false)
                    .messageId(qos == MqttQoS.AT_MOST_ONCE ? 0 : 7)
                    .payload(Unpooled.wrappedBuffer(payload))
                    .build());
        }
    }

    void disconnectAll() {
        clients.writeAndFlush(controlPacket(MqttMessageType.DISCONNECT));
    }

    void dropAll() {
        clients.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
    }

    @Override
    public void close() {
        if (server != null) {
            server.close().awaitUninterruptibly();
        }
        clients.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private static MqttMessage controlPacket(MqttMessageType type) {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }

    private final class BrokerHandler extends SimpleChannelInboundHandler<MqttMessage> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
            MqttMessageType type = msg.fixedHeader().messageType();
            received.add(type);

            switch (type) {
                case CONNECT -> {
                    clientIds.add(((MqttConnectMessage) msg).payload().clientIdentifier());
                    ctx.writeAndFlush(MqttMessageBuilders.connAck()
                            .returnCode(refuse
                                    ? MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED
                                    : MqttConnectReturnCode.CONNECTION_ACCEPTED)
                            .sessionPresent(false)
                            .build());
                }
                case PINGREQ -> ctx.writeAndFlush(controlPacket(MqttMessageType.PINGRESP));
                case PUBLISH -> {
                    MqttPublishMessage publish = (MqttPublishMessage) msg;
                    ctx.writeAndFlush(MqttMessageBuilders.publish()
                            .topicName(publish.variableHeader().topicName())
                            .qos(MqttQoS.AT_MOST_ONCE)
                            .retained(false)
                            .messageId(0)
                            .payload(publish.payload().retainedDuplicate())
                            .build());
                }
                case DISCONNECT -> ctx.close();
                default -> { }
            }
        }
    }
}
