/**
 * MQTT Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic boundary</em> between a
 * concrete networking implementation (Netty, a test fake) and the connection
 * lifecycle core.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production for TCP and for MQTT packet encoding, but no
 * Netty type may leak into the lifecycle core. Everything above these ports
 * sees only:
 * <ul>
 *   <li>Topic names and payloads as {@code String} / {@code byte[]}</li>
 *   <li>Typed commands ({@link com.questrail.pubsub.protocol.mqtt.transport.MqttSession})</li>
 *   <li>Typed session events ({@link com.questrail.pubsub.protocol.mqtt.transport.MqttSessionListener})</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and packet coding only</li>
 *   <li>Not decide on reconnection, timeouts or heartbeats</li>
 *   <li>Not interpret publish payloads</li>
 * </ul>
 */
package com.questrail.pubsub.protocol.mqtt.transport;
