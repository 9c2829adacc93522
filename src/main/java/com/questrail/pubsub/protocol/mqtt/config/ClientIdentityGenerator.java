package com.questrail.pubsub.protocol.mqtt.config;

import com.questrail.pubsub.api.ClientIdentity;

/**
 * Produces the identity a client presents to the broker. Called once per
 * client, at construction.
 */
@FunctionalInterface
public interface ClientIdentityGenerator
{
    ClientIdentity generate(String localId);
}
