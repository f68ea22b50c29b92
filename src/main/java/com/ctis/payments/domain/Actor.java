package com.ctis.payments.domain;

import lombok.Value;

/**
 * The party attributed on an audit entry: an actor type plus a name (user id,
 * gateway type, job name).
 */
@Value
public class Actor {

    ActorType type;
    String name;

    public static Actor user(String userId) {
        return new Actor(ActorType.USER, userId == null || userId.isBlank() ? "anonymous" : userId);
    }

    public static Actor webhook(GatewayType gatewayType) {
        return new Actor(ActorType.WEBHOOK, gatewayType.name());
    }

    public static Actor scheduler(String jobName) {
        return new Actor(ActorType.SCHEDULER, jobName);
    }

    @Override
    public String toString() {
        return type + ":" + name;
    }
}
