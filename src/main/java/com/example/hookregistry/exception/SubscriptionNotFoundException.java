package com.example.hookregistry.exception;

import lombok.Getter;

/**
 * 订阅不存在。
 */
@Getter
public class SubscriptionNotFoundException extends RuntimeException {

    private final Long subscriptionId;

    public SubscriptionNotFoundException(Long subscriptionId) {
        super("Subscription not found: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }
}
