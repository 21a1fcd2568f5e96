package com.example.hookregistry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 提供给中继的订阅视图：投递目标所需的最少信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRelayConfig {

    private Long subscriptionId;

    private String eventName;

    private SubscriptionConfig config;

    public static SubscriptionRelayConfig from(WebhookSubscription subscription) {
        return SubscriptionRelayConfig.builder()
                .subscriptionId(subscription.getId())
                .eventName(subscription.getEventName())
                .config(subscription.getConfig())
                .build();
    }
}
