package com.example.hookregistry.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Webhook 订阅：所有者 + 事件名 + 投递配置。
 * 同一 (createdById, eventName) 同时只允许存在一条。
 */
@Entity
@Table(name = "webhook_subscription", indexes = {
        @Index(name = "idx_subscription_owner_event", columnList = "created_by_id, event_name"),
        @Index(name = "idx_subscription_event", columnList = "event_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "event_name", nullable = false)
    private String eventName; // 例如 "order.created"

    @Column(name = "created_by_id", nullable = false)
    private String createdById;

    @Builder.Default
    private boolean active = true;

    @Embedded
    private SubscriptionConfig config;

    // UTC，精确到秒
    private LocalDateTime createdDateUtc;

    private LocalDateTime lastModifiedDateUtc;
}
