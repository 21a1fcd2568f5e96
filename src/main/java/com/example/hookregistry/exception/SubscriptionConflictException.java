package com.example.hookregistry.exception;

import com.example.hookregistry.model.WebhookSubscription;
import lombok.Getter;

import java.util.List;

/**
 * 重复注册：同一用户对同一事件已存在订阅。
 * <p>
 * 批量创建遇到冲突即停止，冲突前已创建的订阅不会回滚，通过 {@link #getCreated()} 返回。
 */
@Getter
public class SubscriptionConflictException extends RuntimeException {

    private final String eventName;

    private final List<WebhookSubscription> created;

    public SubscriptionConflictException(String eventName, List<WebhookSubscription> created) {
        super("A subscription to event '" + eventName + "' is already registered by this user");
        this.eventName = eventName;
        this.created = List.copyOf(created);
    }
}
