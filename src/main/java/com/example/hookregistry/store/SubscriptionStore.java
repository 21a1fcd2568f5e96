package com.example.hookregistry.store;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;

import java.util.List;
import java.util.Optional;

/**
 * 订阅与投递历史的持久化抽象。
 * <p>
 * 每个方法单独生效，调用之间没有事务；需要严格唯一性的场景应由底层存储的唯一约束保证。
 */
public interface SubscriptionStore {

    /**
     * 查询用户创建的全部订阅。
     *
     * @param ownerId 用户 ID
     * @return 订阅列表
     */
    List<WebhookSubscription> findByOwner(String ownerId);

    /**
     * 按用户和事件名查询订阅。
     *
     * @param ownerId   用户 ID
     * @param eventName 事件名
     * @return 订阅信息
     */
    Optional<WebhookSubscription> findByOwnerAndEvent(String ownerId, String eventName);

    Optional<WebhookSubscription> getById(Long id);

    /**
     * 新增订阅。
     *
     * @param subscription 订阅（id 为空）
     * @return 存储分配的 ID
     */
    Long add(WebhookSubscription subscription);

    void update(Long id, WebhookSubscription subscription);

    void delete(Long id);

    /**
     * 按事件名查询所有用户的订阅。
     *
     * @param eventName  事件名
     * @param activeOnly 是否只返回启用的订阅
     * @return 订阅列表
     */
    List<WebhookSubscription> searchByEvent(String eventName, boolean activeOnly);

    /**
     * 查询订阅最近的投递结果，按尝试时间倒序。
     *
     * @param subscriptionId 订阅 ID
     * @param limit          最多返回条数
     * @return 投递结果列表
     */
    List<SubscriptionDeliveryResult> searchHistory(Long subscriptionId, int limit);

    void addDeliveryResult(Long subscriptionId, SubscriptionDeliveryResult result);
}
