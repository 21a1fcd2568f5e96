package com.example.hookregistry.repository;

import com.example.hookregistry.model.WebhookSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 订阅仓储接口。
 */
@Repository
public interface WebhookSubscriptionRepository extends JpaRepository<WebhookSubscription, Long> {

    /**
     * 查询指定用户创建的全部订阅。
     *
     * @param createdById 用户 ID
     * @return 订阅列表
     */
    List<WebhookSubscription> findByCreatedById(String createdById);

    /**
     * 按用户和事件名查询订阅，用于重复注册检查。
     *
     * @param createdById 用户 ID
     * @param eventName   事件名
     * @return 订阅信息
     */
    Optional<WebhookSubscription> findFirstByCreatedByIdAndEventName(String createdById, String eventName);

    List<WebhookSubscription> findByEventName(String eventName);

    List<WebhookSubscription> findByEventNameAndActiveTrue(String eventName);

    long countByActiveTrue();
}
