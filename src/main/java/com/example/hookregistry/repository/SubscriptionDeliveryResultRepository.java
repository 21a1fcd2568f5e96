package com.example.hookregistry.repository;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 投递历史仓储接口。
 */
@Repository
public interface SubscriptionDeliveryResultRepository extends JpaRepository<SubscriptionDeliveryResult, Long> {

    /**
     * 查询订阅最近的投递结果（按尝试时间倒序）。
     *
     * @param subscriptionId 订阅 ID
     * @param pageable       分页（只取第一页）
     * @return 投递结果列表
     */
    List<SubscriptionDeliveryResult> findBySubscriptionIdOrderByAttemptedDateUtcDesc(Long subscriptionId,
            Pageable pageable);
}
