package com.example.hookregistry.service;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import com.example.hookregistry.store.SubscriptionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 投递历史对账服务：去重写入中继上报的投递结果，并执行自动停用策略。
 * <p>
 * 策略：任意一次 4xx 响应都会停用处于启用状态的订阅；5xx 与成功响应不影响启用状态。
 */
@Service
@Slf4j
public class DeliveryHistoryService {

    public static final String METRIC_RECORDED = "hookregistry.history.recorded";
    public static final String METRIC_DUPLICATES = "hookregistry.history.duplicates";
    public static final String METRIC_DEACTIVATED = "hookregistry.subscriptions.deactivated";

    private final SubscriptionStore store;
    private final Counter recordedCounter;
    private final Counter duplicateCounter;
    private final Counter deactivatedCounter;

    public DeliveryHistoryService(SubscriptionStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.recordedCounter = Counter.builder(METRIC_RECORDED)
                .description("Delivery results recorded")
                .register(meterRegistry);
        this.duplicateCounter = Counter.builder(METRIC_DUPLICATES)
                .description("Delivery results skipped as already recorded")
                .register(meterRegistry);
        this.deactivatedCounter = Counter.builder(METRIC_DEACTIVATED)
                .description("Subscriptions deactivated after a 4xx delivery result")
                .register(meterRegistry);
    }

    /**
     * 批量更新投递历史。空列表直接返回。
     *
     * @param callerId 调用方 ID
     * @param results  投递结果
     */
    public void updateHistory(String callerId, List<SubscriptionDeliveryResult> results) {
        if (results.isEmpty()) {
            return;
        }

        ingest(callerId, results);

        log.info("Added subscription history by user {}", callerId);
    }

    /**
     * 逐条处理投递结果：已存在则跳过；否则写入，遇到 4xx 时停用订阅。
     *
     * @param actor   上报方（调用方 ID 或中继）
     * @param results 投递结果
     */
    public void ingest(String actor, List<SubscriptionDeliveryResult> results) {
        for (SubscriptionDeliveryResult incoming : results) {
            if (existsInStore(results.size(), incoming)) {
                duplicateCounter.increment();
                log.debug("Skipped duplicate subscription history result {} reported by {}", incoming.getResultId(),
                        actor);
                continue;
            }

            store.addDeliveryResult(incoming.getSubscriptionId(), incoming);
            recordedCounter.increment();

            log.info("Added subscription history result {} to subscription {} by {}", incoming.getResultId(),
                    incoming.getSubscriptionId(), actor);

            if (isClientError(incoming.getStatusCode())) {
                deactivate(actor, incoming.getSubscriptionId());
            }
        }
    }

    private void deactivate(String actor, Long subscriptionId) {
        store.getById(subscriptionId)
                .filter(WebhookSubscription::isActive)
                .ifPresent(subscription -> {
                    subscription.setActive(false);
                    store.update(subscriptionId, subscription);
                    deactivatedCounter.increment();

                    log.info("Deactivated subscription {} after client error reported by {}", subscriptionId, actor);
                });
    }

    // 查询深度取本批次条数，而不是该订阅的全部历史
    // TODO: 历史中更早的同 ID 结果会漏判，改为按 (subscriptionId, resultId) 精确查询
    private boolean existsInStore(int pageSize, SubscriptionDeliveryResult incoming) {
        return store.searchHistory(incoming.getSubscriptionId(), pageSize).stream()
                .anyMatch(existing -> existing.getResultId() != null
                        && existing.getResultId().equalsIgnoreCase(incoming.getResultId()));
    }

    static boolean isClientError(Integer statusCode) {
        return statusCode != null && statusCode >= 400 && statusCode < 500;
    }
}
