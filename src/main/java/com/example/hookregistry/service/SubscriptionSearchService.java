package com.example.hookregistry.service;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.SubscriptionRelayConfig;
import com.example.hookregistry.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 订阅查询服务（只读）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionSearchService {

    private final SubscriptionStore store;

    /**
     * 按事件名查询所有用户的启用订阅，不区分所有者。
     *
     * @param callerId  调用方 ID
     * @param eventName 事件名
     * @return 中继配置列表
     */
    public List<SubscriptionRelayConfig> searchByEvent(String callerId, String eventName) {
        List<SubscriptionRelayConfig> subscribers = findActive(eventName);

        log.info("Searched subscriptions for event {} by user {}", eventName, callerId);

        return subscribers;
    }

    List<SubscriptionRelayConfig> findActive(String eventName) {
        return store.searchByEvent(eventName, true).stream()
                .map(SubscriptionRelayConfig::from)
                .collect(Collectors.toList());
    }

    public List<SubscriptionDeliveryResult> searchHistory(Long subscriptionId, int limit) {
        return store.searchHistory(subscriptionId, limit);
    }
}
