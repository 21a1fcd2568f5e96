package com.example.hookregistry.service;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.SubscriptionRelayConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 面向中继的接口：查询事件的订阅者，回报投递结果。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionRelayService {

    public static final String RELAY_ACTOR = "relay";

    private final SubscriptionSearchService searchService;
    private final DeliveryHistoryService deliveryHistoryService;

    public List<SubscriptionRelayConfig> search(String eventName) {
        return searchService.findActive(eventName);
    }

    public void reportResults(List<SubscriptionDeliveryResult> results) {
        log.debug("Relay reported {} delivery results", results.size());
        deliveryHistoryService.ingest(RELAY_ACTOR, results);
    }
}
