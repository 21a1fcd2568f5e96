package com.example.hookregistry.controller;

import com.example.hookregistry.repository.SubscriptionDeliveryResultRepository;
import com.example.hookregistry.repository.WebhookSubscriptionRepository;
import com.example.hookregistry.service.DeliveryHistoryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 监控数据 API
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringApiController {

    private final HealthEndpoint healthEndpoint;
    private final MeterRegistry meterRegistry;
    private final WebhookSubscriptionRepository subscriptionRepository;
    private final SubscriptionDeliveryResultRepository deliveryResultRepository;

    /**
     * 获取系统概览数据
     */
    @GetMapping("/overview")
    public Map<String, Object> getOverview() {
        Map<String, Object> overview = new HashMap<>();

        // 健康状态
        overview.put("status", healthEndpoint.health().getStatus().getCode());

        // 业务数据
        long totalSubscriptions = subscriptionRepository.count();
        long activeSubscriptions = subscriptionRepository.countByActiveTrue();
        overview.put("totalSubscriptions", totalSubscriptions);
        overview.put("activeSubscriptions", activeSubscriptions);
        overview.put("inactiveSubscriptions", totalSubscriptions - activeSubscriptions);
        overview.put("totalDeliveryResults", deliveryResultRepository.count());

        // 本进程启动以来的计数
        overview.put("deactivatedSubscriptions", count(DeliveryHistoryService.METRIC_DEACTIVATED));
        overview.put("duplicateDeliveryResults", count(DeliveryHistoryService.METRIC_DUPLICATES));

        return overview;
    }

    private long count(String name) {
        Counter counter = meterRegistry.find(name).counter();
        return counter != null ? (long) counter.count() : 0L;
    }
}
