package com.example.hookregistry.controller;

import com.example.hookregistry.repository.SubscriptionDeliveryResultRepository;
import com.example.hookregistry.repository.WebhookSubscriptionRepository;
import com.example.hookregistry.service.DeliveryHistoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MonitoringApiControllerTest {

    @Mock
    private HealthEndpoint healthEndpoint;

    @Mock
    private WebhookSubscriptionRepository subscriptionRepository;

    @Mock
    private SubscriptionDeliveryResultRepository deliveryResultRepository;

    @Test
    void overview_shouldReportSubscriptionAndHistoryTotals() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        meterRegistry.counter(DeliveryHistoryService.METRIC_DEACTIVATED).increment(2);
        when(healthEndpoint.health()).thenReturn(Health.up().build());
        when(subscriptionRepository.count()).thenReturn(5L);
        when(subscriptionRepository.countByActiveTrue()).thenReturn(3L);
        when(deliveryResultRepository.count()).thenReturn(12L);

        MonitoringApiController controller = new MonitoringApiController(healthEndpoint, meterRegistry,
                subscriptionRepository, deliveryResultRepository);
        Map<String, Object> overview = controller.getOverview();

        assertEquals("UP", overview.get("status"));
        assertEquals(5L, overview.get("totalSubscriptions"));
        assertEquals(3L, overview.get("activeSubscriptions"));
        assertEquals(2L, overview.get("inactiveSubscriptions"));
        assertEquals(12L, overview.get("totalDeliveryResults"));
        assertEquals(2L, overview.get("deactivatedSubscriptions"));
        assertEquals(0L, overview.get("duplicateDeliveryResults"));
    }
}
