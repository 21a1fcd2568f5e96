package com.example.hookregistry.config;

import com.example.hookregistry.repository.SubscriptionDeliveryResultRepository;
import com.example.hookregistry.repository.WebhookSubscriptionRepository;
import com.example.hookregistry.store.JpaSubscriptionStore;
import com.example.hookregistry.store.NullSafeSubscriptionStore;
import com.example.hookregistry.store.SubscriptionStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 存储与时钟配置。
 */
@Configuration
public class StoreConfig {

    /**
     * JPA 存储外包一层空值适配器，业务代码只拿到非 null 的集合。
     *
     * @param subscriptionRepository   订阅仓储
     * @param deliveryResultRepository 投递历史仓储
     * @return SubscriptionStore
     */
    @Bean
    public SubscriptionStore subscriptionStore(WebhookSubscriptionRepository subscriptionRepository,
            SubscriptionDeliveryResultRepository deliveryResultRepository) {
        return new NullSafeSubscriptionStore(
                new JpaSubscriptionStore(subscriptionRepository, deliveryResultRepository));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
