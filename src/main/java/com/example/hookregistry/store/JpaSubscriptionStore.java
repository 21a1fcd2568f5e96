package com.example.hookregistry.store;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import com.example.hookregistry.repository.SubscriptionDeliveryResultRepository;
import com.example.hookregistry.repository.WebhookSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Spring Data JPA 的存储实现。
 */
@RequiredArgsConstructor
public class JpaSubscriptionStore implements SubscriptionStore {

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final SubscriptionDeliveryResultRepository deliveryResultRepository;

    @Override
    public List<WebhookSubscription> findByOwner(String ownerId) {
        return subscriptionRepository.findByCreatedById(ownerId);
    }

    @Override
    public Optional<WebhookSubscription> findByOwnerAndEvent(String ownerId, String eventName) {
        return subscriptionRepository.findFirstByCreatedByIdAndEventName(ownerId, eventName);
    }

    @Override
    public Optional<WebhookSubscription> getById(Long id) {
        return subscriptionRepository.findById(id);
    }

    @Override
    public Long add(WebhookSubscription subscription) {
        subscription.setId(null);
        return subscriptionRepository.save(subscription).getId();
    }

    @Override
    public void update(Long id, WebhookSubscription subscription) {
        subscription.setId(id);
        subscriptionRepository.save(subscription);
    }

    @Override
    public void delete(Long id) {
        subscriptionRepository.deleteById(id);
    }

    @Override
    public List<WebhookSubscription> searchByEvent(String eventName, boolean activeOnly) {
        return activeOnly
                ? subscriptionRepository.findByEventNameAndActiveTrue(eventName)
                : subscriptionRepository.findByEventName(eventName);
    }

    @Override
    public List<SubscriptionDeliveryResult> searchHistory(Long subscriptionId, int limit) {
        // PageRequest 不接受 0
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return deliveryResultRepository.findBySubscriptionIdOrderByAttemptedDateUtcDesc(subscriptionId,
                PageRequest.of(0, limit));
    }

    @Override
    public void addDeliveryResult(Long subscriptionId, SubscriptionDeliveryResult result) {
        SubscriptionDeliveryResult record = SubscriptionDeliveryResult.builder()
                .resultId(result.getResultId())
                .subscriptionId(subscriptionId)
                .statusCode(result.getStatusCode())
                .attemptedDateUtc(result.getAttemptedDateUtc())
                .build();
        deliveryResultRepository.save(record);
    }
}
