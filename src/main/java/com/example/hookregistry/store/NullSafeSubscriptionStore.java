package com.example.hookregistry.store;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 存储边界适配器：把底层返回的 null 统一转换为空集合 / {@link Optional#empty()}，
 * 上层代码因此不再需要判空。
 */
@RequiredArgsConstructor
public class NullSafeSubscriptionStore implements SubscriptionStore {

    private final SubscriptionStore delegate;

    @Override
    public List<WebhookSubscription> findByOwner(String ownerId) {
        return safe(delegate.findByOwner(ownerId));
    }

    @Override
    public Optional<WebhookSubscription> findByOwnerAndEvent(String ownerId, String eventName) {
        return safe(delegate.findByOwnerAndEvent(ownerId, eventName));
    }

    @Override
    public Optional<WebhookSubscription> getById(Long id) {
        return safe(delegate.getById(id));
    }

    @Override
    public Long add(WebhookSubscription subscription) {
        return delegate.add(subscription);
    }

    @Override
    public void update(Long id, WebhookSubscription subscription) {
        delegate.update(id, subscription);
    }

    @Override
    public void delete(Long id) {
        delegate.delete(id);
    }

    @Override
    public List<WebhookSubscription> searchByEvent(String eventName, boolean activeOnly) {
        return safe(delegate.searchByEvent(eventName, activeOnly));
    }

    @Override
    public List<SubscriptionDeliveryResult> searchHistory(Long subscriptionId, int limit) {
        return safe(delegate.searchHistory(subscriptionId, limit));
    }

    @Override
    public void addDeliveryResult(Long subscriptionId, SubscriptionDeliveryResult result) {
        delegate.addDeliveryResult(subscriptionId, result);
    }

    private static <T> List<T> safe(List<T> items) {
        return items == null ? Collections.emptyList() : items;
    }

    private static <T> Optional<T> safe(Optional<T> item) {
        return item == null ? Optional.empty() : item;
    }
}
