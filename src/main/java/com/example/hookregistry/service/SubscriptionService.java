package com.example.hookregistry.service;

import com.example.hookregistry.dto.SubscriptionDetailResponse;
import com.example.hookregistry.dto.UpdateSubscriptionRequest;
import com.example.hookregistry.exception.SubscriptionConflictException;
import com.example.hookregistry.exception.SubscriptionNotFoundException;
import com.example.hookregistry.model.SubscriptionConfig;
import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import com.example.hookregistry.store.SubscriptionStore;
import com.example.hookregistry.utils.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 订阅生命周期服务：创建、查询、更新与删除。
 * 所有操作都显式接收调用方 ID，用于审计日志和所有者归属。
 */
@Service
@Slf4j
public class SubscriptionService {

    private final SubscriptionStore store;
    private final UrlValidator urlValidator;
    private final Clock clock;
    private final int maxHistoryResults;

    public SubscriptionService(SubscriptionStore store,
            UrlValidator urlValidator,
            Clock clock,
            @Value("${app.history.max-results:100}") int maxHistoryResults) {
        this.store = store;
        this.urlValidator = urlValidator;
        this.clock = clock;
        this.maxHistoryResults = maxHistoryResults;
    }

    /**
     * 为每个事件创建一条订阅。
     * <p>
     * 逐条检查并写入：遇到重复注册立即停止，之前已写入的订阅保留（不回滚），
     * 并通过 {@link SubscriptionConflictException#getCreated()} 返回给调用方。
     *
     * @param callerId 调用方（所有者）ID
     * @param name     订阅名称
     * @param config   投递配置
     * @param events   事件名列表
     * @return 已创建的订阅（带 ID）
     * @throws SubscriptionConflictException 同一用户对某个事件已存在订阅
     */
    public List<WebhookSubscription> create(String callerId, String name, SubscriptionConfig config,
            List<String> events) {
        urlValidator.validate(config.getUrl());

        LocalDateTime now = now();
        List<WebhookSubscription> candidates = events.stream()
                .map(event -> WebhookSubscription.builder()
                        .name(name)
                        .eventName(event)
                        .createdById(callerId)
                        .active(true)
                        .config(copyOf(config))
                        .createdDateUtc(now)
                        .lastModifiedDateUtc(now)
                        .build())
                .collect(Collectors.toList());

        List<WebhookSubscription> created = new ArrayList<>();
        for (WebhookSubscription sub : candidates) {
            if (store.findByOwnerAndEvent(sub.getCreatedById(), sub.getEventName()).isPresent()) {
                log.warn("Duplicate subscription to event {} by user {}", sub.getEventName(), callerId);
                throw new SubscriptionConflictException(sub.getEventName(), created);
            }

            sub.setId(store.add(sub));
            created.add(sub);

            log.info("Created subscription {} to event {} by user {}", sub.getId(), sub.getEventName(), callerId);
        }

        return created;
    }

    /**
     * 查询订阅及其最近的投递历史（最新在前）。
     *
     * @param callerId 调用方 ID
     * @param id       订阅 ID
     * @return 订阅详情
     */
    public SubscriptionDetailResponse get(String callerId, Long id) {
        WebhookSubscription subscription = findOrThrow(id);

        List<SubscriptionDeliveryResult> history = store.searchHistory(id, maxHistoryResults).stream()
                .sorted(Comparator.comparing(SubscriptionDeliveryResult::getAttemptedDateUtc).reversed())
                .collect(Collectors.toList());

        log.info("Retrieved subscription {} by user {}", subscription.getId(), callerId);

        return SubscriptionDetailResponse.builder()
                .subscription(subscription)
                .history(history)
                .build();
    }

    public List<WebhookSubscription> list(String callerId) {
        List<WebhookSubscription> subscriptions = new ArrayList<>(store.findByOwner(callerId));

        log.info("Listed subscriptions for user {}", callerId);

        return subscriptions;
    }

    /**
     * 局部更新订阅。
     * <p>
     * url/secret/contentType 仅在传入非空且与当前值（忽略大小写）不同时覆盖；
     * active 仅在传入且不同时覆盖；lastModifiedDateUtc 总是刷新。
     *
     * @param callerId 调用方 ID
     * @param id       订阅 ID
     * @param request  更新字段
     * @return 更新后的订阅
     */
    public WebhookSubscription update(String callerId, Long id, UpdateSubscriptionRequest request) {
        LocalDateTime now = now();
        WebhookSubscription subscription = findOrThrow(id);

        SubscriptionConfig config = subscription.getConfig();
        if (config == null) {
            config = new SubscriptionConfig();
            subscription.setConfig(config);
        }

        if (changed(request.getUrl(), config.getUrl())) {
            urlValidator.validate(request.getUrl());
            config.setUrl(request.getUrl());
        }
        if (changed(request.getSecret(), config.getSecret())) {
            config.setSecret(request.getSecret());
        }
        if (changed(request.getContentType(), config.getContentType())) {
            config.setContentType(request.getContentType());
        }
        if (request.getActive() != null && request.getActive() != subscription.isActive()) {
            subscription.setActive(request.getActive());
        }
        subscription.setLastModifiedDateUtc(now);

        store.update(id, subscription);

        log.info("Updated subscription {} by user {}", subscription.getId(), callerId);

        return subscription;
    }

    public void delete(String callerId, Long id) {
        WebhookSubscription subscription = findOrThrow(id);

        store.delete(subscription.getId());

        log.info("Deleted subscription {} by user {}", subscription.getId(), callerId);
    }

    private WebhookSubscription findOrThrow(Long id) {
        return store.getById(id).orElseThrow(() -> new SubscriptionNotFoundException(id));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    private static boolean changed(String incoming, String current) {
        return StringUtils.hasLength(incoming) && !incoming.equalsIgnoreCase(current);
    }

    private static SubscriptionConfig copyOf(SubscriptionConfig config) {
        return SubscriptionConfig.builder()
                .url(config.getUrl())
                .secret(config.getSecret())
                .contentType(config.getContentType())
                .build();
    }
}
