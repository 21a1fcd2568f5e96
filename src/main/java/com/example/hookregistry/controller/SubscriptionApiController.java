package com.example.hookregistry.controller;

import com.example.hookregistry.dto.CreateSubscriptionRequest;
import com.example.hookregistry.dto.SearchSubscriptionsResponse;
import com.example.hookregistry.dto.SubscriptionDetailResponse;
import com.example.hookregistry.dto.SubscriptionListResponse;
import com.example.hookregistry.dto.UpdateSubscriptionHistoryRequest;
import com.example.hookregistry.dto.UpdateSubscriptionRequest;
import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import com.example.hookregistry.service.DeliveryHistoryService;
import com.example.hookregistry.service.SubscriptionSearchService;
import com.example.hookregistry.service.SubscriptionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 订阅管理 API。
 * 调用方身份由上游解析后通过 X-User-Id 请求头传入。
 */
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Validated
public class SubscriptionApiController {

    public static final String CALLER_HEADER = "X-User-Id";

    private final SubscriptionService subscriptionService;
    private final SubscriptionSearchService searchService;
    private final DeliveryHistoryService deliveryHistoryService;

    /**
     * 按事件名查询启用的订阅（不区分所有者）。
     *
     * @param callerId  调用方 ID
     * @param eventName 事件名
     * @return 订阅者列表
     */
    @GetMapping("/search")
    public SearchSubscriptionsResponse search(@RequestHeader(CALLER_HEADER) String callerId,
            @RequestParam String eventName) {
        return new SearchSubscriptionsResponse(searchService.searchByEvent(callerId, eventName));
    }

    /**
     * 创建订阅。
     *
     * @param callerId 调用方 ID
     * @param request  创建请求
     * @return 已创建的订阅
     */
    @PostMapping
    public ResponseEntity<SubscriptionListResponse> create(@RequestHeader(CALLER_HEADER) String callerId,
            @Valid @RequestBody CreateSubscriptionRequest request) {
        List<WebhookSubscription> created = subscriptionService.create(callerId, request.getName(),
                request.getConfig(), request.getEvents());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SubscriptionListResponse(created));
    }

    @GetMapping
    public SubscriptionListResponse list(@RequestHeader(CALLER_HEADER) String callerId) {
        return new SubscriptionListResponse(subscriptionService.list(callerId));
    }

    @GetMapping("/{id}")
    public SubscriptionDetailResponse get(@RequestHeader(CALLER_HEADER) String callerId, @PathVariable Long id) {
        return subscriptionService.get(callerId, id);
    }

    /**
     * 查询订阅最近的投递历史。
     *
     * @param id    订阅 ID
     * @param limit 最多返回条数
     * @return 投递结果（最新在前）
     */
    @GetMapping("/{id}/history")
    public List<SubscriptionDeliveryResult> history(@PathVariable Long id,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return searchService.searchHistory(id, limit);
    }

    @PutMapping("/{id}")
    public WebhookSubscription update(@RequestHeader(CALLER_HEADER) String callerId, @PathVariable Long id,
            @RequestBody UpdateSubscriptionRequest request) {
        return subscriptionService.update(callerId, id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(CALLER_HEADER) String callerId, @PathVariable Long id) {
        subscriptionService.delete(callerId, id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 批量写入投递历史，空列表不做任何处理。
     *
     * @param callerId 调用方 ID
     * @param request  投递结果
     * @return 204
     */
    @PutMapping("/history")
    public ResponseEntity<Void> updateHistory(@RequestHeader(CALLER_HEADER) String callerId,
            @Valid @RequestBody UpdateSubscriptionHistoryRequest request) {
        deliveryHistoryService.updateHistory(callerId, request.getResults());
        return ResponseEntity.noContent().build();
    }
}
