package com.example.hookregistry.dto;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.WebhookSubscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 订阅详情：订阅本身 + 最近的投递历史（最新在前）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDetailResponse {

    private WebhookSubscription subscription;

    private List<SubscriptionDeliveryResult> history;
}
