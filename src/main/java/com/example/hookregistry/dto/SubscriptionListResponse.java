package com.example.hookregistry.dto;

import com.example.hookregistry.model.WebhookSubscription;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionListResponse {

    private List<WebhookSubscription> subscriptions;
}
