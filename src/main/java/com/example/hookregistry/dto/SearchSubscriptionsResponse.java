package com.example.hookregistry.dto;

import com.example.hookregistry.model.SubscriptionRelayConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchSubscriptionsResponse {

    private List<SubscriptionRelayConfig> subscribers;
}
