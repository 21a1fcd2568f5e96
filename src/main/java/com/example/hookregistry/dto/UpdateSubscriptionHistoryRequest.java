package com.example.hookregistry.dto;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSubscriptionHistoryRequest {

    @NotNull
    @Builder.Default
    private List<@NotNull @Valid SubscriptionDeliveryResult> results = new ArrayList<>();
}
