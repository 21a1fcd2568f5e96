package com.example.hookregistry.controller;

import com.example.hookregistry.model.SubscriptionDeliveryResult;
import com.example.hookregistry.model.SubscriptionRelayConfig;
import com.example.hookregistry.service.SubscriptionRelayService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 中继接口：查询订阅者、回报投递结果。
 */
@RestController
@RequestMapping("/api/relay")
@RequiredArgsConstructor
@Validated
public class RelayApiController {

    private final SubscriptionRelayService relayService;

    @GetMapping("/subscriptions")
    public List<SubscriptionRelayConfig> subscribers(@RequestParam String eventName) {
        return relayService.search(eventName);
    }

    @PostMapping("/results")
    public ResponseEntity<Void> report(@RequestBody @NotNull List<@NotNull @Valid SubscriptionDeliveryResult> results) {
        relayService.reportResults(results);
        return ResponseEntity.accepted().build();
    }
}
