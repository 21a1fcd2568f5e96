package com.example.hookregistry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 订阅局部更新：为空的字段保持原值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSubscriptionRequest {

    private String url;

    private String secret;

    private String contentType;

    private Boolean active;
}
