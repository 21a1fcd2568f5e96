package com.example.hookregistry.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 订阅的投递配置：目标地址、签名密钥与内容类型。
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionConfig {

    @NotBlank
    @Column(name = "url", nullable = false, length = 2048)
    private String url; // 例如 "https://a.test/hook"

    @Column(name = "secret", columnDefinition = "TEXT")
    private String secret;

    @Column(name = "content_type", length = 100)
    private String contentType; // 例如 "application/json"
}
