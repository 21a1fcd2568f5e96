package com.example.hookregistry.dto;

import com.example.hookregistry.model.SubscriptionConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 创建订阅请求：一个配置对应多个事件，每个事件生成一条订阅。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSubscriptionRequest {

    @NotBlank
    private String name;

    @NotEmpty
    private List<@NotBlank @Pattern(regexp = "^[A-Za-z0-9_.\\-]+$", message = "must contain only letters, digits, '.', '_' or '-'") String> events;

    @NotNull
    @Valid
    private SubscriptionConfig config;
}
