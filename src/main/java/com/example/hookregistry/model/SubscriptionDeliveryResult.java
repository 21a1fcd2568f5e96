package com.example.hookregistry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 单次投递尝试的结果，由中继（relay）上报。
 * 入库后不再修改。
 */
@Entity
@Table(name = "subscription_delivery_result", indexes = {
        @Index(name = "idx_delivery_result_subscription", columnList = "subscription_id, attempted_date_utc")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDeliveryResult {

    @JsonIgnore
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long recordId;

    /**
     * 中继分配的结果 ID，对外即 "id"。
     */
    @NotBlank
    @JsonProperty("id")
    @Column(name = "result_id", nullable = false)
    private String resultId;

    @NotNull
    @Column(name = "subscription_id", nullable = false)
    private Long subscriptionId;

    @NotNull
    @Column(name = "status_code", nullable = false)
    private Integer statusCode;

    @NotNull
    @Column(name = "attempted_date_utc", nullable = false)
    private LocalDateTime attemptedDateUtc;
}
