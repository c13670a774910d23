/*
 * どこで: Tariff 内部 API
 * 何を: 一括登録ペイロード内の 1 件 (貨物種別と料率) を保持する
 * なぜ: 日付ごとのリストを要素単位で検証するため
 */
package com.insurancecost.tariff.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlainTariffRequest(
    @NotBlank(message = "cargo_type is required")
    @Size(max = 50, message = "cargo_type must be at most 50 characters")
    String cargoType,
    @NotNull(message = "rate is required") @Positive(message = "rate must be positive")
    @DecimalMax(value = FiniteNumbers.MAX_FINITE, message = "rate must be a finite number")
    Double rate) {}
