/*
 * どこで: Tariff 公開 API
 * 何を: 保険料評価リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.insurancecost.tariff.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluateCostRequest(
    @NotNull(message = "insurance_date is required") LocalDate insuranceDate,
    @NotBlank(message = "cargo_type is required")
    @Size(max = 50, message = "cargo_type must be at most 50 characters")
    String cargoType,
    @NotNull(message = "declared_price is required")
    @Positive(message = "declared_price must be positive")
    @DecimalMax(value = FiniteNumbers.MAX_FINITE, message = "declared_price must be a finite number")
    Double declaredPrice) {}
