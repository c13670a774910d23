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
public record TariffRateUpdateRequest(
    @NotNull(message = "tariff_date is required") LocalDate tariffDate,
    @NotBlank(message = "cargo_type is required")
    @Size(max = 50, message = "cargo_type must be at most 50 characters")
    String cargoType,
    @NotNull(message = "new_rate is required") @Positive(message = "new_rate must be positive")
    @DecimalMax(value = FiniteNumbers.MAX_FINITE, message = "new_rate must be a finite number")
    Double newRate) {}
