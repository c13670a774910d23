/*
 * どこで: Tariff API
 * 何を: 料率 1 件の応答形式を定義する
 * なぜ: tariffs テーブルの列名と同じ snake_case で返すため
 */
package com.insurancecost.tariff.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.insurancecost.tariff.model.TariffRecord;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TariffResponse(LocalDate date, String cargoType, double rate) {

  public static TariffResponse from(TariffRecord record) {
    return new TariffResponse(record.date(), record.cargoType(), record.rate());
  }
}
