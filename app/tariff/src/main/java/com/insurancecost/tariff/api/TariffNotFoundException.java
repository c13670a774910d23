/*
 * どこで: Tariff API
 * 何を: 指定日付/貨物種別の料率が未登録であることを表現する
 * なぜ: 評価/削除/参照の 404 応答へ変換するため
 */
package com.insurancecost.tariff.api;

import java.time.LocalDate;

public class TariffNotFoundException extends RuntimeException {
  public TariffNotFoundException(LocalDate date, String cargoType) {
    super("Tariff for '" + cargoType + "' on " + date + " is not found");
  }
}
