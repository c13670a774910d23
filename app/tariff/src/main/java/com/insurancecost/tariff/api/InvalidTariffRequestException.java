/*
 * どこで: Tariff API
 * 何を: 料率一括登録ペイロードの妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.insurancecost.tariff.api;

import java.util.List;

public class InvalidTariffRequestException extends RuntimeException {

  private final List<String> errors;

  public InvalidTariffRequestException(List<String> errors) {
    super(String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> errors() {
    return errors;
  }
}
