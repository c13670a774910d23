/*
 * どこで: Tariff ドメインモデル
 * 何を: tariffs テーブルの 1 行 (日付 x 貨物種別の料率) を表す
 * なぜ: API 応答と監査メッセージで同じスナップショットを使うため
 */
package com.insurancecost.tariff.model;

import java.time.LocalDate;

public record TariffRecord(LocalDate date, String cargoType, double rate) {}
