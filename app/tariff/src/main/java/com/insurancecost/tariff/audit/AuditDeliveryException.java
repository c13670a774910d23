/*
 * どこで: 監査ログ送信
 * 何を: 監査バッチの送信失敗を表現する
 * なぜ: 送信失敗を料率変更の失敗と区別して握りつぶせるようにするため
 */
package com.insurancecost.tariff.audit;

public class AuditDeliveryException extends RuntimeException {
  public AuditDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
