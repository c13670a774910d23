/*
 * どこで: 監査ログ送信の抽象
 * 何を: バッチの生成と送信先への一括送信を定義する
 * なぜ: NATS 有効/無効で送信実装を差し替えられるようにするため
 */
package com.insurancecost.tariff.audit;

public interface AuditLogTransport {

  AuditBatch createBatch();

  /**
   * バッチを閉じて 1 単位として送信する。
   *
   * @throws AuditDeliveryException 送信確認が取れなかった場合
   */
  void sendBatch(AuditBatch batch, String subject);
}
