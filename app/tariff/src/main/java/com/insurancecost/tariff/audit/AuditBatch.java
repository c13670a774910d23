/*
 * どこで: 監査ログ送信のバッチ
 * 何を: シリアライズ済みの監査エントリをバイト数/件数の上限付きで蓄積する
 * なぜ: 1 回の送信単位を有界にし、満杯を呼び出し側へ通知するため
 */
package com.insurancecost.tariff.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class AuditBatch {

  private final int maxBytes;
  private final int maxEntries;
  private final List<AuditRecord> records = new ArrayList<>();
  private int sizeInBytes;
  private boolean closed;

  public AuditBatch(int maxBytes, int maxEntries) {
    if (maxBytes <= 0 || maxEntries <= 0) {
      throw new IllegalArgumentException("batch limits must be positive");
    }
    this.maxBytes = maxBytes;
    this.maxEntries = maxEntries;
  }

  /**
   * 上限に収まる場合だけ追加する。
   *
   * <p>空のバッチは上限を超えるエントリでも 1 件目として受け入れる。
   *
   * @return 満杯で追加できなかった場合は false
   */
  public synchronized boolean tryAppend(Instant timestamp, String key, byte[] value) {
    if (closed) {
      throw new IllegalStateException("audit batch is closed");
    }
    if (!records.isEmpty()
        && (sizeInBytes + value.length > maxBytes || records.size() >= maxEntries)) {
      return false;
    }
    records.add(new AuditRecord(timestamp, key, value.clone()));
    sizeInBytes += value.length;
    return true;
  }

  public synchronized int remainingBytes() {
    return Math.max(0, maxBytes - sizeInBytes);
  }

  public synchronized void close() {
    closed = true;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public synchronized boolean isEmpty() {
    return records.isEmpty();
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized List<AuditRecord> records() {
    return List.copyOf(records);
  }

  /** timestamp と key は未指定 (null) を許容する。 */
  public record AuditRecord(Instant timestamp, String key, byte[] value) {}
}
