/*
 * どこで: 監査ログ送信
 * 何を: 料率変更の監査エントリをバッチに溜め、送信タイミングを制御する
 * なぜ: コミットされた変更だけを監査ストリームへ流し、送信失敗で業務処理を失敗させないため
 */
package com.insurancecost.tariff.audit;

import com.insurancecost.common.event.AuditEventPayload;
import com.insurancecost.common.json.CompactJson;
import com.insurancecost.tariff.config.TariffAuditProperties;
import com.insurancecost.tariff.model.AuditOperation;
import com.insurancecost.tariff.service.TariffMetrics;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 監査エントリの蓄積と送信を担う。
 *
 * <p>トランザクション内で記録されたエントリはそのトランザクション専用のバッチに入り、
 * コミット後にまとめて送信される。ロールバック時は送信せずに破棄する。トランザクション外の
 * エントリはプロセス共有のバッチに入り、満杯時または {@link #flush()} で送信される。
 */
@Component
public class AuditLogSink {

  private static final Logger logger = LoggerFactory.getLogger(AuditLogSink.class);

  private final AuditLogTransport transport;
  private final TariffAuditProperties properties;
  private final TariffMetrics metrics;
  private final Clock clock;
  private final Object sharedLock = new Object();

  // sharedLock で保護する
  private AuditBatch sharedBatch;

  public AuditLogSink(
      AuditLogTransport transport,
      TariffAuditProperties properties,
      TariffMetrics metrics,
      Clock clock) {
    this.transport = transport;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public void log(String user, AuditOperation operation, String message) {
    final byte[] value =
        CompactJson.encode(new AuditEventPayload(user, operation.value(), message));
    final Instant timestamp = Instant.now(clock);
    final String key = UUID.randomUUID().toString();
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      currentScope().append(timestamp, key, value);
      return;
    }
    // TariffService の操作は常にトランザクション内なので、ここに来るのはトランザクション外の呼び出し元だけ
    final AuditBatch full;
    synchronized (sharedLock) {
      if (sharedBatch == null) {
        sharedBatch = transport.createBatch();
      }
      if (sharedBatch.tryAppend(timestamp, key, value)) {
        return;
      }
      full = sharedBatch;
      sharedBatch = transport.createBatch();
      sharedBatch.tryAppend(timestamp, key, value);
    }
    // ネットワーク I/O はロック外で行い、他スレッドの log を待たせない
    deliver(full);
  }

  /** 共有バッチを満杯でなくても閉じて送信する。 */
  public void flush() {
    final AuditBatch batch;
    synchronized (sharedLock) {
      batch = sharedBatch;
      sharedBatch = null;
    }
    if (batch != null) {
      deliver(batch);
    }
  }

  @PreDestroy
  public void close() {
    flush();
  }

  private void deliver(AuditBatch batch) {
    if (batch.isEmpty()) {
      batch.close();
      return;
    }
    final int entries = batch.size();
    try {
      transport.sendBatch(batch, properties.subject());
      metrics.recordAuditDelivery(TariffMetrics.RESULT_SUCCESS, entries);
    } catch (RuntimeException ex) {
      // 監査ログは best-effort。コミット済みの料率変更は取り消さない
      logger.warn(
          "audit batch delivery failed entries={} subject={}", entries, properties.subject(), ex);
      metrics.recordAuditDelivery(TariffMetrics.RESULT_FAILURE, entries);
    }
  }

  private TransactionAuditScope currentScope() {
    TransactionAuditScope scope =
        (TransactionAuditScope) TransactionSynchronizationManager.getResource(this);
    if (scope == null) {
      scope = new TransactionAuditScope();
      TransactionSynchronizationManager.bindResource(this, scope);
      TransactionSynchronizationManager.registerSynchronization(scope);
    }
    return scope;
  }

  private final class TransactionAuditScope implements TransactionSynchronization {

    private final List<AuditBatch> sealed = new ArrayList<>();
    private AuditBatch current = transport.createBatch();

    void append(Instant timestamp, String key, byte[] value) {
      if (current.tryAppend(timestamp, key, value)) {
        return;
      }
      // コミット結果が確定するまで送信しないため、満杯のバッチは封印して保持する
      current.close();
      sealed.add(current);
      current = transport.createBatch();
      current.tryAppend(timestamp, key, value);
    }

    @Override
    public void suspend() {
      TransactionSynchronizationManager.unbindResource(AuditLogSink.this);
    }

    @Override
    public void resume() {
      TransactionSynchronizationManager.bindResource(AuditLogSink.this, this);
    }

    @Override
    public void afterCompletion(int status) {
      TransactionSynchronizationManager.unbindResourceIfPossible(AuditLogSink.this);
      final List<AuditBatch> batches = new ArrayList<>(sealed);
      batches.add(current);
      if (status == STATUS_COMMITTED) {
        batches.forEach(AuditLogSink.this::deliver);
        return;
      }
      final int discarded = batches.stream().mapToInt(AuditBatch::size).sum();
      if (discarded > 0) {
        logger.debug("discarded audit entries of an uncommitted transaction entries={}", discarded);
        metrics.recordAuditDiscarded(discarded);
      }
    }
  }
}
