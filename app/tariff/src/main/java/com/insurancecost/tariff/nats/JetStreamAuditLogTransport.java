/*
 * どこで: 監査ログの NATS 送信
 * 何を: 監査バッチの各エントリを JetStream へ publish し、全件の puback を待つ
 * なぜ: バッチ単位で送信成否を判定し、Nats-Msg-Id で再送時の重複を排除するため
 */
package com.insurancecost.tariff.nats;

import com.insurancecost.tariff.audit.AuditBatch;
import com.insurancecost.tariff.audit.AuditDeliveryException;
import com.insurancecost.tariff.audit.AuditLogTransport;
import com.insurancecost.tariff.config.TariffAuditProperties;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JetStreamAuditLogTransport implements AuditLogTransport {

  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_OCCURRED_AT = "occurred_at";

  private final JetStream jetStream;
  private final TariffAuditProperties properties;

  @Override
  public AuditBatch createBatch() {
    return new AuditBatch(properties.batchMaxBytes(), properties.batchMaxEntries());
  }

  @Override
  public void sendBatch(AuditBatch batch, String subject) {
    batch.close();
    final List<CompletableFuture<PublishAck>> acks = new ArrayList<>();
    for (AuditBatch.AuditRecord record : batch.records()) {
      acks.add(jetStream.publishAsync(subject, buildHeaders(record), record.value()));
    }
    try {
      // puback を全件受け取れた場合のみバッチ送信成功とみなす
      CompletableFuture.allOf(acks.toArray(CompletableFuture[]::new))
          .get(properties.publishTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AuditDeliveryException("interrupted while waiting for audit puback", ex);
    } catch (ExecutionException | TimeoutException ex) {
      throw new AuditDeliveryException(
          "audit batch was not acknowledged entries=" + batch.size(), ex);
    }
  }

  private Headers buildHeaders(AuditBatch.AuditRecord record) {
    final Headers headers = new Headers();
    if (record.key() != null) {
      headers.add(HEADER_MESSAGE_ID, record.key());
    }
    if (record.timestamp() != null) {
      headers.add(HEADER_OCCURRED_AT, record.timestamp().toString());
    }
    return headers;
  }
}
