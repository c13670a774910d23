/*
 * どこで: 監査ログの NATS 送信テスト
 * 何を: ヘッダ付きの publish と puback 欠落時の失敗を確認する
 * なぜ: バッチ単位の送信成否判定を保証するため
 */
package com.insurancecost.tariff.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.insurancecost.tariff.audit.AuditBatch;
import com.insurancecost.tariff.audit.AuditDeliveryException;
import com.insurancecost.tariff.config.TariffAuditProperties;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JetStreamAuditLogTransportTest {

  private static final String SUBJECT = "insurance.tariff.audit";
  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private JetStream jetStream;

  private final TariffAuditProperties properties =
      new TariffAuditProperties(
          "tariff-service",
          SUBJECT,
          "insurance-tariff-audit",
          Duration.ofMinutes(2),
          1024,
          10,
          Duration.ofMillis(200),
          Duration.ofSeconds(1));

  @Test
  void createBatchUsesConfiguredLimits() {
    final JetStreamAuditLogTransport transport = new JetStreamAuditLogTransport(jetStream, properties);

    final AuditBatch batch = transport.createBatch();

    assertThat(batch.remainingBytes()).isEqualTo(1024);
    assertThat(batch.isEmpty()).isTrue();
  }

  @Test
  void sendBatchPublishesEveryRecordWithHeaders() {
    when(jetStream.publishAsync(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(mock(PublishAck.class)));
    final JetStreamAuditLogTransport transport = new JetStreamAuditLogTransport(jetStream, properties);
    final AuditBatch batch = transport.createBatch();
    batch.tryAppend(NOW, "key-1", "{\"a\":1}".getBytes(StandardCharsets.UTF_8));
    batch.tryAppend(NOW, "key-2", "{\"a\":2}".getBytes(StandardCharsets.UTF_8));

    transport.sendBatch(batch, SUBJECT);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    verify(jetStream, times(2))
        .publishAsync(eq(SUBJECT), headers.capture(), any(byte[].class));
    assertThat(headers.getAllValues().get(0).getFirst("Nats-Msg-Id")).isEqualTo("key-1");
    assertThat(headers.getAllValues().get(1).getFirst("Nats-Msg-Id")).isEqualTo("key-2");
    assertThat(headers.getAllValues().get(0).getFirst("occurred_at"))
        .isEqualTo("2024-01-01T00:00:00Z");
    assertThat(batch.isClosed()).isTrue();
  }

  @Test
  void sendBatchFailsWhenAnyAckIsMissing() {
    when(jetStream.publishAsync(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(mock(PublishAck.class)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no responders")));
    final JetStreamAuditLogTransport transport = new JetStreamAuditLogTransport(jetStream, properties);
    final AuditBatch batch = transport.createBatch();
    batch.tryAppend(NOW, "key-1", new byte[] {1});
    batch.tryAppend(NOW, "key-2", new byte[] {2});

    assertThatThrownBy(() -> transport.sendBatch(batch, SUBJECT))
        .isInstanceOf(AuditDeliveryException.class)
        .hasMessage("audit batch was not acknowledged entries=2");
  }

  @Test
  void sendBatchFailsWhenAckTimesOut() {
    when(jetStream.publishAsync(eq(SUBJECT), any(Headers.class), any(byte[].class)))
        .thenReturn(new CompletableFuture<>());
    final JetStreamAuditLogTransport transport = new JetStreamAuditLogTransport(jetStream, properties);
    final AuditBatch batch = transport.createBatch();
    batch.tryAppend(NOW, "key-1", new byte[] {1});

    assertThatThrownBy(() -> transport.sendBatch(batch, SUBJECT))
        .isInstanceOf(AuditDeliveryException.class)
        .hasMessage("audit batch was not acknowledged entries=1");
  }
}
