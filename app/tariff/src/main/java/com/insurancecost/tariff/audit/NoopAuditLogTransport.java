/*
 * どこで: 監査ログ送信
 * 何を: NATS 無効時に監査バッチを破棄するダミー送信を提供する
 * なぜ: ローカルテストで NATS なしでも Service を起動可能にするため
 */
package com.insurancecost.tariff.audit;

import com.insurancecost.tariff.config.TariffAuditProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
@RequiredArgsConstructor
public class NoopAuditLogTransport implements AuditLogTransport {

  private static final Logger logger = LoggerFactory.getLogger(NoopAuditLogTransport.class);

  private final TariffAuditProperties properties;

  @Override
  public AuditBatch createBatch() {
    return new AuditBatch(properties.batchMaxBytes(), properties.batchMaxEntries());
  }

  @Override
  public void sendBatch(AuditBatch batch, String subject) {
    batch.close();
    logger.debug("audit transport disabled; dropped entries={} subject={}", batch.size(), subject);
  }
}
