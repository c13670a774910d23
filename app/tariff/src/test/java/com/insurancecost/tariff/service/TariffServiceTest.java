/*
 * どこで: TariffService の統合テスト
 * 何を: 料率操作の結果と、コミット後だけ監査バッチが送られることを確認する
 * なぜ: 料率変更と監査エントリの整合を DB トランザクション込みで保証するため
 */
package com.insurancecost.tariff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insurancecost.tariff.AbstractPostgresContainerTest;
import com.insurancecost.tariff.api.TariffNotFoundException;
import com.insurancecost.tariff.audit.AuditBatch;
import com.insurancecost.tariff.audit.AuditLogTransport;
import com.insurancecost.tariff.model.TariffRecord;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class TariffServiceTest extends AbstractPostgresContainerTest {

  private static final String SUBJECT = "insurance.tariff.audit";
  private static final LocalDate DATE = LocalDate.parse("2024-01-01");
  private static final String ELECTRONICS = "electronics";

  @Autowired private TariffService tariffService;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private PlatformTransactionManager transactionManager;
  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private AuditLogTransport auditLogTransport;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM tariffs", new MapSqlParameterSource());
    when(auditLogTransport.createBatch()).thenAnswer(invocation -> new AuditBatch(16384, 500));
  }

  @Test
  void costScenarioFollowsEditAndDelete() {
    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));
    assertThat(tariffService.evaluateCost(DATE, ELECTRONICS, 200.0)).isEqualTo(300.0);

    assertThat(tariffService.edit(new TariffRecord(DATE, ELECTRONICS, 2.0)))
        .contains(new TariffRecord(DATE, ELECTRONICS, 2.0));
    assertThat(tariffService.evaluateCost(DATE, ELECTRONICS, 200.0)).isEqualTo(400.0);

    assertThat(tariffService.delete(DATE, ELECTRONICS))
        .contains(new TariffRecord(DATE, ELECTRONICS, 2.0));
    assertThatThrownBy(() -> tariffService.evaluateCost(DATE, ELECTRONICS, 200.0))
        .isInstanceOf(TariffNotFoundException.class)
        .hasMessage("Tariff for 'electronics' on 2024-01-01 is not found");

    final List<JsonNode> entries = sentEntries(3);
    assertThat(entries)
        .extracting(entry -> entry.get("operation").asText())
        .containsExactly("upsert", "update", "delete");
    assertThat(entries).allSatisfy(entry -> assertThat(entry.get("user").asText()).isEqualTo("test-service"));
    assertThat(entries.get(1).get("message").asText())
        .isEqualTo(new TariffRecord(DATE, ELECTRONICS, 2.0).toString());
  }

  @Test
  void evaluateCostRejectsProductBeyondDoubleRange() {
    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 2.0)));

    assertThatThrownBy(() -> tariffService.evaluateCost(DATE, ELECTRONICS, 1e308))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("declared_price 1.0E308 is too large for rate 2.0");
    assertThat(tariffService.evaluateCost(DATE, ELECTRONICS, 1e307)).isEqualTo(2e307);
  }

  @Test
  void upsertAuditsOnlyAffectedRowsInOneBatch() {
    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));
    clearInvocations(auditLogTransport);

    final List<TariffRecord> affected =
        tariffService.upsert(
            List.of(
                new TariffRecord(DATE, ELECTRONICS, 1.5),
                new TariffRecord(DATE, "glass", 0.04),
                new TariffRecord(DATE, "furniture", 0.5)));

    assertThat(affected).hasSize(2);
    final ArgumentCaptor<AuditBatch> captor = ArgumentCaptor.forClass(AuditBatch.class);
    verify(auditLogTransport).sendBatch(captor.capture(), eq(SUBJECT));
    assertThat(captor.getValue().size()).isEqualTo(2);
  }

  @Test
  void unchangedUpsertEmitsNoAuditEntry() {
    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));
    clearInvocations(auditLogTransport);

    assertThat(tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)))).isEmpty();

    verify(auditLogTransport, never()).sendBatch(any(), any());
  }

  @Test
  void editWithEqualRateEmitsNoAuditEntry() {
    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));
    clearInvocations(auditLogTransport);

    assertThat(tariffService.edit(new TariffRecord(DATE, ELECTRONICS, 1.5))).isEmpty();
    assertThat(tariffService.edit(new TariffRecord(DATE, "missing", 1.5))).isEmpty();
    assertThat(tariffService.delete(DATE, "missing")).isEmpty();

    verify(auditLogTransport, never()).sendBatch(any(), any());
    assertThat(tariffService.fetch(DATE, "missing")).isEmpty();
  }

  @Test
  void rolledBackTransactionDiscardsAuditEntries() {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

    transactionTemplate.executeWithoutResult(
        status -> {
          tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));
          tariffService.delete(DATE, ELECTRONICS);
          status.setRollbackOnly();
        });

    verify(auditLogTransport, never()).sendBatch(any(), any());
    assertThat(tariffService.fetch(DATE, ELECTRONICS)).isEmpty();
  }

  @Test
  void auditDeliveryFailureDoesNotUndoCommittedChange() {
    doThrow(new IllegalStateException("nats unavailable"))
        .when(auditLogTransport)
        .sendBatch(any(), any());

    tariffService.upsert(List.of(new TariffRecord(DATE, ELECTRONICS, 1.5)));

    assertThat(tariffService.fetch(DATE, ELECTRONICS))
        .contains(new TariffRecord(DATE, ELECTRONICS, 1.5));
  }

  private List<JsonNode> sentEntries(int expectedBatches) {
    final ArgumentCaptor<AuditBatch> captor = ArgumentCaptor.forClass(AuditBatch.class);
    verify(auditLogTransport, times(expectedBatches)).sendBatch(captor.capture(), eq(SUBJECT));
    return captor.getAllValues().stream()
        .flatMap(batch -> batch.records().stream())
        .map(record -> readTree(record.value()))
        .toList();
  }

  private JsonNode readTree(byte[] value) {
    try {
      return objectMapper.readTree(value);
    } catch (IOException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
