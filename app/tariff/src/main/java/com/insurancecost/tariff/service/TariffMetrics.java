/*
 * どこで: Tariff サービス層
 * 何を: 料率操作と監査ログ送信のアプリ固有メトリクス記録を集約する
 * なぜ: 更新の有無と監査ログの欠落を運用で継続監視できるようにするため
 */
package com.insurancecost.tariff.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TariffMetrics {

  public static final String RESULT_AFFECTED = "affected";
  public static final String RESULT_UNCHANGED = "unchanged";
  public static final String RESULT_NOT_FOUND = "not_found";
  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_FAILURE = "failure";

  private static final String METRIC_COMMAND_TOTAL = "tariff.command.total";
  private static final String METRIC_AUDIT_DELIVERY_TOTAL = "tariff.audit.delivery.total";
  private static final String METRIC_AUDIT_DISCARDED_TOTAL = "tariff.audit.discarded.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter auditDiscardedCounter;

  public TariffMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.auditDiscardedCounter =
        Counter.builder(METRIC_AUDIT_DISCARDED_TOTAL)
            .description("Audit entries dropped because their transaction did not commit")
            .register(meterRegistry);
  }

  public void recordCommand(String operation, String result) {
    recordCommand(operation, result, 1);
  }

  public void recordCommand(String operation, String result, int count) {
    if (count <= 0) {
      return;
    }
    final String key = operation + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Tariff command executions per affected row")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordAuditDelivery(String result, int entries) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_AUDIT_DELIVERY_TOTAL)
                    .description("Audit entries handed to the audit transport")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(entries);
  }

  public void recordAuditDiscarded(int entries) {
    auditDiscardedCounter.increment(entries);
  }
}
