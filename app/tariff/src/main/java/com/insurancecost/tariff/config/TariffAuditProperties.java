/*
 * どこで: Tariff アプリの設定バインド
 * 何を: 監査ストリームの送信先とバッチ上限を保持する
 * なぜ: 監査ログの送信先と flush 間隔を環境ごとに切り替えるため
 */
package com.insurancecost.tariff.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "insurance.audit")
public record TariffAuditProperties(
                @NotBlank String user,
                @NotBlank String subject,
                @NotBlank String stream,
                @NotNull @DurationMin(millis = 1, message = "duplicate-window must be positive")
                Duration duplicateWindow,
                @Positive int batchMaxBytes,
                @Positive int batchMaxEntries,
                @NotNull @DurationMin(millis = 1, message = "publish-timeout must be positive")
                Duration publishTimeout,
                @NotNull @DurationMin(millis = 1, message = "flush-interval must be positive")
                Duration flushInterval) {
}
