/*
 * どこで: Tariff NATS 初期化
 * 何を: 監査ストリームの有無を確認し、無ければ作成、監査 subject や重複排除窓がずれていれば揃える
 * なぜ: 運用側で足した subject や保持設定を消さずに、監査エントリの受け口だけを保証するため
 */
package com.insurancecost.tariff.nats;

import com.insurancecost.tariff.config.TariffAuditProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class AuditJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(AuditJetStreamBootstrap.class);
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final TariffAuditProperties properties;

    @PostConstruct
    public void start() {
        try {
            JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
            Optional<StreamConfiguration> existing = findAuditStream(jetStreamManagement);
            if (existing.isEmpty()) {
                jetStreamManagement.addStream(newAuditStream());
                logger.info("audit stream created stream={} subject={} duplicateWindow={}",
                        properties.stream(), properties.subject(), properties.duplicateWindow());
                return;
            }
            StreamConfiguration current = existing.get();
            if (acceptsAuditEntries(current)) {
                logger.info("audit stream already configured stream={} subjects={}",
                        properties.stream(), current.getSubjects());
                return;
            }
            jetStreamManagement.updateStream(reconcile(current));
            logger.info("audit stream reconciled stream={} subject={} duplicateWindow={}",
                    properties.stream(), properties.subject(), properties.duplicateWindow());
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure audit stream " + properties.stream(), ex);
        }
    }

    private Optional<StreamConfiguration> findAuditStream(JetStreamManagement jetStreamManagement)
            throws IOException, JetStreamApiException {
        try {
            return Optional.of(jetStreamManagement.getStreamInfo(properties.stream()).getConfiguration());
        } catch (JetStreamApiException ex) {
            if (ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    private StreamConfiguration newAuditStream() {
        // 監査エントリはサーバ再起動後も残す
        return StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .storageType(StorageType.File)
                .duplicateWindow(properties.duplicateWindow())
                .build();
    }

    private boolean acceptsAuditEntries(StreamConfiguration current) {
        return current.getSubjects().contains(properties.subject())
                && properties.duplicateWindow().equals(current.getDuplicateWindow());
    }

    private StreamConfiguration reconcile(StreamConfiguration current) {
        StreamConfiguration.Builder builder = StreamConfiguration.builder(current)
                .duplicateWindow(properties.duplicateWindow());
        if (!current.getSubjects().contains(properties.subject())) {
            builder.addSubjects(properties.subject());
        }
        return builder.build();
    }
}
