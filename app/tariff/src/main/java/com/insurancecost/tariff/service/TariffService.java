/*
 * どこで: Tariff サービス層
 * 何を: 料率の参照/一括登録/更新/削除と監査ログ記録を担う
 * なぜ: 1 リクエスト = 1 トランザクションの範囲で料率変更と監査エントリを揃えるため
 */
package com.insurancecost.tariff.service;

import com.insurancecost.tariff.api.TariffNotFoundException;
import com.insurancecost.tariff.audit.AuditLogSink;
import com.insurancecost.tariff.config.TariffAuditProperties;
import com.insurancecost.tariff.model.AuditOperation;
import com.insurancecost.tariff.model.TariffRecord;
import com.insurancecost.tariff.repository.TariffRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TariffService {

    private static final Logger logger = LoggerFactory.getLogger(TariffService.class);

    private final TariffRepository tariffRepository;
    private final AuditLogSink auditLogSink;
    private final TariffAuditProperties auditProperties;
    private final TariffMetrics metrics;

    @Transactional(readOnly = true)
    public Optional<TariffRecord> fetch(LocalDate date, String cargoType) {
        return tariffRepository.findByKey(date, cargoType);
    }

    @Transactional(readOnly = true)
    public double evaluateCost(LocalDate date, String cargoType, double declaredPrice) {
        TariffRecord tariff = tariffRepository.findByKey(date, cargoType)
                .orElseThrow(() -> new TariffNotFoundException(date, cargoType));
        double cost = tariff.rate() * declaredPrice;
        if (!Double.isFinite(cost)) {
            // 有限の料率と価格でも積は double の範囲を超えうる
            throw new IllegalArgumentException("declared_price " + declaredPrice + " is too large for rate "
                    + tariff.rate() + " of '" + cargoType + "' on " + date);
        }
        return cost;
    }

    /**
     * 料率を一括で登録する。既存の行は料率が異なる場合のみ更新する。
     *
     * @param tariffs 空でなく、同じ日付に同じ貨物種別を含まないこと
     * @return 追加または料率が変わった行のみ
     */
    @Transactional
    public List<TariffRecord> upsert(List<TariffRecord> tariffs) {
        List<TariffRecord> affected = tariffRepository.upsertAll(tariffs);
        for (TariffRecord tariff : affected) {
            logger.info("upserted tariff {}", tariff);
            auditLogSink.log(auditProperties.user(), AuditOperation.UPSERT, tariff.toString());
        }
        String operation = AuditOperation.UPSERT.value();
        metrics.recordCommand(operation, TariffMetrics.RESULT_AFFECTED, affected.size());
        metrics.recordCommand(operation, TariffMetrics.RESULT_UNCHANGED, tariffs.size() - affected.size());
        return affected;
    }

    /**
     * 料率を更新する。
     *
     * <p>行が存在しない場合と、既に同じ料率の場合はどちらも空を返す。
     */
    @Transactional
    public Optional<TariffRecord> edit(TariffRecord tariff) {
        Optional<TariffRecord> updated = tariffRepository.updateRateIfChanged(tariff);
        String operation = AuditOperation.UPDATE.value();
        if (updated.isEmpty()) {
            metrics.recordCommand(operation, TariffMetrics.RESULT_UNCHANGED);
            return Optional.empty();
        }
        logger.info("updated tariff {}", updated.get());
        auditLogSink.log(auditProperties.user(), AuditOperation.UPDATE, updated.get().toString());
        metrics.recordCommand(operation, TariffMetrics.RESULT_AFFECTED);
        return updated;
    }

    @Transactional
    public Optional<TariffRecord> delete(LocalDate date, String cargoType) {
        Optional<TariffRecord> deleted = tariffRepository.deleteByKey(date, cargoType);
        String operation = AuditOperation.DELETE.value();
        if (deleted.isEmpty()) {
            metrics.recordCommand(operation, TariffMetrics.RESULT_NOT_FOUND);
            return Optional.empty();
        }
        logger.info("deleted tariff {}", deleted.get());
        auditLogSink.log(auditProperties.user(), AuditOperation.DELETE, deleted.get().toString());
        metrics.recordCommand(operation, TariffMetrics.RESULT_AFFECTED);
        return deleted;
    }
}
