/*
 * どこで: 監査ログ送信ワーカー
 * 何を: スケジュールで共有バッチを flush する
 * なぜ: トランザクション外で記録されたエントリが満杯待ちで滞留しないようにするため
 */
package com.insurancecost.tariff.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditFlushWorker {

    private final AuditLogSink auditLogSink;

    // 共有バッチはトランザクション外の log だけが使う。トランザクション内のエントリはコミット時に送られる
    @Scheduled(fixedDelayString = "${insurance.audit.flush-interval}")
    public void run() {
        auditLogSink.flush();
    }
}
