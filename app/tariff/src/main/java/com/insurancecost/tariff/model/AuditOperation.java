/*
 * どこで: Tariff ドメインモデル
 * 何を: 監査ログに記録する変更操作の種類を定義する
 * なぜ: 監査ストリームの operation 値を固定の語彙に揃えるため
 */
package com.insurancecost.tariff.model;

public enum AuditOperation {
    UPSERT("upsert"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    AuditOperation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
