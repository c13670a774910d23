/*
 * どこで: Tariff API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.insurancecost.tariff.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    TARIFF_NOT_FOUND,
    STORE_UNAVAILABLE,
    INTERNAL_ERROR
}
