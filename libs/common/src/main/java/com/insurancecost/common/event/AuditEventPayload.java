/*
 * どこで: common のイベント payload 定義
 * 何を: 監査ストリームへ流す 1 件分の操作記録を表す
 * なぜ: 監査ログの consumer と同一のペイロード形状を共有するため
 */
package com.insurancecost.common.event;

public record AuditEventPayload(String user, String operation, String message) {}
