/*
 * どこで: Tariff Web 設定
 * 何を: リクエスト ID と API 区分 (public/internal) を MDC に載せ、応答ヘッダへ返す
 * なぜ: 料率変更のログと監査ログ送信失敗を呼び出し元のリクエストに紐付けて追跡するため
 */
package com.insurancecost.tariff.config;

import com.insurancecost.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.HandlerInterceptor;

public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String MDC_REQUEST_ID = "request_id";
  static final String MDC_API_SCOPE = "api_scope";
  static final String MDC_ENDPOINT = "endpoint";

  private static final String PUBLIC_PREFIX = "/api/public/";
  private static final String INTERNAL_PREFIX = "/api/internal/";
  private static final List<String> KEYS = List.of(MDC_REQUEST_ID, MDC_API_SCOPE, MDC_ENDPOINT);

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request.getHeader(HEADER_REQUEST_ID));
    MDC.put(MDC_REQUEST_ID, requestId);
    MDC.put(MDC_API_SCOPE, apiScope(request.getRequestURI()));
    MDC.put(MDC_ENDPOINT, request.getMethod() + " " + request.getRequestURI());
    // 304 などボディの無い応答でも呼び出し側が監査ログと突き合わせられるようにする
    response.setHeader(HEADER_REQUEST_ID, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    KEYS.forEach(MDC::remove);
  }

  static String apiScope(String path) {
    if (path.startsWith(PUBLIC_PREFIX)) {
      return "public";
    }
    if (path.startsWith(INTERNAL_PREFIX)) {
      return "internal";
    }
    return "status";
  }

  private String resolveRequestId(String header) {
    return TraceIds.isPresent(header) ? header.trim() : TraceIds.newTraceId();
  }
}
