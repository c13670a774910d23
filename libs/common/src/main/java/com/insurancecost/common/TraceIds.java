package com.insurancecost.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isPresent(String traceId) {
    return traceId != null && !traceId.isBlank();
  }
}
