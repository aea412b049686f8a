package com.gentoro.linktree.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs or command output. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final LinkTreeErrorCode code;
  public final Map<String, Object> context;
  public final String timestamp;

  public ErrorDetails(
      String type,
      String message,
      LinkTreeErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp == null ? null : timestamp.toString();
  }
}
