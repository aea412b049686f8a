package com.gentoro.linktree.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * LinkTreeException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof LinkTreeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    LinkTreeErrorCode code =
        t instanceof IllegalArgumentException
            ? LinkTreeErrorCode.INVALID_ARGUMENT
            : LinkTreeErrorCode.UNKNOWN;
    return new ErrorDetails(
        t.getClass().getSimpleName(), safeMessage(t.getMessage()), code, null, Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
