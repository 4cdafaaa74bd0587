package com.gentoro.codenexus.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. A {@link CodeNexusException} keeps its
   * code and context; anything else is reported as {@link CodeNexusErrorCode#INTERNAL_ERROR}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof CodeNexusException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getSuggestion(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        CodeNexusErrorCode.INTERNAL_ERROR,
        CodeNexusErrorCode.INTERNAL_ERROR.suggestion(),
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static CodeNexusException rethrowIfUnchecked(
      Throwable t, Function<Throwable, CodeNexusException> supplier) {
    if (t instanceof CodeNexusException) {
      return (CodeNexusException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
