package com.gentoro.cppindexer.exception;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link CppIndexerException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof CppIndexerException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), safeMessage(t.getMessage()), ErrorCode.UNKNOWN, Map.of(),
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

  /**
   * Message of the innermost cause that has one, prefixed by its simple class name. Used for
   * single-line log entries about per-file or per-command failures.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    Throwable withMessage = null;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        withMessage = current;
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }
    if (withMessage == null) {
      return t.getClass().getSimpleName();
    }
    return withMessage.getClass().getSimpleName() + ": " + withMessage.getMessage().trim();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static CppIndexerException rethrowIfUnchecked(
      Throwable t, Function<Throwable, CppIndexerException> supplier) {
    if (t instanceof CppIndexerException) {
      return (CppIndexerException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
