package com.gentoro.specops.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/** Turns exceptions into the structured and single-line forms used in analyzer log lines. */
public final class ExceptionUtil {
  static final int DEFAULT_FRAMES = 5;

  private ExceptionUtil() {}

  /** Code and context survive for {@link SpecOpsException}; anything else maps to UNKNOWN. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    SpecOpsErrorCode code = SpecOpsErrorCode.UNKNOWN;
    Map<String, Object> context = null;
    if (t instanceof SpecOpsException ex) {
      code = ex.getCode();
      context = ex.getContext();
    }
    String message = t.getMessage() == null ? "" : t.getMessage();
    return new ErrorDetails(t.getClass().getSimpleName(), message, code, context, Instant.now());
  }

  /**
   * Top {@code maxFrames} frames (all when {@code maxFrames <= 0}) joined with {@code " > "},
   * e.g. {@code a.B.run (B.java:12) > a.C.main (C.java:3)}.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null || t.getStackTrace() == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    int limit = maxFrames <= 0 ? frames.length : Math.min(frames.length, maxFrames);
    return Arrays.stream(frames, 0, limit)
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return e.getClassName() + "." + e.getMethodName() + " (" + file + line + ")";
  }
}
