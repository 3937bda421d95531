package com.gentoro.specops.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("Analyzer exceptions keep code and context in error details")
  void detailsFromAnalyzerException() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(
            new AnalysisCancelledException("stop", Map.of("stage", "extraction")));
    assertEquals("AnalysisCancelledException", details.type);
    assertEquals(SpecOpsErrorCode.CANCELLED, details.code);
    assertEquals("extraction", details.context.get("stage"));
    assertTrue(details.toString().startsWith("AnalysisCancelledException[CANCELLED]: stop"));
  }

  @Test
  @DisplayName("Foreign exceptions map to UNKNOWN")
  void detailsFromForeignException() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(SpecOpsErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
  }

  @Test
  @DisplayName("Compact stack traces keep at most the requested frames")
  void compactStackTrace() {
    Exception e = new RuntimeException("x");
    String trace = ExceptionUtil.formatCompactStackTrace(e, 2);
    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace"));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  @DisplayName("toString includes code, context and cause")
  void exceptionToString() {
    SpecOpsException e =
        new IoException("cannot read", new java.io.IOException("denied"));
    assertEquals(
        "IoException{code=IO_ERROR, message=cannot read, cause=IOException}", e.toString());
  }
}
