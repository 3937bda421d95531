package com.gentoro.specops.exception;

import java.util.Map;

/** The caller cancelled a running analysis; raised between files, never mid-file. */
public class AnalysisCancelledException extends SpecOpsException {
  public AnalysisCancelledException(String message, Map<String, ?> context) {
    super(SpecOpsErrorCode.CANCELLED, message, context);
  }
}
