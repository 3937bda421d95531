package com.gentoro.specops.exception;

import java.util.Map;

/** A typed record (concept, setup step, code example, dependency) failed validation. */
public class ValidationException extends SpecOpsException {
  public ValidationException(String message, Map<String, ?> context) {
    super(SpecOpsErrorCode.INVALID_ARGUMENT, message, context);
  }
}
