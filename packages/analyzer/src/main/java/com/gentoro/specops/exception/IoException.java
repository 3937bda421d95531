package com.gentoro.specops.exception;

/** I/O operation failed (missing file, permission denied, undecodable content). */
public class IoException extends SpecOpsException {
  public IoException(String message) {
    super(SpecOpsErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SpecOpsErrorCode.IO_ERROR, message, cause);
  }
}
