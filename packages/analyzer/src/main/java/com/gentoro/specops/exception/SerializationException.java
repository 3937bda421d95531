package com.gentoro.specops.exception;

/** JSON/YAML/TOML serialization or deserialization error. */
public class SerializationException extends SpecOpsException {
  public SerializationException(String message, Throwable cause) {
    super(SpecOpsErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
