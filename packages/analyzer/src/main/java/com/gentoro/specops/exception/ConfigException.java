package com.gentoro.specops.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends SpecOpsException {
  public ConfigException(String message) {
    super(SpecOpsErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SpecOpsErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
