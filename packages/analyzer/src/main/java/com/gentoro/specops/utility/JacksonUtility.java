package com.gentoro.specops.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.gentoro.specops.exception.SerializationException;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT);

  private static final ObjectMapper TOML_MAPPER = new TomlMapper();

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getTomlMapper() {
    return TOML_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
