package com.flamingo.ai.eventassistant.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.eventassistant.exception.MalformedResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Binds model replies to typed records, stripping the markdown fences models like to add. */
@Component
@Slf4j
public class StructuredResponseParser {

  private final ObjectMapper objectMapper;

  public StructuredResponseParser(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Parses a raw reply.
   *
   * @param backend backend name, for error reporting
   * @param raw the model reply
   * @param schema target type
   * @return the bound value, never null
   * @throws MalformedResponseException if the reply is not JSON for {@code schema}
   */
  public <T> T parse(String backend, String raw, Class<T> schema) {
    String json = stripCodeFences(raw);
    try {
      T value = objectMapper.readValue(json, schema);
      if (value == null) {
        throw new MalformedResponseException(backend, "Model returned JSON null", raw, null);
      }
      return value;
    } catch (JsonProcessingException e) {
      log.debug("Raw response from {} could not be parsed: {}", backend, raw);
      throw new MalformedResponseException(
          backend,
          "Failed to parse " + schema.getSimpleName() + ": " + e.getOriginalMessage(),
          raw,
          e);
    }
  }

  /** Removes {@code ```json} / {@code ```} wrappers and any prose around the outermost object. */
  static String stripCodeFences(String raw) {
    if (raw == null) {
      return "";
    }
    String clean = raw.strip();
    if (clean.startsWith("```json")) {
      clean = clean.substring(7);
    } else if (clean.startsWith("```")) {
      clean = clean.substring(3);
    }
    if (clean.endsWith("```")) {
      clean = clean.substring(0, clean.length() - 3);
    }
    clean = clean.strip();
    if (!clean.startsWith("{") && !clean.startsWith("[")) {
      int start = clean.indexOf('{');
      int end = clean.lastIndexOf('}');
      if (start >= 0 && end > start) {
        clean = clean.substring(start, end + 1);
      }
    }
    return clean;
  }
}
