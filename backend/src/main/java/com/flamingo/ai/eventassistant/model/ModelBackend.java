package com.flamingo.ai.eventassistant.model;

import java.util.List;

/**
 * Text generation, structured generation and embeddings behind one surface. Two instances are
 * wired: a fast one and a reasoning one; which provider sits behind each is a configuration
 * decision.
 */
public interface ModelBackend {

  /** Name used in logs and metrics, e.g. {@code fast}. */
  String name();

  /**
   * Generates free text.
   *
   * @throws com.flamingo.ai.eventassistant.exception.ModelBackendException if the call fails or
   *     returns nothing
   */
  String generate(String prompt, double temperature);

  /**
   * Generates JSON and binds it to {@code schema}. Markdown code fences around the JSON are
   * tolerated.
   *
   * @throws com.flamingo.ai.eventassistant.exception.MalformedResponseException if the reply
   *     cannot be bound
   * @throws com.flamingo.ai.eventassistant.exception.ModelBackendException if the call fails
   */
  <T> T generateStructured(String prompt, Class<T> schema, double temperature);

  /**
   * Embeds text.
   *
   * @throws com.flamingo.ai.eventassistant.exception.ModelBackendException if the call fails
   */
  List<Float> embed(String text);
}
