package com.flamingo.ai.eventassistant.model;

import com.flamingo.ai.eventassistant.exception.ModelBackendException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** {@link ModelBackend} over a LangChain4j chat model and embedding model. */
@Slf4j
public class LangChain4jModelBackend implements ModelBackend {

  // Conservative character budget below the provider token limit
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final String name;
  private final ChatModel chatModel;
  private final EmbeddingModel embeddingModel;
  private final StructuredResponseParser parser;

  public LangChain4jModelBackend(
      String name,
      ChatModel chatModel,
      EmbeddingModel embeddingModel,
      StructuredResponseParser parser) {
    this.name = name;
    this.chatModel = chatModel;
    this.embeddingModel = embeddingModel;
    this.parser = parser;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  @Retry(name = "modelBackend")
  @CircuitBreaker(name = "modelBackend")
  public String generate(String prompt, double temperature) {
    ChatResponse response;
    try {
      ChatRequest request =
          ChatRequest.builder()
              .messages(UserMessage.from(prompt))
              .temperature(temperature)
              .build();
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      throw new ModelBackendException(name, "Chat call failed: " + e.getMessage(), e);
    }
    String text =
        response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
    if (text == null || text.isBlank()) {
      throw new ModelBackendException(name, "Model returned an empty response");
    }
    log.debug("[{}] generated {} chars", name, text.length());
    return text;
  }

  @Override
  @Retry(name = "modelBackend")
  @CircuitBreaker(name = "modelBackend")
  public <T> T generateStructured(String prompt, Class<T> schema, double temperature) {
    String raw = generate(prompt, temperature);
    return parser.parse(name, raw, schema);
  }

  @Override
  @Retry(name = "modelBackend")
  @CircuitBreaker(name = "modelBackend")
  public List<Float> embed(String text) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response;
    try {
      response = embeddingModel.embed(input);
    } catch (RuntimeException e) {
      throw new ModelBackendException(name, "Embedding call failed: " + e.getMessage(), e);
    }
    if (response == null || response.content() == null) {
      throw new ModelBackendException(name, "Embedding model returned no vector");
    }
    float[] vector = response.content().vector();
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
