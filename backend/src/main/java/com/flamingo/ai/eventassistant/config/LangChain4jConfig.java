package com.flamingo.ai.eventassistant.config;

import com.flamingo.ai.eventassistant.config.AssistantConfig.Models.Endpoint;
import com.flamingo.ai.eventassistant.model.LangChain4jModelBackend;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.model.StructuredResponseParser;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models. The provider of each endpoint is chosen here, once; the
 * pipeline only ever sees {@link ModelBackend}.
 */
@Configuration
public class LangChain4jConfig {

  private final AssistantConfig assistantConfig;

  public LangChain4jConfig(AssistantConfig assistantConfig) {
    this.assistantConfig = assistantConfig;
  }

  @Bean
  public ChatModel fastChatModel() {
    return buildChatModel("fast", assistantConfig.getModels().getFast());
  }

  @Bean
  public ChatModel reasoningChatModel() {
    return buildChatModel("reasoning", assistantConfig.getModels().getReasoning());
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    Endpoint endpoint = assistantConfig.getModels().getEmbedding();
    if (endpoint.getProvider() == AssistantConfig.ModelProvider.OLLAMA) {
      return OllamaEmbeddingModel.builder()
          .baseUrl(requireBaseUrl("embedding", endpoint))
          .modelName(endpoint.getModelName())
          .timeout(endpoint.getTimeout())
          .build();
    }
    validateApiKey("embedding", endpoint);
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(endpoint.getApiKey())
            .modelName(endpoint.getModelName())
            .timeout(endpoint.getTimeout());
    if (endpoint.getBaseUrl() != null && !endpoint.getBaseUrl().isBlank()) {
      builder.baseUrl(endpoint.getBaseUrl());
    }
    return builder.build();
  }

  /** Cheap backend: intent classification and query embeddings. */
  @Bean
  public ModelBackend fastModelBackend(
      @Qualifier("fastChatModel") ChatModel fastChatModel,
      EmbeddingModel embeddingModel,
      StructuredResponseParser structuredResponseParser) {
    return new LangChain4jModelBackend(
        "fast", fastChatModel, embeddingModel, structuredResponseParser);
  }

  /** Reasoning backend: filter extraction, relevance judging and answer synthesis. */
  @Bean
  public ModelBackend reasoningModelBackend(
      @Qualifier("reasoningChatModel") ChatModel reasoningChatModel,
      EmbeddingModel embeddingModel,
      StructuredResponseParser structuredResponseParser) {
    return new LangChain4jModelBackend(
        "reasoning", reasoningChatModel, embeddingModel, structuredResponseParser);
  }

  private ChatModel buildChatModel(String role, Endpoint endpoint) {
    if (endpoint.getProvider() == AssistantConfig.ModelProvider.OLLAMA) {
      return OllamaChatModel.builder()
          .baseUrl(requireBaseUrl(role, endpoint))
          .modelName(endpoint.getModelName())
          .timeout(endpoint.getTimeout())
          .logRequests(false)
          .logResponses(false)
          .build();
    }
    validateApiKey(role, endpoint);
    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(endpoint.getApiKey())
            .modelName(endpoint.getModelName())
            .timeout(endpoint.getTimeout())
            .logRequests(false)
            .logResponses(false);
    if (endpoint.getMaxTokens() != null) {
      builder.maxCompletionTokens(endpoint.getMaxTokens());
    }
    if (endpoint.getBaseUrl() != null && !endpoint.getBaseUrl().isBlank()) {
      builder.baseUrl(endpoint.getBaseUrl());
    }
    return builder.build();
  }

  private String requireBaseUrl(String role, Endpoint endpoint) {
    if (endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
      throw new IllegalStateException(
          "assistant.models." + role + ".base-url is required for the Ollama provider.");
    }
    return endpoint.getBaseUrl();
  }

  private void validateApiKey(String role, Endpoint endpoint) {
    if (endpoint.getApiKey() == null || endpoint.getApiKey().isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the "
              + role
              + " model. Set OPENAI_API_KEY environment variable.");
    }
  }
}
