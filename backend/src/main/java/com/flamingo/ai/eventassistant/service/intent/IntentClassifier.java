package com.flamingo.ai.eventassistant.service.intent;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.domain.TextFolding;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.model.dto.IntentClassification;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Routes a query either to a curated collection or to the full search pipeline.
 *
 * <p>A failed or unparseable classification is reported as a failure; callers degrade it to
 * {@link EventIntent#SEARCH} so a query never lands in a wrong curated bucket.
 */
@Service
@Slf4j
public class IntentClassifier {

  static final String STAGE = "intent";

  private static final PromptTemplate PROMPT =
      PromptTemplate.from(
          """
          You are an intent classifier for an event discovery assistant.

          Curated categories:
          {{categories}}

          Rules:
          - If the query names a specific genre, artist, venue, topic or activity (jazz, kids,
            workshops, atölye, stand-up, a band name...), the intent is "search", even when it
            also mentions price, romance or the weekend.
          - Use a curated category only for generic requests that match its description.
          - If in doubt, return "search".

          Query: "{{query}}"

          Return ONLY a JSON object:
          {"intent": "<slug>", "confidence": <0..1>, "reasoning": "<short>"}
          """);

  private final ModelBackend modelBackend;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;

  public IntentClassifier(
      @Qualifier("fastModelBackend") ModelBackend modelBackend,
      AssistantConfig assistantConfig,
      MeterRegistry meterRegistry) {
    this.modelBackend = modelBackend;
    this.assistantConfig = assistantConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Classifies the query.
   *
   * @param query raw user text
   * @return the intent, or a failure when the model could not be reached or understood
   */
  @Timed(value = "assistant.intent", description = "Time to classify query intent")
  public StageResult<EventIntent> classify(String query) {
    String prompt =
        PROMPT.apply(Map.of("categories", describeCategories(), "query", query)).text();

    IntentClassification classification;
    try {
      classification =
          modelBackend.generateStructured(
              prompt, IntentClassification.class, assistantConfig.getIntent().getTemperature());
    } catch (RuntimeException e) {
      RetrievalError error = RetrievalError.from(STAGE, e);
      log.warn("Intent classification failed ({}): {}", error.kind(), error.message());
      meterRegistry.counter("assistant.intent.failures", "kind", error.kind().name()).increment();
      return StageResult.failure(error);
    }

    Optional<EventIntent> parsed =
        classification != null ? EventIntent.fromSlug(classification.intent()) : Optional.empty();
    if (parsed.isEmpty()) {
      String raw = classification != null ? classification.intent() : null;
      log.warn("Intent classifier returned unknown slug '{}'", raw);
      meterRegistry.counter("assistant.intent.failures", "kind", "UNKNOWN_SLUG").increment();
      return StageResult.failure(
          RetrievalError.of(
              RetrievalError.Kind.MALFORMED_RESPONSE, STAGE, "Unknown intent slug: " + raw));
    }

    EventIntent intent = parsed.get();
    if (intent.isCurated() && namesSpecificSubject(query)) {
      log.debug("Query '{}' names a specific subject, overriding {} with search", query, intent);
      intent = EventIntent.SEARCH;
    }

    log.debug(
        "Classified '{}' as {} (confidence={}, reasoning={})",
        query,
        intent.getSlug(),
        classification.confidence(),
        classification.reasoning());
    meterRegistry.counter("assistant.intent.classified", "intent", intent.getSlug()).increment();
    return StageResult.success(intent);
  }

  boolean namesSpecificSubject(String query) {
    String folded = TextFolding.fold(query);
    String[] tokens = folded.split("[^\\p{L}\\p{N}-]+");
    return assistantConfig.getIntent().getSubjectKeywords().stream()
        .map(TextFolding::fold)
        .filter(k -> !k.isEmpty())
        .anyMatch(k -> Arrays.stream(tokens).anyMatch(t -> t.startsWith(k)));
  }

  private static String describeCategories() {
    return Arrays.stream(EventIntent.values())
        .map(i -> "- " + i.getSlug() + ": " + i.getDescription())
        .collect(Collectors.joining("\n"));
  }
}
