package com.flamingo.ai.eventassistant.service.answer;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.ConversationTurn;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import com.flamingo.ai.eventassistant.domain.TurnRole;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Turns the final result set into a conversational recommendation. */
@Service
@Slf4j
public class AnswerSynthesizer {

  static final String STAGE = "answer";

  private static final PromptTemplate PROMPT =
      PromptTemplate.from(
          """
          You are a friendly event discovery assistant for Turkey.

          Conversation so far:
          {{history}}

          User: {{query}}

          Events found for this request:
          {{events}}

          Instructions:
          - Recommend ONLY events from the list above. Never invent events, venues, dates or prices.
          - Mention the price and the date of each event you recommend.
          - If the request implies a plan (e.g. a date night or a weekend out), propose one.
          - Use the conversation to resolve references such as "the first one".
          - Answer in the language of the user's message, concisely.
          """);

  private final ModelBackend modelBackend;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;

  public AnswerSynthesizer(
      @Qualifier("reasoningModelBackend") ModelBackend modelBackend,
      AssistantConfig assistantConfig,
      MeterRegistry meterRegistry) {
    this.modelBackend = modelBackend;
    this.assistantConfig = assistantConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Writes the answer and records the exchange in the session on success.
   *
   * <p>Empty results get the fixed no-match message without a model call. A failed model call
   * gets the fixed fallback sentence. Neither touches the session.
   *
   * @param query raw user text
   * @param results final result groups, best first
   * @param session conversation the query belongs to
   * @return text for the user; never null
   */
  @Timed(value = "assistant.answer", description = "Time to synthesize the answer")
  public String synthesize(String query, List<ResultGroup> results, ConversationSession session) {
    AssistantConfig.Answer config = assistantConfig.getAnswer();
    if (results.isEmpty()) {
      meterRegistry.counter("assistant.answer.no_match").increment();
      return config.getNoMatchMessage();
    }

    StageResult<String> answer =
        generate(query, results, session.recent(config.getHistoryWindow()));
    if (answer.isFailure()) {
      log.warn(
          "Answer generation failed ({}): {}", answer.error().kind(), answer.error().message());
      meterRegistry.counter("assistant.answer.fallback").increment();
      return config.getFallbackMessage();
    }

    String text = answer.value() != null ? answer.value().trim() : "";
    if (text.isEmpty()) {
      log.warn("Model returned an empty answer for '{}'", query);
      meterRegistry.counter("assistant.answer.fallback").increment();
      return config.getFallbackMessage();
    }
    session.appendExchange(query, text);
    meterRegistry.counter("assistant.answer.generated").increment();
    return text;
  }

  /**
   * Composes the answer for a curated collection from the curators' reasons, without a model call.
   */
  public String composeCurated(EventIntent intent, List<ResultGroup> results) {
    if (results.isEmpty()) {
      return assistantConfig.getAnswer().getNoMatchMessage();
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Here are our ").append(intent.getSlug().replace('-', ' ')).append(" picks:\n");
    for (int i = 0; i < results.size(); i++) {
      ResultGroup group = results.get(i);
      sb.append(i + 1).append(". ").append(describe(group));
      if (group.curationReason() != null && !group.curationReason().isBlank()) {
        sb.append(" - ").append(group.curationReason().trim());
      }
      sb.append("\n");
    }
    return sb.toString().trim();
  }

  private StageResult<String> generate(
      String query, List<ResultGroup> results, List<ConversationTurn> history) {
    int contextSize = assistantConfig.getAnswer().getContextSize();
    String events =
        results.stream()
            .limit(contextSize)
            .map(g -> "- " + describe(g) + summarySuffix(g))
            .collect(Collectors.joining("\n"));
    String prompt =
        PROMPT
            .apply(Map.of("history", formatHistory(history), "query", query, "events", events))
            .text();
    try {
      return StageResult.success(
          modelBackend.generate(prompt, assistantConfig.getAnswer().getTemperature()));
    } catch (RuntimeException e) {
      return StageResult.failure(RetrievalError.from(STAGE, e));
    }
  }

  static String describe(ResultGroup group) {
    EventDetails details = group.details();
    StringBuilder sb = new StringBuilder();
    sb.append(details.title() != null ? details.title() : "Untitled event");
    if (details.venue() != null) {
      sb.append(" @ ").append(details.venue());
    }
    sb.append(" (").append(formatDates(group.dates()));
    if (details.price() != null) {
      sb.append(", ").append(formatPrice(details.price())).append(" TL");
    }
    return sb.append(")").toString();
  }

  /** A single date as is; several as "first – last (N shows)". */
  static String formatDates(List<LocalDate> dates) {
    if (dates.isEmpty()) {
      return "date TBA";
    }
    if (dates.size() == 1) {
      return dates.get(0).toString();
    }
    return dates.get(0) + " – " + dates.get(dates.size() - 1) + " (" + dates.size() + " shows)";
  }

  private static String summarySuffix(ResultGroup group) {
    if (group.summary() == null || group.summary().sentimentSummary() == null) {
      return "";
    }
    return ": " + group.summary().sentimentSummary();
  }

  private static String formatPrice(double price) {
    return price == Math.rint(price) ? String.valueOf((long) price) : String.valueOf(price);
  }

  private static String formatHistory(List<ConversationTurn> history) {
    if (history.isEmpty()) {
      return "(no previous conversation)";
    }
    return history.stream()
        .map(t -> (t.role() == TurnRole.USER ? "User" : "Assistant") + ": " + t.text())
        .collect(Collectors.joining("\n"));
  }
}
