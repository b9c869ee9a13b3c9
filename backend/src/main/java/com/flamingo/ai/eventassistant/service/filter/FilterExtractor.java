package com.flamingo.ai.eventassistant.service.filter;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.DateRange;
import com.flamingo.ai.eventassistant.domain.EventFilters;
import com.flamingo.ai.eventassistant.domain.TextFolding;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.model.dto.ExtractedFilters;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Pulls hard constraints out of a query. The model is told to fill only what the user said; the
 * result is then re-validated here so an invented value never narrows the search.
 */
@Service
@Slf4j
public class FilterExtractor {

  static final String STAGE = "filters";

  private static final Pattern DATE_TOKEN = Pattern.compile("\\d{1,2}[./-]\\d{1,2}|\\d{4}");
  private static final Pattern DIGIT = Pattern.compile("\\d");

  private static final PromptTemplate PROMPT =
      PromptTemplate.from(
          """
          You are a query parser. Extract search filters from the user's event query.

          Current Date: {{today}} ({{dayName}})

          Query: "{{query}}"

          Return a JSON object with these keys (use null when the query does not say):
          - max_price: number, the highest acceptable ticket price (e.g. 500)
          - city: string (e.g. "Istanbul", "Ankara")
          - category: string, the kind of event (e.g. "Concert", "Theater", "Workshop")
          - genre: string (e.g. "Jazz", "Rock", "Stand-up")
          - duration: string (e.g. "2 hours")
          - date_range: object with "start" and "end" in YYYY-MM-DD format
            - "this weekend": the coming Friday to Sunday
            - "tomorrow": the day after {{today}}
            - "next week": next Monday to Sunday
            - Turkish: "hafta sonu" means "this weekend", "yarın" means "tomorrow"

          IMPORTANT:
          - ONLY extract filters explicitly mentioned in the query. Never guess.
          - If the user does NOT mention a date or time, date_range is null.
          - If the user does NOT mention a city, city is null.
          - A city outside Turkey is still extracted as city.

          Return ONLY valid JSON.
          """);

  private final ModelBackend modelBackend;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public FilterExtractor(
      @Qualifier("reasoningModelBackend") ModelBackend modelBackend,
      AssistantConfig assistantConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.modelBackend = modelBackend;
    this.assistantConfig = assistantConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Extracts filters from the query.
   *
   * @param query raw user text
   * @return validated filters, or a failure the caller degrades to {@link EventFilters#none()}
   */
  @Timed(value = "assistant.filters", description = "Time to extract query filters")
  public StageResult<EventFilters> extract(String query) {
    LocalDate today = LocalDate.now(clock);
    String prompt =
        PROMPT
            .apply(
                Map.of(
                    "today",
                    today.toString(),
                    "dayName",
                    today.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                    "query",
                    query))
            .text();

    ExtractedFilters extracted;
    try {
      extracted =
          modelBackend.generateStructured(
              prompt, ExtractedFilters.class, assistantConfig.getFilters().getTemperature());
    } catch (RuntimeException e) {
      RetrievalError error = RetrievalError.from(STAGE, e);
      log.warn("Filter extraction failed ({}): {}", error.kind(), error.message());
      meterRegistry.counter("assistant.filters.failures", "kind", error.kind().name()).increment();
      return StageResult.failure(error);
    }

    EventFilters filters = validate(query, extracted);
    log.info("Extracted filters for '{}': {}", query, filters);
    if (filters.hasConstraints()) {
      meterRegistry.counter("assistant.filters.constrained").increment();
    }
    return StageResult.success(filters);
  }

  EventFilters validate(String query, ExtractedFilters extracted) {
    if (extracted == null) {
      return EventFilters.none();
    }
    return new EventFilters(
        validatePrice(query, extracted.maxPrice()),
        ground(query, "city", extracted.city()),
        ground(query, "category", extracted.category()),
        ground(query, "genre", extracted.genre()),
        ground(query, "duration", extracted.duration()),
        validateDateRange(query, extracted.dateRange()));
  }

  private Double validatePrice(String query, Double maxPrice) {
    if (maxPrice == null) {
      return null;
    }
    if (maxPrice.isNaN() || maxPrice < 0) {
      log.warn("Discarding invalid max price {}", maxPrice);
      return null;
    }
    if (!DIGIT.matcher(query).find()) {
      log.warn("Discarding max price {} not stated in query", maxPrice);
      return null;
    }
    return maxPrice;
  }

  private String ground(String query, String field, String value) {
    if (value == null || value.isBlank() || "null".equalsIgnoreCase(value.trim())) {
      return null;
    }
    String trimmed = value.trim();
    if (assistantConfig.getFilters().isStrictGrounding()
        && !TextFolding.containsFolded(query, trimmed)) {
      log.warn("Discarding {} '{}' not present in query", field, trimmed);
      meterRegistry.counter("assistant.filters.discarded", "field", field).increment();
      return null;
    }
    return trimmed;
  }

  private DateRange validateDateRange(String query, ExtractedFilters.DateRangeValue value) {
    if (value == null) {
      return null;
    }
    LocalDate start = parseDate(value.start());
    LocalDate end = parseDate(value.end());
    if (start == null && end == null) {
      return null;
    }
    if (!mentionsDate(query)) {
      log.warn("Discarding hallucinated date range {}..{}", start, end);
      meterRegistry.counter("assistant.filters.discarded", "field", "date_range").increment();
      return null;
    }
    if (start != null && end != null && end.isBefore(start)) {
      return new DateRange(end, start);
    }
    return new DateRange(start, end);
  }

  boolean mentionsDate(String query) {
    String folded = TextFolding.fold(query);
    if (DATE_TOKEN.matcher(folded).find()) {
      return true;
    }
    String[] tokens = folded.split("[^\\p{L}]+");
    return assistantConfig.getFilters().getDateKeywords().stream()
        .map(TextFolding::fold)
        .filter(k -> !k.isEmpty())
        .anyMatch(k -> Arrays.stream(tokens).anyMatch(t -> t.startsWith(k)));
  }

  private static LocalDate parseDate(String text) {
    if (text == null || text.isBlank() || "null".equalsIgnoreCase(text.trim())) {
      return null;
    }
    try {
      return LocalDate.parse(text.trim());
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable date '{}' from filter extraction", text);
      return null;
    }
  }
}
