package com.flamingo.ai.eventassistant.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Structured reply of the filter extraction prompt. Values are kept as the model wrote them;
 * validation happens in the extractor.
 */
public record ExtractedFilters(
    @JsonAlias("max_price") Double maxPrice,
    String city,
    String category,
    String genre,
    String duration,
    @JsonAlias("date_range") DateRangeValue dateRange) {

  /** Date range as emitted by the model, {@code YYYY-MM-DD} strings. */
  public record DateRangeValue(String start, String end) {}
}
