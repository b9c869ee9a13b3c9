package com.flamingo.ai.eventassistant.domain;

/**
 * Hard constraints extracted from a query. Every field is optional and a null field does not
 * constrain anything. Built fresh per query.
 */
public record EventFilters(
    Double maxPrice,
    String city,
    String category,
    String genre,
    String duration,
    DateRange dateRange) {

  private static final EventFilters NONE = new EventFilters(null, null, null, null, null, null);

  public static EventFilters none() {
    return NONE;
  }

  /** True when at least one field would restrict the candidate set. */
  public boolean hasConstraints() {
    return maxPrice != null
        || city != null
        || category != null
        || genre != null
        || duration != null
        || (dateRange != null && !dateRange.isUnbounded());
  }
}
