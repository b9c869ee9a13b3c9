package com.flamingo.ai.eventassistant.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * One logical event across all of its scheduled occurrences, as returned to the caller.
 *
 * @param score best score among the merged occurrences
 * @param summary summary of the best-scoring occurrence
 * @param details details of the best-scoring occurrence
 * @param dates distinct occurrence dates, ascending
 * @param curationReason why a curator placed the event in a collection; null for searched results
 */
public record ResultGroup(
    double score,
    CandidateSummary summary,
    EventDetails details,
    List<LocalDate> dates,
    String curationReason) {

  public ResultGroup {
    dates = List.copyOf(dates);
  }

  public boolean hasMultipleDates() {
    return dates.size() > 1;
  }
}
