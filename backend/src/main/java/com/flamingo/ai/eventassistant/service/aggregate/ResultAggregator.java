package com.flamingo.ai.eventassistant.service.aggregate;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import com.flamingo.ai.eventassistant.domain.TextFolding;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collapses occurrences of the same show into one result. Occurrences share title and venue
 * (compared case-insensitively); the group takes the best member's score, summary and details
 * and the union of all dates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultAggregator {

  private final AssistantConfig assistantConfig;

  public List<ResultGroup> aggregate(List<ScoredCandidate> candidates) {
    return aggregate(candidates, c -> null);
  }

  /**
   * Groups candidates, attaching a curation reason taken from the best member of each group.
   *
   * @param candidates candidates with details resolved
   * @param reasonOf reason for a candidate, may return null
   * @return groups sorted by score descending, at most {@code assistant.aggregation.max-results}
   */
  public List<ResultGroup> aggregate(
      List<ScoredCandidate> candidates, Function<ScoredCandidate, String> reasonOf) {
    List<ResultGroup> singles = new ArrayList<>(candidates.size());
    for (ScoredCandidate candidate : candidates) {
      if (candidate.details() == null) {
        continue;
      }
      LocalDate date = candidate.details().date();
      singles.add(
          new ResultGroup(
              candidate.score(),
              candidate.summary(),
              candidate.details(),
              date != null ? List.of(date) : List.of(),
              reasonOf.apply(candidate)));
    }
    return merge(singles);
  }

  /**
   * Merges groups sharing a key. Applying it to its own output changes nothing.
   *
   * @param groups groups in any order
   * @return merged groups sorted by score descending, truncated
   */
  public List<ResultGroup> merge(List<ResultGroup> groups) {
    Map<String, List<ResultGroup>> byKey = new LinkedHashMap<>();
    for (ResultGroup group : groups) {
      byKey.computeIfAbsent(groupKey(group.details()), k -> new ArrayList<>()).add(group);
    }

    List<ResultGroup> merged = new ArrayList<>(byKey.size());
    for (List<ResultGroup> members : byKey.values()) {
      ResultGroup best = members.get(0);
      TreeSet<LocalDate> dates = new TreeSet<>();
      for (ResultGroup member : members) {
        if (member.score() > best.score()) {
          best = member;
        }
        dates.addAll(member.dates());
      }
      merged.add(
          new ResultGroup(
              best.score(),
              best.summary(),
              best.details(),
              new ArrayList<>(dates),
              best.curationReason()));
    }

    merged.sort(Comparator.comparingDouble(ResultGroup::score).reversed());
    int maxResults = assistantConfig.getAggregation().getMaxResults();
    if (merged.size() > maxResults) {
      log.debug("Truncating {} groups to {}", merged.size(), maxResults);
      return List.copyOf(merged.subList(0, maxResults));
    }
    return List.copyOf(merged);
  }

  static String groupKey(EventDetails details) {
    if (details.title() == null && details.venue() == null) {
      return "uuid:" + details.uuid();
    }
    return TextFolding.fold(details.title()) + "\u0000" + TextFolding.fold(details.venue());
  }
}
