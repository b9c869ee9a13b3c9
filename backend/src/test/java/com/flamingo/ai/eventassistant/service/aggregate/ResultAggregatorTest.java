package com.flamingo.ai.eventassistant.service.aggregate;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

  private ResultAggregator aggregator;

  @BeforeEach
  void setUp() {
    aggregator = new ResultAggregator(new AssistantConfig());
  }

  private static ScoredCandidate candidate(
      String uuid, String title, String venue, String date, double score) {
    return new ScoredCandidate(
        score,
        new CandidateSummary(uuid, "Summary " + uuid, null),
        new EventDetails(
            uuid,
            title,
            venue,
            date != null ? LocalDate.parse(date) : null,
            250.0,
            "Istanbul",
            "Theatre",
            null,
            null));
  }

  @Test
  @DisplayName("Should merge two showings of the same event into one group")
  void shouldMergeShowings() {
    List<ResultGroup> groups =
        aggregator.aggregate(
            List.of(
                candidate("a1", "Hamlet", "Zorlu PSM", "2025-12-12", 0.7),
                candidate("a2", "Hamlet", "Zorlu PSM", "2025-12-10", 0.85)));

    assertThat(groups).hasSize(1);
    ResultGroup group = groups.get(0);
    assertThat(group.dates())
        .containsExactly(LocalDate.of(2025, 12, 10), LocalDate.of(2025, 12, 12));
    assertThat(group.score()).isEqualTo(0.85);
    assertThat(group.details().uuid()).isEqualTo("a2");
    assertThat(group.hasMultipleDates()).isTrue();
  }

  @Test
  @DisplayName("Should compare title and venue case-insensitively and dedupe dates")
  void shouldGroupCaseInsensitively() {
    List<ResultGroup> groups =
        aggregator.aggregate(
            List.of(
                candidate("a1", "HAMLET", "Zorlu PSM", "2025-12-10", 0.5),
                candidate("a2", "Hamlet ", "zorlu psm", "2025-12-10", 0.6),
                candidate("b1", "Hamlet", "Moda Sahnesi", "2025-12-10", 0.9)));

    assertThat(groups).hasSize(2);
    assertThat(groups.get(0).details().venue()).isEqualTo("Moda Sahnesi");
    assertThat(groups.get(1).dates()).containsExactly(LocalDate.of(2025, 12, 10));
  }

  @Test
  @DisplayName("Should sort by score and keep at most ten groups")
  void shouldSortAndTruncate() {
    List<ScoredCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      candidates.add(candidate("e" + i, "Show " + i, "Venue", "2025-12-10", i / 20.0));
    }

    List<ResultGroup> groups = aggregator.aggregate(candidates);

    assertThat(groups).hasSize(10);
    assertThat(groups.get(0).details().title()).isEqualTo("Show 14");
    assertThat(groups)
        .extracting(ResultGroup::score)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }

  @Test
  @DisplayName("Merging its own output changes nothing")
  void mergeIsIdempotent() {
    List<ResultGroup> once =
        aggregator.aggregate(
            List.of(
                candidate("a1", "Hamlet", "Zorlu PSM", "2025-12-12", 0.7),
                candidate("a2", "Hamlet", "Zorlu PSM", "2025-12-10", 0.85),
                candidate("b1", "Cats", "Zorlu PSM", "2025-12-11", 0.6),
                candidate("c1", "Nameless", "Bostancı", null, 0.4)));

    List<ResultGroup> twice = aggregator.merge(once);

    assertThat(twice).isEqualTo(once);

    List<ScoredCandidate> representatives =
        once.stream().map(g -> new ScoredCandidate(g.score(), g.summary(), g.details())).toList();
    assertThat(aggregator.aggregate(representatives))
        .extracting(g -> g.details().uuid())
        .containsExactlyElementsOf(once.stream().map(g -> g.details().uuid()).toList());
  }

  @Test
  @DisplayName("Should carry the reason of the best member")
  void shouldCarryReason() {
    List<ResultGroup> groups =
        aggregator.aggregate(
            List.of(
                candidate("a1", "Hamlet", "Zorlu PSM", "2025-12-12", 0.7),
                candidate("a2", "Hamlet", "Zorlu PSM", "2025-12-10", 0.85)),
            c -> "a2".equals(c.details().uuid()) ? "Stunning staging" : "Other night");

    assertThat(groups.get(0).curationReason()).isEqualTo("Stunning staging");
  }

  @Test
  @DisplayName("Should return no groups for no candidates")
  void shouldHandleEmptyInput() {
    assertThat(aggregator.aggregate(List.of())).isEmpty();
  }
}
