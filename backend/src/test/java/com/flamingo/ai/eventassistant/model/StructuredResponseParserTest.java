package com.flamingo.ai.eventassistant.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.eventassistant.exception.MalformedResponseException;
import com.flamingo.ai.eventassistant.model.dto.ExtractedFilters;
import com.flamingo.ai.eventassistant.model.dto.IntentClassification;
import com.flamingo.ai.eventassistant.model.dto.RelevanceJudgement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StructuredResponseParser Tests")
class StructuredResponseParserTest {

  private StructuredResponseParser parser;

  @BeforeEach
  void setUp() {
    parser = new StructuredResponseParser(new ObjectMapper());
  }

  @Nested
  @DisplayName("stripCodeFences")
  class StripCodeFences {

    @Test
    @DisplayName("should strip json fence")
    void shouldStripJsonFence() {
      assertThat(StructuredResponseParser.stripCodeFences("```json\n{\"a\": 1}\n```"))
          .isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("should strip bare fence")
    void shouldStripBareFence() {
      assertThat(StructuredResponseParser.stripCodeFences("```\n{\"a\": 1}```"))
          .isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("should cut prose around the object")
    void shouldCutProseAroundObject() {
      assertThat(StructuredResponseParser.stripCodeFences("Sure! {\"a\": 1} Hope that helps."))
          .isEqualTo("{\"a\": 1}");
    }

    @Test
    @DisplayName("should treat null as empty")
    void shouldTreatNullAsEmpty() {
      assertThat(StructuredResponseParser.stripCodeFences(null)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should bind fenced intent classification")
  void shouldBindFencedIntentClassification() {
    IntentClassification result =
        parser.parse(
            "fast",
            "```json\n{\"intent\": \"date-night\", \"confidence\": 0.8,"
                + " \"reasoning\": \"romantic\"}\n```",
            IntentClassification.class);

    assertThat(result.intent()).isEqualTo("date-night");
    assertThat(result.confidence()).isEqualTo(0.8);
  }

  @Test
  @DisplayName("Should accept snake_case keys and ignore unknown ones")
  void shouldAcceptSnakeCaseKeys() {
    ExtractedFilters result =
        parser.parse(
            "reasoning",
            "{\"max_price\": 500, \"city\": \"Istanbul\", \"venue\": \"x\","
                + " \"date_range\": {\"start\": \"2025-12-12\", \"end\": null}}",
            ExtractedFilters.class);

    assertThat(result.maxPrice()).isEqualTo(500.0);
    assertThat(result.city()).isEqualTo("Istanbul");
    assertThat(result.dateRange().start()).isEqualTo("2025-12-12");
    assertThat(result.dateRange().end()).isNull();
  }

  @Test
  @DisplayName("Should accept aliased judgement keys")
  void shouldAcceptAliasedJudgementKeys() {
    RelevanceJudgement result =
        parser.parse(
            "reasoning",
            "{\"scores\": [{\"index\": 2, \"score\": 0.9}]}",
            RelevanceJudgement.class);

    assertThat(result.results()).hasSize(1);
    assertThat(result.results().get(0).id()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should reject non-JSON replies")
  void shouldRejectNonJson() {
    assertThatThrownBy(
            () -> parser.parse("fast", "I think it is date-night", IntentClassification.class))
        .isInstanceOf(MalformedResponseException.class)
        .hasMessageContaining("IntentClassification");
  }

  @Test
  @DisplayName("Should reject JSON null")
  void shouldRejectJsonNull() {
    assertThatThrownBy(() -> parser.parse("fast", "null", IntentClassification.class))
        .isInstanceOf(MalformedResponseException.class);
  }
}
