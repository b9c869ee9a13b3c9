package com.flamingo.ai.eventassistant.service.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.exception.MalformedResponseException;
import com.flamingo.ai.eventassistant.exception.ModelBackendException;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.model.dto.IntentClassification;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntentClassifier Tests")
class IntentClassifierTest {

  @Mock private ModelBackend modelBackend;

  private SimpleMeterRegistry meterRegistry;
  private IntentClassifier classifier;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    classifier = new IntentClassifier(modelBackend, new AssistantConfig(), meterRegistry);
  }

  private void modelSays(String slug) {
    when(modelBackend.generateStructured(anyString(), eq(IntentClassification.class), anyDouble()))
        .thenReturn(new IntentClassification(slug, 0.9, "test"));
  }

  @Test
  @DisplayName("Should route a generic romantic request to date-night")
  void shouldRouteRomanticRequestToDateNight() {
    modelSays("date-night");

    StageResult<EventIntent> result = classifier.classify("I want something romantic");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(EventIntent.DATE_NIGHT);
    verify(modelBackend)
        .generateStructured(
            contains("I want something romantic"), eq(IntentClassification.class), eq(0.1));
  }

  @Test
  @DisplayName("Should keep search when the model says search")
  void shouldKeepSearch() {
    modelSays("search");

    assertThat(classifier.classify("Rock concerts in Ankara").value())
        .isEqualTo(EventIntent.SEARCH);
  }

  @Test
  @DisplayName("Should force search when the query names a specific subject")
  void shouldForceSearchForSpecificSubject() {
    modelSays("best-value");

    StageResult<EventIntent> result =
        classifier.classify("Cheap Jazz concerts under 500 TL in Istanbul");

    assertThat(result.value()).isEqualTo(EventIntent.SEARCH);
  }

  @Test
  @DisplayName("Should report backend failures")
  void shouldReportBackendFailures() {
    when(modelBackend.generateStructured(anyString(), eq(IntentClassification.class), anyDouble()))
        .thenThrow(new ModelBackendException("fast", "timeout"));

    StageResult<EventIntent> result = classifier.classify("something fun");

    assertThat(result.isFailure()).isTrue();
    assertThat(result.error().kind()).isEqualTo(RetrievalError.Kind.BACKEND_UNAVAILABLE);
    assertThat(result.orElse(EventIntent.SEARCH)).isEqualTo(EventIntent.SEARCH);
    assertThat(
            meterRegistry
                .counter("assistant.intent.failures", "kind", "BACKEND_UNAVAILABLE")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should report malformed replies")
  void shouldReportMalformedReplies() {
    when(modelBackend.generateStructured(anyString(), eq(IntentClassification.class), anyDouble()))
        .thenThrow(new MalformedResponseException("fast", "not json", "date night!", null));

    StageResult<EventIntent> result = classifier.classify("something fun");

    assertThat(result.error().kind()).isEqualTo(RetrievalError.Kind.MALFORMED_RESPONSE);
  }

  @Test
  @DisplayName("Should report unknown slugs as malformed")
  void shouldReportUnknownSlugs() {
    modelSays("party-time");

    StageResult<EventIntent> result = classifier.classify("something fun");

    assertThat(result.isFailure()).isTrue();
    assertThat(result.error().kind()).isEqualTo(RetrievalError.Kind.MALFORMED_RESPONSE);
  }

  @Test
  @DisplayName("Subject keywords match whole-word prefixes, folded")
  void subjectKeywordsMatchPrefixes() {
    assertThat(classifier.namesSpecificSubject("İSTANBUL'da bir şey")).isTrue();
    assertThat(classifier.namesSpecificSubject("Concerts please")).isTrue();
    assertThat(classifier.namesSpecificSubject("somewhere cozy for two")).isFalse();
  }
}
