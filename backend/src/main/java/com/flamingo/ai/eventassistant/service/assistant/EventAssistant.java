package com.flamingo.ai.eventassistant.service.assistant;

import com.flamingo.ai.eventassistant.catalog.CatalogStore;
import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.CuratedEntry;
import com.flamingo.ai.eventassistant.domain.EventFilters;
import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import com.flamingo.ai.eventassistant.exception.UnknownCollectionException;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import com.flamingo.ai.eventassistant.service.aggregate.ResultAggregator;
import com.flamingo.ai.eventassistant.service.answer.AnswerSynthesizer;
import com.flamingo.ai.eventassistant.service.filter.FilterExtractor;
import com.flamingo.ai.eventassistant.service.intent.IntentClassifier;
import com.flamingo.ai.eventassistant.service.rerank.Reranker;
import com.flamingo.ai.eventassistant.service.retrieval.CandidateRetriever;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the event discovery assistant.
 *
 * <p>A query is classified first. Generic requests are answered from a curated collection; all
 * others run filter extraction, retrieval, reranking, aggregation and answer synthesis in order.
 * Each stage that can fail reports a {@link StageResult}; the degraded value for a failure is
 * chosen here, so backend errors never reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventAssistant {

  private final IntentClassifier intentClassifier;
  private final FilterExtractor filterExtractor;
  private final CandidateRetriever candidateRetriever;
  private final Reranker reranker;
  private final ResultAggregator resultAggregator;
  private final AnswerSynthesizer answerSynthesizer;
  private final CatalogStore catalogStore;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Answers a query within a session. Queries on the same session are serialized.
   *
   * @param query raw user text
   * @param session the caller's conversation
   * @return answer and results; never null
   */
  @Timed(value = "assistant.query", description = "Time to answer a query end to end")
  public AssistantAnswer answerQuery(String query, ConversationSession session) {
    return session.serialized(() -> answer(query.trim(), session));
  }

  private AssistantAnswer answer(String query, ConversationSession session) {
    log.info("Session {} query: '{}'", session.getId(), query);
    meterRegistry.counter("assistant.queries").increment();

    EventIntent intent = intentClassifier.classify(query).orElse(EventIntent.SEARCH);

    if (intent.isCurated()) {
      StageResult<List<ResultGroup>> curated = loadCollection(intent);
      List<ResultGroup> results = curated.orElse(List.of());
      if (!results.isEmpty()) {
        log.info("Answering from curated collection '{}'", intent.getSlug());
        String text = answerSynthesizer.composeCurated(intent, results);
        session.appendExchange(query, text);
        return new AssistantAnswer(text, results, intent);
      }
      log.info("Collection '{}' has nothing to offer, running full search", intent.getSlug());
    }

    EventFilters filters = filterExtractor.extract(query).orElse(EventFilters.none());
    List<ScoredCandidate> candidates = candidateRetriever.retrieve(query, filters);
    List<ScoredCandidate> reranked = reranker.rerank(query, candidates);
    List<ResultGroup> results = resultAggregator.aggregate(reranked);
    log.info(
        "Pipeline for '{}': {} candidates, {} after rerank, {} groups",
        query,
        candidates.size(),
        reranked.size(),
        results.size());

    String text = answerSynthesizer.synthesize(query, results, session);
    return new AssistantAnswer(text, results, EventIntent.SEARCH);
  }

  /**
   * Returns the events of a curated collection, best ranked first.
   *
   * @param tag collection slug such as {@code date-night}
   * @return the collection's results; empty when the catalog cannot be read
   * @throws UnknownCollectionException if {@code tag} names no curated collection
   */
  @Timed(value = "assistant.collection", description = "Time to load a curated collection")
  public List<ResultGroup> getCuratedCollection(String tag) {
    EventIntent intent =
        EventIntent.fromSlug(tag)
            .filter(EventIntent::isCurated)
            .orElseThrow(() -> new UnknownCollectionException(tag));
    return loadCollection(intent).orElse(List.of());
  }

  private StageResult<List<ResultGroup>> loadCollection(EventIntent intent) {
    List<CuratedEntry> entries;
    try {
      entries =
          catalogStore.getCollection(intent.getSlug(), assistantConfig.getCurated().getLimit());
    } catch (RuntimeException e) {
      RetrievalError error = RetrievalError.from("collection", e);
      log.warn(
          "Collection '{}' unavailable ({}): {}", intent.getSlug(), error.kind(), error.message());
      meterRegistry.counter("assistant.collection.failures").increment();
      return StageResult.failure(error);
    }

    List<CuratedEntry> ordered = new ArrayList<>(entries);
    ordered.sort(Comparator.comparingInt(CuratedEntry::rank));
    Map<String, String> reasons = new HashMap<>();
    List<ScoredCandidate> candidates = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      CuratedEntry entry = ordered.get(i);
      CandidateSummary summary =
          entry.summary() != null
              ? entry.summary()
              : new CandidateSummary(entry.details().uuid(), null, null);
      candidates.add(new ScoredCandidate(rankScore(i, ordered.size()), summary, entry.details()));
      if (entry.reason() != null) {
        reasons.putIfAbsent(entry.details().uuid(), entry.reason());
      }
    }
    return StageResult.success(
        resultAggregator.aggregate(candidates, c -> reasons.get(c.details().uuid())));
  }

  /** Rank position 0 of n scores 1.0, the last one 1/n. */
  static double rankScore(int position, int size) {
    return (double) (size - position) / size;
  }
}
