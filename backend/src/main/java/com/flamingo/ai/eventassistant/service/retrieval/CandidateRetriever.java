package com.flamingo.ai.eventassistant.service.retrieval;

import com.flamingo.ai.eventassistant.catalog.CatalogStore;
import com.flamingo.ai.eventassistant.catalog.EventPredicate;
import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.EventFilters;
import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import com.flamingo.ai.eventassistant.domain.VectorMatch;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces the scored candidate set for a query: hard filters first, then vector similarity.
 *
 * <p>Filters are strict. When any filter is present only events in the eligible set can be
 * returned, and every candidate is re-checked against the filters once its details are known.
 * When the vector index yields nothing usable, stored summaries are scanned and compared in memory.
 * No exception escapes: a failing step contributes no candidates.
 */
@Service
@Slf4j
public class CandidateRetriever {

  static final String STAGE = "retrieval";

  private final CatalogStore catalogStore;
  private final ModelBackend modelBackend;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;
  private final Executor catalogLookupExecutor;

  public CandidateRetriever(
      CatalogStore catalogStore,
      @Qualifier("fastModelBackend") ModelBackend modelBackend,
      AssistantConfig assistantConfig,
      MeterRegistry meterRegistry,
      @Qualifier("catalogLookupExecutor") Executor catalogLookupExecutor) {
    this.catalogStore = catalogStore;
    this.modelBackend = modelBackend;
    this.assistantConfig = assistantConfig;
    this.meterRegistry = meterRegistry;
    this.catalogLookupExecutor = catalogLookupExecutor;
  }

  /**
   * Retrieves candidates, best first.
   *
   * @param query raw user text
   * @param filters validated filters; {@link EventFilters#none()} for an unconstrained search
   * @return at most {@code assistant.retrieval.max-candidates} candidates with details resolved
   */
  @Timed(value = "assistant.retrieval", description = "Time to retrieve candidates")
  public List<ScoredCandidate> retrieve(String query, EventFilters filters) {
    AssistantConfig.Retrieval config = assistantConfig.getRetrieval();
    EventPredicate predicate = EventPredicate.fromFilters(filters);

    Set<String> eligible = null;
    if (!predicate.isEmpty()) {
      StageResult<Set<String>> eligibleResult =
          attempt("eligibility", () -> catalogStore.findEventIds(predicate));
      eligible = eligibleResult.orElse(Set.of());
      log.debug("Eligible set for [{}]: {} events", predicate, eligible.size());
      if (eligible.isEmpty()) {
        meterRegistry.counter("assistant.retrieval.empty_eligible").increment();
        return List.of();
      }
    }

    StageResult<List<Float>> embedding = attempt("embedding", () -> modelBackend.embed(query));
    if (embedding.isFailure() || embedding.value().isEmpty()) {
      return List.of();
    }
    List<Float> queryVector = embedding.value();

    List<ScoredCandidate> scored = primary(queryVector, eligible, config);
    if (scored.isEmpty()) {
      log.info("Vector index returned nothing usable, scanning stored summaries");
      meterRegistry.counter("assistant.retrieval.fallback").increment();
      scored = fallbackScan(queryVector, eligible, config);
    }

    List<ScoredCandidate> top =
        scored.stream()
            .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed())
            .limit(config.getMaxCandidates())
            .toList();

    List<ScoredCandidate> resolved =
        resolveDetails(top, config).stream().filter(c -> satisfies(predicate, c)).toList();
    log.debug("Retrieved {} candidates for '{}'", resolved.size(), query);
    meterRegistry.counter("assistant.retrieval.candidates").increment(resolved.size());
    return resolved;
  }

  private List<ScoredCandidate> primary(
      List<Float> queryVector, Set<String> eligible, AssistantConfig.Retrieval config) {
    StageResult<List<VectorMatch>> matches =
        attempt(
            "vector-query",
            () ->
                catalogStore.vectorQuery(
                    config.getVectorIndexName(),
                    config.getVectorProperty(),
                    config.getVectorTopK(),
                    queryVector));
    if (matches.isFailure()) {
      return List.of();
    }

    Map<String, ScoredCandidate> best = new LinkedHashMap<>();
    for (VectorMatch match : matches.value()) {
      CandidateSummary summary = match.summary();
      if (summary == null || summary.eventUuid() == null) {
        continue;
      }
      if (eligible != null && !eligible.contains(summary.eventUuid())) {
        continue;
      }
      best.merge(
          summary.eventUuid(),
          new ScoredCandidate(match.score(), summary, null),
          (a, b) -> a.score() >= b.score() ? a : b);
    }
    return new ArrayList<>(best.values());
  }

  private List<ScoredCandidate> fallbackScan(
      List<Float> queryVector, Set<String> eligible, AssistantConfig.Retrieval config) {
    StageResult<List<CandidateSummary>> summaries =
        attempt("summary-scan", () -> catalogStore.getAllSummaries(config.getFallbackScanLimit()));
    if (summaries.isFailure()) {
      return List.of();
    }

    Map<String, ScoredCandidate> best = new LinkedHashMap<>();
    for (CandidateSummary summary : summaries.value()) {
      if (summary.eventUuid() == null || !summary.hasEmbedding()) {
        continue;
      }
      if (eligible != null && !eligible.contains(summary.eventUuid())) {
        continue;
      }
      double similarity = cosineSimilarity(queryVector, summary.embedding());
      if (similarity > config.getFallbackMinSimilarity()) {
        best.merge(
            summary.eventUuid(),
            new ScoredCandidate(similarity, summary, null),
            (a, b) -> a.score() >= b.score() ? a : b);
      }
    }
    log.debug("Summary scan kept {} of {} summaries", best.size(), summaries.value().size());
    return new ArrayList<>(best.values());
  }

  /**
   * Fetches details for all candidates concurrently; candidates without details are dropped. A
   * lookup the executor refuses, or one still running at the deadline, counts as a failed lookup.
   */
  private List<ScoredCandidate> resolveDetails(
      List<ScoredCandidate> candidates, AssistantConfig.Retrieval config) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    List<CompletableFuture<Optional<EventDetails>>> futures =
        candidates.stream().map(c -> submitLookup(c.eventUuid())).toList();

    long deadline = System.nanoTime() + config.getDetailsTimeout().toNanos();
    List<ScoredCandidate> resolved = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      ScoredCandidate candidate = candidates.get(i);
      CompletableFuture<Optional<EventDetails>> future = futures.get(i);
      try {
        long remaining = Math.max(0, deadline - System.nanoTime());
        Optional<EventDetails> details = future.get(remaining, TimeUnit.NANOSECONDS);
        if (details.isPresent()) {
          resolved.add(new ScoredCandidate(candidate.score(), candidate.summary(), details.get()));
        } else {
          log.debug("No details for candidate {}, dropping", candidate.eventUuid());
        }
      } catch (TimeoutException e) {
        // The lookup thread is not interrupted; its result is ignored
        future.cancel(false);
        log.warn(
            "Details lookup for {} abandoned after {}",
            candidate.eventUuid(),
            config.getDetailsTimeout());
        meterRegistry.counter("assistant.retrieval.details_abandoned").increment();
      } catch (ExecutionException e) {
        RetrievalError error = RetrievalError.from("details", e);
        log.warn(
            "Details lookup for {} failed ({}): {}",
            candidate.eventUuid(),
            error.kind(),
            error.message());
        meterRegistry.counter("assistant.retrieval.details_failures").increment();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(false));
        log.warn("Interrupted while resolving candidate details");
        break;
      }
    }
    return resolved;
  }

  private CompletableFuture<Optional<EventDetails>> submitLookup(String eventUuid) {
    try {
      return CompletableFuture.supplyAsync(
          () -> catalogStore.findEventDetails(eventUuid), catalogLookupExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Details lookup for {} rejected, lookup pool saturated", eventUuid);
      meterRegistry.counter("assistant.retrieval.lookup_rejected").increment();
      return CompletableFuture.failedFuture(e);
    }
  }

  private boolean satisfies(EventPredicate predicate, ScoredCandidate candidate) {
    if (predicate.isEmpty() || predicate.test(candidate.details())) {
      return true;
    }
    log.warn(
        "Candidate {} violates [{}] after details lookup, dropping",
        candidate.eventUuid(),
        predicate);
    return false;
  }

  private <T> StageResult<T> attempt(String step, Supplier<T> call) {
    try {
      T value = call.get();
      return value != null
          ? StageResult.success(value)
          : StageResult.failure(
              RetrievalError.of(
                  RetrievalError.Kind.BACKEND_UNAVAILABLE, STAGE, step + " returned nothing"));
    } catch (RuntimeException e) {
      RetrievalError error = RetrievalError.from(STAGE, e);
      if (error.kind() == RetrievalError.Kind.INDEX_UNAVAILABLE) {
        log.info("Step {} skipped: {}", step, error.message());
      } else {
        log.warn("Step {} failed ({}): {}", step, error.kind(), error.message());
      }
      meterRegistry
          .counter("assistant.retrieval.failures", "step", step, "kind", error.kind().name())
          .increment();
      return StageResult.failure(error);
    }
  }

  /** Cosine similarity of two vectors; 0 when either is empty, zero or their sizes differ. */
  static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
