package com.flamingo.ai.eventassistant.service.rerank;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import com.flamingo.ai.eventassistant.model.ModelBackend;
import com.flamingo.ai.eventassistant.model.dto.RelevanceJudgement;
import com.flamingo.ai.eventassistant.pipeline.RetrievalError;
import com.flamingo.ai.eventassistant.pipeline.StageResult;
import dev.langchain4j.model.input.PromptTemplate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Relevance judging with the reasoning model. Embedding similarity happily matches a jazz query to
 * a jazz-themed stand-up show; the judge sees titles and summaries and drops such candidates.
 *
 * <p>The judge is trusted only when it answers sensibly. An unusable reply keeps the retrieval
 * order and scores; an answer that rejects everything keeps the first {@code
 * assistant.rerank.reject-all-fallback-size} candidates.
 */
@Service
@Slf4j
public class LlmRelevanceReranker implements Reranker {

  static final String STAGE = "rerank";

  private static final PromptTemplate PROMPT =
      PromptTemplate.from(
          """
          You judge whether events match what a user is looking for.

          User query: "{{query}}"

          Candidate events:
          {{candidates}}

          Task:
          1. Give each candidate a relevance score between 0 and 1 for the query's topic.
          2. Drop every candidate scoring below {{minScore}}.
          3. Sort the remaining candidates by score, highest first.

          Return ONLY JSON: {"results": [{"id": <candidate index>, "score": <0..1>}]}
          """);

  private final ModelBackend modelBackend;
  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;

  public LlmRelevanceReranker(
      @Qualifier("reasoningModelBackend") ModelBackend modelBackend,
      AssistantConfig assistantConfig,
      MeterRegistry meterRegistry) {
    this.modelBackend = modelBackend;
    this.assistantConfig = assistantConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "assistant.rerank", description = "Time for LLM relevance judging")
  public List<ScoredCandidate> rerank(String query, List<ScoredCandidate> candidates) {
    AssistantConfig.Rerank config = assistantConfig.getRerank();
    if (candidates.isEmpty()) {
      return List.of();
    }
    if (!config.isEnabled()) {
      log.debug("Reranking disabled, keeping retrieval order");
      return List.copyOf(candidates);
    }

    StageResult<RelevanceJudgement> judgement = judge(query, candidates, config);
    if (judgement.isFailure()) {
      log.warn(
          "Relevance judge unusable ({}), keeping retrieval order: {}",
          judgement.error().kind(),
          judgement.error().message());
      meterRegistry.counter("assistant.rerank.fail_open").increment();
      return List.copyOf(candidates);
    }

    List<ScoredCandidate> accepted = applyJudgement(judgement.value(), candidates, config);
    if (accepted.isEmpty()) {
      int keep = Math.min(config.getRejectAllFallbackSize(), candidates.size());
      log.info(
          "Judge rejected all {} candidates, keeping top {} of retrieval order",
          candidates.size(),
          keep);
      meterRegistry.counter("assistant.rerank.reject_all").increment();
      return List.copyOf(candidates.subList(0, Math.max(0, keep)));
    }

    log.debug(
        "Judge kept {} of {} candidates, top score {}",
        accepted.size(),
        candidates.size(),
        String.format("%.2f", accepted.get(0).score()));
    meterRegistry
        .counter("assistant.rerank.dropped")
        .increment(candidates.size() - accepted.size());
    return accepted;
  }

  private StageResult<RelevanceJudgement> judge(
      String query, List<ScoredCandidate> candidates, AssistantConfig.Rerank config) {
    String prompt =
        PROMPT
            .apply(
                Map.of(
                    "query",
                    query,
                    "candidates",
                    describeCandidates(candidates, config.getSummaryMaxChars()),
                    "minScore",
                    String.valueOf(config.getMinScore())))
            .text();
    try {
      RelevanceJudgement judgement =
          modelBackend.generateStructured(
              prompt, RelevanceJudgement.class, config.getTemperature());
      if (judgement == null || judgement.results() == null) {
        return StageResult.failure(
            RetrievalError.of(
                RetrievalError.Kind.MALFORMED_RESPONSE, STAGE, "Judgement has no results"));
      }
      return StageResult.success(judgement);
    } catch (RuntimeException e) {
      return StageResult.failure(RetrievalError.from(STAGE, e));
    }
  }

  /** Keeps judged candidates with a valid index and a passing score; the first verdict wins. */
  private List<ScoredCandidate> applyJudgement(
      RelevanceJudgement judgement,
      List<ScoredCandidate> candidates,
      AssistantConfig.Rerank config) {
    Set<Integer> seen = new HashSet<>();
    List<ScoredCandidate> accepted = new ArrayList<>();
    for (RelevanceJudgement.Judged judged : judgement.results()) {
      if (judged == null || judged.id() == null || judged.score() == null) {
        continue;
      }
      int id = judged.id();
      double score = judged.score();
      if (id < 0 || id >= candidates.size() || Double.isNaN(score)) {
        log.debug("Ignoring verdict with invalid id {}", id);
        continue;
      }
      if (score < config.getMinScore() || !seen.add(id)) {
        continue;
      }
      accepted.add(candidates.get(id).withScore(score));
    }
    accepted.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    return accepted;
  }

  private static String describeCandidates(List<ScoredCandidate> candidates, int maxChars) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < candidates.size(); i++) {
      ScoredCandidate candidate = candidates.get(i);
      EventDetails details = candidate.details();
      String title = details != null && details.title() != null ? details.title() : "(untitled)";
      String summary = candidate.summary().sentimentSummary();
      if (summary == null) {
        summary = "";
      } else if (summary.length() > maxChars) {
        summary = summary.substring(0, maxChars) + "...";
      }
      sb.append("[").append(i).append("] ").append(title);
      if (details != null && details.genre() != null) {
        sb.append(" (").append(details.genre()).append(")");
      }
      sb.append(": ").append(summary).append("\n");
    }
    return sb.toString().trim();
  }
}
