package com.flamingo.ai.eventassistant.domain;

/** Unit passed between retrieval stages. Score is kept in [0, 1]. */
public record ScoredCandidate(double score, CandidateSummary summary, EventDetails details) {

  public ScoredCandidate {
    score = Math.max(0.0, Math.min(1.0, score));
  }

  public ScoredCandidate withScore(double newScore) {
    return new ScoredCandidate(newScore, summary, details);
  }

  public String eventUuid() {
    return summary.eventUuid();
  }
}
