package com.flamingo.ai.eventassistant.domain;

import java.util.List;

/** Read-only projection of an AI-generated event summary; embedding may be absent. */
public record CandidateSummary(String eventUuid, String sentimentSummary, List<Float> embedding) {

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
