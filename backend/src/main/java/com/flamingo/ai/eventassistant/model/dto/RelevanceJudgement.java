package com.flamingo.ai.eventassistant.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.List;

/**
 * Structured reply of the relevance judge: accepted candidates by index, best first. Candidates
 * the judge dropped are simply absent.
 */
public record RelevanceJudgement(@JsonAlias({"scores", "events"}) List<Judged> results) {

  /** A single verdict; {@code id} is the index shown in the prompt. */
  public record Judged(@JsonAlias({"index", "idx"}) Integer id, Double score) {}
}
