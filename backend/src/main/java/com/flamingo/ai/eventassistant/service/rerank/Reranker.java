package com.flamingo.ai.eventassistant.service.rerank;

import com.flamingo.ai.eventassistant.domain.ScoredCandidate;
import java.util.List;

/** Re-scores retrieved candidates for topical relevance to the query. */
public interface Reranker {

  /**
   * Reranks candidates.
   *
   * @param query raw user text
   * @param candidates retrieval output with details resolved, best first
   * @return the kept candidates, best first; never null
   */
  List<ScoredCandidate> rerank(String query, List<ScoredCandidate> candidates);
}
