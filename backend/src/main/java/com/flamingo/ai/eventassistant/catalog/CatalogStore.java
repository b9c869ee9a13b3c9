package com.flamingo.ai.eventassistant.catalog;

import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.CuratedEntry;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.VectorMatch;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the event catalog. Implementations convert their storage representation into
 * the typed records below and report failures as {@link
 * com.flamingo.ai.eventassistant.exception.CatalogStoreException}.
 */
public interface CatalogStore {

  /**
   * Returns the identifiers of all events satisfying {@code predicate}.
   *
   * @param predicate non-empty conjunction of conditions
   * @return eligible event identifiers, empty when nothing matches
   */
  Set<String> findEventIds(EventPredicate predicate);

  /** Fetches the display projection of one event. */
  Optional<EventDetails> findEventDetails(String eventUuid);

  /**
   * Approximate nearest-neighbour lookup over a vector-indexed property.
   *
   * @param indexName name of the vector index
   * @param property embedding property inside the index
   * @param k number of neighbours
   * @param queryVector query embedding
   * @return matches, best first; scores in [0, 1]
   * @throws com.flamingo.ai.eventassistant.exception.CatalogStoreException flagged as index
   *     unavailable when the index does not exist
   */
  List<VectorMatch> vectorQuery(String indexName, String property, int k, List<Float> queryVector);

  /** Bulk scan of stored summaries, embeddings included. */
  List<CandidateSummary> getAllSummaries(int limit);

  /** Members of a curated collection ordered by rank. */
  List<CuratedEntry> getCollection(String category, int limit);
}
