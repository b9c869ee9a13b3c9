package com.flamingo.ai.eventassistant.catalog;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.Time;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.ClosePointInTimeRequest;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.OpenPointInTimeRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.eventassistant.catalog.EventPredicate.Condition;
import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.CuratedEntry;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.VectorMatch;
import com.flamingo.ai.eventassistant.exception.CatalogStoreException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Event catalog on Elasticsearch.
 *
 * <p>Three indices are read: events (document id = event uuid, keyword fields for city, category,
 * genre and duration, numeric price, date), event summaries (eventUuid, sentimentSummary and a
 * cosine {@code dense_vector}) and curated collection entries (category, eventUuid, rank, reason).
 * The catalog is populated by the enrichment pipeline; this adapter never writes.
 */
@Service
@Slf4j
public class ElasticsearchCatalogStore implements CatalogStore {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${catalog.index.events:events}")
  private String eventsIndex;

  @Value("${catalog.index.summaries:event-summaries}")
  private String summariesIndex;

  @Value("${catalog.index.collections:event-collections}")
  private String collectionsIndex;

  @Value("${catalog.eligible.page-size:5000}")
  private int eligiblePageSize;

  @Value("${catalog.eligible.max:100000}")
  private int eligibleMax;

  @Value("${catalog.eligible.keep-alive:1m}")
  private String eligibleKeepAlive;

  @Autowired
  public ElasticsearchCatalogStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /** Constructor for testing - allows setting index names. */
  @VisibleForTesting
  ElasticsearchCatalogStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String eventsIndex,
      String summariesIndex,
      String collectionsIndex) {
    this(elasticsearchClient, meterRegistry);
    this.eventsIndex = eventsIndex;
    this.summariesIndex = summariesIndex;
    this.collectionsIndex = collectionsIndex;
    this.eligiblePageSize = 5000;
    this.eligibleMax = 100000;
    this.eligibleKeepAlive = "1m";
  }

  @VisibleForTesting
  void setEligiblePaging(int pageSize, int max) {
    this.eligiblePageSize = pageSize;
    this.eligibleMax = max;
  }

  /**
   * Pages through every matching event with {@code search_after} over a point in time, so broad
   * filters are not cut off at the index result window. Stops at {@code catalog.eligible.max}.
   */
  @Override
  @Timed(value = "catalog.eligible", description = "Time to resolve the eligible event set")
  @CircuitBreaker(name = "catalog")
  public Set<String> findEventIds(EventPredicate predicate) {
    List<Query> clauses = predicate.conditions().stream().map(this::toQuery).toList();
    log.debug("Eligibility query on {}: {}", eventsIndex, predicate);
    Time keepAlive = Time.of(t -> t.time(eligibleKeepAlive));
    String pitId = openPointInTime(keepAlive);

    int pageSize = Math.min(eligiblePageSize, eligibleMax);
    Set<String> ids = new LinkedHashSet<>();
    try {
      List<FieldValue> searchAfter = null;
      while (true) {
        SearchRequest request = eligibilityPage(clauses, pitId, keepAlive, pageSize, searchAfter);
        SearchResponse<Map> response = search(request, eventsIndex);
        List<Hit<Map>> hits = response.hits().hits();
        for (Hit<Map> hit : hits) {
          if (ids.size() == eligibleMax) {
            break;
          }
          ids.add(hit.id());
        }
        if (response.pitId() != null) {
          pitId = response.pitId();
        }
        if (ids.size() == eligibleMax && hits.size() == pageSize) {
          log.warn(
              "Eligible set for [{}] reached the cap of {} events, remaining matches ignored",
              predicate,
              eligibleMax);
          meterRegistry.counter("catalog.eligible.truncated").increment();
          break;
        }
        if (hits.size() < pageSize) {
          break;
        }
        searchAfter = hits.get(hits.size() - 1).sort();
      }
    } finally {
      closePointInTime(pitId);
    }
    meterRegistry.counter("catalog.eligible.queries").increment();
    return ids;
  }

  private SearchRequest eligibilityPage(
      List<Query> clauses,
      String pitId,
      Time keepAlive,
      int pageSize,
      List<FieldValue> searchAfter) {
    return SearchRequest.of(
        s -> {
          s.pit(p -> p.id(pitId).keepAlive(keepAlive))
              .query(q -> q.bool(b -> b.filter(clauses)))
              .source(src -> src.fetch(false))
              .sort(so -> so.field(f -> f.field("_shard_doc")))
              .size(pageSize);
          if (searchAfter != null) {
            s.searchAfter(searchAfter);
          }
          return s;
        });
  }

  private String openPointInTime(Time keepAlive) {
    try {
      return elasticsearchClient
          .openPointInTime(
              OpenPointInTimeRequest.of(o -> o.index(eventsIndex).keepAlive(keepAlive)))
          .id();
    } catch (ElasticsearchException e) {
      throw new CatalogStoreException(
          "Cannot open point in time on " + eventsIndex + ": " + e.getMessage(),
          e,
          isIndexProblem(e));
    } catch (IOException e) {
      throw new CatalogStoreException("Cannot open point in time on " + eventsIndex, e);
    }
  }

  private void closePointInTime(String pitId) {
    try {
      elasticsearchClient.closePointInTime(ClosePointInTimeRequest.of(c -> c.id(pitId)));
    } catch (IOException | ElasticsearchException e) {
      // Expires with its keep-alive
      log.debug("Failed to close point in time: {}", e.getMessage());
    }
  }

  @Override
  @CircuitBreaker(name = "catalog")
  public Optional<EventDetails> findEventDetails(String eventUuid) {
    try {
      GetResponse<Map> response =
          elasticsearchClient.get(g -> g.index(eventsIndex).id(eventUuid), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      return Optional.of(toEventDetails(eventUuid, castSource(response.source())));
    } catch (IOException | ElasticsearchException e) {
      throw new CatalogStoreException("Failed to fetch event " + eventUuid, e);
    }
  }

  @Override
  @Timed(value = "catalog.vector_query", description = "Time for approximate kNN lookup")
  public List<VectorMatch> vectorQuery(
      String indexName, String property, int k, List<Float> queryVector) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        kn ->
                            kn.field(property)
                                .queryVector(queryVector)
                                .k(k)
                                .numCandidates(Math.max(k * 5, 100)))
                    .source(src -> src.filter(f -> f.excludes(property)))
                    .size(k));
    SearchResponse<Map> response;
    try {
      response = elasticsearchClient.search(request, Map.class);
    } catch (ElasticsearchException e) {
      if (isIndexProblem(e)) {
        log.warn("Vector index '{}' unavailable: {}", indexName, e.getMessage());
        throw CatalogStoreException.indexUnavailable(indexName, e);
      }
      throw new CatalogStoreException("Vector query failed on " + indexName, e);
    } catch (IOException e) {
      throw new CatalogStoreException("Vector query failed on " + indexName, e);
    }

    List<VectorMatch> matches = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      if (hit.source() == null) {
        continue;
      }
      double score = hit.score() != null ? hit.score() : 0.0;
      matches.add(new VectorMatch(toSummary(hit.id(), castSource(hit.source())), score));
    }
    meterRegistry.counter("catalog.vector_query").increment();
    return matches;
  }

  @Override
  @Timed(value = "catalog.summary_scan", description = "Time to scan stored summaries")
  @CircuitBreaker(name = "catalog")
  public List<CandidateSummary> getAllSummaries(int limit) {
    SearchRequest request =
        SearchRequest.of(s -> s.index(summariesIndex).query(q -> q.matchAll(m -> m)).size(limit));
    SearchResponse<Map> response = search(request, summariesIndex);
    List<CandidateSummary> summaries = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      if (hit.source() != null) {
        summaries.add(toSummary(hit.id(), castSource(hit.source())));
      }
    }
    log.debug("Scanned {} summaries from {}", summaries.size(), summariesIndex);
    return summaries;
  }

  @Override
  @Timed(value = "catalog.collection", description = "Time to load a curated collection")
  @CircuitBreaker(name = "catalog")
  public List<CuratedEntry> getCollection(String category, int limit) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(collectionsIndex)
                    .query(q -> q.term(t -> t.field("category").value(category)))
                    .sort(so -> so.field(f -> f.field("rank").order(SortOrder.Asc)))
                    .size(limit));
    SearchResponse<Map> response = search(request, collectionsIndex);

    List<CuratedEntry> entries = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      if (hit.source() == null) {
        continue;
      }
      Map<String, Object> source = castSource(hit.source());
      String eventUuid = asString(source.get("eventUuid"));
      if (eventUuid == null) {
        log.warn("Collection entry {} in '{}' has no eventUuid, skipping", hit.id(), category);
        continue;
      }
      Optional<EventDetails> details = findEventDetails(eventUuid);
      if (details.isEmpty()) {
        log.warn("Collection '{}' references missing event {}", category, eventUuid);
        continue;
      }
      Integer rank = asInteger(source.get("rank"));
      entries.add(
          new CuratedEntry(
              details.get(),
              findSummary(eventUuid).orElse(null),
              rank != null ? rank : entries.size() + 1,
              asString(source.get("reason"))));
    }
    return entries;
  }

  private Optional<CandidateSummary> findSummary(String eventUuid) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(summariesIndex)
                    .query(q -> q.term(t -> t.field("eventUuid").value(eventUuid)))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(1));
    SearchResponse<Map> response = search(request, summariesIndex);
    return response.hits().hits().stream()
        .filter(hit -> hit.source() != null)
        .findFirst()
        .map(hit -> toSummary(hit.id(), castSource(hit.source())));
  }

  private SearchResponse<Map> search(SearchRequest request, String index) {
    try {
      return elasticsearchClient.search(request, Map.class);
    } catch (ElasticsearchException e) {
      throw new CatalogStoreException(
          "Search failed on " + index + ": " + e.getMessage(), e, isIndexProblem(e));
    } catch (IOException e) {
      throw new CatalogStoreException("Search failed on " + index + ": " + e.getMessage(), e);
    }
  }

  private Query toQuery(Condition condition) {
    String field = condition.field().property();
    switch (condition.operator()) {
      case CONTAINS_IGNORE_CASE:
        String pattern = "*" + escapeWildcard((String) condition.value()) + "*";
        return Query.of(q -> q.wildcard(w -> w.field(field).value(pattern).caseInsensitive(true)));
      case AT_MOST:
        if (condition.field() == EventPredicate.Field.DATE) {
          String date = condition.value().toString();
          return Query.of(q -> q.range(r -> r.date(d -> d.field(field).lte(date))));
        }
        double max = (Double) condition.value();
        return Query.of(q -> q.range(r -> r.number(n -> n.field(field).lte(max))));
      case AT_LEAST:
        if (condition.field() == EventPredicate.Field.DATE) {
          String date = condition.value().toString();
          return Query.of(q -> q.range(r -> r.date(d -> d.field(field).gte(date))));
        }
        double min = (Double) condition.value();
        return Query.of(q -> q.range(r -> r.number(n -> n.field(field).gte(min))));
      default:
        throw new IllegalArgumentException("Unsupported operator " + condition.operator());
    }
  }

  private static boolean isIndexProblem(ElasticsearchException e) {
    String type = e.error() != null ? e.error().type() : null;
    return e.status() == 404
        || "index_not_found_exception".equals(type)
        || "search_phase_execution_exception".equals(type);
  }

  static String escapeWildcard(String value) {
    return value.replace("\\", "\\\\").replace("*", "\\*").replace("?", "\\?");
  }

  @VisibleForTesting
  static EventDetails toEventDetails(String id, Map<String, Object> source) {
    String uuid = asString(source.get("uuid"));
    return new EventDetails(
        uuid != null ? uuid : id,
        asString(source.get("title")),
        asString(source.get("venue")),
        asDate(source.get("date")),
        asDouble(source.get("price")),
        asString(source.get("city")),
        asString(source.get("category")),
        asString(source.get("genre")),
        asString(source.get("duration")));
  }

  @VisibleForTesting
  static CandidateSummary toSummary(String id, Map<String, Object> source) {
    String eventUuid = asString(source.get("eventUuid"));
    return new CandidateSummary(
        eventUuid != null ? eventUuid : id,
        asString(source.get("sentimentSummary")),
        asVector(source.get("embedding")));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> castSource(Map source) {
    return (Map<String, Object>) source;
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  private static Integer asInteger(Object value) {
    if (value instanceof Number n) {
      return n.intValue();
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Double asDouble(Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Double.parseDouble(s.trim().replace(',', '.'));
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static LocalDate asDate(Object value) {
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    if (text.length() > 10) {
      text = text.substring(0, 10);
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      log.debug("Unparseable event date '{}'", value);
      return null;
    }
  }

  private static List<Float> asVector(Object value) {
    if (!(value instanceof List<?> list) || list.isEmpty()) {
      return null;
    }
    List<Float> vector = new ArrayList<>(list.size());
    for (Object element : list) {
      if (!(element instanceof Number n)) {
        return null;
      }
      vector.add(n.floatValue());
    }
    return vector;
  }
}
