package com.flamingo.ai.eventassistant.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch.core.ClosePointInTimeRequest;
import co.elastic.clients.elasticsearch.core.OpenPointInTimeRequest;
import co.elastic.clients.elasticsearch.core.OpenPointInTimeResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.eventassistant.domain.CandidateSummary;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.EventFilters;
import com.flamingo.ai.eventassistant.exception.CatalogStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchCatalogStore Tests")
class ElasticsearchCatalogStoreTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private ElasticsearchCatalogStore store;

  @BeforeEach
  void setUp() {
    store =
        new ElasticsearchCatalogStore(
            elasticsearchClient,
            new SimpleMeterRegistry(),
            "events",
            "event-summaries",
            "event-collections");
  }

  @Nested
  @DisplayName("Source conversion")
  class SourceConversion {

    @Test
    @DisplayName("should convert a full event source")
    void shouldConvertEventSource() {
      Map<String, Object> source = new HashMap<>();
      source.put("uuid", "evt-1");
      source.put("title", "Jazz Night");
      source.put("venue", "Nardis");
      source.put("date", "2025-12-10T21:00:00");
      source.put("price", 450);
      source.put("city", "Istanbul");
      source.put("genre", "Jazz");

      EventDetails details = ElasticsearchCatalogStore.toEventDetails("doc-1", source);

      assertThat(details.uuid()).isEqualTo("evt-1");
      assertThat(details.date()).isEqualTo(LocalDate.of(2025, 12, 10));
      assertThat(details.price()).isEqualTo(450.0);
      assertThat(details.category()).isNull();
    }

    @Test
    @DisplayName("should fall back to the document id and tolerate bad values")
    void shouldTolerateBadValues() {
      Map<String, Object> source = new HashMap<>();
      source.put("title", "Show");
      source.put("date", "someday");
      source.put("price", "350,5");

      EventDetails details = ElasticsearchCatalogStore.toEventDetails("doc-2", source);

      assertThat(details.uuid()).isEqualTo("doc-2");
      assertThat(details.date()).isNull();
      assertThat(details.price()).isEqualTo(350.5);
    }

    @Test
    @DisplayName("should convert summaries with and without embeddings")
    void shouldConvertSummaries() {
      CandidateSummary withVector =
          ElasticsearchCatalogStore.toSummary(
              "s1",
              Map.of(
                  "eventUuid", "evt-1", "sentimentSummary", "Cozy", "embedding", List.of(0.5, 1)));
      CandidateSummary withoutVector =
          ElasticsearchCatalogStore.toSummary("s2", Map.of("sentimentSummary", "Loud"));

      assertThat(withVector.eventUuid()).isEqualTo("evt-1");
      assertThat(withVector.embedding()).containsExactly(0.5f, 1.0f);
      assertThat(withoutVector.eventUuid()).isEqualTo("s2");
      assertThat(withoutVector.hasEmbedding()).isFalse();
    }

    @Test
    @DisplayName("should escape wildcard metacharacters")
    void shouldEscapeWildcards() {
      assertThat(ElasticsearchCatalogStore.escapeWildcard("a*b?c")).isEqualTo("a\\*b\\?c");
    }
  }

  @Nested
  @DisplayName("Vector query failures")
  class VectorQueryFailures {

    @Test
    @DisplayName("should report a missing index as index unavailable")
    void shouldReportMissingIndex() throws IOException {
      ElasticsearchException missing =
          new ElasticsearchException(
              "search",
              ErrorResponse.of(
                  r ->
                      r.status(404)
                          .error(e -> e.type("index_not_found_exception").reason("missing"))));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(missing);

      assertThatThrownBy(() -> store.vectorQuery("event-summaries", "embedding", 20, List.of(1f)))
          .isInstanceOfSatisfying(
              CatalogStoreException.class, e -> assertThat(e.isIndexUnavailable()).isTrue());
    }

    @Test
    @DisplayName("should report I/O errors as plain store failures")
    void shouldReportIoErrors() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> store.vectorQuery("event-summaries", "embedding", 20, List.of(1f)))
          .isInstanceOfSatisfying(
              CatalogStoreException.class, e -> assertThat(e.isIndexUnavailable()).isFalse());
    }
  }
  @Nested
  @DisplayName("Eligible set paging")
  class EligibleSetPaging {

    private final EventPredicate inIstanbul =
        EventPredicate.fromFilters(new EventFilters(null, "Istanbul", null, null, null, null));

    @SuppressWarnings("unchecked")
    private SearchResponse<Map> page(String pitId, String... ids) {
      List<Hit<Map>> hits = new ArrayList<>();
      for (String id : ids) {
        long sortValue = Long.parseLong(id.substring(1));
        hits.add(Hit.<Map>of(h -> h.index("events").id(id).sort(FieldValue.of(sortValue))));
      }
      return SearchResponse.<Map>of(
          r ->
              r.took(1)
                  .timedOut(false)
                  .pitId(pitId)
                  .shards(sh -> sh.total(1).successful(1).failed(0))
                  .hits(h -> h.hits(hits)));
    }

    @BeforeEach
    void openPointInTime() throws IOException {
      when(elasticsearchClient.openPointInTime(any(OpenPointInTimeRequest.class)))
          .thenReturn(
              OpenPointInTimeResponse.of(
                  o -> o.id("pit-1").shards(sh -> sh.total(1).successful(1).failed(0))));
    }

    @Test
    @DisplayName("should follow search_after past the first page")
    void shouldCollectAllPages() throws IOException {
      store.setEligiblePaging(2, 100);
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(page("pit-2", "e1", "e2"), page("pit-2", "e3"));

      Set<String> ids = store.findEventIds(inIstanbul);

      assertThat(ids).containsExactly("e1", "e2", "e3");
      ArgumentCaptor<SearchRequest> requests = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient, times(2)).search(requests.capture(), eq(Map.class));
      SearchRequest second = requests.getAllValues().get(1);
      assertThat(second.pit().id()).isEqualTo("pit-2");
      assertThat(second.searchAfter()).hasSize(1);
      assertThat(second.searchAfter().get(0).longValue()).isEqualTo(2L);
      verify(elasticsearchClient).closePointInTime(any(ClosePointInTimeRequest.class));
    }

    @Test
    @DisplayName("should stop at the configured cap and count the truncation")
    void shouldStopAtCap() throws IOException {
      SimpleMeterRegistry registry = new SimpleMeterRegistry();
      ElasticsearchCatalogStore capped =
          new ElasticsearchCatalogStore(
              elasticsearchClient, registry, "events", "event-summaries", "event-collections");
      capped.setEligiblePaging(2, 3);
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(page("pit-1", "e1", "e2"), page("pit-1", "e3", "e4"));

      Set<String> ids = capped.findEventIds(inIstanbul);

      assertThat(ids).containsExactly("e1", "e2", "e3");
      assertThat(registry.counter("catalog.eligible.truncated").count()).isEqualTo(1.0);
      verify(elasticsearchClient).closePointInTime(any(ClosePointInTimeRequest.class));
    }

    @Test
    @DisplayName("should release the point in time when a page fails")
    void shouldClosePointInTimeOnFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection reset"));

      assertThatThrownBy(() -> store.findEventIds(inIstanbul))
          .isInstanceOf(CatalogStoreException.class);
      verify(elasticsearchClient).closePointInTime(any(ClosePointInTimeRequest.class));
    }
  }
}
