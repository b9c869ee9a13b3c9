package com.flamingo.ai.eventassistant.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Configuration properties for the event assistant pipeline. */
@ConfigurationProperties(prefix = "assistant")
@Getter
@Setter
public class AssistantConfig {

  /** Zone the catalog's event dates are expressed in; relative dates resolve against it. */
  private String timeZone = "Europe/Istanbul";

  private Models models = new Models();
  private Intent intent = new Intent();
  private Filters filters = new Filters();
  private Retrieval retrieval = new Retrieval();
  private Rerank rerank = new Rerank();
  private Aggregation aggregation = new Aggregation();
  private Answer answer = new Answer();
  private Session session = new Session();
  private Curated curated = new Curated();
  private Cli cli = new Cli();

  /** Supported model providers. */
  public enum ModelProvider {
    OPENAI,
    OLLAMA
  }

  @Getter
  @Setter
  public static class Models {
    /** Cheap model used for intent classification and query embeddings. */
    private Endpoint fast = new Endpoint("gpt-4o-mini", Duration.ofSeconds(10));

    /** Higher-quality model used for filters, reranking and answers. */
    private Endpoint reasoning = new Endpoint("gpt-4o", Duration.ofSeconds(30));

    private Endpoint embedding = new Endpoint("text-embedding-3-small", Duration.ofSeconds(10));

    @Getter
    @Setter
    public static class Endpoint {
      private ModelProvider provider = ModelProvider.OPENAI;
      private String modelName;
      private String apiKey;

      /** Overrides the provider default; required for Ollama. */
      private String baseUrl;

      private Duration timeout;
      private Integer maxTokens;

      public Endpoint() {}

      public Endpoint(String modelName, Duration timeout) {
        this.modelName = modelName;
        this.timeout = timeout;
      }
    }
  }

  @Getter
  @Setter
  public static class Intent {
    private double temperature = 0.1;

    /** Query words that name a specific subject and therefore force a full search. */
    private List<String> subjectKeywords =
        new ArrayList<>(
            List.of(
                "istanbul", "ankara", "izmir", "tl", "concert", "jazz", "rock", "workshop",
                "atölye", "sinema", "cinema", "tiyatro", "theater", "theatre", "stand-up",
                "opera", "festival", "exhibition", "sergi"));
  }

  @Getter
  @Setter
  public static class Filters {
    private double temperature = 0.0;

    /** Drop text filters whose value does not literally occur in the query. */
    private boolean strictGrounding = true;

    /** Words that license a date range; without one (or a date-like token) it is discarded. */
    private List<String> dateKeywords =
        new ArrayList<>(
            List.of(
                "today", "tomorrow", "tonight", "weekend", "week", "month", "year", "bugün",
                "yarın", "akşam", "gece", "hafta", "ay", "yıl", "monday", "tuesday",
                "wednesday", "thursday", "friday", "saturday", "sunday", "pazartesi", "salı",
                "çarşamba", "perşembe", "cuma", "cumartesi", "pazar", "ocak", "şubat", "mart",
                "nisan", "mayıs", "haziran", "temmuz", "ağustos", "eylül", "ekim", "kasım",
                "aralık", "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct",
                "nov", "dec"));
  }

  @Getter
  @Setter
  public static class Retrieval {
    private String vectorIndexName = "event-summaries";
    private String vectorProperty = "embedding";
    private int vectorTopK = 20;
    private int fallbackScanLimit = 5000;
    private double fallbackMinSimilarity = 0.3;
    private int maxCandidates = 20;

    /** Upper bound for resolving event details of all candidates. */
    private Duration detailsTimeout = Duration.ofSeconds(3);
  }

  @Getter
  @Setter
  public static class Rerank {
    private boolean enabled = true;
    private double minScore = 0.4;

    /**
     * How many of the original candidates to keep when the judge rejects all of them. Zero keeps
     * nothing.
     */
    private int rejectAllFallbackSize = 3;

    private int summaryMaxChars = 300;
    private double temperature = 0.0;
  }

  @Getter
  @Setter
  public static class Aggregation {
    private int maxResults = 10;
  }

  @Getter
  @Setter
  public static class Answer {
    private int contextSize = 5;
    private int historyWindow = 6;
    private double temperature = 0.7;
    private String noMatchMessage = "I couldn't find any events matching your request.";
    private String fallbackMessage = "Here are the events I found.";
  }

  @Getter
  @Setter
  public static class Session {
    /** Ring-buffer capacity of each session's conversation memory. */
    private int maxTurns = 20;

    /** Sessions not accessed for this long are evicted; zero or negative keeps them forever. */
    private Duration idleTimeout = Duration.ofHours(2);
  }

  @Getter
  @Setter
  public static class Curated {
    private int limit = 5;
  }

  @Getter
  @Setter
  public static class Cli {
    private boolean enabled = false;
  }
}
