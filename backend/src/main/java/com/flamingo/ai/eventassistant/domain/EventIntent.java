package com.flamingo.ai.eventassistant.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Curated-collection intents a query can be routed to, plus the full-search sentinel. */
public enum EventIntent {
  BEST_VALUE("best-value", "High quality events with great value for money."),
  DATE_NIGHT("date-night", "Romantic, intimate, impressive date spots."),
  HIDDEN_GEMS("hidden-gems", "Unique, niche, off-the-beaten-path cool events."),
  THIS_WEEKEND("this-weekend", "The absolute best things happening this upcoming weekend."),

  /** Not a collection: run the full retrieval pipeline. */
  SEARCH("search", "Anything naming a specific genre, artist, topic or constraint.");

  private final String slug;
  private final String description;

  EventIntent(String slug, String description) {
    this.slug = slug;
    this.description = description;
  }

  public String getSlug() {
    return slug;
  }

  public String getDescription() {
    return description;
  }

  public boolean isCurated() {
    return this != SEARCH;
  }

  /**
   * Resolves a slug such as {@code "date-night"}; matching ignores case and surrounding blanks.
   *
   * @param slug the slug, may be null
   * @return the intent, or empty when the slug is unknown
   */
  public static Optional<EventIntent> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    String normalized = slug.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return Arrays.stream(values()).filter(i -> i.slug.equals(normalized)).findFirst();
  }
}
