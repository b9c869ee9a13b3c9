package com.flamingo.ai.eventassistant.exception;

/** Exception thrown when the event catalog cannot be queried. */
public class CatalogStoreException extends RuntimeException {

  private final boolean indexUnavailable;

  public CatalogStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public CatalogStoreException(String message, Throwable cause, boolean indexUnavailable) {
    super(message, cause);
    this.indexUnavailable = indexUnavailable;
  }

  public static CatalogStoreException indexUnavailable(String indexName, Throwable cause) {
    return new CatalogStoreException("Index not available: " + indexName, cause, true);
  }

  public boolean isIndexUnavailable() {
    return indexUnavailable;
  }
}
