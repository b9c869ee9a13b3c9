package com.flamingo.ai.eventassistant.pipeline;

import com.flamingo.ai.eventassistant.exception.CatalogStoreException;
import com.flamingo.ai.eventassistant.exception.MalformedResponseException;
import java.util.concurrent.TimeoutException;

/** Why a pipeline stage could not produce its normal output. */
public record RetrievalError(Kind kind, String stage, String message) {

  /** Error taxonomy shared by all stages. */
  public enum Kind {
    /** Model or catalog call failed. */
    BACKEND_UNAVAILABLE,
    /** Model answered, but not with parseable, schema-conforming JSON. */
    MALFORMED_RESPONSE,
    /** The vector index is missing; triggers the in-memory scan. */
    INDEX_UNAVAILABLE,
    /** A bounded call ran out of time. */
    TIMEOUT
  }

  public static RetrievalError of(Kind kind, String stage, String message) {
    return new RetrievalError(kind, stage, message);
  }

  /**
   * Classifies an exception raised inside a stage.
   *
   * @param stage stage name used in logs
   * @param cause the failure
   * @return the matching error
   */
  public static RetrievalError from(String stage, Throwable cause) {
    Throwable root = unwrap(cause);
    Kind kind;
    if (root instanceof MalformedResponseException) {
      kind = Kind.MALFORMED_RESPONSE;
    } else if (root instanceof CatalogStoreException cse && cse.isIndexUnavailable()) {
      kind = Kind.INDEX_UNAVAILABLE;
    } else if (root instanceof TimeoutException) {
      kind = Kind.TIMEOUT;
    } else {
      kind = Kind.BACKEND_UNAVAILABLE;
    }
    String message = root.getMessage() != null ? root.getMessage() : root.getClass().getName();
    return new RetrievalError(kind, stage, message);
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof java.util.concurrent.CompletionException
            || current instanceof java.util.concurrent.ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
