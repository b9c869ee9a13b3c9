package com.flamingo.ai.eventassistant.exception;

/** The model replied, but the reply is not valid JSON for the requested schema. */
public class MalformedResponseException extends ModelBackendException {

  private final String rawResponse;

  public MalformedResponseException(
      String backend, String message, String rawResponse, Throwable cause) {
    super(backend, message, cause);
    this.rawResponse = rawResponse;
  }

  public String getRawResponse() {
    return rawResponse;
  }
}
