package com.flamingo.ai.eventassistant.exception;

/** Exception thrown when a model backend call fails. */
public class ModelBackendException extends RuntimeException {

  private final String backend;

  public ModelBackendException(String backend, String message) {
    super(message);
    this.backend = backend;
  }

  public ModelBackendException(String backend, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
  }

  public String getBackend() {
    return backend;
  }
}
