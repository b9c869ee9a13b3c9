package com.flamingo.ai.eventassistant.exception;

/** Exception thrown when a curated collection tag is not one of the known intents. */
public class UnknownCollectionException extends RuntimeException {

  private final String tag;

  public UnknownCollectionException(String tag) {
    super("Unknown collection: " + tag);
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
