package com.flamingo.ai.eventassistant.domain;

/** A single utterance kept in session memory. */
public record ConversationTurn(TurnRole role, String text) {

  public static ConversationTurn user(String text) {
    return new ConversationTurn(TurnRole.USER, text);
  }

  public static ConversationTurn assistant(String text) {
    return new ConversationTurn(TurnRole.ASSISTANT, text);
  }
}
