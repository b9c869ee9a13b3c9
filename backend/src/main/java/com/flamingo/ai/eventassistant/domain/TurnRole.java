package com.flamingo.ai.eventassistant.domain;

/** Speaker of a conversation turn. */
public enum TurnRole {
  USER,
  ASSISTANT
}
