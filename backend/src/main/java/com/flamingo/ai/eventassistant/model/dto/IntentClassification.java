package com.flamingo.ai.eventassistant.model.dto;

/** Structured reply of the intent classification prompt. */
public record IntentClassification(String intent, Double confidence, String reasoning) {}
