package com.flamingo.ai.eventassistant.domain;

/** Membership of an event in a curated collection. Summary is null when none was generated. */
public record CuratedEntry(
    EventDetails details, CandidateSummary summary, int rank, String reason) {}
