package com.flamingo.ai.eventassistant.domain;

/** A summary returned by a nearest-neighbour lookup together with its similarity score. */
public record VectorMatch(CandidateSummary summary, double score) {}
