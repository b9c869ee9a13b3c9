package com.flamingo.ai.eventassistant.domain;

import java.time.LocalDate;

/**
 * Display and ranking projection of a stored event. One logical show may be stored as several
 * records that share title and venue but differ by date.
 */
public record EventDetails(
    String uuid,
    String title,
    String venue,
    LocalDate date,
    Double price,
    String city,
    String category,
    String genre,
    String duration) {}
