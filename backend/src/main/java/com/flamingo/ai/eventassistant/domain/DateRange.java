package com.flamingo.ai.eventassistant.domain;

import java.time.LocalDate;

/** Inclusive date window; either bound may be absent. */
public record DateRange(LocalDate start, LocalDate end) {

  public boolean isUnbounded() {
    return start == null && end == null;
  }

  public boolean contains(LocalDate date) {
    if (date == null) {
      return false;
    }
    if (start != null && date.isBefore(start)) {
      return false;
    }
    return end == null || !date.isAfter(end);
  }
}
