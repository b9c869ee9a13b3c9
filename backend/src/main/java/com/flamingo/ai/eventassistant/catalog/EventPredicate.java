package com.flamingo.ai.eventassistant.catalog;

import com.flamingo.ai.eventassistant.domain.DateRange;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.EventFilters;
import com.flamingo.ai.eventassistant.domain.TextFolding;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of exact/range conditions over event fields. Store adapters translate it into their
 * own query language; {@link #test(EventDetails)} evaluates the same semantics in memory.
 */
public final class EventPredicate {

  /** Filterable event fields. */
  public enum Field {
    PRICE("price"),
    CITY("city"),
    CATEGORY("category"),
    GENRE("genre"),
    DURATION("duration"),
    DATE("date");

    private final String property;

    Field(String property) {
      this.property = property;
    }

    /** Stored property name. */
    public String property() {
      return property;
    }
  }

  /** Comparison applied to a field. */
  public enum Operator {
    AT_MOST,
    AT_LEAST,
    CONTAINS_IGNORE_CASE
  }

  /**
   * One clause. {@code value} is a {@link Double} for price, a {@link LocalDate} for date and a
   * {@link String} otherwise.
   */
  public record Condition(Field field, Operator operator, Object value) {

    @Override
    public String toString() {
      return field.property() + " " + operator + " " + value;
    }
  }

  private static final EventPredicate EMPTY = new EventPredicate(List.of());

  private final List<Condition> conditions;

  private EventPredicate(List<Condition> conditions) {
    this.conditions = List.copyOf(conditions);
  }

  /** Builds the predicate from every present filter field. */
  public static EventPredicate fromFilters(EventFilters filters) {
    if (filters == null || !filters.hasConstraints()) {
      return EMPTY;
    }
    List<Condition> conditions = new ArrayList<>();
    if (filters.maxPrice() != null) {
      conditions.add(new Condition(Field.PRICE, Operator.AT_MOST, filters.maxPrice()));
    }
    addText(conditions, Field.CITY, filters.city());
    addText(conditions, Field.CATEGORY, filters.category());
    addText(conditions, Field.GENRE, filters.genre());
    addText(conditions, Field.DURATION, filters.duration());
    DateRange range = filters.dateRange();
    if (range != null) {
      if (range.start() != null) {
        conditions.add(new Condition(Field.DATE, Operator.AT_LEAST, range.start()));
      }
      if (range.end() != null) {
        conditions.add(new Condition(Field.DATE, Operator.AT_MOST, range.end()));
      }
    }
    return new EventPredicate(conditions);
  }

  private static void addText(List<Condition> conditions, Field field, String value) {
    if (value != null && !value.isBlank()) {
      conditions.add(new Condition(field, Operator.CONTAINS_IGNORE_CASE, value.trim()));
    }
  }

  public List<Condition> conditions() {
    return conditions;
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }

  /** True when {@code details} satisfies every condition. Missing values never satisfy one. */
  public boolean test(EventDetails details) {
    for (Condition condition : conditions) {
      if (!matches(condition, details)) {
        return false;
      }
    }
    return true;
  }

  private static boolean matches(Condition condition, EventDetails details) {
    switch (condition.field()) {
      case PRICE:
        return compare(details.price(), (Double) condition.value(), condition.operator());
      case DATE:
        LocalDate date = details.date();
        if (date == null) {
          return false;
        }
        int cmp = date.compareTo((LocalDate) condition.value());
        return condition.operator() == Operator.AT_MOST ? cmp <= 0 : cmp >= 0;
      case CITY:
        return TextFolding.containsFolded(details.city(), (String) condition.value());
      case CATEGORY:
        return TextFolding.containsFolded(details.category(), (String) condition.value());
      case GENRE:
        return TextFolding.containsFolded(details.genre(), (String) condition.value());
      case DURATION:
        return TextFolding.containsFolded(details.duration(), (String) condition.value());
      default:
        return false;
    }
  }

  private static boolean compare(Double actual, Double bound, Operator operator) {
    if (actual == null) {
      return false;
    }
    return operator == Operator.AT_MOST ? actual <= bound : actual >= bound;
  }

  @Override
  public String toString() {
    return conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND "));
  }
}
