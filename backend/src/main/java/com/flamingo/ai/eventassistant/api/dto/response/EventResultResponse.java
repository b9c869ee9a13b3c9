package com.flamingo.ai.eventassistant.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.eventassistant.domain.EventDetails;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One logical event in an answer, with all of its dates. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventResultResponse {

  private String eventUuid;
  private String title;
  private String venue;
  private String city;
  private String category;
  private String genre;
  private String duration;
  private Double price;
  private List<LocalDate> dates;
  private double score;
  private String summary;
  private String reason;

  public static EventResultResponse fromGroup(ResultGroup group) {
    EventDetails details = group.details();
    return EventResultResponse.builder()
        .eventUuid(details.uuid())
        .title(details.title())
        .venue(details.venue())
        .city(details.city())
        .category(details.category())
        .genre(details.genre())
        .duration(details.duration())
        .price(details.price())
        .dates(group.dates())
        .score(group.score())
        .summary(group.summary() != null ? group.summary().sentimentSummary() : null)
        .reason(group.curationReason())
        .build();
  }
}
