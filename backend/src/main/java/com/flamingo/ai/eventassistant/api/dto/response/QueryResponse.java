package com.flamingo.ai.eventassistant.api.dto.response;

import com.flamingo.ai.eventassistant.service.assistant.AssistantAnswer;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  private UUID sessionId;
  private String intent;
  private String answer;
  private List<EventResultResponse> results;

  public static QueryResponse fromAnswer(UUID sessionId, AssistantAnswer answer) {
    return QueryResponse.builder()
        .sessionId(sessionId)
        .intent(answer.intent().getSlug())
        .answer(answer.answer())
        .results(answer.results().stream().map(EventResultResponse::fromGroup).toList())
        .build();
  }
}
