package com.flamingo.ai.eventassistant.service.assistant;

import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.domain.ResultGroup;
import java.util.List;

/**
 * What a query produces: the text shown to the user and the events behind it.
 *
 * @param answer conversational text; never null
 * @param results result groups, best first; possibly empty
 * @param intent how the query was routed
 */
public record AssistantAnswer(String answer, List<ResultGroup> results, EventIntent intent) {

  public AssistantAnswer {
    results = List.copyOf(results);
  }
}
