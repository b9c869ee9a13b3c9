package com.flamingo.ai.eventassistant.api.rest;

import com.flamingo.ai.eventassistant.api.dto.request.QueryRequest;
import com.flamingo.ai.eventassistant.api.dto.response.EventResultResponse;
import com.flamingo.ai.eventassistant.api.dto.response.QueryResponse;
import com.flamingo.ai.eventassistant.service.assistant.AssistantAnswer;
import com.flamingo.ai.eventassistant.service.assistant.EventAssistant;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import com.flamingo.ai.eventassistant.service.session.SessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for asking the assistant and browsing curated collections. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AssistantController {

  private final EventAssistant eventAssistant;
  private final SessionService sessionService;

  /** Answers a query within a session. */
  @PostMapping("/sessions/{sessionId}/query")
  public ResponseEntity<QueryResponse> query(
      @PathVariable UUID sessionId, @Valid @RequestBody QueryRequest request) {
    ConversationSession session = sessionService.getSession(sessionId);
    AssistantAnswer answer = eventAssistant.answerQuery(request.getQuery(), session);
    return ResponseEntity.ok(QueryResponse.fromAnswer(sessionId, answer));
  }

  /** Gets the events of a curated collection. */
  @GetMapping("/collections/{tag}")
  public ResponseEntity<List<EventResultResponse>> getCollection(@PathVariable String tag) {
    log.debug("Fetching curated collection '{}'", tag);
    return ResponseEntity.ok(
        eventAssistant.getCuratedCollection(tag).stream()
            .map(EventResultResponse::fromGroup)
            .toList());
  }
}
