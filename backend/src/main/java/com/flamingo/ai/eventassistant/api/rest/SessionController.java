package com.flamingo.ai.eventassistant.api.rest;

import com.flamingo.ai.eventassistant.api.dto.response.SessionResponse;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import com.flamingo.ai.eventassistant.service.session.SessionService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for assistant sessions. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionService sessionService;

  /** Creates a new session. */
  @PostMapping
  public ResponseEntity<SessionResponse> createSession() {
    ConversationSession session = sessionService.createSession();
    return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.fromSession(session));
  }

  /** Gets all sessions. */
  @GetMapping
  public ResponseEntity<List<SessionResponse>> getAllSessions() {
    return ResponseEntity.ok(
        sessionService.getAllSessions().stream().map(SessionResponse::fromSession).toList());
  }

  /** Gets a session by ID. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(SessionResponse.fromSession(sessionService.getSession(sessionId)));
  }

  /** Deletes a session and its conversation memory. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteSession(@PathVariable UUID sessionId) {
    sessionService.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
