package com.flamingo.ai.eventassistant.service.session;

import java.util.List;
import java.util.UUID;

/** Service interface for assistant session management. */
public interface SessionService {

  /**
   * Creates a new session with empty memory.
   *
   * @return the created session
   */
  ConversationSession createSession();

  /**
   * Gets a session by ID and marks it as accessed.
   *
   * @param sessionId the session ID
   * @return the session
   * @throws com.flamingo.ai.eventassistant.exception.SessionNotFoundException if not found
   */
  ConversationSession getSession(UUID sessionId);

  /**
   * Gets all live sessions, most recently accessed first.
   *
   * @return list of sessions
   */
  List<ConversationSession> getAllSessions();

  /**
   * Deletes a session and discards its memory.
   *
   * @param sessionId the session ID
   * @throws com.flamingo.ai.eventassistant.exception.SessionNotFoundException if not found
   */
  void deleteSession(UUID sessionId);
}
