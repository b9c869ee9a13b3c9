package com.flamingo.ai.eventassistant.api.dto.response;

import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID id;
  private int turnCount;
  private int maxTurns;
  private Instant createdAt;
  private Instant lastAccessedAt;

  public static SessionResponse fromSession(ConversationSession session) {
    return SessionResponse.builder()
        .id(session.getId())
        .turnCount(session.size())
        .maxTurns(session.getMaxTurns())
        .createdAt(session.getCreatedAt())
        .lastAccessedAt(session.getLastAccessedAt())
        .build();
  }
}
