package com.flamingo.ai.eventassistant.service.session;

import com.flamingo.ai.eventassistant.config.AssistantConfig;
import com.flamingo.ai.eventassistant.exception.SessionNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/** In-memory implementation of the SessionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final Map<UUID, ConversationSession> sessions = new ConcurrentHashMap<>();

  private final AssistantConfig assistantConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  public ConversationSession createSession() {
    ConversationSession session =
        new ConversationSession(
            UUID.randomUUID(), assistantConfig.getSession().getMaxTurns(), clock.instant());
    sessions.put(session.getId(), session);
    meterRegistry.counter("session.created").increment();
    log.info("Created session with ID: {}", session.getId());
    return session;
  }

  @Override
  public ConversationSession getSession(UUID sessionId) {
    ConversationSession session = sessions.get(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    session.touch(clock.instant());
    return session;
  }

  @Override
  public List<ConversationSession> getAllSessions() {
    return sessions.values().stream()
        .sorted(Comparator.comparing(ConversationSession::getLastAccessedAt).reversed())
        .toList();
  }

  @Override
  public void deleteSession(UUID sessionId) {
    ConversationSession removed = sessions.remove(sessionId);
    if (removed == null) {
      throw new SessionNotFoundException(sessionId);
    }
    removed.clear();
    meterRegistry.counter("session.deleted").increment();
    log.info("Deleted session {}", sessionId);
  }

  /**
   * Evicts sessions idle for longer than {@code assistant.session.idle-timeout}.
   *
   * @return number of sessions evicted
   */
  @Scheduled(fixedDelayString = "${assistant.session.sweep-interval:PT5M}")
  public int evictIdleSessions() {
    Duration idleTimeout = assistantConfig.getSession().getIdleTimeout();
    if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(idleTimeout);
    int evicted = 0;
    for (ConversationSession session : sessions.values()) {
      if (session.getLastAccessedAt().isBefore(cutoff)
          && sessions.remove(session.getId(), session)) {
        session.clear();
        evicted++;
      }
    }
    if (evicted > 0) {
      meterRegistry.counter("session.evicted").increment(evicted);
      log.info("Evicted {} sessions idle since before {}", evicted, cutoff);
    }
    return evicted;
  }
}
