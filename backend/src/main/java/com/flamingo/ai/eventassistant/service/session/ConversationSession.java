package com.flamingo.ai.eventassistant.service.session;

import com.flamingo.ai.eventassistant.domain.ConversationTurn;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One conversation with the assistant. Memory is a ring buffer of the most recent turns; queries
 * against the same session run one at a time.
 */
public class ConversationSession {

  private final UUID id;
  private final Instant createdAt;
  private final int maxTurns;
  private final Deque<ConversationTurn> turns;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile Instant lastAccessedAt;

  public ConversationSession(UUID id, int maxTurns, Instant createdAt) {
    if (maxTurns < 2) {
      throw new IllegalArgumentException("maxTurns must hold at least one exchange: " + maxTurns);
    }
    this.id = id;
    this.maxTurns = maxTurns;
    this.createdAt = createdAt;
    this.lastAccessedAt = createdAt;
    this.turns = new ArrayDeque<>(maxTurns);
  }

  public UUID getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastAccessedAt() {
    return lastAccessedAt;
  }

  public int getMaxTurns() {
    return maxTurns;
  }

  /** Runs {@code work} while holding this session's lock. */
  public <T> T serialized(Supplier<T> work) {
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }

  /** Appends a user turn and the assistant's reply, evicting the oldest turns when full. */
  public void appendExchange(String userText, String assistantText) {
    lock.lock();
    try {
      push(ConversationTurn.user(userText));
      push(ConversationTurn.assistant(assistantText));
    } finally {
      lock.unlock();
    }
  }

  private void push(ConversationTurn turn) {
    if (turns.size() == maxTurns) {
      turns.removeFirst();
    }
    turns.addLast(turn);
  }

  /** Immutable copy of the retained history, oldest first. */
  public List<ConversationTurn> history() {
    lock.lock();
    try {
      return List.copyOf(turns);
    } finally {
      lock.unlock();
    }
  }

  /** The last {@code n} turns, oldest first. */
  public List<ConversationTurn> recent(int n) {
    List<ConversationTurn> all = history();
    if (n <= 0) {
      return List.of();
    }
    return all.size() <= n ? all : new ArrayList<>(all.subList(all.size() - n, all.size()));
  }

  public int size() {
    lock.lock();
    try {
      return turns.size();
    } finally {
      lock.unlock();
    }
  }

  void touch(Instant now) {
    this.lastAccessedAt = now;
  }

  void clear() {
    lock.lock();
    try {
      turns.clear();
    } finally {
      lock.unlock();
    }
  }
}
