package com.flamingo.ai.eventassistant.service.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.eventassistant.domain.ConversationTurn;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversationSession Tests")
class ConversationSessionTest {

  private static ConversationSession session(int maxTurns) {
    return new ConversationSession(UUID.randomUUID(), maxTurns, Instant.EPOCH);
  }

  @Test
  @DisplayName("Should evict the oldest turns once full")
  void shouldEvictOldestTurns() {
    ConversationSession session = session(4);

    session.appendExchange("q1", "a1");
    session.appendExchange("q2", "a2");
    session.appendExchange("q3", "a3");

    assertThat(session.history())
        .containsExactly(
            ConversationTurn.user("q2"),
            ConversationTurn.assistant("a2"),
            ConversationTurn.user("q3"),
            ConversationTurn.assistant("a3"));
  }

  @Test
  @DisplayName("History snapshots are immutable and detached")
  void historySnapshotsAreDetached() {
    ConversationSession session = session(10);
    session.appendExchange("q1", "a1");

    List<ConversationTurn> snapshot = session.history();
    session.appendExchange("q2", "a2");

    assertThat(snapshot).hasSize(2);
    assertThatThrownBy(() -> snapshot.add(ConversationTurn.user("x")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Recent returns the last n turns, oldest first")
  void recentReturnsLastTurns() {
    ConversationSession session = session(10);
    session.appendExchange("q1", "a1");
    session.appendExchange("q2", "a2");

    assertThat(session.recent(3))
        .containsExactly(
            ConversationTurn.assistant("a1"),
            ConversationTurn.user("q2"),
            ConversationTurn.assistant("a2"));
    assertThat(session.recent(0)).isEmpty();
    assertThat(session.recent(10)).hasSize(4);
  }

  @Test
  @DisplayName("Should reject a capacity that cannot hold one exchange")
  void shouldRejectTinyCapacity() {
    assertThatThrownBy(() -> session(1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Serialized work never overlaps within a session")
  void serializedWorkDoesNotOverlap() throws InterruptedException {
    ConversationSession session = session(200);
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(threads);
    ExecutorService pool = Executors.newFixedThreadPool(threads);

    for (int i = 0; i < threads; i++) {
      int n = i;
      pool.submit(
          () -> {
            try {
              start.await();
              session.serialized(
                  () -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    session.appendExchange("q" + n, "a" + n);
                    inFlight.decrementAndGet();
                    return null;
                  });
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              done.countDown();
            }
          });
    }
    start.countDown();

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    pool.shutdown();
    assertThat(maxInFlight.get()).isEqualTo(1);
    assertThat(session.size()).isEqualTo(threads * 2);
  }
}
