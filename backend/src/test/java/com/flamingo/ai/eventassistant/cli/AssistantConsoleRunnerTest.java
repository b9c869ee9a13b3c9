package com.flamingo.ai.eventassistant.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.eventassistant.domain.EventIntent;
import com.flamingo.ai.eventassistant.service.assistant.AssistantAnswer;
import com.flamingo.ai.eventassistant.service.assistant.EventAssistant;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import com.flamingo.ai.eventassistant.service.session.SessionService;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssistantConsoleRunner Tests")
class AssistantConsoleRunnerTest {

  @Mock private EventAssistant eventAssistant;
  @Mock private SessionService sessionService;

  @InjectMocks private AssistantConsoleRunner runner;

  private String run(String input) throws Exception {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    runner.runLoop(
        new BufferedReader(new StringReader(input)),
        new PrintStream(buffer, true, StandardCharsets.UTF_8));
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Should answer each line until exit")
  void shouldAnswerUntilExit() throws Exception {
    ConversationSession session = new ConversationSession(UUID.randomUUID(), 20, Instant.EPOCH);
    when(sessionService.createSession()).thenReturn(session);
    when(eventAssistant.answerQuery("jazz tonight", session))
        .thenReturn(new AssistantAnswer("Nothing tonight.", List.of(), EventIntent.SEARCH));

    String output = run("jazz tonight\n\nexit\nnever asked\n");

    assertThat(output).contains("Nothing tonight.");
    verify(eventAssistant, times(1)).answerQuery(any(), any());
    verify(sessionService).deleteSession(session.getId());
  }

  @Test
  @DisplayName("Should start a fresh session on /reset")
  void shouldResetSession() throws Exception {
    ConversationSession first = new ConversationSession(UUID.randomUUID(), 20, Instant.EPOCH);
    ConversationSession second = new ConversationSession(UUID.randomUUID(), 20, Instant.EPOCH);
    when(sessionService.createSession()).thenReturn(first, second);
    when(eventAssistant.answerQuery(eq("theatre"), eq(second)))
        .thenReturn(new AssistantAnswer("Try Hamlet.", List.of(), EventIntent.SEARCH));

    String output = run("/reset\ntheatre\n");

    assertThat(output).contains("Started a new conversation.").contains("Try Hamlet.");
    verify(sessionService).deleteSession(first.getId());
    verify(sessionService).deleteSession(second.getId());
  }
}
