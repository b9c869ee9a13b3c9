package com.flamingo.ai.eventassistant.cli;

import com.flamingo.ai.eventassistant.domain.ResultGroup;
import com.flamingo.ai.eventassistant.service.assistant.AssistantAnswer;
import com.flamingo.ai.eventassistant.service.assistant.EventAssistant;
import com.flamingo.ai.eventassistant.service.session.ConversationSession;
import com.flamingo.ai.eventassistant.service.session.SessionService;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Interactive console loop over a single session. Enabled with {@code assistant.cli.enabled=true}.
 *
 * <p>{@code /reset} starts a new session, {@code exit} or {@code quit} ends the loop.
 */
@Component
@ConditionalOnProperty(name = "assistant.cli.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AssistantConsoleRunner implements CommandLineRunner {

  private final EventAssistant eventAssistant;
  private final SessionService sessionService;

  @Override
  public void run(String... args) throws IOException {
    BufferedReader in =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    runLoop(in, System.out);
  }

  void runLoop(BufferedReader in, PrintStream out) throws IOException {
    ConversationSession session = sessionService.createSession();
    log.info("Console session {} started", session.getId());
    out.println("Ask me about events. Type 'exit' to quit, '/reset' to start over.");

    while (true) {
      out.print("> ");
      out.flush();
      String line = in.readLine();
      if (line == null) {
        break;
      }
      String query = line.trim();
      if (query.isEmpty()) {
        continue;
      }
      if ("exit".equalsIgnoreCase(query) || "quit".equalsIgnoreCase(query)) {
        break;
      }
      if ("/reset".equals(query)) {
        sessionService.deleteSession(session.getId());
        session = sessionService.createSession();
        out.println("Started a new conversation.");
        continue;
      }

      AssistantAnswer answer = eventAssistant.answerQuery(query, session);
      out.println();
      out.println(answer.answer());
      if (!answer.results().isEmpty()) {
        out.println();
        for (ResultGroup group : answer.results()) {
          out.printf(
              "  [%.2f] %s @ %s %s%n",
              group.score(), group.details().title(), group.details().venue(), group.dates());
        }
      }
      out.println();
    }

    sessionService.deleteSession(session.getId());
    log.info("Console session {} ended", session.getId());
  }
}
