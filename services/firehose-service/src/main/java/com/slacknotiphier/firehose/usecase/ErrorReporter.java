package com.slacknotiphier.firehose.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slacknotiphier.firehose.domain.Notifier;
import com.slacknotiphier.firehose.model.RenderedMessage;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reports a failed webhook request to chat. Never throws. */
@Component
@Slf4j
public class ErrorReporter {

  private static final String STACK_INDENT = "        ";

  private final Notifier notifier;
  private final ObjectMapper objectMapper;

  public ErrorReporter(Notifier notifier, ObjectMapper objectMapper) {
    this.notifier = notifier;
    this.objectMapper = objectMapper;
  }

  public void report(Object request, Throwable error) {
    log.error("Failed to process firehose request", error);
    try {
      notifier.send(RenderedMessage.error(compose(request, error)));
    } catch (Exception e) {
      log.error("Failed to deliver error report for: {}", error.toString(), e);
    }
  }

  String compose(Object request, Throwable error) {
    return "*Exception in Slack-Notiphier:* "
        + error
        + "\n*Original message:* "
        + serialize(request)
        + "\n*Stacktrace:*\n"
        + indent(stackTrace(error));
  }

  private String serialize(Object request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (Exception e) {
      log.warn("Cannot serialize original request: {}", e.getMessage());
      return String.valueOf(request);
    }
  }

  private static String stackTrace(Throwable error) {
    StringWriter out = new StringWriter();
    error.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  private static String indent(String text) {
    return text.lines()
        .map(line -> line.isBlank() ? line : STACK_INDENT + line)
        .collect(Collectors.joining("\n"));
  }
}
