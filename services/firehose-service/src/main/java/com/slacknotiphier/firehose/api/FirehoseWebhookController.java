package com.slacknotiphier.firehose.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.slacknotiphier.firehose.usecase.TransactionDispatcher;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Firehose webhook endpoint.
 *
 * <p>Any well-formed request is acknowledged with {@code OK}, whatever happens while it is
 * processed, so the tracker never retries. Processing failures surface in Slack and in the logs.
 */
@RestController
@Slf4j
public class FirehoseWebhookController {

  private final TransactionDispatcher dispatcher;

  public FirehoseWebhookController(TransactionDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  public String hello() {
    return "Hello, World!";
  }

  @PostMapping("/firehose")
  public ResponseEntity<?> firehose(@RequestBody(required = false) JsonNode request) {
    if (request == null || !request.isObject() || request.isEmpty()) {
      log.warn("Rejecting firehose call without a JSON object body");
      return ResponseEntity.badRequest()
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("error", "Bad request"));
    }
    try {
      dispatcher.handle(request);
    } catch (RuntimeException e) {
      log.error("Firehose processing failed outside the error reporter", e);
    }
    return ResponseEntity.ok("OK\n");
  }
}
