package com.slacknotiphier.firehose.usecase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slacknotiphier.firehose.domain.Notifier;
import com.slacknotiphier.firehose.domain.TransactionSource;
import com.slacknotiphier.firehose.model.EnrichedTransaction;
import com.slacknotiphier.firehose.model.FirehosePayload;
import com.slacknotiphier.firehose.model.ObjectType;
import com.slacknotiphier.firehose.model.RenderedMessage;
import com.slacknotiphier.firehose.render.MessageRenderer;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handles one firehose webhook call: enriches its transactions, renders one message per
 * transaction and sends it.
 *
 * <p>Any failure stops the remaining transactions of the request and is reported once through
 * {@link ErrorReporter}; {@link #handle(JsonNode)} itself never throws.
 */
@Service
@Slf4j
public class TransactionDispatcher {

  private final TransactionSource transactions;
  private final MessageRenderer renderer;
  private final Notifier notifier;
  private final DebugNotes debugNotes;
  private final ErrorReporter errorReporter;
  private final ObjectMapper objectMapper;

  public TransactionDispatcher(
      TransactionSource transactions,
      MessageRenderer renderer,
      Notifier notifier,
      DebugNotes debugNotes,
      ErrorReporter errorReporter,
      ObjectMapper objectMapper) {
    this.transactions = transactions;
    this.renderer = renderer;
    this.notifier = notifier;
    this.debugNotes = debugNotes;
    this.errorReporter = errorReporter;
    this.objectMapper = objectMapper;
  }

  public void handle(JsonNode request) {
    try {
      FirehosePayload payload = FirehosePayload.from(request);
      if (log.isDebugEnabled()) {
        log.debug("Incoming message:\n{}", request.toPrettyString());
      }

      List<EnrichedTransaction> enriched =
          transactions.getTransactions(
              payload.objectType(), payload.objectPhid(), payload.transactionPhids());
      Optional<ObjectType> objectType = ObjectType.fromCode(payload.objectType());

      for (EnrichedTransaction tx : enriched) {
        Optional<RenderedMessage> message = objectType.flatMap(type -> renderer.render(type, tx));
        if (message.isEmpty()) {
          debugNotes.note("No message will be generated for: " + describe(tx));
          continue;
        }
        notifier.send(message.get());
        log.debug("Message: {}", message.get());
      }
    } catch (Exception e) {
      errorReporter.report(request, e);
    }
  }

  private String describe(EnrichedTransaction tx) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tx);
    } catch (JsonProcessingException e) {
      return tx.toString();
    }
  }
}
