package com.slacknotiphier.firehose.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of one firehose webhook call: the object that changed and the PHIDs of the transactions
 * applied to it.
 */
public record FirehosePayload(String objectType, String objectPhid, List<String> transactionPhids) {

  public FirehosePayload {
    transactionPhids = List.copyOf(transactionPhids);
  }

  /**
   * Extracts the payload from the raw request. Identifiers are read from {@code phid}, falling back
   * to {@code id}.
   *
   * @throws IllegalArgumentException if a required field is missing
   */
  public static FirehosePayload from(JsonNode request) {
    if (request == null || !request.isObject()) {
      throw new IllegalArgumentException("Firehose request must be a JSON object");
    }
    JsonNode object = request.path("object");
    if (!object.isObject()) {
      throw new IllegalArgumentException("Firehose request has no 'object'");
    }
    String type = required(object, "type");
    String phid = identifier(object);

    JsonNode transactions = request.path("transactions");
    if (!transactions.isArray()) {
      throw new IllegalArgumentException("Firehose request has no 'transactions' list");
    }
    List<String> phids = new ArrayList<>();
    for (JsonNode t : transactions) {
      phids.add(identifier(t));
    }
    return new FirehosePayload(type, phid, phids);
  }

  private static String identifier(JsonNode node) {
    JsonNode phid = node.path("phid");
    if (phid.isTextual() && !phid.asText().isBlank()) {
      return phid.asText();
    }
    return required(node, "id");
  }

  private static String required(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
      throw new IllegalArgumentException("Firehose request is missing '" + field + "'");
    }
    return value.asText();
  }
}
