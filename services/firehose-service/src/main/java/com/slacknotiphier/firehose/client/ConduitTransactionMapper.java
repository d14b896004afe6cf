package com.slacknotiphier.firehose.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.slacknotiphier.firehose.model.EnrichedTransaction;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps {@code transaction.search} results onto {@link EnrichedTransaction}.
 *
 * <p>Subtype codes are {@code <prefix>-<action>}: comments and inline comments become {@code
 * add-comment}, owner changes become {@code claim} when the author takes the object and {@code
 * assign} otherwise, status and priority changes become {@code change-status} and {@code
 * change-priority}. Every other conduit type is kept as is.
 */
final class ConduitTransactionMapper {

  private ConduitTransactionMapper() {}

  static EnrichedTransaction map(
      JsonNode tx, String prefix, String objectPhid, String repository) {
    String conduitType = text(tx.path("type"));
    String author = text(tx.path("authorPHID"));
    JsonNode fields = tx.path("fields");
    String comment = comment(tx.path("comments"));

    String action;
    String assignee = null;
    if (conduitType == null || "comment".equals(conduitType) || "inline".equals(conduitType)) {
      action = comment == null ? "unknown" : "add-comment";
    } else {
      action =
          switch (conduitType) {
            case "owner" -> {
              assignee = text(fields.path("new"));
              yield assignee != null && assignee.equals(author) ? "claim" : "assign";
            }
            case "status" -> "change-status";
            case "priority" -> "change-priority";
            default -> conduitType;
          };
    }

    String object = text(tx.path("objectPHID"));
    return new EnrichedTransaction(
        prefix + "-" + action,
        author,
        object == null ? objectPhid : object,
        repository,
        comment,
        assignee,
        value(fields.path("old")),
        value(fields.path("new")));
  }

  static List<EnrichedTransaction> mapAll(
      JsonNode data, String prefix, String objectPhid, String repository) {
    List<EnrichedTransaction> out = new ArrayList<>();
    for (JsonNode tx : data) {
      out.add(map(tx, prefix, objectPhid, repository));
    }
    return out;
  }

  private static String comment(JsonNode comments) {
    for (JsonNode c : comments) {
      if (c.path("removed").asBoolean(false)) {
        continue;
      }
      String raw = text(c.path("content").path("raw"));
      if (raw != null && !raw.isBlank()) {
        return raw;
      }
    }
    return null;
  }

  /** Priority values come as {@code {"value": 90, "name": "Needs Triage"}}. */
  private static String value(JsonNode node) {
    if (node.isObject()) {
      return text(node.path("name"));
    }
    return text(node);
  }

  private static String text(JsonNode node) {
    return node.isMissingNode() || node.isNull() ? null : node.asText();
  }
}
