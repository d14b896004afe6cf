package com.slacknotiphier.firehose.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.slacknotiphier.firehose.config.SlackProperties;
import com.slacknotiphier.firehose.domain.Notifier;
import com.slacknotiphier.firehose.model.RenderedMessage;
import com.slacknotiphier.firehose.render.ChannelRouter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Slack Web API access.
 *
 * <p>Required bot scopes: {@code chat:write} for posting, {@code users:read} for the member list.
 */
@Service
@Slf4j
public class SlackClient implements Notifier {

  private static final int USERS_PAGE_SIZE = 200;

  private final RestClient rest;
  private final ChannelRouter router;

  public SlackClient(RestClient.Builder builder, SlackProperties properties, ChannelRouter router) {
    String token = properties.token() == null ? "" : properties.token().trim();
    if (token.isBlank()) {
      throw new IllegalStateException("Can't find a token to connect to Slack.");
    }
    this.rest =
        builder
            .baseUrl(properties.baseUrl())
            .defaultHeader("Authorization", "Bearer " + token)
            .build();
    this.router = router;
  }

  /** Posts the message as a coloured attachment. Delivery failures are logged and dropped. */
  @Override
  public void send(RenderedMessage message) {
    String channel = message.channel() == null ? router.defaultChannel() : message.channel();
    Map<String, Object> attachment = new HashMap<>();
    attachment.put("color", message.severity().color());
    attachment.put("text", message.text());
    Map<String, Object> body = new HashMap<>();
    body.put("channel", channel);
    body.put("attachments", List.of(attachment));

    try {
      JsonNode result =
          rest.post()
              .uri("/chat.postMessage")
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      if (result == null || !result.path("ok").asBoolean(false)) {
        log.error(
            "Couldn't send message to Slack because '{}', dropping: {}",
            result == null ? "empty response" : result.path("error").asText(),
            message);
      }
    } catch (Exception e) {
      log.error(
          "Couldn't send message to Slack because '{}', dropping: {}", e.getMessage(), message);
    }
  }

  /**
   * Lists active human members.
   *
   * @return real name to Slack user id
   */
  public Map<String, String> getUsers() {
    log.info("Getting list of users from Slack...");
    Map<String, String> users = new HashMap<>();
    String cursor = "";
    do {
      JsonNode response = usersPage(cursor);
      if (response == null || !response.path("ok").asBoolean(false)) {
        String error = response == null ? "empty response" : response.path("error").asText();
        throw new SlackClientException(
            "Couldn't retrieve user list from Slack. Error: " + error);
      }
      for (JsonNode member : response.path("members")) {
        String realName = member.path("real_name").asText("");
        if (member.path("is_bot").asBoolean(true)
            || member.path("deleted").asBoolean(true)
            || realName.isBlank()) {
          continue;
        }
        users.put(realName, member.path("id").asText());
      }
      cursor = response.path("response_metadata").path("next_cursor").asText("");
    } while (!cursor.isBlank());
    return users;
  }

  private JsonNode usersPage(String cursor) {
    try {
      return rest.get()
          .uri(
              uriBuilder -> {
                uriBuilder.path("/users.list").queryParam("limit", USERS_PAGE_SIZE);
                if (!cursor.isBlank()) {
                  uriBuilder.queryParam("cursor", cursor);
                }
                return uriBuilder.build();
              })
          .retrieve()
          .body(JsonNode.class);
    } catch (Exception e) {
      throw new SlackClientException("Couldn't retrieve user list from Slack", e);
    }
  }

  /** Slack markup that pings the given user id. */
  public static String mention(String slackUserId) {
    return "<@" + slackUserId + ">";
  }
}
