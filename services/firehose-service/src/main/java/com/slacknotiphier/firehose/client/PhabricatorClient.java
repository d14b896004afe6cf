package com.slacknotiphier.firehose.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.slacknotiphier.firehose.config.PhabricatorProperties;
import com.slacknotiphier.firehose.domain.ObjectLookup;
import com.slacknotiphier.firehose.domain.TransactionSource;
import com.slacknotiphier.firehose.model.EnrichedTransaction;
import com.slacknotiphier.firehose.model.ObjectType;
import com.slacknotiphier.firehose.model.TrackerUser;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/** Conduit API client for the tracker. */
@Component
@Slf4j
public class PhabricatorClient implements TransactionSource, ObjectLookup {

  private static final Duration REPOSITORY_NAME_TTL = Duration.ofMinutes(10);

  private final RestClient rest;
  private final ObjectMapper objectMapper;
  private final String token;
  private final Cache<String, String> repositoryNames;

  public PhabricatorClient(
      RestClient.Builder builder, PhabricatorProperties properties, ObjectMapper objectMapper) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("phabricator.base-url must be configured");
    }
    this.rest = builder.baseUrl(properties.baseUrl()).build();
    this.objectMapper = objectMapper;
    this.token = properties.token() == null ? "" : properties.token().trim();
    this.repositoryNames =
        Caffeine.newBuilder().expireAfterWrite(REPOSITORY_NAME_TTL).maximumSize(500).build();
  }

  @Override
  public List<EnrichedTransaction> getTransactions(
      String objectType, String objectPhid, List<String> transactionPhids) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("objectIdentifier", objectPhid);
    params.put("constraints", Map.of("phids", transactionPhids));
    JsonNode result = call("transaction.search", params);

    Optional<ObjectType> type = ObjectType.fromCode(objectType);
    String prefix =
        type.map(ObjectType::subtypePrefix).orElse(objectType.toLowerCase(Locale.ROOT));
    String repository = type.map(t -> repositoryName(t, objectPhid)).orElse(null);
    return ConduitTransactionMapper.mapAll(result.path("data"), prefix, objectPhid, repository);
  }

  /** Slack link to the object, {@code <uri|full name>}. */
  @Override
  public String getLink(String phid) {
    JsonNode result = call("phid.query", Map.of("phids", List.of(phid)));
    JsonNode object = result.path(phid);
    if (object.isMissingNode() || object.isNull()) {
      throw new PhabricatorClientException("Phabricator doesn't know object " + phid);
    }
    return "<" + object.path("uri").asText() + "|" + object.path("fullName").asText() + ">";
  }

  @Override
  public Optional<String> getOwner(String phid) {
    JsonNode owner;
    String code = typeCode(phid);
    if ("TASK".equals(code)) {
      owner = firstFields("maniphest.search", phid).path("ownerPHID");
    } else if ("DREV".equals(code)) {
      owner = firstFields("differential.revision.search", phid).path("authorPHID");
    } else {
      return Optional.empty();
    }
    return owner.isTextual() && !owner.asText().isBlank()
        ? Optional.of(owner.asText())
        : Optional.empty();
  }

  /** All tracker users, following the search cursor. */
  public List<TrackerUser> getUsers() {
    log.info("Getting list of users from Phabricator...");
    List<TrackerUser> users = new ArrayList<>();
    String after = null;
    do {
      Map<String, Object> params = new LinkedHashMap<>();
      if (after != null) {
        params.put("after", after);
      }
      JsonNode result = call("user.search", params);
      for (JsonNode user : result.path("data")) {
        JsonNode fields = user.path("fields");
        users.add(
            new TrackerUser(
                user.path("phid").asText(),
                fields.path("username").asText(),
                fields.path("realName").asText("")));
      }
      JsonNode next = result.path("cursor").path("after");
      after = next.isNull() || next.isMissingNode() ? null : next.asText();
    } while (after != null);
    return users;
  }

  private String repositoryName(ObjectType type, String objectPhid) {
    String searchMethod =
        switch (type) {
          case DIFF -> "differential.revision.search";
          case COMMIT -> "diffusion.commit.search";
          case TASK, PROJECT, REPOSITORY -> null;
        };
    if (searchMethod == null) {
      return null;
    }
    JsonNode repositoryPhid = firstFields(searchMethod, objectPhid).path("repositoryPHID");
    if (!repositoryPhid.isTextual()) {
      return null;
    }
    return repositoryNames.get(
        repositoryPhid.asText(),
        phid -> {
          JsonNode fields = firstFields("diffusion.repository.search", phid);
          String shortName = fields.path("shortName").asText("");
          return shortName.isBlank() ? fields.path("name").asText(null) : shortName;
        });
  }

  private JsonNode firstFields(String method, String phid) {
    JsonNode result = call(method, Map.of("constraints", Map.of("phids", List.of(phid))));
    JsonNode data = result.path("data");
    if (!data.isArray() || data.isEmpty()) {
      throw new PhabricatorClientException(method + " found nothing for " + phid);
    }
    return data.get(0).path("fields");
  }

  JsonNode call(String method, Map<String, Object> params) {
    Map<String, Object> withToken = new LinkedHashMap<>(params);
    withToken.put("__conduit__", Map.of("token", token));
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    try {
      form.add("params", objectMapper.writeValueAsString(withToken));
    } catch (JsonProcessingException e) {
      throw new PhabricatorClientException("Cannot encode " + method + " parameters", e);
    }
    form.add("output", "json");
    form.add("__conduit__", "true");

    log.debug("Conduit request {}", method);
    JsonNode response =
        rest.post()
            .uri("/{method}", method)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .body(JsonNode.class);
    if (response == null) {
      throw new PhabricatorClientException("Conduit returned empty response for " + method);
    }
    JsonNode errorCode = response.path("error_code");
    if (!errorCode.isMissingNode() && !errorCode.isNull()) {
      throw new PhabricatorClientException(
          "Conduit error "
              + errorCode.asText()
              + " on "
              + method
              + ": "
              + response.path("error_info").asText());
    }
    return response.path("result");
  }

  private static String typeCode(String phid) {
    if (phid == null) {
      return "";
    }
    String[] parts = phid.split("-");
    return parts.length >= 2 ? parts[1] : "";
  }
}
