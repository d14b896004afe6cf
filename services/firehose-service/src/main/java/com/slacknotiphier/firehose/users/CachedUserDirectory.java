package com.slacknotiphier.firehose.users;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.slacknotiphier.firehose.client.PhabricatorClient;
import com.slacknotiphier.firehose.client.SlackClient;
import com.slacknotiphier.firehose.config.NotifierProperties;
import com.slacknotiphier.firehose.domain.UserDirectory;
import com.slacknotiphier.firehose.model.ResolvedUser;
import com.slacknotiphier.firehose.model.TrackerUser;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tracker users joined with Slack members by real name.
 *
 * <p>The joined snapshot is built on first use and rebuilt after the configured TTL.
 */
@Component
@Slf4j
public class CachedUserDirectory implements UserDirectory {

  private static final String SNAPSHOT_KEY = "users";

  private final PhabricatorClient phabricator;
  private final SlackClient slack;
  private final Cache<String, Snapshot> cache;

  @Autowired
  public CachedUserDirectory(
      PhabricatorClient phabricator, SlackClient slack, NotifierProperties properties) {
    this(phabricator, slack, properties.users().cacheTtl());
  }

  public CachedUserDirectory(PhabricatorClient phabricator, SlackClient slack, Duration ttl) {
    this.phabricator = phabricator;
    this.slack = slack;
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(ttl == null ? Duration.ofHours(1) : ttl)
            .maximumSize(1)
            .build();
  }

  @Override
  public Optional<ResolvedUser> find(String phid) {
    if (phid == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(snapshot().byPhid().get(phid)).map(Entry::toResolvedUser);
  }

  /**
   * Only users that have a Slack account have a mention; others resolve to empty so their
   * {@code @username} stays as written.
   */
  @Override
  public Optional<String> findMention(String phidOrUsername) {
    if (phidOrUsername == null) {
      return Optional.empty();
    }
    Snapshot snapshot = snapshot();
    Entry entry = snapshot.byPhid().get(phidOrUsername);
    if (entry == null) {
      entry = snapshot.byUsername().get(phidOrUsername);
    }
    return entry == null || entry.slackId() == null
        ? Optional.empty()
        : Optional.of(SlackClient.mention(entry.slackId()));
  }

  private Snapshot snapshot() {
    return cache.get(SNAPSHOT_KEY, key -> load());
  }

  private Snapshot load() {
    Map<String, String> slackIds = slack.getUsers();
    Map<String, Entry> byPhid = new HashMap<>();
    Map<String, Entry> byUsername = new HashMap<>();
    int matched = 0;
    for (TrackerUser user : phabricator.getUsers()) {
      String slackId = user.realName() == null ? null : slackIds.get(user.realName());
      Entry entry = new Entry(user.username(), slackId);
      byPhid.put(user.phid(), entry);
      byUsername.put(user.username(), entry);
      if (slackId != null) {
        matched++;
      }
    }
    log.info("Loaded {} Phabricator users, {} matched to Slack", byPhid.size(), matched);
    return new Snapshot(Map.copyOf(byPhid), Map.copyOf(byUsername));
  }

  private record Snapshot(Map<String, Entry> byPhid, Map<String, Entry> byUsername) {}

  private record Entry(String username, String slackId) {
    ResolvedUser toResolvedUser() {
      return slackId == null
          ? ResolvedUser.withoutChatAccount(username)
          : new ResolvedUser(username, SlackClient.mention(slackId));
    }
  }
}
