package com.slacknotiphier.firehose.render;

import com.slacknotiphier.firehose.domain.ObjectLookup;
import com.slacknotiphier.firehose.domain.UnresolvableIdentityException;
import com.slacknotiphier.firehose.domain.UserDirectory;
import com.slacknotiphier.firehose.model.CommitAction;
import com.slacknotiphier.firehose.model.DiffAction;
import com.slacknotiphier.firehose.model.EnrichedTransaction;
import com.slacknotiphier.firehose.model.ObjectType;
import com.slacknotiphier.firehose.model.ProjectAction;
import com.slacknotiphier.firehose.model.RenderedMessage;
import com.slacknotiphier.firehose.model.RepositoryAction;
import com.slacknotiphier.firehose.model.ResolvedUser;
import com.slacknotiphier.firehose.model.TaskAction;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns enriched tracker transactions into chat messages.
 *
 * <p>Each object type has its own set of recognised subtypes; anything else renders to an empty
 * result. Unknown authors and owners raise {@link UnresolvableIdentityException}, whatever the
 * subtype, and the exception is left to the caller.
 */
@Component
public class MessageRenderer {

  private final ObjectLookup objects;
  private final UserDirectory users;
  private final MentionResolver mentions;
  private final ChannelRouter router;

  public MessageRenderer(
      ObjectLookup objects, UserDirectory users, MentionResolver mentions, ChannelRouter router) {
    this.objects = objects;
    this.users = users;
    this.mentions = mentions;
    this.router = router;
  }

  /**
   * Renders one transaction. The author, link and owner are resolved before the subtype is
   * looked at, so an unknown identity fails even for subtypes that produce no message.
   */
  public Optional<RenderedMessage> render(ObjectType objectType, EnrichedTransaction tx) {
    return switch (objectType) {
      case TASK -> renderTask(tx);
      case DIFF -> renderDiff(tx);
      case COMMIT -> renderCommit(tx);
      case PROJECT -> renderProject(tx);
      case REPOSITORY -> renderRepository(tx);
    };
  }

  private Optional<RenderedMessage> renderTask(EnrichedTransaction tx) {
    String link = objects.getLink(tx.object());
    Optional<String> ownerPhid = objects.getOwner(tx.object());
    ResolvedUser owner = ownerPhid.map(this::require).orElse(null);
    String author = require(tx.author()).displayName();
    boolean notifyOwner = owner != null && !Objects.equals(tx.author(), ownerPhid.get());

    return TaskAction.fromCode(tx.type())
        .map(
            action -> {
              String text =
                  switch (action) {
                    case CREATE -> String.format("User %s created task %s", author, link);
                    case ADD_COMMENT ->
                        String.format(
                            "User %s commented on task %s with: %s",
                            author, link, mentions.resolve(tx.comment()));
                    case CLAIM -> String.format("User %s claimed task %s", author, link);
                    case ASSIGN ->
                        String.format(
                            "User %s assigned %s to task %s", author, assignee(tx), link);
                    case CHANGE_STATUS ->
                        String.format(
                            "User %s changed the status of task %s from %s to %s",
                            author, link, tx.oldValue(), tx.newValue());
                    case CHANGE_PRIORITY ->
                        String.format(
                            "User %s changed the priority of task %s from %s to %s",
                            author, link, tx.oldValue(), tx.newValue());
                  };
              boolean prefixed =
                  switch (action) {
                    case ADD_COMMENT, CHANGE_STATUS, CHANGE_PRIORITY -> notifyOwner;
                    case CREATE, CLAIM, ASSIGN -> false;
                  };
              return RenderedMessage.of(prefixed ? owner.chatMention() + " " + text : text);
            });
  }

  private Optional<RenderedMessage> renderDiff(EnrichedTransaction tx) {
    String link = objects.getLink(tx.object());
    String ownerPhid =
        objects
            .getOwner(tx.object())
            .orElseThrow(
                () ->
                    new UnresolvableIdentityException("Diff " + tx.object() + " has no owner"));
    String ownerMention = require(ownerPhid).chatMention();
    String author = require(tx.author()).displayName();
    String channel = router.channelFor(tx.repository());

    return DiffAction.fromCode(tx.type())
        .map(
            action -> {
              String text =
                  switch (action) {
                    case CREATE -> String.format("User %s created diff %s", author, link);
                    case UPDATE -> String.format("User %s updated diff %s", author, link);
                    case ABANDON -> String.format("User %s abandoned diff %s", author, link);
                    case RECLAIM -> String.format("User %s reclaimed diff %s", author, link);
                    case ADD_COMMENT -> {
                      String message =
                          String.format(
                              "User %s commented on diff %s with %s",
                              author, link, mentions.resolve(tx.comment()));
                      yield Objects.equals(tx.author(), ownerPhid)
                          ? message
                          : ownerMention + " " + message;
                    }
                    case ACCEPT ->
                        String.format("%s User %s accepted diff %s", ownerMention, author, link);
                    case REQUEST_CHANGES ->
                        String.format(
                            "%s User %s requested changes to diff %s", ownerMention, author, link);
                    case COMMANDEER ->
                        String.format(
                            "%s User %s took command of diff %s", ownerMention, author, link);
                  };
              return RenderedMessage.of(text, channel);
            });
  }

  private Optional<RenderedMessage> renderCommit(EnrichedTransaction tx) {
    String link = objects.getLink(tx.object());
    String author = require(tx.author()).displayName();
    String channel = router.channelFor(tx.repository());

    return CommitAction.fromCode(tx.type())
        .map(
            action ->
                switch (action) {
                  case ADD_COMMENT ->
                      RenderedMessage.of(
                          String.format(
                              "User %s created commit %s on repository %s",
                              author, link, tx.repository()),
                          channel);
                });
  }

  private Optional<RenderedMessage> renderProject(EnrichedTransaction tx) {
    String link = objects.getLink(tx.object());
    String author = require(tx.author()).displayName();

    return ProjectAction.fromCode(tx.type())
        .map(
            action ->
                switch (action) {
                  case CREATE ->
                      RenderedMessage.of(String.format("User %s created project %s", author, link));
                });
  }

  private Optional<RenderedMessage> renderRepository(EnrichedTransaction tx) {
    String link = objects.getLink(tx.object());
    String author = require(tx.author()).displayName();

    return RepositoryAction.fromCode(tx.type())
        .map(
            action ->
                switch (action) {
                  case CREATE ->
                      RenderedMessage.of(
                          String.format("User %s created repository %s", author, link));
                });
  }

  private String assignee(EnrichedTransaction tx) {
    if (tx.assignee() == null || tx.assignee().isBlank()) {
      return "nobody";
    }
    return users.find(tx.assignee()).map(ResolvedUser::chatMention).orElse(tx.assignee());
  }

  private ResolvedUser require(String phid) {
    if (phid == null) {
      throw UnresolvableIdentityException.unknownUser(null);
    }
    return users.find(phid).orElseThrow(() -> UnresolvableIdentityException.unknownUser(phid));
  }
}
