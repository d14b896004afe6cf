package com.slacknotiphier.firehose.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.slacknotiphier.firehose.domain.ObjectLookup;
import com.slacknotiphier.firehose.domain.UnresolvableIdentityException;
import com.slacknotiphier.firehose.domain.UserDirectory;
import com.slacknotiphier.firehose.model.EnrichedTransaction;
import com.slacknotiphier.firehose.model.ObjectType;
import com.slacknotiphier.firehose.model.RenderedMessage;
import com.slacknotiphier.firehose.model.ResolvedUser;
import com.slacknotiphier.firehose.model.Severity;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageRendererTest {

  private static final String ALICE = "PHID-USER-alice";
  private static final String OWEN = "PHID-USER-owen";
  private static final String BOB = "PHID-USER-bob";
  private static final String TASK = "PHID-TASK-1";
  private static final String DIFF = "PHID-DREV-1";

  private ObjectLookup objects;
  private UserDirectory users;
  private MessageRenderer renderer;

  @BeforeEach
  void setUp() {
    objects = mock(ObjectLookup.class);
    users = mock(UserDirectory.class);
    when(users.find(anyString())).thenReturn(Optional.empty());
    when(users.find(ALICE)).thenReturn(Optional.of(new ResolvedUser("alice", "<@U1>")));
    when(users.find(OWEN)).thenReturn(Optional.of(new ResolvedUser("owen", "<@U9>")));
    when(users.find(BOB)).thenReturn(Optional.of(new ResolvedUser("bob", "<@U2>")));
    when(users.findMention(anyString())).thenReturn(Optional.empty());
    when(users.findMention("bob")).thenReturn(Optional.of("<@U2>"));

    when(objects.getLink(TASK)).thenReturn("L");
    when(objects.getLink(DIFF)).thenReturn("D");
    when(objects.getOwner(anyString())).thenReturn(Optional.empty());

    ChannelRouter router =
        new ChannelRouter(Map.of("__default__", "#general", "backend", "#backend"));
    renderer =
        new MessageRenderer(objects, users, new MentionResolver(users, MentionMode.EXACT), router);
  }

  @Test
  void taskCreate() {
    Optional<RenderedMessage> msg =
        renderer.render(ObjectType.TASK, EnrichedTransaction.of("task-create", ALICE, TASK));

    assertThat(msg).isPresent();
    assertThat(msg.get().text()).isEqualTo("User alice created task L");
    assertThat(msg.get().channel()).isNull();
    assertThat(msg.get().severity()).isEqualTo(Severity.NONE);
  }

  @Test
  void taskComment_prefixesOwner_andResolvesMentions() {
    when(objects.getOwner(TASK)).thenReturn(Optional.of(OWEN));
    EnrichedTransaction tx = comment("task-add-comment", ALICE, TASK, "hey @bob check this");

    String text = renderer.render(ObjectType.TASK, tx).orElseThrow().text();

    assertThat(text)
        .isEqualTo("<@U9> User alice commented on task L with: hey <@U2> check this")
        .startsWith("<@U9> ")
        .contains("<@U2>")
        .doesNotContain("bob");
  }

  @Test
  void taskComment_byOwner_orWithoutOwner_hasNoPrefix() {
    EnrichedTransaction tx = comment("task-add-comment", ALICE, TASK, "done");

    assertThat(renderer.render(ObjectType.TASK, tx).orElseThrow().text())
        .isEqualTo("User alice commented on task L with: done");

    when(objects.getOwner(TASK)).thenReturn(Optional.of(ALICE));
    assertThat(renderer.render(ObjectType.TASK, tx).orElseThrow().text())
        .isEqualTo("User alice commented on task L with: done");
  }

  @Test
  void taskClaim() {
    assertThat(
            renderer
                .render(ObjectType.TASK, EnrichedTransaction.of("task-claim", ALICE, TASK))
                .orElseThrow()
                .text())
        .isEqualTo("User alice claimed task L");
  }

  @Test
  void taskAssign_toUser_orNobody() {
    EnrichedTransaction assigned =
        new EnrichedTransaction("task-assign", ALICE, TASK, null, null, BOB, null, BOB);
    EnrichedTransaction unassigned =
        new EnrichedTransaction("task-assign", ALICE, TASK, null, null, null, BOB, null);

    assertThat(renderer.render(ObjectType.TASK, assigned).orElseThrow().text())
        .isEqualTo("User alice assigned <@U2> to task L");
    assertThat(renderer.render(ObjectType.TASK, unassigned).orElseThrow().text())
        .isEqualTo("User alice assigned nobody to task L");
  }

  @Test
  void taskStatusAndPriority_prefixOwnerWhenSomeoneElseChangesThem() {
    when(objects.getOwner(TASK)).thenReturn(Optional.of(OWEN));
    EnrichedTransaction status =
        new EnrichedTransaction(
            "task-change-status", ALICE, TASK, null, null, null, "open", "resolved");
    EnrichedTransaction priority =
        new EnrichedTransaction(
            "task-change-priority", ALICE, TASK, null, null, null, "Normal", "High");

    assertThat(renderer.render(ObjectType.TASK, status).orElseThrow().text())
        .isEqualTo("<@U9> User alice changed the status of task L from open to resolved");
    assertThat(renderer.render(ObjectType.TASK, priority).orElseThrow().text())
        .isEqualTo("<@U9> User alice changed the priority of task L from Normal to High");
  }

  @Test
  void taskStatus_withoutOwner_hasNoPrefix() {
    EnrichedTransaction status =
        new EnrichedTransaction(
            "task-change-status", ALICE, TASK, null, null, null, "open", "resolved");

    assertThat(renderer.render(ObjectType.TASK, status).orElseThrow().text())
        .isEqualTo("User alice changed the status of task L from open to resolved");
  }

  @Test
  void unknownTaskSubtype_rendersNothing() {
    assertThat(renderer.render(ObjectType.TASK, EnrichedTransaction.of("task-title", ALICE, TASK)))
        .isEmpty();
  }

  @Test
  void diffLifecycle_isRoutedByRepository() {
    when(objects.getOwner(DIFF)).thenReturn(Optional.of(OWEN));

    assertThat(renderDiff("diff-create", ALICE, "backend").text())
        .isEqualTo("User alice created diff D");
    assertThat(renderDiff("diff-update", ALICE, "backend").text())
        .isEqualTo("User alice updated diff D");
    assertThat(renderDiff("diff-abandon", ALICE, "backend").text())
        .isEqualTo("User alice abandoned diff D");
    assertThat(renderDiff("diff-reclaim", ALICE, "backend").text())
        .isEqualTo("User alice reclaimed diff D");
    assertThat(renderDiff("diff-create", ALICE, "backend").channel()).isEqualTo("#backend");
    assertThat(renderDiff("diff-create", ALICE, "frontend").channel()).isEqualTo("#general");
  }

  @Test
  void diffReviewActions_alwaysPrefixOwner_evenForOwnActions() {
    when(objects.getOwner(DIFF)).thenReturn(Optional.of(OWEN));

    assertThat(renderDiff("diff-accept", ALICE, "backend").text())
        .isEqualTo("<@U9> User alice accepted diff D");
    assertThat(renderDiff("diff-request-changes", ALICE, "backend").text())
        .isEqualTo("<@U9> User alice requested changes to diff D");
    assertThat(renderDiff("diff-commandeer", OWEN, "backend").text())
        .isEqualTo("<@U9> User owen took command of diff D");
  }

  @Test
  void diffComment_prefixesOwnerOnlyForOthers() {
    when(objects.getOwner(DIFF)).thenReturn(Optional.of(OWEN));
    EnrichedTransaction byAlice =
        new EnrichedTransaction(
            "diff-add-comment", ALICE, DIFF, "backend", "lgtm @bob", null, null, null);
    EnrichedTransaction byOwen =
        new EnrichedTransaction(
            "diff-add-comment", OWEN, DIFF, "backend", "thanks", null, null, null);

    assertThat(renderer.render(ObjectType.DIFF, byAlice).orElseThrow().text())
        .isEqualTo("<@U9> User alice commented on diff D with lgtm <@U2>");
    assertThat(renderer.render(ObjectType.DIFF, byOwen).orElseThrow().text())
        .isEqualTo("User owen commented on diff D with thanks");
  }

  @Test
  void diffWithUnknownOwner_fails() {
    when(objects.getOwner(DIFF)).thenReturn(Optional.of("PHID-USER-ghost"));

    assertThatThrownBy(() -> renderDiff("diff-create", ALICE, "backend"))
        .isInstanceOf(UnresolvableIdentityException.class)
        .hasMessageContaining("PHID-USER-ghost");
  }

  @Test
  void commitComment_namesRepository() {
    when(objects.getLink("PHID-CMIT-1")).thenReturn("C");
    EnrichedTransaction tx =
        new EnrichedTransaction(
            "commit-add-comment", ALICE, "PHID-CMIT-1", "backend", "nice", null, null, null);

    RenderedMessage msg = renderer.render(ObjectType.COMMIT, tx).orElseThrow();

    assertThat(msg.text()).isEqualTo("User alice created commit C on repository backend");
    assertThat(msg.channel()).isEqualTo("#backend");
  }

  @Test
  void projectAndRepositoryCreate() {
    when(objects.getLink("PHID-PROJ-1")).thenReturn("P");
    when(objects.getLink("PHID-REPO-1")).thenReturn("R");

    assertThat(
            renderer
                .render(
                    ObjectType.PROJECT, EnrichedTransaction.of("proj-create", ALICE, "PHID-PROJ-1"))
                .orElseThrow()
                .text())
        .isEqualTo("User alice created project P");
    assertThat(
            renderer
                .render(
                    ObjectType.REPOSITORY,
                    EnrichedTransaction.of("repo-create", ALICE, "PHID-REPO-1"))
                .orElseThrow()
                .text())
        .isEqualTo("User alice created repository R");
  }

  @Test
  void unknownAuthor_fails() {
    assertThatThrownBy(
            () ->
                renderer.render(
                    ObjectType.PROJECT,
                    EnrichedTransaction.of("proj-create", "PHID-USER-ghost", "PHID-PROJ-1")))
        .isInstanceOf(UnresolvableIdentityException.class)
        .hasMessage("Unknown Phabricator user: PHID-USER-ghost");
  }

  @Test
  void unknownSubtype_stillRequiresKnownAuthor() {
    assertThatThrownBy(
            () ->
                renderer.render(
                    ObjectType.TASK,
                    EnrichedTransaction.of("task-title", "PHID-USER-ghost", TASK)))
        .isInstanceOf(UnresolvableIdentityException.class)
        .hasMessage("Unknown Phabricator user: PHID-USER-ghost");
  }

  @Test
  void unknownDiffSubtype_stillRequiresOwner() {
    assertThatThrownBy(
            () ->
                renderer.render(ObjectType.DIFF, EnrichedTransaction.of("diff-close", ALICE, DIFF)))
        .isInstanceOf(UnresolvableIdentityException.class)
        .hasMessageContaining("has no owner");
  }

  private RenderedMessage renderDiff(String type, String author, String repository) {
    EnrichedTransaction tx =
        new EnrichedTransaction(type, author, DIFF, repository, null, null, null, null);
    return renderer.render(ObjectType.DIFF, tx).orElseThrow();
  }

  private static EnrichedTransaction comment(
      String type, String author, String object, String text) {
    return new EnrichedTransaction(type, author, object, null, text, null, null, null);
  }
}
