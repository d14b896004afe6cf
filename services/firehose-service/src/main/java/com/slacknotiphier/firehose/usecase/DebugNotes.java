package com.slacknotiphier.firehose.usecase;

import com.slacknotiphier.firehose.domain.Notifier;
import com.slacknotiphier.firehose.model.RenderedMessage;
import com.slacknotiphier.firehose.model.Severity;
import com.slacknotiphier.firehose.render.ChannelRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Diagnostic notes about events that produced no message. Always logged at debug level, and
 * mirrored to the {@code __debug__} channel when one is configured.
 */
@Component
@Slf4j
public class DebugNotes {

  private final Notifier notifier;
  private final ChannelRouter router;

  public DebugNotes(Notifier notifier, ChannelRouter router) {
    this.notifier = notifier;
    this.router = router;
  }

  public void note(String text) {
    log.debug("{}", text);
    router
        .debugChannel()
        .ifPresent(channel -> notifier.send(new RenderedMessage(text, channel, Severity.INFO)));
  }
}
