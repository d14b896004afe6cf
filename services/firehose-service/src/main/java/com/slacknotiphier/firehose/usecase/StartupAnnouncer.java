package com.slacknotiphier.firehose.usecase;

import com.slacknotiphier.firehose.domain.Notifier;
import com.slacknotiphier.firehose.model.RenderedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupAnnouncer {

  static final String STARTED = "Slack Notiphier started running.";

  private final Notifier notifier;

  public StartupAnnouncer(Notifier notifier) {
    this.notifier = notifier;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void announce() {
    log.info(STARTED);
    notifier.send(RenderedMessage.info(STARTED));
  }
}
