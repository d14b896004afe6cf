package com.slacknotiphier.firehose.domain;

import com.slacknotiphier.firehose.model.RenderedMessage;

/**
 * Delivers messages to the chat platform.
 *
 * <p>Implementations absorb delivery failures (log and drop) instead of throwing.
 */
public interface Notifier {
  void send(RenderedMessage message);
}
