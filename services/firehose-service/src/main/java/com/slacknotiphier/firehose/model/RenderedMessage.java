package com.slacknotiphier.firehose.model;

/**
 * One chat notification ready for delivery.
 *
 * <p>A null {@code channel} means "no override": the notifier sends it to the default channel.
 */
public record RenderedMessage(String text, String channel, Severity severity) {

  public RenderedMessage {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Rendered message text must not be blank");
    }
    severity = severity == null ? Severity.NONE : severity;
  }

  public static RenderedMessage of(String text) {
    return new RenderedMessage(text, null, Severity.NONE);
  }

  public static RenderedMessage of(String text, String channel) {
    return new RenderedMessage(text, channel, Severity.NONE);
  }

  public static RenderedMessage info(String text) {
    return new RenderedMessage(text, null, Severity.INFO);
  }

  public static RenderedMessage error(String text) {
    return new RenderedMessage(text, null, Severity.ERROR);
  }
}
