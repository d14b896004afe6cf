package com.slacknotiphier.firehose.render;

import com.slacknotiphier.firehose.config.NotifierProperties;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ChannelRouter {

  public static final String DEFAULT_KEY = "__default__";
  public static final String DEBUG_KEY = "__debug__";

  private final Map<String, String> channels;
  private final String defaultChannel;

  public ChannelRouter(NotifierProperties properties) {
    this(properties.channels());
  }

  public ChannelRouter(Map<String, String> channels) {
    String fallback = channels == null ? null : channels.get(DEFAULT_KEY);
    if (fallback == null || fallback.isBlank()) {
      throw new IllegalStateException(
          "notifier.channels." + DEFAULT_KEY + " must be configured");
    }
    this.channels = Map.copyOf(channels);
    this.defaultChannel = fallback.trim();
  }

  /** Channel for events of the given repository; the default channel when it has no mapping. */
  public String channelFor(String repository) {
    if (repository == null || repository.isBlank()) {
      return defaultChannel;
    }
    String channel = channels.get(repository);
    return channel == null || channel.isBlank() ? defaultChannel : channel;
  }

  public String defaultChannel() {
    return defaultChannel;
  }

  public Optional<String> debugChannel() {
    String debug = channels.get(DEBUG_KEY);
    return debug == null || debug.isBlank() ? Optional.empty() : Optional.of(debug);
  }
}
