package com.slacknotiphier.firehose.config;

import com.slacknotiphier.firehose.render.MentionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Routing and rendering settings.
 *
 * <p>{@code channels} maps repository short names to Slack channels. The reserved keys {@code
 * __default__} (required) and {@code __debug__} (optional) must be written in bracket notation in
 * YAML so the underscores survive binding.
 */
@ConfigurationProperties(prefix = "notifier")
@Validated
public record NotifierProperties(
    @NotEmpty Map<String, String> channels,
    @Valid @DefaultValue Mentions mentions,
    @Valid @DefaultValue Users users) {

  public NotifierProperties {
    channels = channels == null ? Map.of() : Map.copyOf(channels);
  }

  public record Mentions(@NotNull @DefaultValue("exact") MentionMode mode) {}

  public record Users(@NotNull @DefaultValue("PT1H") Duration cacheTtl) {}
}
