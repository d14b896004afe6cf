package com.slacknotiphier.firehose.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "slack")
public record SlackProperties(@DefaultValue("https://slack.com/api") String baseUrl, String token) {}
