package com.slacknotiphier.firehose.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "http")
public record HttpClientProperties(
    @DefaultValue("PT5S") Duration connectTimeout, @DefaultValue("PT15S") Duration readTimeout) {}
