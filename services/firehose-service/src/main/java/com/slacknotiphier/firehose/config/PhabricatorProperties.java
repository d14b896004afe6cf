package com.slacknotiphier.firehose.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Conduit endpoint ({@code https://phab.example.com/api}) and API token. */
@ConfigurationProperties(prefix = "phabricator")
@Validated
public record PhabricatorProperties(@NotBlank String baseUrl, String token) {}
