package com.slacknotiphier.firehose.model;

/** Presentation category of a notification, rendered as a Slack attachment colour. */
public enum Severity {
  NONE("#F0F0F0"),
  INFO("#28D7E5"),
  WARN("warning"),
  ERROR("danger"),
  SUCCESS("good");

  private final String color;

  Severity(String color) {
    this.color = color;
  }

  public String color() {
    return color;
  }
}
