package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Optional;

public enum ProjectAction {
  CREATE("proj-create");

  private final String code;

  ProjectAction(String code) {
    this.code = code;
  }

  public static Optional<ProjectAction> fromCode(String code) {
    return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
  }
}
