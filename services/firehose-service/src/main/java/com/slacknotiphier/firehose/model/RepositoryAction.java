package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Optional;

public enum RepositoryAction {
  CREATE("repo-create");

  private final String code;

  RepositoryAction(String code) {
    this.code = code;
  }

  public static Optional<RepositoryAction> fromCode(String code) {
    return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
  }
}
