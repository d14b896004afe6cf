package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Optional;

public enum CommitAction {
  ADD_COMMENT("commit-add-comment");

  private final String code;

  CommitAction(String code) {
    this.code = code;
  }

  public static Optional<CommitAction> fromCode(String code) {
    return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
  }
}
