package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Optional;

public enum DiffAction {
  CREATE("diff-create"),
  UPDATE("diff-update"),
  ABANDON("diff-abandon"),
  RECLAIM("diff-reclaim"),
  ADD_COMMENT("diff-add-comment"),
  ACCEPT("diff-accept"),
  REQUEST_CHANGES("diff-request-changes"),
  COMMANDEER("diff-commandeer");

  private final String code;

  DiffAction(String code) {
    this.code = code;
  }

  public static Optional<DiffAction> fromCode(String code) {
    return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
  }
}
