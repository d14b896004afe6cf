package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Optional;

/** Task transaction subtypes that produce a notification. */
public enum TaskAction {
  CREATE("task-create"),
  ADD_COMMENT("task-add-comment"),
  CLAIM("task-claim"),
  ASSIGN("task-assign"),
  CHANGE_STATUS("task-change-status"),
  CHANGE_PRIORITY("task-change-priority");

  private final String code;

  TaskAction(String code) {
    this.code = code;
  }

  public static Optional<TaskAction> fromCode(String code) {
    return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
  }
}
