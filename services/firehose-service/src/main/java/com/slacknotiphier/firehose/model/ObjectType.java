package com.slacknotiphier.firehose.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Tracker object types the service knows how to describe, keyed by their PHID type code. */
public enum ObjectType {
  TASK("TASK", "task"),
  DIFF("DREV", "diff"),
  COMMIT("CMIT", "commit"),
  PROJECT("PROJ", "proj"),
  REPOSITORY("REPO", "repo");

  private static final Map<String, ObjectType> BY_CODE =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(ObjectType::code, Function.identity()));

  private final String code;
  private final String subtypePrefix;

  ObjectType(String code, String subtypePrefix) {
    this.code = code;
    this.subtypePrefix = subtypePrefix;
  }

  public String code() {
    return code;
  }

  /** Prefix of the transaction subtype codes for this object, e.g. {@code task} in task-claim. */
  public String subtypePrefix() {
    return subtypePrefix;
  }

  public static Optional<ObjectType> fromCode(String code) {
    return code == null ? Optional.empty() : Optional.ofNullable(BY_CODE.get(code));
  }
}
