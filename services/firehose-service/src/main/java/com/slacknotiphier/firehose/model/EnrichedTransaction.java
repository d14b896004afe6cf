package com.slacknotiphier.firehose.model;

/**
 * A single tracker transaction reduced to the fields the renderer needs.
 *
 * <p>{@code type} is the subtype code, prefixed by object kind ({@code task-add-comment}, {@code
 * diff-accept}, ...). {@code object} is the PHID of the task, diff, commit, project or repository
 * the transaction belongs to. {@code repository} is the repository short name and is only filled
 * for diffs and commits. Type-specific fields are null when they do not apply.
 */
public record EnrichedTransaction(
    String type,
    String author,
    String object,
    String repository,
    String comment,
    String assignee,
    String oldValue,
    String newValue) {

  public static EnrichedTransaction of(String type, String author, String object) {
    return new EnrichedTransaction(type, author, object, null, null, null, null, null);
  }
}
