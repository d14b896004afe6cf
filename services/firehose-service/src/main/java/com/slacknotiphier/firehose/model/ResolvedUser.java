package com.slacknotiphier.firehose.model;

public record ResolvedUser(String displayName, String chatMention) {

  /** A tracker user with no chat account is mentioned by plain name. */
  public static ResolvedUser withoutChatAccount(String displayName) {
    return new ResolvedUser(displayName, "@" + displayName);
  }
}
