package com.slacknotiphier.firehose.render;

/** How resolved {@code @username} mentions are substituted into comment text. */
public enum MentionMode {
  /** Replace only the matched {@code @username} tokens. */
  EXACT,
  /** Replace every occurrence of the bare username anywhere in the text. */
  SUBSTRING
}
