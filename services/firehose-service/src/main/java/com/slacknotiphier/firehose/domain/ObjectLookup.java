package com.slacknotiphier.firehose.domain;

import java.util.Optional;

public interface ObjectLookup {

  /** Display string linking to the object, ready to embed in a chat message. */
  String getLink(String phid);

  /** PHID of the object's owner: a task's assignee, a diff's author. */
  Optional<String> getOwner(String phid);
}
