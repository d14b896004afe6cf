package com.slacknotiphier.firehose.domain;

import com.slacknotiphier.firehose.model.ResolvedUser;
import java.util.Optional;

public interface UserDirectory {

  Optional<ResolvedUser> find(String phid);

  /** Resolves either a user PHID or a bare tracker username to a chat mention. */
  Optional<String> findMention(String phidOrUsername);
}
