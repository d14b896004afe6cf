package com.slacknotiphier.firehose.domain;

/** A transaction author or object owner is not known to the user directory. */
public class UnresolvableIdentityException extends RuntimeException {

  public UnresolvableIdentityException(String message) {
    super(message);
  }

  public static UnresolvableIdentityException unknownUser(String phid) {
    return new UnresolvableIdentityException("Unknown Phabricator user: " + phid);
  }
}
