package com.slacknotiphier.firehose.client;

public class PhabricatorClientException extends RuntimeException {
  public PhabricatorClientException(String message) {
    super(message);
  }

  public PhabricatorClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
