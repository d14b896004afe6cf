package com.slacknotiphier.firehose.model;

public record TrackerUser(String phid, String username, String realName) {}
