package com.slacknotiphier.firehose;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FirehoseServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FirehoseServiceApplication.class, args);
  }
}
