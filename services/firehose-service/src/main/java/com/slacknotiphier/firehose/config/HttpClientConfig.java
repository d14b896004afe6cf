package com.slacknotiphier.firehose.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class HttpClientConfig {

  /** Applies the configured timeouts to every RestClient built from Boot's builder. */
  @Bean
  public RestClientCustomizer httpTimeouts(HttpClientProperties properties) {
    return builder -> {
      SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
      factory.setConnectTimeout(Math.toIntExact(properties.connectTimeout().toMillis()));
      factory.setReadTimeout(Math.toIntExact(properties.readTimeout().toMillis()));
      builder.requestFactory(factory);
    };
  }
}
