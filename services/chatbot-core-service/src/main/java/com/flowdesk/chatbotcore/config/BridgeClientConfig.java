package com.flowdesk.chatbotcore.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class BridgeClientConfig {

  @Bean
  public RestClient bridgeRestClient(RestClient.Builder builder, BridgeProperties properties) {
    Duration timeout = properties.timeout();
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Math.toIntExact(timeout.toMillis()));
    requestFactory.setReadTimeout(Math.toIntExact(timeout.toMillis()));
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
