package com.example.home_view.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  EventQueueClientProperties.class,
  HomeViewProperties.class,
  LocalizationProperties.class
})
public class EventQueueClientConfig {

  @Bean
  RestClient eventQueueRestClient(RestClient.Builder builder, EventQueueClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
