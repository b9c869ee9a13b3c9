package com.flamingo.ai.eventassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EventAssistantApplication {

  public static void main(String[] args) {
    SpringApplication.run(EventAssistantApplication.class, args);
  }
}
