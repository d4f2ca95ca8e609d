package com.mocha.supporters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SupporterSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(SupporterSyncApplication.class, args);
  }
}
