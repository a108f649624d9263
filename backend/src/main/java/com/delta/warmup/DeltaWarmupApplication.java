package com.delta.warmup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaWarmupApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaWarmupApplication.class, args);
  }
}
