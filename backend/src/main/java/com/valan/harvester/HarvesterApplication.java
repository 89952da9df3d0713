package com.valan.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(HarvesterApplication.class, args);
  }
}
