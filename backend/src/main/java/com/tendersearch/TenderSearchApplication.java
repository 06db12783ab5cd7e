package com.tendersearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TenderSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenderSearchApplication.class, args);
  }
}
