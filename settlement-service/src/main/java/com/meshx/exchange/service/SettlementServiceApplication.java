package com.meshx.exchange.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.meshx.exchange")
public class SettlementServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(SettlementServiceApplication.class, args);
  }
}
