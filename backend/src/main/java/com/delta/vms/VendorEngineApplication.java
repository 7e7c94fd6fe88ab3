package com.delta.vms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VendorEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(VendorEngineApplication.class, args);
  }
}
