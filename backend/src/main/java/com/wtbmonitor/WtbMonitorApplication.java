package com.wtbmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WtbMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(WtbMonitorApplication.class, args);
  }
}
