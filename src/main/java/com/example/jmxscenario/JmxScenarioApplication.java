package com.example.jmxscenario;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JmxScenarioApplication {
  public static void main(String[] args) {
    SpringApplication.run(JmxScenarioApplication.class, args);
  }
}
