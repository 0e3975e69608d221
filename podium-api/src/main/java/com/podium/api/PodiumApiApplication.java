package com.podium.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.podium.api")
public class PodiumApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(PodiumApiApplication.class, args);
  }
}
