package com.social.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(SocialApiApplication.class, args);
  }
}
