package com.flamingo.ai.quartorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the manuscript conversion backend. */
@SpringBootApplication
public class QuartoriumApplication {

  public static void main(String[] args) {
    SpringApplication.run(QuartoriumApplication.class, args);
  }
}
