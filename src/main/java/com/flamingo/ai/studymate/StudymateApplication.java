package com.flamingo.ai.studymate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the study assistant service. */
@SpringBootApplication
public class StudymateApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudymateApplication.class, args);
  }
}
