package com.flamingo.ai.timelineqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the timeline question-answering service. */
@SpringBootApplication
public class TimelineQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimelineQaApplication.class, args);
  }
}
