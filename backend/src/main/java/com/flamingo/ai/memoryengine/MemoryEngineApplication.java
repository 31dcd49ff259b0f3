package com.flamingo.ai.memoryengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for hosting the memory engine as a standalone Spring application. */
@SpringBootApplication
public class MemoryEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemoryEngineApplication.class, args);
  }
}
