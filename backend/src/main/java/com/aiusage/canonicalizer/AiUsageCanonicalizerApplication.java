package com.aiusage.canonicalizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiUsageCanonicalizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AiUsageCanonicalizerApplication.class, args);
  }
}
