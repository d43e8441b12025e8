package com.flamingo.ai.reportingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the report ingestion service. */
@SpringBootApplication
public class ReportIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReportIngestApplication.class, args);
  }
}
