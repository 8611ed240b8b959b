package com.jobtrail.dedup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobTrailDedupApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobTrailDedupApplication.class, args);
  }
}
