/*
 * Where: Outreach application entry point
 * What: boots Spring with property scanning and the scheduled workers
 * Why: the HTTP API, the job engine and the workers run as a single process
 */
package com.example.outreach;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class OutreachApplication {

  public static void main(String[] args) {
    SpringApplication.run(OutreachApplication.class, args);
  }
}
