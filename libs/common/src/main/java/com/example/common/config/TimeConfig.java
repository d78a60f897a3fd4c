/*
 * Where: shared configuration
 * What: exposes the application Clock as a bean
 * Why: quota days and due dates are computed from one injectable clock in the configured zone
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.clock.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
