package com.example.outreach.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class JobExecutorConfig {

  public static final String JOB_EXECUTOR = "outreachJobExecutor";

  @Bean(name = JOB_EXECUTOR)
  public ThreadPoolTaskExecutor outreachJobExecutor(OutreachJobProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorPoolSize());
    executor.setMaxPoolSize(properties.executorPoolSize());
    executor.setQueueCapacity(properties.executorQueueCapacity());
    executor.setThreadNamePrefix("outreach-job-");
    // In-flight items finish before shutdown; unfinished jobs resume from their checkpoint.
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
