package com.flamingo.ai.clinicalnotes.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the executor running provider calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "generationExecutor")
  public Executor generationExecutor(NoteConfig noteConfig) {
    NoteConfig.Generation generation = noteConfig.getGeneration();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(generation.getCorePoolSize());
    executor.setMaxPoolSize(generation.getMaxPoolSize());
    executor.setQueueCapacity(generation.getQueueCapacity());
    executor.setThreadNamePrefix("note-gen-");
    executor.initialize();
    return executor;
  }
}
