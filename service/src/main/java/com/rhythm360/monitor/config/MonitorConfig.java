package com.rhythm360.monitor.config;

import com.rhythm360.monitor.scoring.FitnessProfile;
import com.rhythm360.monitor.scoring.ScoringEnsemble;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class MonitorConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  FitnessProfile fitnessProfile(
      @Value("${monitor.profile.age:40}") double age,
      @Value("${monitor.profile.baseline-resting-hr:#{null}}") Double baselineRestingHr) {
    return new FitnessProfile(age, baselineRestingHr);
  }

  @Bean
  ScoringEnsemble scoringEnsemble(FitnessProfile fitnessProfile) {
    return new ScoringEnsemble(fitnessProfile);
  }

  @Bean(name = "scoringExecutor")
  Executor scoringExecutor(@Value("${monitor.scoring.pool-size:2}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(64);
    executor.setThreadNamePrefix("scoring-");
    executor.initialize();
    return executor;
  }

  // Picked up by @Async as the default executor.
  @Bean(name = "taskExecutor")
  Executor taskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(256);
    executor.setThreadNamePrefix("notify-");
    executor.initialize();
    return executor;
  }
}
