/*
 * どこで: Registrar 設定
 * 何を: ジョブ実行用のワーカープールを提供する
 * なぜ: ジョブを要求スレッドから切り離し、同時実行数を制限するため
 */
package org.openreg.registrar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class JobExecutorConfig {

  @Bean
  ThreadPoolTaskExecutor jobTaskExecutor(JobProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerPoolSize());
    executor.setMaxPoolSize(properties.workerPoolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("registrar-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
