/*
 * どこで: Reminder アプリの設定
 * 何を: トリガー発火用の TaskScheduler と配信用 Executor を提供する
 * なぜ: 発火判定を注入 Clock で評価し、送信のブロッキングをトリガースレッドから切り離すため
 */
package com.example.reminder.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  public static final String DISPATCH_EXECUTOR = "reminderDispatchExecutor";

  @Bean
  ThreadPoolTaskScheduler reminderTaskScheduler(
      ReminderSchedulerProperties properties, Clock clock) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("reminder-trigger-");
    // cron/one-shot の次回時刻はこの Clock で評価される
    scheduler.setClock(clock);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean(name = DISPATCH_EXECUTOR)
  ThreadPoolTaskExecutor reminderDispatchExecutor(ReminderSchedulerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchPoolSize());
    executor.setMaxPoolSize(properties.dispatchPoolSize());
    executor.setThreadNamePrefix("reminder-dispatch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
