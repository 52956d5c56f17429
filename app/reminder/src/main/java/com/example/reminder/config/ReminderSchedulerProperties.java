/*
 * どこで: Reminder アプリの設定バインド
 * 何を: トリガー用スケジューラと配信用スレッドプールのサイズを保持する
 * なぜ: 受信者数に応じて同時配信数を運用側で調整するため
 */
package com.example.reminder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.scheduler")
public record ReminderSchedulerProperties(Boolean enabled, int poolSize, int dispatchPoolSize) {

  public ReminderSchedulerProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    poolSize = poolSize <= 0 ? 2 : poolSize;
    dispatchPoolSize = dispatchPoolSize <= 0 ? 8 : dispatchPoolSize;
  }

  public boolean isEnabled() {
    return enabled;
  }
}
