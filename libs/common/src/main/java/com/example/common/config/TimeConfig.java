/*
 * どこで: Common 共通設定
 * 何を: スケジューラと配信処理が参照する Clock を DI 可能にする
 * なぜ: 発火時刻の計算をテストで固定時刻へ差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // 受信者ごとのタイムゾーンは ZonedDateTime 側で扱うため、基準クロックは UTC 固定とする
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
