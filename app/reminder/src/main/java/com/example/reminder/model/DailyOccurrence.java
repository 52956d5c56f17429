/*
 * どこで: Reminder ドメインモデル
 * 何を: 毎日の定時リマインド 1 件分の計画結果
 * なぜ: 受信者のタイムゾーンで評価する cron 式と次回発火時刻を対で扱うため
 */
package com.example.reminder.model;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public record DailyOccurrence(LocalTime time, ZoneId zone, ZonedDateTime nextFireTime) {

  /** Spring の 6 フィールド cron 式 (秒 分 時 日 月 曜日)。 */
  public String cronExpression() {
    return "0 " + time.getMinute() + " " + time.getHour() + " * * *";
  }

  public String label() {
    return String.format("%02d:%02d %s", time.getHour(), time.getMinute(), zone.getId());
  }
}
