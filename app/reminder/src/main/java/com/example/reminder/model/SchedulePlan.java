/*
 * どこで: Reminder ドメインモデル
 * 何を: 購読 1 件に対する発火予定 (ローンチ 1 回 + 毎日 N 件)
 * なぜ: 計画 (純粋関数) とトリガー登録 (副作用) を分離するため
 */
package com.example.reminder.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record SchedulePlan(Instant launchFireTime, List<DailyOccurrence> dailyOccurrences) {

  public SchedulePlan {
    dailyOccurrences = dailyOccurrences == null ? List.of() : List.copyOf(dailyOccurrences);
  }

  public Optional<Instant> launch() {
    return Optional.ofNullable(launchFireTime);
  }

  public boolean isInert() {
    return launchFireTime == null && dailyOccurrences.isEmpty();
  }
}
