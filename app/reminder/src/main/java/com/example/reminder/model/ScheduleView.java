package com.example.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** 稼働中トリガーの読み取り専用ビュー。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleView(String subscriptionId, Instant launchFireTime, List<String> dailyTriggers) {

  public ScheduleView {
    dailyTriggers = dailyTriggers == null ? List.of() : List.copyOf(dailyTriggers);
  }
}
