package com.example.reminder.model;

import java.time.ZonedDateTime;

/** ローンチ日までの残り日数。{@code targetDate} は対象ゾーンでの 0 時。 */
public record Countdown(long days, ZonedDateTime targetDate) {

  public boolean isToday() {
    return days == 0;
  }
}
