/*
 * どこで: Reminder アプリの設定バインド
 * 何を: ローンチ日時・既定タイムゾーン・既定の毎日通知時刻を保持する
 * なぜ: 購読リクエストで省略された値とカウントダウン表示の基準を外部化するため
 */
package com.example.reminder.config;

import com.example.common.ZoneIds;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.launch")
public record ReminderLaunchProperties(
    String eventName, String eventTag, String time, String timezone, List<String> dailyTimes) {

  private static final String DEFAULT_TIMEZONE = "Africa/Nairobi";

  public ReminderLaunchProperties {
    eventName = eventName == null || eventName.isBlank() ? "Launch" : eventName;
    eventTag = eventTag == null || eventTag.isBlank() ? "launch-countdown" : eventTag;
    timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
    dailyTimes = dailyTimes == null ? List.of("09:00") : List.copyOf(dailyTimes);
    if (ZoneIds.parse(timezone).isEmpty()) {
      throw new IllegalArgumentException("reminder.launch.timezone is invalid: " + timezone);
    }
    if (time != null && !time.isBlank()) {
      try {
        LocalDateTime.parse(time);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("reminder.launch.time is invalid: " + time, ex);
      }
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }

  /** 既定のローンチ日時。未設定なら購読はローンチ通知を持たない。 */
  public Optional<LocalDateTime> launchTime() {
    if (time == null || time.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(LocalDateTime.parse(time));
  }

  /** 既定のローンチ日時を {@code timezone} 基準の瞬間として、指定ゾーンの現地時刻へ変換する。 */
  public Optional<LocalDateTime> launchTimeIn(ZoneId zone) {
    return launchTime()
        .map(t -> t.atZone(zoneId()).withZoneSameInstant(zone).toLocalDateTime());
  }
}
