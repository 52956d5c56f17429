/*
 * どこで: Reminder サービス層
 * 何を: 購読リクエストの値を検証し、既定値を補って SubscriptionRecord を生成する
 * なぜ: 不正な配信先や時刻をストアに入る前の境界で弾くため
 */
package com.example.reminder.service;

import com.example.common.ZoneIds;
import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.SubscriptionRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SubscriptionFactory {

  private static final DateTimeFormatter NORMALIZED_TIME = DateTimeFormatter.ofPattern("HH:mm");

  private final ReminderLaunchProperties launchProperties;
  private final Clock clock;

  /**
   * 新しい購読レコードを生成する。省略された値は設定の既定値で補う。
   *
   * @param launchTime ISO-8601 日時。オフセット付きなら購読のタイムゾーンの現地時刻へ換算する
   * @param dailyTimes {@code HH:mm} のリスト。{@code null} なら既定値、空リストなら毎日通知なし
   * @throws IllegalArgumentException 配信先・タイムゾーン・時刻のいずれかが不正な場合
   */
  public SubscriptionRecord create(
      EndpointDescriptor endpoint, String launchTime, List<String> dailyTimes, String timezone) {
    if (endpoint == null || !endpoint.isComplete()) {
      throw new IllegalArgumentException("subscription endpoint and keys are required");
    }
    final ZoneId zone = resolveZone(timezone);
    return new SubscriptionRecord(
        UUID.randomUUID().toString(),
        new EndpointDescriptor(endpoint.endpoint().trim(), endpoint.keys()),
        resolveLaunchTime(launchTime, zone),
        resolveDailyTimes(dailyTimes),
        zone.getId(),
        Instant.now(clock),
        null);
  }

  private ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return launchProperties.zoneId();
    }
    return ZoneIds.parse(timezone)
        .orElseThrow(() -> new IllegalArgumentException("timezone is invalid"));
  }

  private LocalDateTime resolveLaunchTime(String launchTime, ZoneId zone) {
    if (launchTime == null) {
      return launchProperties.launchTimeIn(zone).orElse(null);
    }
    if (launchTime.isBlank()) {
      return null;
    }
    try {
      final TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              launchTime.trim(), ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return zoned.withZoneSameInstant(zone).toLocalDateTime();
      }
      return (LocalDateTime) parsed;
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("launch_time is invalid", ex);
    }
  }

  private List<String> resolveDailyTimes(List<String> dailyTimes) {
    final List<String> source = dailyTimes == null ? launchProperties.dailyTimes() : dailyTimes;
    final List<String> normalized = new ArrayList<>(source.size());
    for (String raw : source) {
      final LocalTime time =
          SchedulePlanner.parseDailyTime(raw)
              .orElseThrow(
                  () -> new IllegalArgumentException("daily_times contains an invalid time: " + raw));
      final String value = NORMALIZED_TIME.format(time);
      if (!normalized.contains(value)) {
        normalized.add(value);
      }
    }
    return normalized;
  }
}
