/*
 * どこで: Reminder サービス層
 * 何を: 購読レコードと現在時刻から、ローンチ通知と毎日通知の発火予定を計算する
 * なぜ: トリガー登録から切り離した純粋関数にして、再計画の冪等性をテストで保証するため
 */
package com.example.reminder.service;

import com.example.common.ZoneIds;
import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.model.DailyOccurrence;
import com.example.reminder.model.SchedulePlan;
import com.example.reminder.model.SubscriptionRecord;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class SchedulePlanner {

  private static final Logger logger = LoggerFactory.getLogger(SchedulePlanner.class);

  // 24 時間表記の H:mm / HH:mm のみ受け付け、秒やオフセット付きは不正値として扱う
  private static final DateTimeFormatter DAILY_TIME_FORMAT =
      DateTimeFormatter.ofPattern("H:mm").withResolverStyle(ResolverStyle.STRICT);

  private final ZoneId defaultZone;
  // レコードにローンチ日時が無いときの既定ローンチ (defaultZone 基準)
  private final LocalDateTime defaultLaunch;

  @Autowired
  public SchedulePlanner(ReminderLaunchProperties launchProperties) {
    this(launchProperties.zoneId(), launchProperties.launchTime().orElse(null));
  }

  SchedulePlanner(ZoneId defaultZone) {
    this(defaultZone, null);
  }

  SchedulePlanner(ZoneId defaultZone, LocalDateTime defaultLaunch) {
    this.defaultZone = defaultZone;
    this.defaultLaunch = defaultLaunch;
  }

  public SchedulePlan plan(SubscriptionRecord record, Instant now) {
    final ZoneId zone = resolveZone(record);
    return new SchedulePlan(planLaunch(record, zone, now), planDaily(record, zone, now));
  }

  public ZoneId resolveZone(SubscriptionRecord record) {
    final Optional<ZoneId> parsed = ZoneIds.parse(record.timezone());
    if (parsed.isEmpty() && record.timezone() != null && !record.timezone().isBlank()) {
      logger.warn(
          "subscription timezone invalid; using default id={} timezone={} default={}",
          record.id(),
          record.timezone(),
          defaultZone);
    }
    return parsed.orElse(defaultZone);
  }

  /**
   * 通知文面の基準になるローンチの瞬間。レコードの値を優先し、無ければ既定ローンチを使う。
   *
   * @return どちらも無ければ空
   */
  public Optional<Instant> effectiveLaunch(SubscriptionRecord record) {
    if (record.launchTime() != null) {
      return Optional.of(record.launchTime().atZone(resolveZone(record)).toInstant());
    }
    return Optional.ofNullable(defaultLaunch).map(t -> t.atZone(defaultZone).toInstant());
  }

  /** ローンチ済み (ローンチの瞬間が {@code now} 以前) なら true。ローンチが無ければ false。 */
  public boolean isLaunchPassed(SubscriptionRecord record, Instant now) {
    return effectiveLaunch(record).map(launchAt -> !launchAt.isAfter(now)).orElse(false);
  }

  /** {@code HH:mm} を解析する。不正値なら空を返す。 */
  public static Optional<LocalTime> parseDailyTime(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalTime.parse(value.trim(), DAILY_TIME_FORMAT));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  private Instant planLaunch(SubscriptionRecord record, ZoneId zone, Instant now) {
    if (record.launchTime() == null) {
      return null;
    }
    final Instant launchAt = record.launchTime().atZone(zone).toInstant();
    // 過ぎたローンチは取りこぼしとして扱い、再送しない
    return launchAt.isAfter(now) ? launchAt : null;
  }

  private List<DailyOccurrence> planDaily(SubscriptionRecord record, ZoneId zone, Instant now) {
    // ローンチ後は毎日通知を計画しない
    if (isLaunchPassed(record, now)) {
      if (!record.dailyTimes().isEmpty()) {
        logger.info("daily reminders retired: launch has passed id={}", record.id());
      }
      return List.of();
    }
    final Set<LocalTime> times = new LinkedHashSet<>();
    for (String raw : record.dailyTimes()) {
      final Optional<LocalTime> parsed = parseDailyTime(raw);
      if (parsed.isEmpty()) {
        logger.warn("daily time skipped: malformed id={} value={}", record.id(), raw);
        continue;
      }
      times.add(parsed.get());
    }
    final ZonedDateTime localNow = now.atZone(zone);
    final List<DailyOccurrence> occurrences = new ArrayList<>(times.size());
    for (LocalTime time : times) {
      occurrences.add(new DailyOccurrence(time, zone, nextOccurrence(localNow, time)));
    }
    return occurrences;
  }

  private ZonedDateTime nextOccurrence(ZonedDateTime localNow, LocalTime time) {
    // DST の欠落時刻は ZonedDateTime.of が後ろへずらす
    final ZonedDateTime today = ZonedDateTime.of(localNow.toLocalDate(), time, localNow.getZone());
    if (!today.isBefore(localNow)) {
      return today;
    }
    return ZonedDateTime.of(localNow.toLocalDate().plusDays(1), time, localNow.getZone());
  }
}
