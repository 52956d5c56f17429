/*
 * どこで: Reminder サービス層
 * 何を: ローンチ通知/毎日通知/手動通知の Push ペイロードを組み立てる
 * なぜ: 残り日数に応じた文面の分岐を配信処理から切り離すため
 */
package com.example.reminder.service;

import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.model.Countdown;
import com.example.reminder.model.NotificationPayload;
import com.example.reminder.model.SubscriptionRecord;
import com.example.reminder.model.TriggerKind;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationComposer {

  static final String CELEBRATION_ICON = "/celebration-icon.png";
  static final String COUNTDOWN_ICON = "/countdown-icon.png";
  private static final DateTimeFormatter TARGET_DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

  private final ReminderLaunchProperties launchProperties;
  private final CountdownService countdownService;
  private final SchedulePlanner planner;

  public NotificationPayload compose(SubscriptionRecord record, TriggerKind trigger, Instant now) {
    final ZoneId zone = planner.resolveZone(record);
    final LocalDateTime launchTime =
        record.launchTime() != null
            ? record.launchTime()
            : launchProperties.launchTimeIn(zone).orElse(null);
    final String event = launchProperties.eventName();
    if (launchTime == null) {
      return new NotificationPayload(
          "⏰ " + event + " reminder",
          "Stay tuned for " + event + ".",
          COUNTDOWN_ICON,
          launchProperties.eventTag(),
          "/",
          null,
          customData(null, trigger));
    }
    final Countdown countdown = countdownService.countdown(launchTime, zone, now);
    final Map<String, Object> customData = customData(countdown, trigger);
    if (trigger == TriggerKind.LAUNCH || countdown.isToday()) {
      return new NotificationPayload(
          "🎉 " + event + " is today!",
          "The day has finally arrived! Happy " + event + "!",
          CELEBRATION_ICON,
          launchProperties.eventTag(),
          "/",
          Boolean.TRUE,
          customData);
    }
    if (countdown.days() == 1) {
      return new NotificationPayload(
          "⏰ " + event + " is tomorrow!",
          "Just 1 more day until " + event + ". Get ready!",
          COUNTDOWN_ICON,
          launchProperties.eventTag(),
          "/",
          null,
          customData);
    }
    return new NotificationPayload(
        "📅 " + countdown.days() + " days until " + event,
        "Only "
            + countdown.days()
            + " days left ("
            + formatTargetDate(countdown)
            + ")",
        COUNTDOWN_ICON,
        launchProperties.eventTag(),
        "/",
        null,
        customData);
  }

  public static String formatTargetDate(Countdown countdown) {
    return TARGET_DATE_FORMAT.format(countdown.targetDate());
  }

  private Map<String, Object> customData(Countdown countdown, TriggerKind trigger) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("trigger", trigger.name().toLowerCase(Locale.ROOT));
    if (countdown != null) {
      data.put("days_remaining", countdown.days());
      data.put("target_date", countdown.targetDate().toOffsetDateTime().toString());
    }
    return data;
  }
}
