/*
 * どこで: Reminder サービス層
 * 何を: 受信者のタイムゾーンでローンチ日までの残り日数を計算する
 * なぜ: 通知文面とカウントダウン API で同じ日付境界を使うため
 */
package com.example.reminder.service;

import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.model.Countdown;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CountdownService {

  private final ReminderLaunchProperties launchProperties;
  private final Clock clock;

  /** 設定された既定のローンチに対するカウントダウン。ローンチ未設定なら空。 */
  public Optional<Countdown> defaultCountdown() {
    return launchProperties
        .launchTime()
        .map(launch -> countdown(launch, launchProperties.zoneId(), Instant.now(clock)));
  }

  public Countdown countdown(LocalDateTime launchTime, ZoneId zone, Instant now) {
    // 時刻ではなく暦日で数えるため、双方をゾーン内の 0 時に揃える
    final LocalDate today = now.atZone(zone).toLocalDate();
    final ZonedDateTime target = launchTime.toLocalDate().atStartOfDay(zone);
    final long days = Math.max(0L, ChronoUnit.DAYS.between(today, target.toLocalDate()));
    return new Countdown(days, target);
  }
}
