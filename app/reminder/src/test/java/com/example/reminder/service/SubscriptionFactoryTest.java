/*
 * どこで: Reminder 購読生成のユニットテスト
 * 何を: 既定値の補完と、不正な配信先/タイムゾーン/時刻の拒否を検証する
 * なぜ: 壊れた購読がストアへ入る前に 400 として弾かれることを保証するため
 */
package com.example.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.SubscriptionRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubscriptionFactoryTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final EndpointDescriptor ENDPOINT =
      new EndpointDescriptor(
          " https://push.example.com/abc ", new EndpointDescriptor.Keys("p256dh", "auth"));

  private final SubscriptionFactory factory =
      new SubscriptionFactory(
          new ReminderLaunchProperties(
              "Launch", null, "2026-09-13T00:00", "Africa/Nairobi", List.of("09:00")),
          Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

  @Test
  void omittedValuesTakeConfiguredDefaults() {
    final SubscriptionRecord record = factory.create(ENDPOINT, null, null, null);

    assertThat(record.id()).isNotBlank();
    assertThat(record.endpoint()).isEqualTo("https://push.example.com/abc");
    assertThat(record.launchTime()).isEqualTo(LocalDateTime.parse("2026-09-13T00:00"));
    assertThat(record.dailyTimes()).containsExactly("09:00");
    assertThat(record.timezone()).isEqualTo("Africa/Nairobi");
    assertThat(record.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(record.lastSentAt()).isNull();
  }

  @Test
  void blankLaunchTimeMeansNoLaunchReminder() {
    final SubscriptionRecord record = factory.create(ENDPOINT, "", List.of(), "UTC");

    assertThat(record.launchTime()).isNull();
    assertThat(record.dailyTimes()).isEmpty();
  }

  @Test
  void offsetLaunchTimeIsConvertedToSubscriptionZone() {
    final SubscriptionRecord record =
        factory.create(ENDPOINT, "2026-09-13T00:00:00Z", null, "Asia/Tokyo");

    assertThat(record.launchTime()).isEqualTo(LocalDateTime.parse("2026-09-13T09:00"));
  }

  @Test
  void defaultLaunchKeepsSameInstantForEveryTimezone() {
    final SubscriptionRecord nairobi = factory.create(ENDPOINT, null, null, null);
    final SubscriptionRecord newYork = factory.create(ENDPOINT, null, null, "America/New_York");

    // 既定ローンチは Africa/Nairobi の 2026-09-13T00:00 (= 2026-09-12T21:00Z)
    assertThat(newYork.launchTime()).isEqualTo(LocalDateTime.parse("2026-09-12T17:00"));
    assertThat(newYork.launchTime().atZone(ZoneId.of("America/New_York")).toInstant())
        .isEqualTo(nairobi.launchTime().atZone(ZoneId.of("Africa/Nairobi")).toInstant())
        .isEqualTo(Instant.parse("2026-09-12T21:00:00Z"));
  }

  @Test
  void dailyTimesAreNormalizedAndDeduplicated() {
    final SubscriptionRecord record =
        factory.create(ENDPOINT, null, List.of("9:00", "09:00", "18:30"), null);

    assertThat(record.dailyTimes()).containsExactly("09:00", "18:30");
  }

  @Test
  void rejectsIncompleteEndpoint() {
    final EndpointDescriptor noKeys = new EndpointDescriptor("https://push.example.com/abc", null);

    assertThatThrownBy(() -> factory.create(noKeys, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsUnknownTimezone() {
    assertThatThrownBy(() -> factory.create(ENDPOINT, null, null, "Mars/Olympus"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("timezone");
  }

  @Test
  void rejectsMalformedDailyTime() {
    assertThatThrownBy(() -> factory.create(ENDPOINT, null, List.of("25:00"), null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("25:00");
  }

  @Test
  void rejectsMalformedLaunchTime() {
    assertThatThrownBy(() -> factory.create(ENDPOINT, "next friday", null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("launch_time");
  }
}
