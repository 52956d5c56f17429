/*
 * どこで: Reminder ドメインモデル
 * 何を: 購読ストアに永続化される受信者 1 件分のスナップショット
 * なぜ: 計画・配信・API で同じ購読情報を共有するため
 */
package com.example.reminder.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 受信者の購読レコード。
 *
 * <p>{@code launchTime} は {@code timezone} で解釈する現地日時。{@code dailyTimes} は {@code HH:mm}
 * 形式の文字列をそのまま保持し、手編集で壊れた値も保存したまま計画時にスキップする。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionRecord(
    String id,
    EndpointDescriptor endpointDescriptor,
    LocalDateTime launchTime,
    List<String> dailyTimes,
    String timezone,
    Instant createdAt,
    Instant lastSentAt) {

  public SubscriptionRecord {
    // 手編集されたファイルの null 要素も保持するため List.copyOf は使わない
    dailyTimes =
        dailyTimes == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(dailyTimes));
  }

  public String endpoint() {
    return endpointDescriptor == null ? null : endpointDescriptor.endpoint();
  }

  public SubscriptionRecord withLastSentAt(Instant sentAt) {
    return new SubscriptionRecord(
        id, endpointDescriptor, launchTime, dailyTimes, timezone, createdAt, sentAt);
  }

  /** 同一エンドポイントの再購読で、識別子と作成時刻を保ったまま中身を差し替える。 */
  public SubscriptionRecord replacedBy(SubscriptionRecord update) {
    return new SubscriptionRecord(
        id,
        update.endpointDescriptor(),
        update.launchTime(),
        update.dailyTimes(),
        update.timezone(),
        createdAt,
        lastSentAt);
  }
}
