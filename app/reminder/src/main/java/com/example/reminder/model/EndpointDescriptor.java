/*
 * どこで: Reminder ドメインモデル
 * 何を: Web Push 配信先 (endpoint URL と受信者ごとの暗号鍵) を保持する
 * なぜ: 配信先を不透明なハンドルとして等価比較だけで扱うため
 */
package com.example.reminder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EndpointDescriptor(String endpoint, Keys keys) {

  @JsonIgnore
  public boolean isComplete() {
    return hasText(endpoint) && keys != null && hasText(keys.p256dh()) && hasText(keys.auth());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public record Keys(String p256dh, String auth) {}
}
