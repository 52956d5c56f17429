/*
 * どこで: Reminder ドメインモデル
 * 何を: Push メッセージ本文として送る JSON の内容
 * なぜ: Service Worker 側の表示項目をサーバで一元的に組み立てるため
 */
package com.example.reminder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
    String title,
    String body,
    String icon,
    String tag,
    String url,
    Boolean requireInteraction,
    Map<String, Object> customData) {

  public NotificationPayload {
    customData = customData == null ? Map.of() : Map.copyOf(customData);
  }
}
