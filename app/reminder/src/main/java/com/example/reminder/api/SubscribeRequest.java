/*
 * どこで: Reminder API
 * 何を: 購読リクエストの入力を保持する
 * なぜ: ブラウザの PushSubscription をそのまま送る形と、スケジュール指定付きで包む形の両方を受け付けるため
 */
package com.example.reminder.api;

import com.example.reminder.model.EndpointDescriptor;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscribeRequest(
    String endpoint,
    EndpointDescriptor.Keys keys,
    EndpointDescriptor subscription,
    String launchTime,
    List<String> dailyTimes,
    String timezone) {

  /** 包まれた {@code subscription} を優先し、無ければトップレベルの endpoint/keys を使う。 */
  public EndpointDescriptor descriptor() {
    if (subscription != null) {
      return subscription;
    }
    if (endpoint == null && keys == null) {
      return null;
    }
    return new EndpointDescriptor(endpoint, keys);
  }
}
