/*
 * どこで: Reminder API
 * 何を: 手動配信の結果件数を返す
 * なぜ: テスト配信で配信先消滅による削除が起きたかを呼び出し側で確認できるようにするため
 */
package com.example.reminder.api;

import com.example.reminder.model.DispatchSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchSummaryResponse(boolean success, int delivered, int retryable, int pruned) {

  public static DispatchSummaryResponse from(DispatchSummary summary) {
    return new DispatchSummaryResponse(
        true, summary.delivered(), summary.retryable(), summary.pruned());
  }
}
