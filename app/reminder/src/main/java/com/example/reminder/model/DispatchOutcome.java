/*
 * どこで: Reminder ドメインモデル
 * 何を: 1 回の配信試行の結果分類
 * なぜ: ステータスコード判定を呼び出し側へ散らさず、削除判断を明示するため
 */
package com.example.reminder.model;

public enum DispatchOutcome {
  DELIVERED("delivered"),
  RETRYABLE("retryable"),
  PERMANENTLY_GONE("gone");

  private final String metricTag;

  DispatchOutcome(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
