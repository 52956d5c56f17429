/*
 * どこで: Reminder ドメインモデル
 * 何を: 手動配信 1 回分の結果集計
 * なぜ: テスト配信 API で成功/再試行対象/削除件数を返すため
 */
package com.example.reminder.model;

public record DispatchSummary(int delivered, int retryable, int pruned) {

  public static DispatchSummary empty() {
    return new DispatchSummary(0, 0, 0);
  }

  public DispatchSummary plus(DispatchOutcome outcome) {
    return switch (outcome) {
      case DELIVERED -> new DispatchSummary(delivered + 1, retryable, pruned);
      case RETRYABLE -> new DispatchSummary(delivered, retryable + 1, pruned);
      case PERMANENTLY_GONE -> new DispatchSummary(delivered, retryable, pruned + 1);
    };
  }

  public int total() {
    return delivered + retryable + pruned;
  }
}
