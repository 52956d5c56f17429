/*
 * どこで: Reminder サービス層
 * 何を: 指定時刻に 1 度だけ発火し、その後は自動的に解除される Trigger
 * なぜ: 遠い将来のローンチ通知もスケジューラの Clock 基準で評価し、発火後に再登録させないため
 */
package com.example.reminder.service;

import java.time.Instant;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

final class OneShotTrigger implements Trigger {

  private final Instant fireAt;

  OneShotTrigger(Instant fireAt) {
    this.fireAt = fireAt;
  }

  @Override
  public Instant nextExecution(TriggerContext triggerContext) {
    // 一度でも実行済みなら null を返し、ReschedulingRunnable に終了させる
    return triggerContext.lastScheduledExecution() == null ? fireAt : null;
  }

  Instant fireAt() {
    return fireAt;
  }

  @Override
  public String toString() {
    return "OneShotTrigger[" + fireAt + "]";
  }
}
