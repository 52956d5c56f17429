/*
 * どこで: Reminder サービス層
 * 何を: 受信者 1 件分の稼働中トリガー (ローンチ最大 1 件 + 毎日 N 件) を保持する
 * なぜ: 再計画時に部分更新せず、エントリ単位で丸ごと解除/再構築するため
 */
package com.example.reminder.service;

import com.example.reminder.model.ScheduleView;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

final class ScheduleEntry {

  private final String subscriptionId;
  private final Map<String, ScheduledFuture<?>> dailyTriggers = new LinkedHashMap<>();
  private Instant launchFireTime;
  private ScheduledFuture<?> launchFuture;
  private boolean cancelled;

  ScheduleEntry(String subscriptionId) {
    this.subscriptionId = subscriptionId;
  }

  String subscriptionId() {
    return subscriptionId;
  }

  synchronized void armLaunch(Instant fireTime, ScheduledFuture<?> future) {
    this.launchFireTime = fireTime;
    this.launchFuture = future;
  }

  synchronized void armDaily(String label, ScheduledFuture<?> future) {
    dailyTriggers.put(label, future);
  }

  /** ローンチは結果に関わらず 1 回限りなので、発火時点で予定から外す。 */
  synchronized void launchFired() {
    launchFireTime = null;
    launchFuture = null;
  }

  synchronized boolean isCancelled() {
    return cancelled;
  }

  /** 冪等。2 回目以降は何もしない。 */
  synchronized void cancel() {
    if (cancelled) {
      return;
    }
    cancelled = true;
    if (launchFuture != null) {
      launchFuture.cancel(false);
    }
    for (ScheduledFuture<?> future : dailyTriggers.values()) {
      if (future != null) {
        future.cancel(false);
      }
    }
    launchFireTime = null;
    launchFuture = null;
    dailyTriggers.clear();
  }

  synchronized int armedCount() {
    return (launchFireTime != null ? 1 : 0) + dailyTriggers.size();
  }

  synchronized ScheduleView view() {
    return new ScheduleView(subscriptionId, launchFireTime, new ArrayList<>(dailyTriggers.keySet()));
  }
}
