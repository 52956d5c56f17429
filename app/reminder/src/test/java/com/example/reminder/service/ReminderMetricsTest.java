/*
 * どこで: Reminder メトリクステスト
 * 何を: 配信結果/購読削除/稼働中トリガー数のメトリクスが記録されることを検証する
 * なぜ: 配信先消滅の監視指標の計測回帰を防ぐため
 */
package com.example.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.TriggerKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class ReminderMetricsTest {

  @Test
  void recordsDispatchPruneAndArmedMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderMetrics metrics = new ReminderMetrics(registry);

    metrics.recordDispatch(DispatchOutcome.DELIVERED, TriggerKind.DAILY);
    metrics.recordDispatch(DispatchOutcome.DELIVERED, TriggerKind.DAILY);
    metrics.recordDispatch(DispatchOutcome.PERMANENTLY_GONE, TriggerKind.LAUNCH);
    metrics.recordPruned();
    metrics.updateArmedTriggers(4);

    final Counter delivered =
        registry
            .get("reminder.dispatch.total")
            .tags("result", "delivered", "trigger", "daily")
            .counter();
    final Counter gone =
        registry
            .get("reminder.dispatch.total")
            .tags("result", "gone", "trigger", "launch")
            .counter();
    final Counter pruned = registry.get("reminder.subscription.pruned.total").counter();
    final Gauge armed = registry.get("reminder.trigger.armed").gauge();

    assertThat(delivered.count()).isEqualTo(2.0d);
    assertThat(gone.count()).isEqualTo(1.0d);
    assertThat(pruned.count()).isEqualTo(1.0d);
    assertThat(armed.value()).isEqualTo(4.0d);
  }

  @Test
  void armedGaugeNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderMetrics metrics = new ReminderMetrics(registry);

    metrics.updateArmedTriggers(-1);

    assertThat(registry.get("reminder.trigger.armed").gauge().value()).isZero();
  }
}
