/*
 * どこで: Reminder サービス層
 * 何を: 配信結果/購読削除/稼働中トリガー数のアプリ固有メトリクスを記録する
 * なぜ: 配信先消滅の急増やトリガーの取りこぼしを Prometheus から観測できるようにするため
 */
package com.example.reminder.service;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.TriggerKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ReminderMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "reminder.dispatch.total";
  private static final String METRIC_PRUNED_TOTAL = "reminder.subscription.pruned.total";
  private static final String METRIC_TRIGGER_ARMED = "reminder.trigger.armed";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger armedTriggers = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final Counter prunedCounter;

  public ReminderMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_TRIGGER_ARMED, armedTriggers, AtomicInteger::get)
        .description("Current number of armed launch and daily triggers")
        .register(meterRegistry);
    this.prunedCounter =
        Counter.builder(METRIC_PRUNED_TOTAL)
            .description("Total number of subscriptions removed because the endpoint is gone")
            .register(meterRegistry);
  }

  public void recordDispatch(DispatchOutcome outcome, TriggerKind trigger) {
    final String triggerTag = trigger.name().toLowerCase(Locale.ROOT);
    dispatchCounters
        .computeIfAbsent(
            outcome.metricTag() + "|" + triggerTag,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Reminder dispatch outcomes")
                    .tags(Tags.of("result", outcome.metricTag(), "trigger", triggerTag))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPruned() {
    prunedCounter.increment();
  }

  public void updateArmedTriggers(int count) {
    armedTriggers.set(Math.max(count, 0));
  }
}
