/*
 * どこで: Reminder サービス層
 * 何を: 受信者ごとのローンチ/毎日トリガーを登録・解除し、発火時に配信と削除判断を行う
 * なぜ: 稼働中トリガーとストア変更の責務を 1 か所に集め、配信先消滅時の解除漏れを防ぐため
 */
package com.example.reminder.service;

import com.example.common.TraceIds;
import com.example.reminder.config.SchedulerConfig;
import com.example.reminder.model.DailyOccurrence;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.NotificationPayload;
import com.example.reminder.model.SchedulePlan;
import com.example.reminder.model.ScheduleView;
import com.example.reminder.model.SubscriptionRecord;
import com.example.reminder.model.TriggerKind;
import com.example.reminder.repository.SubscriptionRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

/**
 * 受信者 id ごとのトリガー状態 (未登録 → 稼働中 → 発火 → 解除) を管理する。
 *
 * <p>{@link #schedule(String)} は既存エントリを必ず丸ごと解除してから再構築する。差分更新は行わない。トリガーの発火は配信用
 * Executor へ引き渡すだけにして、送信のブロッキングが他の受信者のトリガーを止めないようにする。
 */
@Service
public class ReminderJobScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ReminderJobScheduler.class);
  private static final String MDC_SUBSCRIPTION_ID = "subscription_id";
  private static final String MDC_TRIGGER = "trigger";

  private final TaskScheduler taskScheduler;
  private final Executor dispatchExecutor;
  private final SchedulePlanner planner;
  private final NotificationComposer composer;
  private final DispatchClient dispatchClient;
  private final SubscriptionRegistry registry;
  private final ReminderMetrics metrics;
  private final Clock clock;
  private final ConcurrentMap<String, ScheduleEntry> entries = new ConcurrentHashMap<>();

  public ReminderJobScheduler(
      TaskScheduler taskScheduler,
      @Qualifier(SchedulerConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor,
      SchedulePlanner planner,
      NotificationComposer composer,
      DispatchClient dispatchClient,
      SubscriptionRegistry registry,
      ReminderMetrics metrics,
      Clock clock) {
    this.taskScheduler = taskScheduler;
    this.dispatchExecutor = dispatchExecutor;
    this.planner = planner;
    this.composer = composer;
    this.dispatchClient = dispatchClient;
    this.registry = registry;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 指定 id のトリガーを解除し、現在のレコードから計画し直して再登録する。
   *
   * <p>レコードが存在しない、または計画が空なら解除だけを行う。
   */
  public void schedule(String subscriptionId) {
    final RuntimeException[] failure = new RuntimeException[1];
    entries.compute(
        subscriptionId,
        (id, existing) -> {
          if (existing != null) {
            existing.cancel();
          }
          final Optional<SubscriptionRecord> record = registry.find(id);
          if (record.isEmpty()) {
            return null;
          }
          final SchedulePlan plan = planner.plan(record.get(), Instant.now(clock));
          if (plan.isInert()) {
            logger.info("subscription has nothing to schedule id={}", id);
            return null;
          }
          final ScheduleEntry entry = new ScheduleEntry(id);
          try {
            arm(entry, plan);
          } catch (RuntimeException ex) {
            entry.cancel();
            failure[0] = ex;
            return null;
          }
          return entry;
        });
    metrics.updateArmedTriggers(armedCount());
    if (failure[0] != null) {
      throw failure[0];
    }
  }

  /** トリガーだけを解除する。ストアには触れない。未登録の id なら何もしない。 */
  public void unschedule(String subscriptionId) {
    final ScheduleEntry removed = entries.remove(subscriptionId);
    if (removed != null) {
      removed.cancel();
      logger.info("subscription triggers torn down id={}", subscriptionId);
    }
    metrics.updateArmedTriggers(armedCount());
  }

  /**
   * スケジュール状態を経由せずに即時配信する。配信先消滅時の削除はスケジュール発火と同じ扱い。
   *
   * @throws SubscriptionNotFoundException id が未登録の場合
   */
  public DispatchOutcome dispatchNow(String subscriptionId) {
    final SubscriptionRecord record =
        registry
            .find(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    return dispatch(record, TriggerKind.MANUAL);
  }

  public Optional<ScheduleView> describe(String subscriptionId) {
    return Optional.ofNullable(entries.get(subscriptionId)).map(ScheduleEntry::view);
  }

  public int armedCount() {
    return entries.values().stream().mapToInt(ScheduleEntry::armedCount).sum();
  }

  private void arm(ScheduleEntry entry, SchedulePlan plan) {
    plan.launch()
        .ifPresent(
            fireAt -> {
              final ScheduledFuture<?> future =
                  taskScheduler.schedule(
                      () -> onTrigger(entry, TriggerKind.LAUNCH), new OneShotTrigger(fireAt));
              entry.armLaunch(fireAt, future);
            });
    for (DailyOccurrence occurrence : plan.dailyOccurrences()) {
      final ScheduledFuture<?> future =
          taskScheduler.schedule(
              () -> onTrigger(entry, TriggerKind.DAILY),
              new CronTrigger(occurrence.cronExpression(), occurrence.zone()));
      entry.armDaily(occurrence.label(), future);
    }
    logger.info(
        "subscription scheduled id={} launchAt={} daily={}",
        entry.subscriptionId(),
        plan.launchFireTime(),
        plan.dailyOccurrences().size());
  }

  private void onTrigger(ScheduleEntry entry, TriggerKind trigger) {
    try {
      dispatchExecutor.execute(() -> fire(entry, trigger));
    } catch (RejectedExecutionException ex) {
      logger.warn(
          "dispatch rejected by executor id={} trigger={}", entry.subscriptionId(), trigger, ex);
    }
  }

  private void fire(ScheduleEntry entry, TriggerKind trigger) {
    if (trigger == TriggerKind.LAUNCH) {
      entry.launchFired();
    }
    // 解除/差し替え済みのエントリから遅れて届いた発火は捨てる
    if (entry.isCancelled()) {
      logger.debug("stale trigger ignored id={} trigger={}", entry.subscriptionId(), trigger);
      return;
    }
    final Optional<SubscriptionRecord> record = registry.find(entry.subscriptionId());
    if (record.isEmpty()) {
      unschedule(entry.subscriptionId());
      return;
    }
    final Instant now = Instant.now(clock);
    if (trigger == TriggerKind.DAILY && planner.isLaunchPassed(record.get(), now)) {
      logger.info(
          "daily trigger fired after launch; retiring schedule id={}", entry.subscriptionId());
      retire(entry);
      return;
    }
    dispatch(record.get(), trigger);
    // ローンチ通知が最後の通知。残った毎日トリガーもここで解除する
    if (trigger == TriggerKind.LAUNCH) {
      retire(entry);
    }
  }

  private void retire(ScheduleEntry entry) {
    if (entries.remove(entry.subscriptionId(), entry)) {
      entry.cancel();
      logger.info("subscription triggers torn down id={}", entry.subscriptionId());
    }
    metrics.updateArmedTriggers(armedCount());
  }

  private DispatchOutcome dispatch(SubscriptionRecord record, TriggerKind trigger) {
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    MDC.put(MDC_SUBSCRIPTION_ID, record.id());
    MDC.put(MDC_TRIGGER, trigger.name().toLowerCase(Locale.ROOT));
    try {
      final Instant now = Instant.now(clock);
      final NotificationPayload payload = composer.compose(record, trigger, now);
      final DispatchOutcome outcome = sendSafely(record, payload);
      metrics.recordDispatch(outcome, trigger);
      switch (outcome) {
        case DELIVERED -> registry.markSent(record.id(), now);
        case RETRYABLE ->
            logger.warn("reminder dispatch failed; waiting for next trigger id={}", record.id());
        case PERMANENTLY_GONE -> prune(record);
      }
      return outcome;
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
      MDC.remove(MDC_SUBSCRIPTION_ID);
      MDC.remove(MDC_TRIGGER);
    }
  }

  private DispatchOutcome sendSafely(SubscriptionRecord record, NotificationPayload payload) {
    try {
      return dispatchClient.send(record.endpointDescriptor(), payload);
    } catch (RuntimeException ex) {
      logger.warn("dispatch client threw; treating as retryable id={}", record.id(), ex);
      return DispatchOutcome.RETRYABLE;
    }
  }

  private void prune(SubscriptionRecord record) {
    // 削除と永続化を先に行い、その後で残りのトリガーをすべて解除する
    registry.remove(record.id());
    unschedule(record.id());
    metrics.recordPruned();
    logger.info(
        "subscription pruned because endpoint is gone id={} endpoint={}",
        record.id(),
        record.endpoint());
  }
}
