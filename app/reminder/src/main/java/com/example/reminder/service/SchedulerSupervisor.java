/*
 * どこで: Reminder サービス層
 * 何を: 起動時に全購読のトリガーを復元し、購読の追加/解除と手動配信の入口を提供する
 * なぜ: 再起動後もストアからスケジュールを再構築し、API 層にスケジューラ内部を見せないため
 */
package com.example.reminder.service;

import com.example.reminder.config.ReminderSchedulerProperties;
import com.example.reminder.config.SchedulerConfig;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.DispatchSummary;
import com.example.reminder.model.SubscriptionRecord;
import com.example.reminder.repository.SubscriptionRegistry;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class SchedulerSupervisor {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerSupervisor.class);

  private final SubscriptionRegistry registry;
  private final ReminderJobScheduler jobScheduler;
  private final ReminderSchedulerProperties properties;
  private final Executor dispatchExecutor;

  public SchedulerSupervisor(
      SubscriptionRegistry registry,
      ReminderJobScheduler jobScheduler,
      ReminderSchedulerProperties properties,
      @Qualifier(SchedulerConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor) {
    this.registry = registry;
    this.jobScheduler = jobScheduler;
    this.properties = properties;
    this.dispatchExecutor = dispatchExecutor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.isEnabled()) {
      logger.info("reminder scheduler disabled; skipping bootstrap");
      return;
    }
    bootstrap();
  }

  /**
   * ストアから全購読を読み込み、1 件ずつトリガーを登録する。1 件の失敗は残りの登録を止めない。
   *
   * @return 登録に成功した購読数
   */
  public int bootstrap() {
    final List<SubscriptionRecord> records = registry.reload();
    int scheduled = 0;
    for (SubscriptionRecord record : records) {
      try {
        jobScheduler.schedule(record.id());
        scheduled++;
      } catch (RuntimeException ex) {
        logger.warn("subscription scheduling failed during bootstrap id={}", record.id(), ex);
      }
    }
    logger.info(
        "reminder scheduler bootstrapped subscriptions={} scheduled={} armedTriggers={}",
        records.size(),
        scheduled,
        jobScheduler.armedCount());
    return scheduled;
  }

  /** 購読を保存してトリガーを登録する。既知の endpoint なら既存 id のまま更新する。 */
  public String addSubscription(SubscriptionRecord record) {
    final SubscriptionRecord stored = registry.upsert(record);
    jobScheduler.schedule(stored.id());
    logger.info("subscription stored id={} endpoint={}", stored.id(), stored.endpoint());
    return stored.id();
  }

  /** トリガーを解除して購読を削除する。未登録の id なら何もしない。 */
  public boolean removeSubscription(String subscriptionId) {
    if (subscriptionId == null || subscriptionId.isBlank()) {
      return false;
    }
    jobScheduler.unschedule(subscriptionId);
    final boolean removed = registry.remove(subscriptionId).isPresent();
    if (removed) {
      logger.info("subscription removed id={}", subscriptionId);
    }
    return removed;
  }

  public boolean removeSubscriptionByEndpoint(String endpoint) {
    return registry
        .findByEndpoint(endpoint)
        .map(record -> removeSubscription(record.id()))
        .orElse(false);
  }

  /** 指定の購読へ即時配信する。 */
  public DispatchSummary dispatchNow(String subscriptionId) {
    return DispatchSummary.empty().plus(jobScheduler.dispatchNow(subscriptionId));
  }

  /** 全購読へ並行して即時配信する。配信中に削除された購読は結果に含めない。 */
  public DispatchSummary dispatchNowToAll() {
    final List<SubscriptionRecord> records = registry.snapshot();
    if (records.isEmpty()) {
      logger.info("no subscriptions to send to");
      return DispatchSummary.empty();
    }
    logger.info("manual dispatch to all subscriptions count={}", records.size());
    final List<CompletableFuture<DispatchOutcome>> futures =
        records.stream()
            .map(
                record ->
                    CompletableFuture.supplyAsync(
                        () -> dispatchIfPresent(record.id()), dispatchExecutor))
            .toList();
    DispatchSummary summary = DispatchSummary.empty();
    for (CompletableFuture<DispatchOutcome> future : futures) {
      final DispatchOutcome outcome = future.join();
      if (outcome != null) {
        summary = summary.plus(outcome);
      }
    }
    logger.info(
        "manual dispatch finished delivered={} retryable={} pruned={}",
        summary.delivered(),
        summary.retryable(),
        summary.pruned());
    return summary;
  }

  private DispatchOutcome dispatchIfPresent(String subscriptionId) {
    try {
      return jobScheduler.dispatchNow(subscriptionId);
    } catch (SubscriptionNotFoundException ex) {
      return null;
    }
  }
}
