/*
 * どこで: Reminder API
 * 何を: 購読/解除/テスト配信/カウントダウン/VAPID 公開鍵のエンドポイントを提供する
 * なぜ: フロントエンドから見える公開インターフェースを 1 か所にまとめるため
 */
package com.example.reminder.api;

import com.example.reminder.config.ReminderLaunchProperties;
import com.example.reminder.config.WebPushProperties;
import com.example.reminder.model.Countdown;
import com.example.reminder.model.DispatchSummary;
import com.example.reminder.model.SubscriptionRecord;
import com.example.reminder.service.CountdownService;
import com.example.reminder.service.NotificationComposer;
import com.example.reminder.service.SchedulerSupervisor;
import com.example.reminder.service.SubscriptionFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReminderController {

  private final SchedulerSupervisor supervisor;
  private final SubscriptionFactory subscriptionFactory;
  private final CountdownService countdownService;
  private final ReminderLaunchProperties launchProperties;
  private final WebPushProperties webPushProperties;

  @GetMapping("/vapidPublicKey")
  public VapidPublicKeyResponse vapidPublicKey() {
    return new VapidPublicKeyResponse(webPushProperties.publicKey());
  }

  @GetMapping("/countdown")
  public CountdownResponse countdown() {
    final Countdown countdown =
        countdownService.defaultCountdown().orElseThrow(LaunchNotConfiguredException::new);
    return new CountdownResponse(
        countdown.days(),
        countdown.targetDate().toOffsetDateTime().toString(),
        NotificationComposer.formatTargetDate(countdown),
        countdown.isToday(),
        launchProperties.timezone());
  }

  @PostMapping("/subscribe")
  public ResponseEntity<SubscribeResponse> subscribe(@RequestBody SubscribeRequest request) {
    final SubscriptionRecord record =
        subscriptionFactory.create(
            request.descriptor(), request.launchTime(), request.dailyTimes(), request.timezone());
    final String id = supervisor.addSubscription(record);
    return ResponseEntity.status(HttpStatus.CREATED).body(new SubscribeResponse(true, id));
  }

  @PostMapping("/unsubscribe")
  public UnsubscribeResponse unsubscribe(
      @RequestBody(required = false) UnsubscribeRequest request) {
    if (request == null) {
      return new UnsubscribeResponse(true, false);
    }
    // 未登録の id/endpoint は成功扱いの no-op とする
    boolean removed = supervisor.removeSubscription(request.id());
    if (!removed && request.resolvedEndpoint() != null) {
      removed = supervisor.removeSubscriptionByEndpoint(request.resolvedEndpoint());
    }
    return new UnsubscribeResponse(true, removed);
  }

  @PostMapping("/test-notification")
  public DispatchSummaryResponse testNotification(
      @RequestBody(required = false) TestNotificationRequest request) {
    final DispatchSummary summary =
        request == null || request.id() == null || request.id().isBlank()
            ? supervisor.dispatchNowToAll()
            : supervisor.dispatchNow(request.id());
    return DispatchSummaryResponse.from(summary);
  }
}
