/*
 * どこで: Reminder デバッグ API
 * 何を: 購読ごとの稼働中トリガーを取得する
 * なぜ: 再起動後の復元結果やタイムゾーン解釈を運用時に目視確認するため
 */
package com.example.reminder.api;

import com.example.reminder.model.ScheduleView;
import com.example.reminder.service.ReminderJobScheduler;
import com.example.reminder.service.SubscriptionNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/reminder")
@RequiredArgsConstructor
public class ScheduleDebugController {

  private final ReminderJobScheduler jobScheduler;

  @GetMapping("/schedules/{subscriptionId}")
  public ScheduleView schedule(@PathVariable("subscriptionId") String subscriptionId) {
    return jobScheduler
        .describe(subscriptionId)
        .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
  }
}
