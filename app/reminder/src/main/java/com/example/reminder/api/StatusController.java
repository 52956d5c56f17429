/*
 * どこで: Reminder API
 * 何を: 稼働中の購読数とトリガー数を含む簡易ステータスを返す
 * なぜ: ロードバランサの疎通確認とスケジュール復元の目視確認を兼ねるため
 */
package com.example.reminder.api;

import com.example.reminder.repository.SubscriptionRegistry;
import com.example.reminder.service.ReminderJobScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final SubscriptionRegistry registry;
  private final ReminderJobScheduler jobScheduler;

  @GetMapping("/")
  public String status() {
    return "reminder: ok subscriptions=" + registry.size() + " armed=" + jobScheduler.armedCount();
  }
}
