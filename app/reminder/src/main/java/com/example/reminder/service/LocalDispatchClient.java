/*
 * どこで: Reminder サービス層
 * 何を: Push 送信を模擬する DispatchClient
 * なぜ: VAPID 鍵なしのローカル環境でもスケジュールの状態遷移を確認するため
 */
package com.example.reminder.service;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.NotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "reminder.push.enabled", havingValue = "false")
public class LocalDispatchClient implements DispatchClient {

  private static final Logger logger = LoggerFactory.getLogger(LocalDispatchClient.class);

  @Override
  public DispatchOutcome send(EndpointDescriptor endpoint, NotificationPayload payload) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "notification simulated send endpoint={} title={}", endpoint.endpoint(), payload.title());
    return DispatchOutcome.DELIVERED;
  }
}
