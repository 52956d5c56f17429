/*
 * どこで: Reminder サービス層
 * 何を: VAPID 署名付きの暗号化 Web Push を 1 件送信し、HTTP ステータスで結果を分類する
 * なぜ: 404/410 (配信先消滅) だけを恒久失敗として呼び出し側の削除判断に渡すため
 */
package com.example.reminder.service;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.NotificationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.ExecutionException;
import nl.martijndwars.webpush.Encoding;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import nl.martijndwars.webpush.Subscription;
import org.apache.http.HttpResponse;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WebPushDispatchClient implements DispatchClient {

  private static final Logger logger = LoggerFactory.getLogger(WebPushDispatchClient.class);
  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_GONE = 410;

  private final PushService pushService;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "PushService/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public WebPushDispatchClient(PushService pushService, ObjectMapper objectMapper) {
    this.pushService = pushService;
    this.objectMapper = objectMapper;
  }

  @Override
  public DispatchOutcome send(EndpointDescriptor endpoint, NotificationPayload payload) {
    final String body;
    try {
      body = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      logger.warn("push payload serialization failed endpoint={}", endpoint.endpoint(), ex);
      return DispatchOutcome.RETRYABLE;
    }
    try {
      final Notification notification = new Notification(toSubscription(endpoint), body);
      final HttpResponse response = pushService.send(notification, Encoding.AES128GCM);
      return classify(endpoint, response.getStatusLine().getStatusCode());
    } catch (GeneralSecurityException | JoseException | IllegalArgumentException ex) {
      // 受信者の鍵が壊れている場合もここに来るが、配信先消滅とは区別して削除しない
      logger.warn("push encryption failed endpoint={}", endpoint.endpoint(), ex);
      return DispatchOutcome.RETRYABLE;
    } catch (IOException | ExecutionException ex) {
      logger.warn("push transport failed endpoint={}", endpoint.endpoint(), ex);
      return DispatchOutcome.RETRYABLE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("push send interrupted endpoint={}", endpoint.endpoint());
      return DispatchOutcome.RETRYABLE;
    }
  }

  @VisibleForTesting
  static DispatchOutcome classify(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) {
      return DispatchOutcome.DELIVERED;
    }
    if (statusCode == HTTP_NOT_FOUND || statusCode == HTTP_GONE) {
      return DispatchOutcome.PERMANENTLY_GONE;
    }
    return DispatchOutcome.RETRYABLE;
  }

  private DispatchOutcome classify(EndpointDescriptor endpoint, int statusCode) {
    final DispatchOutcome outcome = classify(statusCode);
    if (outcome != DispatchOutcome.DELIVERED) {
      logger.warn(
          "push rejected endpoint={} status={} outcome={}", endpoint.endpoint(), statusCode, outcome);
    }
    return outcome;
  }

  private Subscription toSubscription(EndpointDescriptor endpoint) {
    return new Subscription(
        endpoint.endpoint(),
        new Subscription.Keys(endpoint.keys().p256dh(), endpoint.keys().auth()));
  }
}
