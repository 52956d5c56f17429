/*
 * どこで: Reminder サービス層
 * 何を: CI/Test 専用で「配信先消滅」を注入する DispatchClient
 * なぜ: 実コード経路を汚さずに E2E で購読削除とトリガー解除を再現するため
 */
package com.example.reminder.service;

import com.example.reminder.config.WebPushProperties;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.NotificationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "reminder.push.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingDispatchClient implements DispatchClient {

  private final LocalDispatchClient delegate;
  private final WebPushProperties properties;

  @Override
  public DispatchOutcome send(EndpointDescriptor endpoint, NotificationPayload payload) {
    if (shouldInjectGone(endpoint.endpoint())) {
      return DispatchOutcome.PERMANENTLY_GONE;
    }
    return delegate.send(endpoint, payload);
  }

  private boolean shouldInjectGone(String endpoint) {
    final String prefix = properties.failureInjection().endpointPrefix();
    if (prefix.isBlank() || endpoint == null) {
      return false;
    }
    return endpoint.startsWith(prefix);
  }
}
