/*
 * どこで: Reminder 送信層のユニットテスト
 * 何を: CI/Test 専用失敗注入 DispatchClient の分岐を検証する
 * なぜ: 配信先消滅による購読削除シナリオの前提が壊れないようにするため
 */
package com.example.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.reminder.config.WebPushProperties;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.NotificationPayload;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FailureInjectingDispatchClientTest {

  private static final NotificationPayload PAYLOAD =
      new NotificationPayload("title", "body", null, "launch-countdown", "/", null, Map.of());

  @Test
  void sendReportsGoneWhenPrefixMatches() {
    final LocalDispatchClient delegate = mock(LocalDispatchClient.class);
    final FailureInjectingDispatchClient client =
        new FailureInjectingDispatchClient(delegate, properties("https://gone.example/"));

    final DispatchOutcome outcome = client.send(endpoint("https://gone.example/abc"), PAYLOAD);

    assertThat(outcome).isEqualTo(DispatchOutcome.PERMANENTLY_GONE);
    verifyNoInteractions(delegate);
  }

  @Test
  void sendDelegatesWhenPrefixDoesNotMatch() {
    final LocalDispatchClient delegate = mock(LocalDispatchClient.class);
    final FailureInjectingDispatchClient client =
        new FailureInjectingDispatchClient(delegate, properties("https://gone.example/"));
    final EndpointDescriptor endpoint = endpoint("https://push.example.com/abc");
    when(delegate.send(endpoint, PAYLOAD)).thenReturn(DispatchOutcome.DELIVERED);

    assertThat(client.send(endpoint, PAYLOAD)).isEqualTo(DispatchOutcome.DELIVERED);

    verify(delegate).send(endpoint, PAYLOAD);
  }

  @Test
  void sendDelegatesWhenPrefixIsBlank() {
    final LocalDispatchClient delegate = mock(LocalDispatchClient.class);
    final FailureInjectingDispatchClient client =
        new FailureInjectingDispatchClient(delegate, properties(""));
    final EndpointDescriptor endpoint = endpoint("https://gone.example/abc");
    when(delegate.send(endpoint, PAYLOAD)).thenReturn(DispatchOutcome.DELIVERED);

    assertThat(client.send(endpoint, PAYLOAD)).isEqualTo(DispatchOutcome.DELIVERED);
  }

  private WebPushProperties properties(String prefix) {
    return new WebPushProperties(
        false, null, null, null, new WebPushProperties.FailureInjection(true, prefix));
  }

  private EndpointDescriptor endpoint(String url) {
    return new EndpointDescriptor(url, new EndpointDescriptor.Keys("p256dh", "auth"));
  }
}
