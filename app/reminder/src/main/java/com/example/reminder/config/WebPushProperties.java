/*
 * どこで: Reminder アプリの設定バインド
 * 何を: VAPID 鍵と Push 送信の有効/無効、テスト用の失敗注入設定を保持する
 * なぜ: 署名鍵を環境変数から注入し、ローカルでは実送信を止められるようにするため
 */
package com.example.reminder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.push")
public record WebPushProperties(
    Boolean enabled,
    String publicKey,
    String privateKey,
    String subject,
    FailureInjection failureInjection) {

  public WebPushProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    subject = subject == null || subject.isBlank() ? "mailto:admin@example.com" : subject;
    failureInjection = failureInjection == null ? new FailureInjection(false, "") : failureInjection;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean hasKeys() {
    return publicKey != null && !publicKey.isBlank() && privateKey != null && !privateKey.isBlank();
  }

  /** ci/test プロファイルでのみ参照する失敗注入設定。 */
  public record FailureInjection(boolean enabled, String endpointPrefix) {

    public FailureInjection {
      endpointPrefix = endpointPrefix == null ? "" : endpointPrefix;
    }
  }
}
