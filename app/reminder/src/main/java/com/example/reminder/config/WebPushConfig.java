/*
 * どこで: Reminder アプリの設定
 * 何を: VAPID 鍵から PushService を組み立て、Web Push 用の DispatchClient を提供する
 * なぜ: 署名鍵が無い状態での起動を止め、送信設定の不備を早期に検出するため
 */
package com.example.reminder.config;

import com.example.reminder.service.DispatchClient;
import com.example.reminder.service.WebPushDispatchClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.GeneralSecurityException;
import java.security.Security;
import nl.martijndwars.webpush.PushService;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "reminder.push.enabled", havingValue = "true", matchIfMissing = true)
public class WebPushConfig {

  @Bean
  PushService pushService(WebPushProperties properties) throws GeneralSecurityException {
    if (!properties.hasKeys()) {
      throw new IllegalStateException(
          "reminder.push.public-key and reminder.push.private-key must be set");
    }
    // web-push の ECDH/ECDSA は BouncyCastle プロバイダ前提
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    return new PushService(properties.publicKey(), properties.privateKey(), properties.subject());
  }

  @Bean
  DispatchClient webPushDispatchClient(PushService pushService, ObjectMapper objectMapper) {
    return new WebPushDispatchClient(pushService, objectMapper);
  }
}
